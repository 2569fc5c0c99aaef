package com.products.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Product Scraper application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>shop offers of a hotline.ua product,</li>
 *   <li>customer reviews of a comfy.ua or brain.com.ua product.</li>
 * </ul>
 * It wires together the source-specific adapters, the retrying fetch layer and
 * the MongoDB merge store behind a single {@code /product} controller.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/product-scraper-0.0.1-SNAPSHOT.jar
 *
 *   // Then:
 *   curl "http://localhost:8000/product/offers?url=https://hotline.ua/ua/mobile-apple-iphone-15/&sort=asc"
 * }</pre>
 */
@SpringBootApplication
public class ProductScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(ProductScraperApplication.class, args);
    }
}
