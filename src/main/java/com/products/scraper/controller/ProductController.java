package com.products.scraper.controller;

import com.products.scraper.dto.ProductCommentsResponse;
import com.products.scraper.dto.ProductOffersResponse;
import com.products.scraper.service.ProductParsingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller exposing product offers and product reviews.
 *
 * <h3>Offers</h3>
 * <pre>{@code
 * GET /product/offers?url=https://hotline.ua/ua/mobile-apple-iphone-15/&count_limit=20&sort=asc
 *
 * {
 *   "url": "https://hotline.ua/mobile-apple-iphone-15",
 *   "offers": [
 *     { "url": "https://hotline.ua/go/price/123",
 *       "original_url": "https://shop.example/iphone-15",
 *       "title": "Apple iPhone 15 128GB Black",
 *       "shop": "Example",
 *       "price": 33999.0,
 *       "is_used": false }
 *   ]
 * }
 * }</pre>
 *
 * <h3>Comments</h3>
 * <pre>{@code
 * GET /product/comments?url=https://brain.com.ua/ukr/Apple_iPhone_15-p1045123.html&date_to=2024-06-30
 *
 * { "url": "...", "comments": [ { "rating": 5.0, "advantages": "", "shortcomings": "", "comment": "..." } ] }
 * }</pre>
 *
 * <p>Optional parameters are taken as strings so that malformed values fall
 * back to defaults instead of failing the request.</p>
 */
@Slf4j
@RestController
@RequestMapping("/product")
@RequiredArgsConstructor
public class ProductController {

    private final ProductParsingService parsingService;

    @GetMapping(value = "/offers", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProductOffersResponse> offers(
            @RequestParam("url") final String url,
            @RequestParam(name = "timeout_limit", required = false) final String timeoutLimit,
            @RequestParam(name = "count_limit", required = false) final String countLimit,
            @RequestParam(name = "sort", required = false) final String sort) {
        return ResponseEntity.ok(parsingService.offers(url, timeoutLimit, countLimit, sort));
    }

    @GetMapping(value = "/comments", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProductCommentsResponse> comments(
            @RequestParam("url") final String url,
            @RequestParam(name = "date_to", required = false) final String dateTo) {
        return ResponseEntity.ok(parsingService.comments(url, dateTo));
    }

    /**
     * Any unexpected failure of a run becomes a 500 with the message.
     *
     * @param ex the exception
     * @return {@code {"error": "..."}}
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleFailure(final RuntimeException ex) {
        log.error("Request failed", ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", message));
    }
}
