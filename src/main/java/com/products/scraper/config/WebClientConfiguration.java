package com.products.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Builds the single pooled {@link WebClient} shared by every source adapter.
 * <p>
 * Redirects are <b>not</b> followed by the connector: the fetch layer walks
 * redirect chains itself so that it can report the final shop URL.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration CONNECT_TIMEOUT  = Duration.ofSeconds(10);
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(20);
    private static final Duration POOL_ACQUIRE_DELAY = Duration.ofSeconds(2);
    private static final int MAX_CONNECTIONS = 50;

    /** Brain returns whole review lists as one HTML string inside JSON. */
    private static final int MAX_IN_MEMORY_BYTES = 8 * 1024 * 1024;

    @Bean
    @Qualifier("scraperWebClient")
    public WebClient scraperWebClient(final WebClient.Builder builder,
                                      @Qualifier("scraperObjectMapper") final ObjectMapper mapper) {
        return configure(builder, mapper).build();
    }

    /**
     * Applies connector, codecs and logging filters to {@code builder}.
     * Exposed for tests that need the production wiring without a context.
     *
     * @param builder a fresh builder
     * @param mapper  the scraper object mapper
     * @return the same builder, configured
     */
    public static WebClient.Builder configure(final WebClient.Builder builder, final ObjectMapper mapper) {

        /* --- JSON codecs wired to the custom ObjectMapper ------------------ */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES);
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper,
                                    MediaType.APPLICATION_JSON, new MediaType("application", "*+json")));
                })
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("source-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(POOL_ACQUIRE_DELAY)
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.HTTP11)
                .compress(true)
                .followRedirect(false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(RESPONSE_TIMEOUT)
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);

        return builder
                // each adapter supplies its own absolute URI → no baseUrl needed
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/json, text/plain, */*")
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().asHttpHeaders().getLocation());
            return Mono.just(res);
        });
    }
}
