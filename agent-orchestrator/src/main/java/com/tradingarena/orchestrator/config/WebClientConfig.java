package com.tradingarena.orchestrator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One {@link WebClient} per external collaborator. Transport timeouts here are a
 * backstop; each call also carries its own {@code .timeout(...)} from {@code arena.timeouts}.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${services.inference.base-url:https://openrouter.ai/api/v1}")
    private String inferenceUrl;

    @Value("${services.inference.api-key:}")
    private String inferenceApiKey;

    @Value("${services.brokerage.base-url:https://paper-api.alpaca.markets}")
    private String brokerageUrl;

    @Value("${services.market-data.base-url:https://data.alpaca.markets}")
    private String marketDataUrl;

    @Value("${services.news.base-url:https://data.alpaca.markets}")
    private String newsUrl;

    @Value("${services.alpaca.key-id:}")
    private String alpacaKeyId;

    @Value("${services.alpaca.secret-key:}")
    private String alpacaSecretKey;

    @Bean
    public WebClient inferenceWebClient(WebClient.Builder builder) {
        WebClient.Builder b = builder.clone()
            .baseUrl(inferenceUrl)
            .clientConnector(connector(120))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter());
        if (!inferenceApiKey.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + inferenceApiKey);
        } else {
            log.warn("No inference API key configured (services.inference.api-key); every inference call will fail");
        }
        return b.build();
    }

    @Bean
    public WebClient brokerageWebClient(WebClient.Builder builder) {
        return alpaca(builder, brokerageUrl);
    }

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        return alpaca(builder, marketDataUrl);
    }

    @Bean
    public WebClient newsWebClient(WebClient.Builder builder) {
        return alpaca(builder, newsUrl);
    }

    private WebClient alpaca(WebClient.Builder builder, String baseUrl) {
        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(connector(30))
            .defaultHeader("APCA-API-KEY-ID", alpacaKeyId)
            .defaultHeader("APCA-API-SECRET-KEY", alpacaSecretKey)
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    private static ReactorClientHttpConnector connector(int readTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    private static ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Upstream server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
