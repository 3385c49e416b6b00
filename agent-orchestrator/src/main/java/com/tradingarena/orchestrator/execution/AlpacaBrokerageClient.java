package com.tradingarena.orchestrator.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Component
public class AlpacaBrokerageClient implements BrokerageClient {

    private static final Logger log = LoggerFactory.getLogger(AlpacaBrokerageClient.class);

    private final WebClient webClient;

    public AlpacaBrokerageClient(@Qualifier("brokerageWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<OrderResponse> submitOrder(OrderRequest order) {
        return webClient.post()
            .uri("/v2/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(order)
            .retrieve()
            .bodyToMono(OrderResponse.class)
            .doOnNext(r -> log.info("ORDER_SUBMITTED clientOrderId={} symbol={} side={} qty={} orderId={} status={}",
                                    order.clientOrderId(), order.symbol(), order.side(), order.quantity(),
                                    r.id(), r.status()))
            .doOnError(e -> log.warn("ORDER_REJECTED clientOrderId={} symbol={} reason={}",
                                     order.clientOrderId(), order.symbol(), e.getMessage()));
    }
}
