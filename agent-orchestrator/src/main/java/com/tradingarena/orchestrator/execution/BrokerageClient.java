package com.tradingarena.orchestrator.execution;

import reactor.core.publisher.Mono;

/**
 * Paper brokerage port. Errors (transport, 4xx/5xx) surface as error signals; a
 * response with a non-accepted status is returned as-is for the caller to judge.
 */
public interface BrokerageClient {

    Mono<OrderResponse> submitOrder(OrderRequest order);
}
