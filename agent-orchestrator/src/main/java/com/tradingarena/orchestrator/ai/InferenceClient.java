package com.tradingarena.orchestrator.ai;

import reactor.core.publisher.Mono;

/**
 * Chat-completions style inference provider. Implementations signal transport and
 * envelope failures as errors; they never interpret the completion text.
 */
public interface InferenceClient {

    Mono<InferenceResponse> complete(InferenceRequest request);
}
