package com.tradingarena.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingarena.common.exception.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code POST /chat/completions} client (OpenRouter by default).
 *
 * <p>Fully non-blocking. The caller applies the per-call timeout so that a timeout can be
 * told apart from a provider error.
 */
@Component
public class ChatCompletionsInferenceClient implements InferenceClient {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsInferenceClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ChatCompletionsInferenceClient(@Qualifier("inferenceWebClient") WebClient webClient,
                                          ObjectMapper objectMapper) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<InferenceResponse> complete(InferenceRequest request) {
        Map<String, Object> body = Map.of(
            "model", request.modelId(),
            "max_tokens", request.maxTokens(),
            "temperature", request.temperature(),
            "messages", List.of(
                Map.of("role", "system", "content", request.systemPrompt()),
                Map.of("role", "user", "content", request.userPrompt()))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(json -> webClient.post()
                .uri("/chat/completions")
                .bodyValue(json)
                .retrieve()
                .bodyToMono(String.class))
            .map(raw -> extract(request.agentName(), raw))
            .doOnNext(r -> log.debug("Inference completed. agent={} model={} promptTokens={} completionTokens={}",
                                        request.agentName(), request.modelId(), r.promptTokens(), r.completionTokens()));
    }

    InferenceResponse extract(String agentName, String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new InferenceException(agentName, "inference envelope is not JSON", e);
        }
        if (root.hasNonNull("error")) {
            throw new InferenceException(agentName, "provider error: " + root.path("error").path("message").asText("unknown"));
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new InferenceException(agentName, "inference envelope has no completion text");
        }
        JsonNode usage = root.path("usage");
        Long prompt = usage.hasNonNull("prompt_tokens") ? usage.path("prompt_tokens").asLong() : null;
        Long completion = usage.hasNonNull("completion_tokens") ? usage.path("completion_tokens").asLong() : null;
        return new InferenceResponse(content.asText(), prompt, completion);
    }
}
