package com.tradingarena.orchestrator.ai;

/**
 * Text of the first completion choice plus token usage; usage fields are {@code null}
 * when the provider did not report them.
 */
public record InferenceResponse(String text, Long promptTokens, Long completionTokens) {

    public boolean hasUsage() {
        return promptTokens != null && completionTokens != null;
    }
}
