package com.tradingarena.orchestrator.ai;

public record InferenceRequest(
    String agentName,
    String modelId,
    String systemPrompt,
    String userPrompt,
    int maxTokens,
    double temperature
) {}
