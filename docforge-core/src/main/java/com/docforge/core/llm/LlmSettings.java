package com.docforge.core.llm;

/**
 * Connection settings for an OpenAI-compatible chat completions endpoint.
 *
 * @param apiKey bearer token
 * @param baseUrl base URL without the {@code /v1/chat/completions} path
 * @param model model name
 * @param temperature sampling temperature
 * @param maxTokens completion token limit
 * @param timeoutSeconds whole-call timeout
 * @param maxAttempts attempts per call, retries included
 */
public record LlmSettings(
    String apiKey,
    String baseUrl,
    String model,
    double temperature,
    int maxTokens,
    int timeoutSeconds,
    int maxAttempts
) {
    public static final String OPENAI_BASE_URL = "https://api.openai.com";
    public static final String OPENROUTER_BASE_URL = "https://openrouter.ai/api";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public LlmSettings {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("API key missing for language model provider");
        }
        baseUrl = baseUrl == null || baseUrl.isBlank() ? OPENAI_BASE_URL : stripTrailingSlash(baseUrl);
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
        maxTokens = maxTokens <= 0 ? 1024 : maxTokens;
        timeoutSeconds = timeoutSeconds <= 0 ? 60 : timeoutSeconds;
        maxAttempts = Math.max(1, maxAttempts);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
