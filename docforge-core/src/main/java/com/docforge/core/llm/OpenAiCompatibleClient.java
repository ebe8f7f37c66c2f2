package com.docforge.core.llm;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.CriticReview;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Client for OpenAI-compatible {@code /v1/chat/completions} endpoints (OpenAI, OpenRouter,
 * local servers exposing the same API).
 *
 * <p>Implements both capabilities: {@link #complete(ChatPrompt)} returns the message content
 * and {@link #evaluate(String, String, CodeElement)} asks for a JSON verdict. Requests are
 * retried on 408, 429, 5xx and transport errors with exponential backoff, honouring
 * {@code Retry-After}; a 2xx body without usable content fails at once.
 */
public class OpenAiCompatibleClient implements CompletionClient, EvaluationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleClient.class);

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final long MAX_BACKOFF_MILLIS = 10_000L;

    private final OkHttpClient http;
    private final LlmSettings settings;
    private final PromptFactory prompts;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiCompatibleClient(LlmSettings settings) {
        this(settings, new PromptFactory());
    }

    public OpenAiCompatibleClient(LlmSettings settings, PromptFactory prompts) {
        this.settings = settings;
        this.prompts = prompts;
        this.http = new OkHttpClient.Builder()
            .connectTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(settings.timeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(settings.timeoutSeconds(), TimeUnit.SECONDS)
            .callTimeout(settings.timeoutSeconds(), TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();
    }

    @Override
    public String complete(ChatPrompt prompt) throws GenerationException {
        try {
            return chat(prompt, false);
        } catch (IOException e) {
            throw new GenerationException("Completion failed: " + e.getMessage(), e);
        }
    }

    @Override
    public CriticReview evaluate(String code, String candidate, CodeElement element) throws EvaluationException {
        String content;
        try {
            content = chat(prompts.evaluationPrompt(code, candidate, element), true);
        } catch (IOException e) {
            throw new EvaluationException("Evaluation failed: " + e.getMessage(), e);
        }
        return parseVerdict(content);
    }

    /**
     * Parses a {@code {score, issues, suggestions}} verdict. Scores outside [0, 1] are clamped.
     *
     * @param content message content
     * @return review
     * @throws EvaluationException if the content is not a JSON object with a numeric score
     */
    CriticReview parseVerdict(String content) throws EvaluationException {
        JsonNode root;
        try {
            root = mapper.readTree(stripFences(content));
        } catch (IOException e) {
            throw new EvaluationException("Verdict is not JSON: " + abbreviate(content), e);
        }
        JsonNode score = root == null ? null : root.get("score");
        if (score == null || !score.isNumber()) {
            throw new EvaluationException("Verdict has no numeric score: " + abbreviate(content));
        }
        double value = Math.max(0.0, Math.min(1.0, score.asDouble()));
        return new CriticReview(value, strings(root.path("issues")), strings(root.path("suggestions")));
    }

    private String chat(ChatPrompt prompt, boolean jsonMode) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.model());
        payload.put("temperature", settings.temperature());
        payload.put("max_tokens", settings.maxTokens());
        payload.put("messages", List.of(
            Map.of("role", "system", "content", prompt.system()),
            Map.of("role", "user", "content", prompt.user())
        ));
        if (jsonMode) {
            payload.put("response_format", Map.of("type", "json_object"));
        }
        Request request = new Request.Builder()
            .url(settings.baseUrl() + COMPLETIONS_PATH)
            .header("Authorization", "Bearer " + settings.apiKey())
            .header("Content-Type", "application/json")
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

        int attempt = 0;
        while (true) {
            attempt++;
            try (Response response = http.newCall(request).execute()) {
                String body = response.body() == null ? "" : response.body().string();
                if (!response.isSuccessful()) {
                    if (shouldRetry(response.code()) && attempt < settings.maxAttempts()) {
                        log.warn("HTTP {} from {}, retrying (attempt {}/{})", response.code(),
                            settings.baseUrl(), attempt, settings.maxAttempts());
                        sleepBackoff(response.headers(), attempt);
                        continue;
                    }
                    throw new HttpStatusException(response.code(), abbreviate(body));
                }
                return messageContent(body);
            } catch (HttpStatusException | MalformedResponseException | InterruptedIOException e) {
                throw e;
            } catch (IOException e) {
                if (attempt >= settings.maxAttempts()) {
                    throw e;
                }
                log.warn("I/O error calling {}: {}, retrying", settings.baseUrl(), e.getMessage());
                sleepBackoff(null, attempt);
            }
        }
    }

    private String messageContent(String body) throws MalformedResponseException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new MalformedResponseException("Response is not JSON: " + abbreviate(body), e);
        }
        String content = root == null ? ""
            : root.path("choices").path(0).path("message").path("content").asText("").trim();
        if (content.isEmpty()) {
            throw new MalformedResponseException("Empty content in response", null);
        }
        return content;
    }

    private static boolean shouldRetry(int code) {
        return code == 408 || code == 429 || code >= 500;
    }

    private static void sleepBackoff(Headers headers, int attempt) throws InterruptedIOException {
        long delayMillis = -1;
        if (headers != null) {
            String retryAfter = headers.get("Retry-After");
            if (retryAfter != null) {
                try {
                    delayMillis = (long) (Double.parseDouble(retryAfter.trim()) * 1000L);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric Retry-After: {}", retryAfter);
                }
            }
        }
        if (delayMillis < 0) {
            delayMillis = (long) (500L * Math.pow(2, attempt - 1)) + ThreadLocalRandom.current().nextInt(250);
        }
        try {
            Thread.sleep(Math.min(delayMillis, MAX_BACKOFF_MILLIS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during backoff");
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(item -> {
                if (!item.asText("").isBlank()) {
                    values.add(item.asText().trim());
                }
            });
        }
        return values;
    }

    private static String stripFences(String content) {
        String text = content.trim();
        if (text.startsWith("```")) {
            int firstLineEnd = text.indexOf('\n');
            text = firstLineEnd > 0 ? text.substring(firstLineEnd + 1) : "";
            int closing = text.lastIndexOf("```");
            if (closing >= 0) {
                text = text.substring(0, closing);
            }
        }
        return text.trim();
    }

    private static String abbreviate(String text) {
        String flat = text == null ? "" : text.replaceAll("\\s+", " ");
        return flat.length() > 300 ? flat.substring(0, 300) + "..." : flat;
    }

    /** Non-retryable HTTP status. */
    private static final class HttpStatusException extends IOException {
        HttpStatusException(int status, String body) {
            super("HTTP " + status + ": " + body);
        }
    }

    /** Successful status with a body that carries no usable completion; not retried. */
    private static final class MalformedResponseException extends IOException {
        MalformedResponseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
