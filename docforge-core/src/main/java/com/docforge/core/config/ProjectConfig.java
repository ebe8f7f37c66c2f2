package com.docforge.core.config;

import com.docforge.core.model.DocstringStyle;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Root configuration loaded from {@code .docforge.yaml}.
 *
 * <p>Every field is optional; absent values fall back to the built-in defaults when the
 * configuration is resolved into {@link PipelineSettings}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * style: numpy
 * maxIterations: 3
 * threshold: 0.8
 * overwrite: false
 * workers: 4
 * fileTimeoutSeconds: 120
 *
 * llm:
 *   provider: openai
 *   model: gpt-4o-mini
 *   temperature: 0.2
 * }</pre>
 *
 * @param style style id ({@code google}, {@code numpy}, {@code rst})
 * @param maxIterations refinement iterations per element
 * @param threshold acceptance threshold
 * @param overwrite replace existing blocks
 * @param workers files processed in parallel by the batch command
 * @param elementWorkers elements refined in parallel within a file
 * @param fileTimeoutSeconds per-file timeout in batch runs
 * @param llm language model settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("style") String style,
    @JsonProperty("maxIterations") Integer maxIterations,
    @JsonProperty("threshold") Double threshold,
    @JsonProperty("overwrite") Boolean overwrite,
    @JsonProperty("workers") Integer workers,
    @JsonProperty("elementWorkers") Integer elementWorkers,
    @JsonProperty("fileTimeoutSeconds") Integer fileTimeoutSeconds,
    @JsonProperty("llm") LlmConfig llm
) {
    public static final int DEFAULT_WORKERS = 1;
    public static final int DEFAULT_FILE_TIMEOUT_SECONDS = 300;

    static final String ENV_STYLE = "DOCFORGE_STYLE";
    static final String ENV_MAX_ITERATIONS = "DOCFORGE_MAX_ITERATIONS";
    static final String ENV_THRESHOLD = "DOCFORGE_THRESHOLD";
    static final String ENV_MODEL = "DOCFORGE_MODEL";

    public ProjectConfig {
        llm = llm != null ? llm : LlmConfig.defaults();
    }

    /**
     * Creates a configuration with every value unset.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null, null, null, LlmConfig.defaults());
    }

    /**
     * Resolves pipeline settings, filling unset values with defaults.
     *
     * @return settings
     * @throws IllegalArgumentException if a configured value is out of range or the style is unknown
     */
    public PipelineSettings pipelineSettings() {
        PipelineSettings defaults = PipelineSettings.defaults();
        return new PipelineSettings(
            style != null ? DocstringStyle.fromId(style) : defaults.style(),
            threshold != null ? threshold : defaults.threshold(),
            maxIterations != null ? maxIterations : defaults.maxIterations(),
            overwrite != null ? overwrite : defaults.overwrite(),
            elementWorkers != null ? elementWorkers : defaults.elementWorkers()
        );
    }

    public int effectiveWorkers() {
        return workers != null && workers > 0 ? workers : DEFAULT_WORKERS;
    }

    public int effectiveFileTimeoutSeconds() {
        return fileTimeoutSeconds != null && fileTimeoutSeconds > 0 ? fileTimeoutSeconds : DEFAULT_FILE_TIMEOUT_SECONDS;
    }

    /**
     * Applies {@code DOCFORGE_*} environment overrides. Unparseable numbers are ignored.
     *
     * @param env environment variables
     * @return configuration with overrides applied
     */
    public ProjectConfig withEnvironment(Map<String, String> env) {
        String envStyle = blankToNull(env.get(ENV_STYLE));
        Integer envIterations = parseInteger(env.get(ENV_MAX_ITERATIONS));
        Double envThreshold = parseDouble(env.get(ENV_THRESHOLD));
        String envModel = blankToNull(env.get(ENV_MODEL));
        LlmConfig resolvedLlm = envModel != null ? llm.withModel(envModel) : llm;
        return new ProjectConfig(
            envStyle != null ? envStyle : style,
            envIterations != null ? envIterations : maxIterations,
            envThreshold != null ? envThreshold : threshold,
            overwrite, workers, elementWorkers, fileTimeoutSeconds, resolvedLlm);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer parseInteger(String value) {
        try {
            return value == null || value.isBlank() ? null : Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        try {
            return value == null || value.isBlank() ? null : Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Language model settings.
     *
     * @param provider {@code rule} (no external calls) or {@code openai}
     * @param model model name
     * @param endpoint base URL of an OpenAI-compatible API
     * @param temperature sampling temperature
     * @param maxTokens completion token limit
     * @param timeoutSeconds per-call timeout
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LlmConfig(
        @JsonProperty("provider") String provider,
        @JsonProperty("model") String model,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("maxTokens") Integer maxTokens,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds
    ) {
        public static final String PROVIDER_RULE = "rule";
        public static final String PROVIDER_OPENAI = "openai";

        public static LlmConfig defaults() {
            return new LlmConfig(PROVIDER_RULE, null, null, null, null, null);
        }

        public String effectiveProvider() {
            return provider == null || provider.isBlank() ? PROVIDER_RULE : provider.trim();
        }

        public LlmConfig withProvider(String newProvider) {
            return new LlmConfig(newProvider, model, endpoint, temperature, maxTokens, timeoutSeconds);
        }

        public LlmConfig withModel(String newModel) {
            return new LlmConfig(provider, newModel, endpoint, temperature, maxTokens, timeoutSeconds);
        }

        public LlmConfig withEndpoint(String newEndpoint) {
            return new LlmConfig(provider, model, newEndpoint, temperature, maxTokens, timeoutSeconds);
        }
    }
}
