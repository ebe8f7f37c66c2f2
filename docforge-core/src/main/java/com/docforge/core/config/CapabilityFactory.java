package com.docforge.core.config;

import com.docforge.core.critic.DocstringCritic;
import com.docforge.core.generator.DocstringGenerator;
import com.docforge.core.generator.impl.LanguageModelGenerator;
import com.docforge.core.generator.impl.RuleBasedGenerator;
import com.docforge.core.llm.LlmSettings;
import com.docforge.core.llm.OpenAiCompatibleClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Selects the generator and critic variants for a run.
 *
 * <p>{@code rule} uses the deterministic generator and objective-only critic. {@code openai}
 * wires both to one {@link OpenAiCompatibleClient}; the key is read from
 * {@code OPENAI_API_KEY}, or from {@code OPENROUTER_API_KEY}, in which case the OpenRouter
 * endpoint is the default.
 */
public final class CapabilityFactory {

    public static final String ENV_OPENAI_KEY = "OPENAI_API_KEY";
    public static final String ENV_OPENROUTER_KEY = "OPENROUTER_API_KEY";

    private static final Logger log = LoggerFactory.getLogger(CapabilityFactory.class);
    private static final double DEFAULT_TEMPERATURE = 0.2;
    private static final int MAX_ATTEMPTS = 3;

    private CapabilityFactory() {
        // Utility class - no instantiation
    }

    /**
     * Generator and critic for one run.
     *
     * @param generator candidate producer
     * @param critic candidate reviewer
     */
    public record Capabilities(DocstringGenerator generator, DocstringCritic critic) {
    }

    /**
     * Creates the capabilities named by {@code llm.provider}.
     *
     * @param llm language model settings
     * @param env environment variables holding API keys
     * @return generator and critic
     * @throws IllegalStateException if the provider is unknown or its API key is missing
     */
    public static Capabilities create(ProjectConfig.LlmConfig llm, Map<String, String> env) {
        String provider = llm.effectiveProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case ProjectConfig.LlmConfig.PROVIDER_RULE -> {
                log.debug("Using rule-based generator and objective critic");
                yield new Capabilities(new RuleBasedGenerator(), new DocstringCritic());
            }
            case ProjectConfig.LlmConfig.PROVIDER_OPENAI -> {
                OpenAiCompatibleClient client = new OpenAiCompatibleClient(settings(llm, env));
                log.info("Using language model {}", llm.model() != null ? llm.model() : LlmSettings.DEFAULT_MODEL);
                yield new Capabilities(new LanguageModelGenerator(client), new DocstringCritic(client));
            }
            default -> throw new IllegalStateException("Unknown provider: " + llm.provider());
        };
    }

    static LlmSettings settings(ProjectConfig.LlmConfig llm, Map<String, String> env) {
        String openAiKey = env.get(ENV_OPENAI_KEY);
        String openRouterKey = env.get(ENV_OPENROUTER_KEY);
        String apiKey;
        String defaultEndpoint;
        if (openAiKey != null && !openAiKey.isBlank()) {
            apiKey = openAiKey;
            defaultEndpoint = LlmSettings.OPENAI_BASE_URL;
        } else if (openRouterKey != null && !openRouterKey.isBlank()) {
            apiKey = openRouterKey;
            defaultEndpoint = LlmSettings.OPENROUTER_BASE_URL;
        } else {
            throw new IllegalStateException(
                "Provider 'openai' requires " + ENV_OPENAI_KEY + " or " + ENV_OPENROUTER_KEY);
        }
        String endpoint = llm.endpoint() != null && !llm.endpoint().isBlank() ? llm.endpoint() : defaultEndpoint;
        return new LlmSettings(apiKey, endpoint, llm.model(),
            llm.temperature() != null ? llm.temperature() : DEFAULT_TEMPERATURE,
            llm.maxTokens() != null ? llm.maxTokens() : 0,
            llm.timeoutSeconds() != null ? llm.timeoutSeconds() : 0,
            MAX_ATTEMPTS);
    }
}
