package com.docforge.cli;

import com.docforge.core.config.ProjectConfig;
import picocli.CommandLine.Option;

/**
 * Language model options. API keys come from {@code OPENAI_API_KEY} or {@code OPENROUTER_API_KEY}.
 */
public class LlmOptions {

    @Option(names = "--provider", description = "rule | openai (default: rule)")
    String provider;

    @Option(names = "--model", description = "Model name, e.g. gpt-4o-mini")
    String model;

    @Option(names = "--endpoint",
        description = "Override base URL of an OpenAI-compatible API, e.g. https://openrouter.ai/api")
    String endpoint;

    public ProjectConfig.LlmConfig apply(ProjectConfig.LlmConfig llm) {
        ProjectConfig.LlmConfig result = llm;
        if (provider != null) {
            result = result.withProvider(provider);
        }
        if (model != null) {
            result = result.withModel(model);
        }
        if (endpoint != null) {
            result = result.withEndpoint(endpoint);
        }
        return result;
    }
}
