package com.docforge.core.llm;

/**
 * Natural-language generation capability.
 *
 * <p>Implementations may be slow, rate limited or unavailable. Callers always have a
 * rule-based path to fall back on.
 */
public interface CompletionClient {

    /**
     * Produces text for a prompt.
     *
     * @param prompt chat prompt
     * @return generated text, never blank
     * @throws GenerationException if the call fails or times out
     */
    String complete(ChatPrompt prompt) throws GenerationException;
}
