package com.docforge.core.llm;

import java.util.Objects;

/**
 * A two-message chat prompt.
 *
 * @param system system instruction
 * @param user user message carrying the element facts
 */
public record ChatPrompt(String system, String user) {
    public ChatPrompt {
        Objects.requireNonNull(system, "system must not be null");
        Objects.requireNonNull(user, "user must not be null");
    }
}
