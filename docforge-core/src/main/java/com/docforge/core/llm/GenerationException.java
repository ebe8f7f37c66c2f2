package com.docforge.core.llm;

/**
 * A text generation call failed or returned nothing usable.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
