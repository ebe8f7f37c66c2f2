package com.docforge.core.llm;

/**
 * An evaluation call failed or returned an unparseable verdict.
 */
public class EvaluationException extends Exception {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
