package com.docforge.core.model;

import java.util.Objects;

/**
 * An exception kind raised explicitly in a body.
 *
 * @param kind exception name as written at the raise site (e.g. "ValueError", "errors.NotFound")
 * @param description optional description
 */
public record ExceptionInfo(String kind, String description) {

    public ExceptionInfo {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ExceptionInfo of(String kind) {
        return new ExceptionInfo(kind, null);
    }
}
