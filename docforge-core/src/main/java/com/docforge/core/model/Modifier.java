package com.docforge.core.model;

/**
 * Attributes of an element that shape generation prompts but not its identity.
 */
public enum Modifier {
    /** Defined with {@code async def}. */
    ASYNC,
    /** Has at least one decorator. */
    DECORATED,
    /** Decorated with {@code @staticmethod}. */
    STATIC_METHOD,
    /** Decorated with {@code @classmethod}. */
    CLASS_METHOD,
    /** Decorated with {@code @property} or a property setter/deleter. */
    PROPERTY,
    /** Decorated with {@code @abstractmethod}. */
    ABSTRACT,
    /** Defined inside a function body. */
    NESTED,
    /** Body contains {@code yield}. */
    GENERATOR
}
