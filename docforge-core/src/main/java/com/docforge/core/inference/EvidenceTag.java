package com.docforge.core.inference;

/**
 * Usage evidence observed for a parameter.
 */
public enum EvidenceTag {
    /** {@code p[i]} or {@code p[a:b]}. */
    INDEXED,
    /** {@code p["key"]}. */
    KEY_ACCESS,
    /** {@code p.items()}, {@code p.keys()}, {@code p.get(...)}. */
    MAPPING_METHOD,
    /** {@code p.append(...)}, {@code p.extend(...)}, {@code p.sort()}. */
    SEQUENCE_MUTATION,
    /** {@code p.add(...)}, {@code p.union(...)}. */
    SET_METHOD,
    /** {@code p.strip()}, {@code p.startswith(...)}. */
    STRING_METHOD,
    /** Combined or compared with a string literal. */
    STRING_OPERAND,
    /** Operand of {@code + - * / // % **} or unary minus. */
    ARITHMETIC,
    /** Ordered against a numeric literal. */
    NUMERIC_COMPARISON,
    /** Iterated by {@code for}, a comprehension or an iterating builtin. */
    ITERATED,
    /** Right operand of {@code in}. */
    MEMBERSHIP,
    /** Passed to {@code len}. */
    SIZED,
    /** Called like a function. */
    CALLED,
    /** Any other attribute access. Never decides a type alone. */
    ATTRIBUTE,
    NUMERIC_DEFAULT,
    STRING_DEFAULT,
    BOOL_DEFAULT,
    LIST_DEFAULT,
    DICT_DEFAULT
}
