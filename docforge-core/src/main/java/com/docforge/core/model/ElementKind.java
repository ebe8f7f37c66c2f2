package com.docforge.core.model;

/**
 * Kind of a documentable code element.
 */
public enum ElementKind {
    FUNCTION("function"),
    METHOD("method"),
    CONSTRUCTOR("constructor"),
    CLASS("class");

    private final String label;

    ElementKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true for kinds defined with {@code def}.
     *
     * @return true unless this is {@link #CLASS}
     */
    public boolean isCallable() {
        return this != CLASS;
    }
}
