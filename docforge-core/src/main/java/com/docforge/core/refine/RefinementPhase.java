package com.docforge.core.refine;

/**
 * States of the per-element refinement loop.
 */
public enum RefinementPhase {
    INIT,
    GENERATED,
    REVIEWED,
    ACCEPTED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED;
    }
}
