package com.docforge.core.model;

/**
 * Terminal state of the refinement loop for one element.
 */
public enum RefinementOutcome {
    /** A candidate reached the confidence threshold. */
    ACCEPTED,
    /** The iteration budget ran out; the best candidate seen is used. */
    EXHAUSTED
}
