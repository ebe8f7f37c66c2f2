package com.docforge.core.refine;

import com.docforge.core.model.CriticReview;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable loop state for one element. Confined to the thread refining that element.
 */
final class RefinementState {

    private RefinementPhase phase = RefinementPhase.INIT;
    private int iteration;
    private String candidate;
    private final List<Attempt> history = new ArrayList<>();
    private Attempt best;

    RefinementPhase phase() {
        return phase;
    }

    int iteration() {
        return iteration;
    }

    String candidate() {
        return candidate;
    }

    void generated(String newCandidate) {
        requirePhase(RefinementPhase.INIT, RefinementPhase.REVIEWED);
        iteration++;
        candidate = newCandidate;
        phase = RefinementPhase.GENERATED;
    }

    void reviewed(CriticReview review, double confidence) {
        requirePhase(RefinementPhase.GENERATED);
        Attempt attempt = new Attempt(iteration, candidate, review, confidence);
        history.add(attempt);
        // Ties keep the earlier candidate.
        if (best == null || confidence > best.confidence()) {
            best = attempt;
        }
        phase = RefinementPhase.REVIEWED;
    }

    void finish(RefinementPhase terminal) {
        requirePhase(RefinementPhase.REVIEWED);
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("not a terminal phase: " + terminal);
        }
        phase = terminal;
    }

    Attempt latest() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    Attempt best() {
        return best;
    }

    private void requirePhase(RefinementPhase... allowed) {
        for (RefinementPhase candidatePhase : allowed) {
            if (phase == candidatePhase) {
                return;
            }
        }
        throw new IllegalStateException("unexpected transition from " + phase);
    }
}
