package com.docforge.core.model;

import java.util.List;

/**
 * Structured judgement of one candidate block. Produced fresh per iteration.
 *
 * @param score quality score in [0, 1]
 * @param issues problems found, in detection order
 * @param suggestions improvements to apply on the next iteration
 */
public record CriticReview(
    double score,
    List<String> issues,
    List<String> suggestions
) {
    public CriticReview {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be in [0, 1]: " + score);
        }
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
