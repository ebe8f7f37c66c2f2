package com.docforge.core.refine;

import com.docforge.core.model.CriticReview;

/**
 * One generate-review-score round.
 *
 * @param iteration 1-based iteration number
 * @param candidate generated block
 * @param review critic review of {@code candidate}
 * @param confidence scorer output for {@code candidate}
 */
public record Attempt(int iteration, String candidate, CriticReview review, double confidence) {
}
