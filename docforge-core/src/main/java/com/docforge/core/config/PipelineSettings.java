package com.docforge.core.config;

import com.docforge.core.model.DocstringStyle;

import java.util.Objects;

/**
 * Immutable run configuration threaded through every pipeline call.
 *
 * @param style target documentation style
 * @param threshold confidence needed to accept a candidate; values above 1.0 are never met
 * @param maxIterations generator calls allowed per element, at least 1
 * @param overwrite replace existing blocks instead of skipping their elements
 * @param elementWorkers elements refined in parallel within one file, at least 1
 */
public record PipelineSettings(
    DocstringStyle style,
    double threshold,
    int maxIterations,
    boolean overwrite,
    int elementWorkers
) {
    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final int DEFAULT_MAX_ITERATIONS = 3;

    public PipelineSettings {
        Objects.requireNonNull(style, "style must not be null");
        if (Double.isNaN(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be >= 0: " + threshold);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        }
        if (elementWorkers < 1) {
            throw new IllegalArgumentException("elementWorkers must be >= 1: " + elementWorkers);
        }
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(DocstringStyle.GOOGLE, DEFAULT_THRESHOLD, DEFAULT_MAX_ITERATIONS, false, 1);
    }

    public PipelineSettings withStyle(DocstringStyle newStyle) {
        return new PipelineSettings(newStyle, threshold, maxIterations, overwrite, elementWorkers);
    }

    public PipelineSettings withThreshold(double newThreshold) {
        return new PipelineSettings(style, newThreshold, maxIterations, overwrite, elementWorkers);
    }

    public PipelineSettings withMaxIterations(int newMaxIterations) {
        return new PipelineSettings(style, threshold, newMaxIterations, overwrite, elementWorkers);
    }

    public PipelineSettings withOverwrite(boolean newOverwrite) {
        return new PipelineSettings(style, threshold, maxIterations, newOverwrite, elementWorkers);
    }
}
