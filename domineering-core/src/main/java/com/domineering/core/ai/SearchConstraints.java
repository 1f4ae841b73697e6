package com.domineering.core.ai;

import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 */
public record SearchConstraints(int depthLimit, PruningMode pruning) {

    public SearchConstraints {
        Objects.requireNonNull(pruning, "pruning");
        if (depthLimit < 0) {
            throw new IllegalArgumentException("depthLimit must not be negative");
        }
    }

    public static SearchConstraints ofDepth(int depthLimit) {
        return new SearchConstraints(depthLimit, PruningMode.ALPHA_BETA);
    }

    /**
     * Cutoff strategy applied while walking the tree.
     */
    public enum PruningMode {
        ALPHA_BETA,
        /**
         * Plain minimax: every child is examined. Returns the same value as
         * {@link #ALPHA_BETA}, only slower.
         */
        NONE
    }
}
