package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;

/**
 * A single heuristic metric computed over a leaf position.
 */
@FunctionalInterface
public interface Evaluator {

    /**
     * Computes the metric for the given position.
     *
     * @param workingCopy a private copy of the leaf position; implementations may write
     *                    {@link DomineeringState#MARKED} into it
     * @return the unweighted metric value
     */
    int score(DomineeringState workingCopy);
}
