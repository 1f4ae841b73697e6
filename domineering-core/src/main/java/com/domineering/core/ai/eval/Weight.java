package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;

/**
 * Factor applied to an {@link Evaluator} result. Receives the untouched leaf position.
 */
@FunctionalInterface
public interface Weight {

    int weight(DomineeringState position);

    static Weight constant(int value) {
        return ignored -> value;
    }
}
