package com.domineering.core.ai.eval;

import java.util.Objects;

/**
 * One entry of an {@link EvaluationPipeline}.
 *
 * @param name      label reported in the per-step FINEST trace of {@link EvaluationPipeline#evaluate}
 * @param evaluator the metric to compute on the working copy
 * @param weight    the factor applied to the metric
 */
public record EvaluationStep(String name, Evaluator evaluator, Weight weight) {

    public EvaluationStep {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(weight, "weight");
    }
}
