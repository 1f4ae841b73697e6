package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;
import com.domineering.core.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered list of weighted evaluators producing the heuristic value of a leaf position.
 * Positive values favour HOME, negative values favour AWAY.
 *
 * <p>Steps run in insertion order on a single working copy of the position, so marking
 * evaluators see the marks left by the steps before them.
 */
public final class EvaluationPipeline {

    private static final Logger LOGGER = Logger.getLogger(EvaluationPipeline.class.getName());

    public static final int RESERVED_WEIGHT = 2;
    public static final int OPEN_WEIGHT = 1;

    private final List<EvaluationStep> steps;

    private EvaluationPipeline(List<EvaluationStep> steps) {
        this.steps = List.copyOf(steps);
    }

    /**
     * Returns the canonical pipeline: reserved and open slots for HOME, then for AWAY, clearing
     * marks after each side.
     */
    public static EvaluationPipeline standard() {
        return builder()
                .add("home-reserved", new ReservedPairEvaluator(Player.HOME), Weight.constant(RESERVED_WEIGHT))
                .add("home-open", new OpenPairEvaluator(Player.HOME), Weight.constant(OPEN_WEIGHT))
                .add("clear-home-marks", new ClearMarks(), Weight.constant(0))
                .add("away-reserved", new ReservedPairEvaluator(Player.AWAY), Weight.constant(-RESERVED_WEIGHT))
                .add("away-open", new OpenPairEvaluator(Player.AWAY), Weight.constant(-OPEN_WEIGHT))
                .add("clear-away-marks", new ClearMarks(), Weight.constant(0))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluates the position. The position itself is never modified.
     */
    public double evaluate(DomineeringState position) {
        Objects.requireNonNull(position, "position");
        DomineeringState workingCopy = new DomineeringState(position);
        boolean trace = LOGGER.isLoggable(Level.FINEST);
        double total = 0;
        for (EvaluationStep step : steps) {
            double contribution = (double) step.weight().weight(position) * step.evaluator().score(workingCopy);
            total += contribution;
            if (trace) {
                LOGGER.finest(() -> String.format("%s contributed %s", step.name(), contribution));
            }
        }
        return total;
    }

    public static final class Builder {

        private final List<EvaluationStep> steps = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String name, Evaluator evaluator, Weight weight) {
            steps.add(new EvaluationStep(name, evaluator, weight));
            return this;
        }

        public EvaluationPipeline build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Pipeline needs at least one step");
            }
            return new EvaluationPipeline(steps);
        }
    }
}
