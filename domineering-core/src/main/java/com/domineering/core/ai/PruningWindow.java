package com.domineering.core.ai;

import com.domineering.core.Player;
import java.util.Objects;

/**
 * Alpha-beta bounds of one branch of the search.
 * Within a branch alpha only rises and beta only falls; each recursive call works on its own
 * {@link #copy()} so a subtree never narrows the window of its caller.
 */
public final class PruningWindow {

    public static final double NEG_INF = Double.NEGATIVE_INFINITY;
    public static final double POS_INF = Double.POSITIVE_INFINITY;

    private double alpha;
    private double beta;

    public PruningWindow(double alpha, double beta) {
        if (Double.isNaN(alpha) || Double.isNaN(beta)) {
            throw new IllegalArgumentException("Window bounds must be numbers");
        }
        this.alpha = alpha;
        this.beta = beta;
    }

    /**
     * Returns the widest window, used at the root of every top-level search.
     */
    public static PruningWindow full() {
        return new PruningWindow(NEG_INF, POS_INF);
    }

    public double alpha() {
        return alpha;
    }

    public double beta() {
        return beta;
    }

    public PruningWindow copy() {
        return new PruningWindow(alpha, beta);
    }

    /**
     * Raises alpha for the maximizer, lowers beta for the minimizer.
     */
    public void updateIfNeeded(double score, Player mover) {
        Objects.requireNonNull(mover, "mover");
        if (mover.isMaximizer()) {
            alpha = Math.max(alpha, score);
        } else {
            beta = Math.min(beta, score);
        }
    }

    /**
     * Returns {@code true} on a beta cutoff for the maximizer ({@code score >= beta}) or an alpha
     * cutoff for the minimizer ({@code score <= alpha}).
     */
    public boolean canPrune(double score, Player mover) {
        Objects.requireNonNull(mover, "mover");
        return mover.isMaximizer() ? score >= beta : score <= alpha;
    }

    @Override
    public String toString() {
        return "[" + alpha + ", " + beta + "]";
    }
}
