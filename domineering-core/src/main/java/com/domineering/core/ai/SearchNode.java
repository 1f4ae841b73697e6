package com.domineering.core.ai;

import com.domineering.core.Move;
import com.domineering.core.Player;
import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable description of one vertex of the game tree.
 *
 * <p>{@code mover} is the player to act at this node and {@code originMove} is the placement
 * the opponent made to reach it ({@code null} at the root). The score is unset ({@code NaN}),
 * a finite heuristic value, or an infinite value marking a proven outcome.
 */
public final class SearchNode {

    private final Player mover;
    private final int depth;
    private final Move originMove;
    private final double score;
    private final boolean terminal;

    private SearchNode(Player mover, int depth, Move originMove, double score, boolean terminal) {
        this.mover = mover;
        this.depth = depth;
        this.originMove = originMove;
        this.score = score;
        this.terminal = terminal;
    }

    public static SearchNode root(Player mover) {
        return new SearchNode(Objects.requireNonNull(mover, "mover"), 0, null, Double.NaN, false);
    }

    /**
     * Returns the node reached when this node's mover plays {@code move}.
     */
    public SearchNode child(Move move) {
        return new SearchNode(mover.opponent(), depth + 1, Objects.requireNonNull(move, "move"), Double.NaN, false);
    }

    public SearchNode withScore(double newScore) {
        return new SearchNode(mover, depth, originMove, newScore, terminal);
    }

    /**
     * Marks this node as a position where its mover has no legal placement, i.e. a loss for
     * the mover.
     */
    public SearchNode asTerminal() {
        return new SearchNode(mover, depth, originMove, mover.losingScore(), true);
    }

    /**
     * Marks this node as carrying a proven outcome with the given infinite score.
     */
    public SearchNode asProven(double provenScore) {
        if (!Double.isInfinite(provenScore)) {
            throw new IllegalArgumentException("Proven score must be infinite: " + provenScore);
        }
        return new SearchNode(mover, depth, originMove, provenScore, true);
    }

    public Player mover() {
        return mover;
    }

    public int depth() {
        return depth;
    }

    public Move originMove() {
        return originMove;
    }

    public double score() {
        return score;
    }

    public boolean hasScore() {
        return !Double.isNaN(score);
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Orders nodes so that the best ones for {@code chooser} come first: descending scores for
     * the maximizer, ascending for the minimizer. Nodes without a score sort last.
     */
    public static Comparator<SearchNode> bestFirst(Player chooser) {
        Objects.requireNonNull(chooser, "chooser");
        Comparator<SearchNode> byScore = Comparator.comparingDouble(SearchNode::score);
        Comparator<SearchNode> scored = chooser.isMaximizer() ? byScore.reversed() : byScore;
        return Comparator.comparing((SearchNode node) -> !node.hasScore()).thenComparing(scored);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchNode other)) {
            return false;
        }
        return depth == other.depth && terminal == other.terminal && mover == other.mover
                && Objects.equals(originMove, other.originMove)
                && Double.compare(score, other.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mover, depth, originMove, score, terminal);
    }

    @Override
    public String toString() {
        return "SearchNode{mover=" + mover + ", depth=" + depth + ", move=" + originMove
                + ", score=" + score + (terminal ? ", terminal" : "") + "}";
    }
}
