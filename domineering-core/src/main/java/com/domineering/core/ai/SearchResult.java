package com.domineering.core.ai;

import com.domineering.core.Move;
import java.util.Objects;
import java.util.Optional;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param bestNode        the resolved root choice; the root itself when no move was examined
 * @param depthLimit      the ply limit the search ran with
 * @param visitedNodes    number of nodes entered, leaves included
 * @param cutoffs         number of alpha-beta cutoffs
 * @param moveOrderReused whether the root children came from the move-order cache
 * @param elapsedNanos    wall-clock duration of the synchronous search
 */
public record SearchResult(SearchNode bestNode, int depthLimit, long visitedNodes, long cutoffs,
        boolean moveOrderReused, long elapsedNanos) {

    public SearchResult {
        Objects.requireNonNull(bestNode, "bestNode");
    }

    public Optional<Move> bestMove() {
        return Optional.ofNullable(bestNode.originMove());
    }

    public double score() {
        return bestNode.score();
    }
}
