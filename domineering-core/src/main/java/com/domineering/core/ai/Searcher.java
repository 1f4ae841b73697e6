package com.domineering.core.ai;

import com.domineering.core.DomineeringState;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Executes a search for the best move in the provided {@link DomineeringState} under the
     * supplied {@link SearchConstraints}.
     *
     * @param state the starting position to analyse; not modified
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SearchResult search(DomineeringState state, SearchConstraints constraints);
}
