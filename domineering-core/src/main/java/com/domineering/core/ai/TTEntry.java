package com.domineering.core.ai;

import com.domineering.core.Move;

/**
 * Entry stored inside the transposition table.
 *
 * @param value    the evaluated value, positive in favour of HOME
 * @param depth    the search depth for which the value is valid
 * @param flag     the alpha-beta bound classification for the stored value
 * @param bestMove the move that produced {@link #value()}, or {@code null} if unknown
 */
public record TTEntry(double value, int depth, TTFlag flag, Move bestMove) {
}
