package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;
import com.domineering.core.Player;
import java.util.Objects;

/**
 * Counts the empty slots that only the given player can ever fill, marking their cells.
 * HOME slots are scanned row by row, AWAY slots column by column; since marked cells count as
 * unavailable, the scan order decides which neighbouring slots become reserved.
 */
public final class ReservedPairEvaluator extends MarkingEvaluator {

    private final Player player;

    public ReservedPairEvaluator(Player player) {
        this.player = Objects.requireNonNull(player, "player");
    }

    @Override
    public int score(DomineeringState workingCopy) {
        return player.isHorizontal() ? countHorizontal(workingCopy) : countVertical(workingCopy);
    }

    private static int countHorizontal(DomineeringState state) {
        int count = 0;
        for (int r = 0; r < state.getRows(); r++) {
            for (int c = 0; c < state.getCols(); c++) {
                if (reservedForHorizontal(r, c, r, c + 1, state)) {
                    count++;
                    markSlot(r, c, r, c + 1, state);
                }
            }
        }
        return count;
    }

    private static int countVertical(DomineeringState state) {
        int count = 0;
        for (int c = 0; c < state.getCols(); c++) {
            for (int r = 0; r < state.getRows(); r++) {
                if (reservedForVertical(r, c, r + 1, c, state)) {
                    count++;
                    markSlot(r, c, r + 1, c, state);
                }
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "ReservedPairEvaluator[" + player + "]";
    }
}
