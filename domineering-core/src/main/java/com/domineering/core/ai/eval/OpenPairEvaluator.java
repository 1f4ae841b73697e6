package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;
import com.domineering.core.Player;
import java.util.Objects;

/**
 * Counts the remaining empty slots in the given player's orientation, marking their cells so
 * that overlapping slots are counted once.
 */
public final class OpenPairEvaluator extends MarkingEvaluator {

    private final Player player;

    public OpenPairEvaluator(Player player) {
        this.player = Objects.requireNonNull(player, "player");
    }

    @Override
    public int score(DomineeringState workingCopy) {
        int dr = player.isHorizontal() ? 0 : 1;
        int dc = player.isHorizontal() ? 1 : 0;
        int count = 0;
        for (int c = 0; c < workingCopy.getCols(); c++) {
            for (int r = 0; r < workingCopy.getRows(); r++) {
                if (placeable(r, c, r + dr, c + dc, workingCopy)) {
                    count++;
                    markSlot(r, c, r + dr, c + dc, workingCopy);
                }
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "OpenPairEvaluator[" + player + "]";
    }
}
