package com.domineering.core.ai.eval;

import com.domineering.core.DomineeringState;

/**
 * Base class for evaluators that count domino slots and mark the counted cells so that later
 * evaluators in the same pipeline pass do not count them again.
 * A {@link ClearMarks} step must run once a side's counts are final.
 */
public abstract class MarkingEvaluator implements Evaluator {

    /**
     * Marks the cell as counted. Cells that are not empty are left untouched.
     */
    protected static void mark(int row, int col, DomineeringState state) {
        if (state.isEmpty(row, col)) {
            state.setCell(row, col, DomineeringState.MARKED);
        }
    }

    /**
     * Reverts every marked cell back to {@link DomineeringState#EMPTY}.
     */
    protected static void clearMarks(DomineeringState state) {
        for (int r = 0; r < state.getRows(); r++) {
            for (int c = 0; c < state.getCols(); c++) {
                if (state.getCell(r, c) == DomineeringState.MARKED) {
                    state.setCell(r, c, DomineeringState.EMPTY);
                }
            }
        }
    }

    /**
     * Returns {@code true} if both cells are on the board and empty. Adjacency is not checked.
     */
    protected static boolean placeable(int r1, int c1, int r2, int c2, DomineeringState state) {
        return state.isEmpty(r1, c1) && state.isEmpty(r2, c2);
    }

    /**
     * Checks whether the horizontal slot is reserved for HOME: both cells are empty and the
     * cells directly above and directly below are all unavailable (occupied, marked or off-board).
     */
    protected static boolean reservedForHorizontal(int r1, int c1, int r2, int c2, DomineeringState state) {
        if (!placeable(r1, c1, r2, c2, state)) {
            return false;
        }
        boolean noSpaceAbove = !state.isEmpty(r1 + 1, c1) && !state.isEmpty(r2 + 1, c2);
        boolean noSpaceBelow = !state.isEmpty(r1 - 1, c1) && !state.isEmpty(r2 - 1, c2);
        return noSpaceAbove && noSpaceBelow;
    }

    /**
     * Checks whether the vertical slot is reserved for AWAY: both cells are empty and the cells
     * directly to the left and right are all unavailable.
     */
    protected static boolean reservedForVertical(int r1, int c1, int r2, int c2, DomineeringState state) {
        if (!placeable(r1, c1, r2, c2, state)) {
            return false;
        }
        boolean noSpaceLeft = !state.isEmpty(r1, c1 - 1) && !state.isEmpty(r2, c2 - 1);
        boolean noSpaceRight = !state.isEmpty(r1, c1 + 1) && !state.isEmpty(r2, c2 + 1);
        return noSpaceLeft && noSpaceRight;
    }

    /**
     * Marks both cells of a counted slot.
     */
    protected static void markSlot(int r1, int c1, int r2, int c2, DomineeringState state) {
        mark(r1, c1, state);
        mark(r2, c2, state);
    }
}
