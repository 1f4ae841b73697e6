package com.domineering.core;

import java.util.Objects;

/**
 * A domino placement covering the two cells {@code (r1, c1)} and {@code (r2, c2)}.
 */
public record Move(int r1, int c1, int r2, int c2) {

    public static Move horizontal(int row, int col) {
        return new Move(row, col, row, col + 1);
    }

    public static Move vertical(int row, int col) {
        return new Move(row, col, row + 1, col);
    }

    /**
     * Creates the placement anchored at {@code (row, col)} in the orientation of the given player.
     */
    public static Move of(Player player, int row, int col) {
        Objects.requireNonNull(player, "player");
        return player.isHorizontal() ? horizontal(row, col) : vertical(row, col);
    }

    public boolean isHorizontal() {
        return r1 == r2 && c2 == c1 + 1;
    }

    public boolean isVertical() {
        return c1 == c2 && r2 == r1 + 1;
    }

    @Override
    public String toString() {
        return "(" + r1 + "," + c1 + ")-(" + r2 + "," + c2 + ")";
    }
}
