package com.domineering.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mutable grid representation of a Domineering position.
 * Each cell holds one symbol: {@link #EMPTY}, a player's symbol, or the evaluator scratch
 * symbol {@link #MARKED}. The state also tracks which player is to move.
 */
public final class DomineeringState {

    public static final char EMPTY = '.';
    /**
     * Scratch symbol that evaluators write on private working copies to flag already counted
     * cells.
     */
    public static final char MARKED = '!';

    private final int rows;
    private final int cols;
    private final char[] cells;
    private Player toMove;

    /**
     * Creates an empty board with HOME to move.
     */
    public DomineeringState(int rows, int cols) {
        this(rows, cols, Player.HOME);
    }

    public DomineeringState(int rows, int cols, Player toMove) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Board must have at least one row and one column: "
                    + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.cells = new char[rows * cols];
        Arrays.fill(cells, EMPTY);
        this.toMove = Objects.requireNonNull(toMove, "toMove");
    }

    /**
     * Creates an independent copy of {@code other}.
     */
    public DomineeringState(DomineeringState other) {
        Objects.requireNonNull(other, "other");
        this.rows = other.rows;
        this.cols = other.cols;
        this.cells = other.cells.clone();
        this.toMove = other.toMove;
    }

    /**
     * Builds a state from one string per row, e.g. {@code parse(Player.AWAY, "HH.", "...")}.
     */
    public static DomineeringState parse(Player toMove, String... rowStrings) {
        Objects.requireNonNull(rowStrings, "rowStrings");
        if (rowStrings.length == 0) {
            throw new IllegalArgumentException("At least one row is required");
        }
        int width = rowStrings[0].length();
        DomineeringState state = new DomineeringState(rowStrings.length, width, toMove);
        for (int r = 0; r < rowStrings.length; r++) {
            String row = Objects.requireNonNull(rowStrings[r], "row");
            if (row.length() != width) {
                throw new IllegalArgumentException("Row " + r + " has length " + row.length() + ", expected " + width);
            }
            for (int c = 0; c < width; c++) {
                state.setCell(r, c, row.charAt(c));
            }
        }
        return state;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public Player getToMove() {
        return toMove;
    }

    /**
     * Passes the turn to the other player.
     */
    public void togglePlayer() {
        toMove = toMove.opponent();
    }

    public boolean isInBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public char getCell(int row, int col) {
        checkCell(row, col);
        return cells[row * cols + col];
    }

    public void setCell(int row, int col, char symbol) {
        checkCell(row, col);
        if (symbol != EMPTY && symbol != MARKED && Player.fromSymbol(symbol) == null) {
            throw new IllegalArgumentException("Unknown cell symbol '" + symbol + "'");
        }
        cells[row * cols + col] = symbol;
    }

    /**
     * Returns {@code true} if the cell exists and holds {@link #EMPTY}. Coordinates outside the
     * grid are never empty.
     */
    public boolean isEmpty(int row, int col) {
        return isInBounds(row, col) && cells[row * cols + col] == EMPTY;
    }

    /**
     * Returns {@code true} if the player to move may place the given domino.
     */
    public boolean isLegal(Move move) {
        Objects.requireNonNull(move, "move");
        boolean oriented = toMove.isHorizontal() ? move.isHorizontal() : move.isVertical();
        return oriented && isEmpty(move.r1(), move.c1()) && isEmpty(move.r2(), move.c2());
    }

    /**
     * Enumerates the legal placements of the player to move, anchored cell by cell in row-major
     * order.
     */
    public List<Move> legalMoves() {
        List<Move> moves = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                Move move = Move.of(toMove, r, c);
                if (isLegal(move)) {
                    moves.add(move);
                }
            }
        }
        return moves;
    }

    public boolean hasLegalMove() {
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (isLegal(Move.of(toMove, r, c))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Places the domino for the player to move and passes the turn.
     */
    public void place(Move move) {
        if (!isLegal(move)) {
            throw new IllegalArgumentException("Illegal move " + move + " for " + toMove);
        }
        char symbol = toMove.symbol();
        cells[move.r1() * cols + move.c1()] = symbol;
        cells[move.r2() * cols + move.c2()] = symbol;
        togglePlayer();
    }

    /**
     * Counts the cells that are still {@link #EMPTY}.
     */
    public int countEmpty() {
        int count = 0;
        for (char cell : cells) {
            if (cell == EMPTY) {
                count++;
            }
        }
        return count;
    }

    public Fingerprint fingerprint() {
        return new Fingerprint(rows, cols, new String(cells), toMove);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DomineeringState other)) {
            return false;
        }
        return rows == other.rows && cols == other.cols && toMove == other.toMove
                && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(rows, cols, toMove);
        return 31 * result + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(rows * (cols + 1) + 16);
        builder.append(toMove).append(" to move");
        for (int r = 0; r < rows; r++) {
            builder.append('\n').append(cells, r * cols, cols);
        }
        return builder.toString();
    }

    private void checkCell(int row, int col) {
        if (!isInBounds(row, col)) {
            throw new IllegalArgumentException("Cell (" + row + "," + col + ") out of range for "
                    + rows + "x" + cols + " board");
        }
    }
}
