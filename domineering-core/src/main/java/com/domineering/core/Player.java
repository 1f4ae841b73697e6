package com.domineering.core;

/**
 * The two sides of a Domineering match.
 * HOME places horizontal dominoes and maximizes the evaluation, AWAY places vertical dominoes
 * and minimizes it.
 */
public enum Player {
    HOME('H', true),
    AWAY('V', false);

    private final char symbol;
    private final boolean maximizer;

    Player(char symbol, boolean maximizer) {
        this.symbol = symbol;
        this.maximizer = maximizer;
    }

    /**
     * Returns the cell symbol written for this player's dominoes.
     */
    public char symbol() {
        return symbol;
    }

    public boolean isMaximizer() {
        return maximizer;
    }

    public boolean isHorizontal() {
        return this == HOME;
    }

    public Player opponent() {
        return this == HOME ? AWAY : HOME;
    }

    /**
     * Returns the score of a position this player has lost, i.e. a position where this player
     * is to move and has no legal placement left.
     */
    public double losingScore() {
        return maximizer ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }

    public double winningScore() {
        return -losingScore();
    }

    /**
     * Returns the player owning the provided cell symbol, or {@code null} if none does.
     */
    public static Player fromSymbol(char symbol) {
        for (Player player : values()) {
            if (player.symbol == symbol) {
                return player;
            }
        }
        return null;
    }
}
