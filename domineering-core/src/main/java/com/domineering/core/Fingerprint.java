package com.domineering.core;

import java.util.Objects;

/**
 * Immutable structural signature of a {@link DomineeringState}: the full grid contents and
 * the side to move. Two states with equal fingerprints are interchangeable for searching.
 */
public record Fingerprint(int rows, int cols, String cells, Player toMove) {

    public Fingerprint {
        Objects.requireNonNull(cells, "cells");
        Objects.requireNonNull(toMove, "toMove");
        if (cells.length() != rows * cols) {
            throw new IllegalArgumentException("Expected " + rows * cols + " cells but got " + cells.length());
        }
    }
}
