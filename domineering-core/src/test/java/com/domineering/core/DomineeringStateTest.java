package com.domineering.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class DomineeringStateTest {

    @Test
    void enumeratesHorizontalMovesForHome() {
        DomineeringState state = new DomineeringState(2, 3, Player.HOME);

        assertEquals(List.of(Move.horizontal(0, 0), Move.horizontal(0, 1),
                Move.horizontal(1, 0), Move.horizontal(1, 1)), state.legalMoves());
    }

    @Test
    void enumeratesVerticalMovesForAway() {
        DomineeringState state = DomineeringState.parse(Player.AWAY,
                "H..",
                "...",
                "..V");

        assertEquals(List.of(Move.vertical(0, 1), Move.vertical(0, 2),
                Move.vertical(1, 0), Move.vertical(1, 1)), state.legalMoves());
    }

    @Test
    void rejectsMovesInWrongOrientationOrOffBoard() {
        DomineeringState state = new DomineeringState(2, 2, Player.HOME);

        assertFalse(state.isLegal(Move.vertical(0, 0)));
        assertFalse(state.isLegal(Move.horizontal(0, 1)));
        assertFalse(state.isLegal(Move.horizontal(-1, 0)));
        assertThrows(IllegalArgumentException.class, () -> state.place(Move.vertical(0, 0)));
    }

    @Test
    void placeWritesSymbolAndPassesTurn() {
        DomineeringState state = new DomineeringState(2, 2, Player.HOME);

        state.place(Move.horizontal(1, 0));

        assertEquals('H', state.getCell(1, 0));
        assertEquals('H', state.getCell(1, 1));
        assertEquals(Player.AWAY, state.getToMove());
        assertFalse(state.hasLegalMove(), "AWAY has no vertical slot left");
        assertEquals(2, state.countEmpty());
    }

    @Test
    void copiesAreIndependent() {
        DomineeringState original = new DomineeringState(2, 2);
        DomineeringState copy = new DomineeringState(original);

        copy.place(Move.horizontal(0, 0));

        assertTrue(original.isEmpty(0, 0));
        assertEquals(Player.HOME, original.getToMove());
        assertNotEquals(original, copy);
    }

    @Test
    void fingerprintCoversGridAndSideToMove() {
        DomineeringState first = DomineeringState.parse(Player.HOME, "HH.", "...");
        DomineeringState second = new DomineeringState(2, 3, Player.HOME);
        second.place(Move.horizontal(0, 0));
        second.togglePlayer();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(first.fingerprint(), second.fingerprint());

        second.togglePlayer();
        assertNotEquals(first.fingerprint(), second.fingerprint());
    }

    @Test
    void outOfRangeCellsAreNeverEmpty() {
        DomineeringState state = new DomineeringState(1, 1);

        assertTrue(state.isEmpty(0, 0));
        assertFalse(state.isEmpty(0, 1));
        assertFalse(state.isEmpty(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> state.getCell(1, 0));
    }

    @Test
    void parseRejectsMalformedRows() {
        assertThrows(IllegalArgumentException.class, () -> DomineeringState.parse(Player.HOME, "..", "."));
        assertThrows(IllegalArgumentException.class, () -> DomineeringState.parse(Player.HOME, "x."));
        assertThrows(IllegalArgumentException.class, () -> new DomineeringState(0, 3));
    }
}
