package com.domineering.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.domineering.core.Move;
import com.domineering.core.Player;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchNodeTest {

    @Test
    void childAdvancesDepthAndSwapsMover() {
        SearchNode root = SearchNode.root(Player.HOME);
        SearchNode child = root.child(Move.horizontal(0, 0));

        assertNull(root.originMove());
        assertFalse(root.hasScore());
        assertEquals(1, child.depth());
        assertSame(Player.AWAY, child.mover());
        assertEquals(Move.horizontal(0, 0), child.originMove());
    }

    @Test
    void terminalNodeScoresLossForItsMover() {
        SearchNode home = SearchNode.root(Player.HOME).asTerminal();
        SearchNode away = SearchNode.root(Player.AWAY).asTerminal();

        assertTrue(home.isTerminal());
        assertEquals(Double.NEGATIVE_INFINITY, home.score());
        assertEquals(Double.POSITIVE_INFINITY, away.score());
    }

    @Test
    void provenScoreMustBeInfinite() {
        SearchNode node = SearchNode.root(Player.HOME);

        assertThrows(IllegalArgumentException.class, () -> node.asProven(3));
        assertTrue(node.asProven(Double.POSITIVE_INFINITY).isTerminal());
    }

    @Test
    void bestFirstOrdersByChooserAndPutsUnscoredLast() {
        SearchNode root = SearchNode.root(Player.HOME);
        SearchNode low = root.child(Move.horizontal(0, 0)).withScore(-1);
        SearchNode high = root.child(Move.horizontal(1, 0)).withScore(4);
        SearchNode unscored = root.child(Move.horizontal(2, 0));

        List<SearchNode> nodes = new ArrayList<>(List.of(unscored, low, high));
        nodes.sort(SearchNode.bestFirst(Player.HOME));
        assertEquals(List.of(high, low, unscored), nodes);

        nodes.sort(SearchNode.bestFirst(Player.AWAY));
        assertEquals(List.of(low, high, unscored), nodes);
    }
}
