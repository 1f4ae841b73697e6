package com.domineering.core.ai;

import com.domineering.core.Fingerprint;
import com.domineering.core.Player;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-search store of child orderings recorded two plies below the root.
 *
 * <p>Between two calls of {@link SearchEngine#search} the real game normally advances by one ply
 * per side, so a position recorded at depth 2 becomes the next root. Reusing its children, sorted
 * by the scores of the previous search, lets the next search examine the strongest moves first.
 *
 * <p>Not thread-safe. The engine hands the cache to its sorter thread only after a search returns
 * and takes it back by joining the sort task, so no two threads touch it at the same time.
 */
public final class MoveOrderCache {

    private final Map<Fingerprint, List<SearchNode>> orderings = new HashMap<>();

    /**
     * Records the children examined below the given position, replacing any earlier ordering.
     */
    public void record(Fingerprint position, List<SearchNode> children) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(children, "children");
        orderings.put(position, new ArrayList<>(children));
    }

    /**
     * Removes and returns the ordering stored for the position, or {@code null} if there is none.
     */
    public List<SearchNode> take(Fingerprint position) {
        return orderings.remove(Objects.requireNonNull(position, "position"));
    }

    public List<SearchNode> peek(Fingerprint position) {
        List<SearchNode> children = orderings.get(Objects.requireNonNull(position, "position"));
        return children == null ? null : List.copyOf(children);
    }

    /**
     * Sorts every stored ordering best-first for {@code chooser}.
     */
    public void sortAll(Player chooser) {
        var comparator = SearchNode.bestFirst(chooser);
        for (List<SearchNode> children : orderings.values()) {
            children.sort(comparator);
        }
    }

    public void clear() {
        orderings.clear();
    }

    public int size() {
        return orderings.size();
    }

    public boolean isEmpty() {
        return orderings.isEmpty();
    }
}
