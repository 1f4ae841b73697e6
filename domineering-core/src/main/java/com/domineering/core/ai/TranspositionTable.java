package com.domineering.core.ai;

import com.domineering.core.Fingerprint;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe position to value table keyed by {@link Fingerprint}.
 *
 * <p>{@link SearchEngine} inserts each completed root result but does not read the table while
 * searching; lookups are left to callers.
 */
public final class TranspositionTable {

    private final ConcurrentHashMap<Fingerprint, TTEntry> entries = new ConcurrentHashMap<>();

    public TTEntry get(Fingerprint key) {
        return entries.get(Objects.requireNonNull(key, "key"));
    }

    /**
     * Stores the entry unless the table already holds one searched at least as deep.
     *
     * @return the entry held for the key after the update
     */
    public TTEntry put(Fingerprint key, TTEntry entry) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(entry, "entry");
        return entries.merge(key, entry,
                (existing, candidate) -> existing.depth() >= candidate.depth() ? existing : candidate);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
