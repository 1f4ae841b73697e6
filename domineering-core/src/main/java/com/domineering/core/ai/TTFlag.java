package com.domineering.core.ai;

/**
 * Classification of a value stored in the {@link TranspositionTable}.
 * {@link SearchEngine} stores full-window root results and therefore only writes {@link #EXACT};
 * the bound flags are available to callers that store results of narrowed-window searches.
 */
public enum TTFlag {
    EXACT,
    LOWER_BOUND,
    UPPER_BOUND
}
