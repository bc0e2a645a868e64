package io.mapperxform.core.compiler;

/**
 * How functoid inputs whose target handle carries no {@code input-<N>} index are positioned.
 *
 * <ul>
 * <li>{@link #APPEND_UNINDEXED}: indexed inputs first, by index; unindexed inputs follow in edge
 * order (default).</li>
 * <li>{@link #LEGACY_INDEX_ZERO}: unindexed inputs sort as index 0, so several of them compete for
 * the first slot. Matches documents produced by early editor versions.</li>
 * </ul>
 */
public enum InputOrdering {
    APPEND_UNINDEXED,
    LEGACY_INDEX_ZERO
}
