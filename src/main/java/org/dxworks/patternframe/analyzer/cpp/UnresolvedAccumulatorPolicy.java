package org.dxworks.patternframe.analyzer.cpp;

import java.util.Locale;

/**
 * What to do when a chain feeds a named sink that no declaration registered.
 */
public enum UnresolvedAccumulatorPolicy {
    /** Report {@code UNRESOLVED_ACCUMULATOR_REFERENCE}. */
    STRICT,
    /** Bind the name implicitly, starting from an empty value. */
    PERMISSIVE;

    public static UnresolvedAccumulatorPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return STRICT;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
