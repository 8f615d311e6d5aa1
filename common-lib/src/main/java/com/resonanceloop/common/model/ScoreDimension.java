package com.resonanceloop.common.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of independent dimensions a response is scored on.
 *
 * <p>Declaration order is significant: it is the iteration order of every
 * per-dimension map and the tie-break order when picking the weakest dimension.
 */
public enum ScoreDimension {
    TONE("tone"),
    APPROACH("approach"),
    CADENCE("cadence"),
    LEXICAL("lexical"),
    STRUCTURE("structure");

    private final String key;

    ScoreDimension(String key) {
        this.key = key;
    }

    /** Lower-case key used in profile files and strategy tags. */
    public String key() {
        return key;
    }

    public static Optional<ScoreDimension> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
            .filter(d -> d.key.equalsIgnoreCase(key.trim()))
            .findFirst();
    }
}
