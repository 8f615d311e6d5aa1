package com.resonanceloop.common.profile;

import com.resonanceloop.common.model.ScoreDimension;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Opaque text the composer and mutator assemble requests from.
 *
 * @param directive           system directive sent with every request
 * @param promptTemplate      initial prompt; contains {@link #SCENARIO_PLACEHOLDER} once or more
 * @param identityStatement   role framing restated by the broader mutation strategies
 * @param complianceDirective closing instruction used by the strongest strategy
 * @param amplifiers          one reinforcement phrase per dimension
 */
public record ProfileFraming(
    String directive,
    String promptTemplate,
    String identityStatement,
    String complianceDirective,
    Map<ScoreDimension, String> amplifiers
) {
    public static final String SCENARIO_PLACEHOLDER = "{scenario}";

    public ProfileFraming {
        Map<ScoreDimension, String> copy = new EnumMap<>(ScoreDimension.class);
        copy.putAll(amplifiers);
        amplifiers = Collections.unmodifiableMap(copy);
    }

    public String amplifier(ScoreDimension dimension) {
        return amplifiers.get(dimension);
    }
}
