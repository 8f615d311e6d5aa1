package com.resonanceloop.common.profile;

import com.resonanceloop.common.model.ScoreDimension;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validated behavioral profile a response is scored against.
 *
 * <p>Instances are built only by {@link ProfileValidator}, are deeply immutable and
 * are shared across concurrent runs. Patterns are compiled once at load time.
 */
public record TargetProfile(
    String profileId,
    String displayName,
    String description,
    Map<ScoreDimension, Double> dimensionWeights,
    Map<String, List<Pattern>> patternSets,
    Map<String, String> categoricalCodes,
    ProfileFraming framing
) {
    /** Optional pattern set whose hits add a bonus to the tone dimension. */
    public static final String INTENSIFIERS = "intensifiers";

    public TargetProfile {
        Map<ScoreDimension, Double> weights = new EnumMap<>(ScoreDimension.class);
        weights.putAll(dimensionWeights);
        dimensionWeights = Collections.unmodifiableMap(weights);
        Map<String, List<Pattern>> sets = new LinkedHashMap<>();
        patternSets.forEach((key, patterns) -> sets.put(key, List.copyOf(patterns)));
        patternSets = Collections.unmodifiableMap(sets);
        categoricalCodes = categoricalCodes == null ? Map.of() : Map.copyOf(categoricalCodes);
    }

    public double weight(ScoreDimension dimension) {
        return dimensionWeights.getOrDefault(dimension, 0.0);
    }

    public List<Pattern> patterns(ScoreDimension dimension) {
        return patternSets.getOrDefault(dimension.key(), List.of());
    }

    public List<Pattern> intensifiers() {
        return patternSets.getOrDefault(INTENSIFIERS, List.of());
    }

    public String code(String name) {
        return categoricalCodes.get(name);
    }
}
