package com.resonanceloop.common.profile;

import com.resonanceloop.common.exception.ProfileValidationException;
import com.resonanceloop.common.model.ScoreDimension;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Converts a raw {@link ProfileDefinition} into a {@link TargetProfile}, failing fast.
 *
 * <p>Rules:
 * <ul>
 *   <li>every {@link ScoreDimension} has a weight in [0,1], and the weights sum to 1 within {@link #WEIGHT_EPSILON}</li>
 *   <li>every dimension has a non-empty pattern set; every pattern compiles</li>
 *   <li>framing is complete: directive, template with {@code {scenario}}, identity, compliance, one amplifier per dimension</li>
 * </ul>
 * All problems are collected and reported together in one {@link ProfileValidationException}.
 */
public final class ProfileValidator {

    public static final double WEIGHT_EPSILON = 1e-6;
    static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private ProfileValidator() {}

    public static TargetProfile validate(ProfileDefinition definition) {
        if (definition == null) {
            throw new ProfileValidationException("<null>", List.of("definition is null"));
        }
        String id = isBlank(definition.profileId()) ? "<unnamed>" : definition.profileId().trim();
        List<String> problems = new ArrayList<>();
        if (isBlank(definition.profileId())) problems.add("profileId is missing");

        Map<ScoreDimension, Double> weights = validateWeights(definition.dimensionWeights(), problems);
        Map<String, List<Pattern>> patternSets = compilePatternSets(definition.patternSets(), problems);
        ProfileFraming framing = validateFraming(definition.framing(), problems);

        if (!problems.isEmpty()) {
            throw new ProfileValidationException(id, problems);
        }
        return new TargetProfile(
            id,
            isBlank(definition.displayName()) ? id : definition.displayName(),
            definition.description() == null ? "" : definition.description(),
            weights,
            patternSets,
            definition.categoricalCodes(),
            framing);
    }

    // ── weights ───────────────────────────────────────────────────────────────

    private static Map<ScoreDimension, Double> validateWeights(Map<String, Double> raw, List<String> problems) {
        Map<ScoreDimension, Double> weights = new EnumMap<>(ScoreDimension.class);
        if (raw == null || raw.isEmpty()) {
            problems.add("dimensionWeights are missing");
            return weights;
        }
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            ScoreDimension dimension = ScoreDimension.fromKey(entry.getKey()).orElse(null);
            if (dimension == null) {
                problems.add("unknown weight dimension '" + entry.getKey() + "'");
                continue;
            }
            Double w = entry.getValue();
            if (w == null || w.isNaN() || w < 0.0 || w > 1.0) {
                problems.add("weight for '" + dimension.key() + "' must be within [0,1], got " + w);
                continue;
            }
            weights.put(dimension, w);
        }
        boolean complete = true;
        for (ScoreDimension dimension : ScoreDimension.values()) {
            if (!weights.containsKey(dimension) && !hasKey(raw, dimension)) {
                problems.add("weight for '" + dimension.key() + "' is missing");
                complete = false;
            }
        }
        if (complete && weights.size() == ScoreDimension.values().length) {
            double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
            if (Math.abs(sum - 1.0) > WEIGHT_EPSILON) {
                problems.add(String.format("weights must sum to 1.0, got %.6f", sum));
            }
        }
        return weights;
    }

    private static boolean hasKey(Map<String, Double> raw, ScoreDimension dimension) {
        return raw.keySet().stream().anyMatch(k -> dimension.key().equalsIgnoreCase(k.trim()));
    }

    // ── pattern sets ──────────────────────────────────────────────────────────

    private static Map<String, List<Pattern>> compilePatternSets(Map<String, List<String>> raw, List<String> problems) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        if (raw == null || raw.isEmpty()) {
            problems.add("patternSets are missing");
            return compiled;
        }
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            String key = entry.getKey().trim().toLowerCase();
            List<Pattern> patterns = new ArrayList<>();
            for (String source : entry.getValue() == null ? List.<String>of() : entry.getValue()) {
                if (isBlank(source)) {
                    problems.add("blank pattern in set '" + key + "'");
                    continue;
                }
                try {
                    patterns.add(Pattern.compile(source, PATTERN_FLAGS));
                } catch (PatternSyntaxException e) {
                    problems.add("pattern '" + source + "' in set '" + key + "' does not compile: "
                                 + e.getDescription());
                }
            }
            compiled.put(key, patterns);
        }
        for (ScoreDimension dimension : ScoreDimension.values()) {
            List<Pattern> set = compiled.get(dimension.key());
            if (set == null || set.isEmpty()) {
                problems.add("pattern set '" + dimension.key() + "' is missing or empty");
            }
        }
        return compiled;
    }

    // ── framing ───────────────────────────────────────────────────────────────

    private static ProfileFraming validateFraming(ProfileDefinition.Framing raw, List<String> problems) {
        if (raw == null) {
            problems.add("framing is missing");
            return null;
        }
        if (isBlank(raw.directive())) problems.add("framing.directive is missing");
        if (isBlank(raw.identityStatement())) problems.add("framing.identityStatement is missing");
        if (isBlank(raw.complianceDirective())) problems.add("framing.complianceDirective is missing");
        if (isBlank(raw.promptTemplate())) {
            problems.add("framing.promptTemplate is missing");
        } else if (!raw.promptTemplate().contains(ProfileFraming.SCENARIO_PLACEHOLDER)) {
            problems.add("framing.promptTemplate lacks the " + ProfileFraming.SCENARIO_PLACEHOLDER + " placeholder");
        }

        Map<ScoreDimension, String> amplifiers = new EnumMap<>(ScoreDimension.class);
        Map<String, String> rawAmplifiers = raw.amplifiers() == null ? Map.of() : raw.amplifiers();
        rawAmplifiers.forEach((key, text) -> ScoreDimension.fromKey(key)
            .ifPresentOrElse(
                d -> { if (!isBlank(text)) amplifiers.put(d, text.trim()); },
                () -> problems.add("unknown amplifier dimension '" + key + "'")));
        for (ScoreDimension dimension : ScoreDimension.values()) {
            if (!amplifiers.containsKey(dimension)) {
                problems.add("framing.amplifiers." + dimension.key() + " is missing");
            }
        }
        return new ProfileFraming(raw.directive(), raw.promptTemplate(),
                                  raw.identityStatement(), raw.complianceDirective(), amplifiers);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
