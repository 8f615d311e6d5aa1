package com.resonanceloop.common;

import com.resonanceloop.common.profile.ProfileDefinition;
import com.resonanceloop.common.profile.ProfileValidator;
import com.resonanceloop.common.profile.TargetProfile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Profile fixtures for unit tests. Every accessor returns a fresh, mutable copy.
 */
public final class TestProfiles {

    public static final String SCENARIO = "A neighbour asks whether to forgive a friend who broke a promise.";

    private TestProfiles() {}

    public static TargetProfile nurturer() {
        return ProfileValidator.validate(definition());
    }

    public static ProfileDefinition definition() {
        return new ProfileDefinition("nurturer", "Test Nurturer", "fixture",
                                     weights(), patternSets(), codes(), framing());
    }

    public static Map<String, Double> weights() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("tone", 0.25);
        w.put("approach", 0.25);
        w.put("cadence", 0.20);
        w.put("lexical", 0.15);
        w.put("structure", 0.15);
        return w;
    }

    public static Map<String, List<String>> patternSets() {
        Map<String, List<String>> sets = new LinkedHashMap<>();
        sets.put("tone", List.of("\\bwarm\\w*", "\\bcare\\w*", "\\bgentle\\w*", "\\bhope\\w*"));
        sets.put("intensifiers", List.of("\\bdeeply\\b", "\\btruly\\b"));
        sets.put("approach", List.of("\\bsupport\\w*", "\\btogether\\b", "\\blisten\\w*"));
        sets.put("cadence", List.of("\\bgently\\b", "\\bslowly\\b", ";"));
        sets.put("lexical", List.of("compassion", "growth", "trust", "harmony"));
        sets.put("structure", List.of("\\bjudgment\\b", "\\brecommend\\w*", "\\bconclusion\\b"));
        return sets;
    }

    public static Map<String, String> codes() {
        Map<String, String> codes = new LinkedHashMap<>();
        codes.put("toneCode", "COMPASSIONATE");
        codes.put("decisionStyle", "heart_centered");
        return codes;
    }

    public static ProfileDefinition.Framing framing() {
        return framing("Consider this situation: {scenario}\nGive your judgment, recommendation and conclusion.");
    }

    public static ProfileDefinition.Framing framing(String template) {
        Map<String, String> amplifiers = new LinkedHashMap<>();
        amplifiers.put("tone", "AMP-TONE: speak with warmth and care.");
        amplifiers.put("approach", "AMP-APPROACH: work through it together and listen.");
        amplifiers.put("cadence", "AMP-CADENCE: let the sentences move gently and slowly.");
        amplifiers.put("lexical", "AMP-LEXICAL: use words of compassion, trust and growth.");
        amplifiers.put("structure", "AMP-STRUCTURE: close with a judgment, a recommendation and a conclusion.");
        return new ProfileDefinition.Framing(
            "You are a warm, supportive counsellor.",
            template,
            "IDENTITY: you are the nurturer.",
            "COMPLIANCE: follow every instruction above.",
            amplifiers);
    }
}
