package com.resonanceloop.common.mutation;

import com.resonanceloop.common.model.ScoreDimension;

/**
 * Mutation strategies, selected by attempt index.
 *
 * <pre>
 *   attempt 1   → TARGETED_AMPLIFICATION   weakest dimension only
 *   attempt 2   → COMPREHENSIVE_BOOST      all dimensions, identity restated
 *   attempt ≥ 3 → MAXIMUM_AMPLIFICATION    all dimensions, pervasive, compliance directive
 * </pre>
 */
public enum MutationStrategy {
    TARGETED_AMPLIFICATION,
    COMPREHENSIVE_BOOST,
    MAXIMUM_AMPLIFICATION;

    public static MutationStrategy forAttempt(int attemptIndex) {
        if (attemptIndex < 1) {
            throw new IllegalArgumentException("attemptIndex must be >= 1, got " + attemptIndex);
        }
        return switch (attemptIndex) {
            case 1 -> TARGETED_AMPLIFICATION;
            case 2 -> COMPREHENSIVE_BOOST;
            default -> MAXIMUM_AMPLIFICATION;
        };
    }

    public String tag(ScoreDimension weakest) {
        return switch (this) {
            case TARGETED_AMPLIFICATION -> weakest.key() + "_booster";
            case COMPREHENSIVE_BOOST -> "comprehensive_booster";
            case MAXIMUM_AMPLIFICATION -> "maximum_amplification";
        };
    }
}
