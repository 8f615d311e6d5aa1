package com.resonanceloop.common.mutation;

import com.resonanceloop.common.model.Request;
import com.resonanceloop.common.model.ScoreBreakdown;
import com.resonanceloop.common.model.ScoreDimension;
import com.resonanceloop.common.profile.ProfileFraming;
import com.resonanceloop.common.profile.TargetProfile;

import java.util.Locale;
import java.util.Objects;

/**
 * Derives the next request from the previous one and the score it earned.
 *
 * <p>The mutator only appends: the previous prompt is kept intact and a refinement block
 * is added after it. A mutated request is therefore never shorter than its predecessor
 * and still contains the scenario text verbatim. No I/O, no randomness.
 */
public final class RequestMutator {

    static final String BLOCK_OPEN = "\n\n[Refinement %d: %s]\n";

    public MutationResult mutate(Request request, TargetProfile profile,
                                 ScoreBreakdown breakdown, int attemptIndex) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(breakdown, "breakdown");

        MutationStrategy strategy = MutationStrategy.forAttempt(attemptIndex);
        ScoreDimension weakest = breakdown.weakestDimension();
        String tag = strategy.tag(weakest);

        StringBuilder block = new StringBuilder(
            String.format(Locale.ROOT, BLOCK_OPEN, request.revision() + 1, tag));
        ProfileFraming framing = profile.framing();
        switch (strategy) {
            case TARGETED_AMPLIFICATION -> block
                .append(framing.amplifier(weakest)).append('\n')
                .append(String.format(Locale.ROOT,
                    "The previous answer was weakest in %s (%.2f). Strengthen %s above all else.",
                    weakest.key(), breakdown.score(weakest), weakest.key()));
            case COMPREHENSIVE_BOOST -> {
                block.append(framing.identityStatement()).append('\n');
                appendAmplifiers(block, framing, "");
            }
            case MAXIMUM_AMPLIFICATION -> {
                block.append(framing.identityStatement()).append('\n');
                appendAmplifiers(block, framing, " Apply this in every paragraph, without exception.");
                block.append(framing.complianceDirective());
            }
        }

        Request next = request.revise(request.prompt() + block, tag);
        return new MutationResult(next, strategy, tag);
    }

    private static void appendAmplifiers(StringBuilder block, ProfileFraming framing, String emphasis) {
        for (ScoreDimension d : ScoreDimension.values()) {
            block.append("- ").append(framing.amplifier(d)).append(emphasis).append('\n');
        }
    }
}
