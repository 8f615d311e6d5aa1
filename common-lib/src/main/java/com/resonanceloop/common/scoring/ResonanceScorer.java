package com.resonanceloop.common.scoring;

import com.resonanceloop.common.model.ScoreBreakdown;
import com.resonanceloop.common.profile.TargetProfile;

/**
 * Maps a response text to its resonance with a profile.
 *
 * <p>Implementations MUST be pure: no I/O, no randomness, and identical inputs always
 * produce an equal {@link ScoreBreakdown}.
 */
public interface ResonanceScorer {

    ScoreBreakdown score(String content, TargetProfile profile);
}
