package com.resonanceloop.common.scoring;

import com.resonanceloop.common.TestProfiles;
import com.resonanceloop.common.model.ScoreBreakdown;
import com.resonanceloop.common.model.ScoreDimension;
import com.resonanceloop.common.profile.TargetProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link PatternResonanceScorer}: bounds, weighting,
 * idempotence, floor penalty and the per-dimension formulas.
 */
class PatternResonanceScorerTest {

    private static final String RICH = """
        I care deeply about you, and I hope we can walk through this together.
        Let us listen gently; trust grows slowly when compassion leads.
        My judgment is that harmony returns with patience and support.
        My recommendation is to talk warmly and openly with your friend.
        In conclusion, growth comes from forgiving with a gentle heart.
        """;

    private final PatternResonanceScorer scorer = new PatternResonanceScorer();
    private final TargetProfile profile = TestProfiles.nurturer();

    // ── empty content ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("empty content")
    class EmptyContent {

        @Test
        @DisplayName("blank text → all-zero dimensions and overall 0")
        void blankContent_allZero() {
            ScoreBreakdown b = scorer.score("   \n ", profile);
            for (ScoreDimension d : ScoreDimension.values()) {
                assertEquals(0.0, b.score(d));
            }
            assertEquals(0.0, b.overall());
            assertEquals(0, b.wordCount());
            assertEquals(ScoreDimension.TONE, b.weakestDimension());
        }

        @Test
        @DisplayName("null text is treated as empty")
        void nullContent_allZero() {
            assertEquals(0.0, scorer.score(null, profile).overall());
        }
    }

    // ── properties ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("breakdown properties")
    class Properties {

        @Test
        @DisplayName("every dimension lies within [0,1]")
        void dimensionsBounded() {
            for (String text : List.of(RICH, "warm warm warm warm", "care; care; care; care; care",
                                       "nothing relevant is said here at all, not one word of it")) {
                ScoreBreakdown b = scorer.score(text, profile);
                b.dimensions().values().forEach(v -> assertTrue(v >= 0.0 && v <= 1.0, "out of range: " + v));
            }
        }

        @Test
        @DisplayName("overall equals the weighted sum of dimensions")
        void overallIsWeightedSum() {
            ScoreBreakdown b = scorer.score(RICH, profile);
            double expected = 0.0;
            for (ScoreDimension d : ScoreDimension.values()) {
                expected += profile.weight(d) * b.score(d);
            }
            assertEquals(expected, b.overall(), 1e-12);
        }

        @Test
        @DisplayName("profile weights sum to 1")
        void weightsSumToOne() {
            double sum = profile.dimensionWeights().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(1.0, sum, 1e-9);
        }

        @Test
        @DisplayName("scoring twice yields an equal breakdown")
        void idempotent() {
            ScoreBreakdown first = scorer.score(RICH, profile);
            ScoreBreakdown second = scorer.score(RICH, profile);
            assertEquals(first, second);
            assertEquals(Double.doubleToLongBits(first.overall()), Double.doubleToLongBits(second.overall()));
        }

        @Test
        @DisplayName("rich, on-profile content scores above off-profile content")
        void richBeatsOffProfile() {
            String off = "The quarterly report lists revenue figures and the logistics schedule for next month in detail.";
            assertTrue(scorer.score(RICH, profile).overall() > scorer.score(off, profile).overall());
        }
    }

    // ── dimensions ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("dimension formulas")
    class Dimensions {

        @Test
        @DisplayName("tone = 2·density + intensifier bonus")
        void toneFormula() {
            // 23 words, tone hits: warm, care; intensifier: truly
            String text = "I feel warm and truly grateful for the care you show us every single day "
                        + "in this small quiet town by the sea";
            ScoreBreakdown b = scorer.score(text, profile);
            assertEquals(23, b.wordCount());
            assertEquals(2.0 / 23 * 2 + 0.1, b.score(ScoreDimension.TONE), 1e-9);
        }

        @Test
        @DisplayName("structure = share of markers present")
        void structureCoverage() {
            String text = "After long thought my judgment is clear and my recommendation follows from it, "
                        + "though I know that others may see this whole matter in another light entirely.";
            assertEquals(2.0 / 3, scorer.score(text, profile).score(ScoreDimension.STRUCTURE), 1e-9);
        }

        @Test
        @DisplayName("missing structure markers make structure the weakest dimension")
        void weakestDimension() {
            String text = "I care about you and hope we can support each other together through this; "
                        + "trust and compassion grow gently when we listen and share what we feel.";
            ScoreBreakdown b = scorer.score(text, profile);
            assertEquals(0.0, b.score(ScoreDimension.STRUCTURE));
            assertEquals(ScoreDimension.STRUCTURE, b.weakestDimension());
            assertTrue(b.warnings().stream().anyMatch(w -> w.startsWith("structure")));
        }

        @Test
        @DisplayName("short content is scaled by words/minWords")
        void floorPenalty() {
            ScoreBreakdown b = scorer.score("warm care", profile);
            assertEquals(2, b.wordCount());
            b.dimensions().values().forEach(v -> assertTrue(v <= 0.1 + 1e-12, "not penalised: " + v));
            assertTrue(b.evidence().stream().anyMatch(e -> e.startsWith("floor penalty")));
        }

        @Test
        @DisplayName("single-sentence content has perfect length consistency")
        void varianceHelpers() {
            assertEquals(0.0, PatternResonanceScorer.variance(List.of(7)));
            assertEquals(1.0, PatternResonanceScorer.variance(List.of(1, 3)), 1e-12);
            assertEquals(List.of(2, 3), PatternResonanceScorer.sentenceLengths("One two. Three four five!"));
        }
    }

    @Test
    @DisplayName("minWords below 1 is rejected")
    void invalidMinWords() {
        assertThrows(IllegalArgumentException.class, () -> new PatternResonanceScorer(0));
    }
}
