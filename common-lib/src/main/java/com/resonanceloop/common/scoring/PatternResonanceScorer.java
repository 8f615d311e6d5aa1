package com.resonanceloop.common.scoring;

import com.resonanceloop.common.model.ScoreBreakdown;
import com.resonanceloop.common.model.ScoreDimension;
import com.resonanceloop.common.profile.TargetProfile;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-density scorer over the five {@link ScoreDimension}s.
 *
 * <p>With {@code W} = word count, {@code hits} = total pattern matches and
 * {@code matched/patterns} = share of a set's patterns that match at least once:
 * <pre>
 *   tone      = min(2 · min(hits/W, 1) + min(0.1 · intensifierHits, 0.3), 1)
 *   approach  = 0.7 · matched/patterns + 0.3 · min(hits/W, 1)
 *   cadence   = 0.6 · 1/(1 + var(sentenceLengths)/100) + 0.4 · min(10 · hits/W, 1)
 *   lexical   = 0.7 · matched/patterns + 0.3 · min(20 · matched/W, 1)
 *   structure = matched/patterns
 *
 *   overall   = Σ weight(d) · d
 * </pre>
 * When {@code W < minWords} every dimension is scaled by {@code W / minWords}.
 * Each dimension is clipped to [0,1] before weighting. Empty content scores zero throughout.
 */
public final class PatternResonanceScorer implements ResonanceScorer {

    public static final int DEFAULT_MIN_WORDS = 20;

    static final double TONE_DENSITY_GAIN = 2.0;
    static final double INTENSIFIER_STEP = 0.1;
    static final double INTENSIFIER_CAP = 0.3;
    static final double COVERAGE_SHARE = 0.7;
    static final double DENSITY_SHARE = 0.3;
    static final double CONSISTENCY_SHARE = 0.6;
    static final double INDICATOR_SHARE = 0.4;
    static final double CADENCE_INDICATOR_GAIN = 10.0;
    static final double VARIANCE_SCALE = 100.0;
    static final double LEXICAL_DENSITY_GAIN = 20.0;

    static final double DIMENSION_WARNING = 0.3;
    static final double OVERALL_WARNING = 0.5;
    private static final int EVIDENCE_SAMPLES = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private final int minWords;

    public PatternResonanceScorer() {
        this(DEFAULT_MIN_WORDS);
    }

    public PatternResonanceScorer(int minWords) {
        if (minWords < 1) throw new IllegalArgumentException("minWords must be >= 1, got " + minWords);
        this.minWords = minWords;
    }

    public int minWords() {
        return minWords;
    }

    @Override
    public ScoreBreakdown score(String content, TargetProfile profile) {
        Objects.requireNonNull(profile, "profile");
        String text = content == null ? "" : content.strip();
        if (text.isEmpty()) {
            return empty();
        }

        int words = countWords(text);
        List<String> evidence = new ArrayList<>();
        Map<ScoreDimension, Double> dimensions = new EnumMap<>(ScoreDimension.class);
        dimensions.put(ScoreDimension.TONE, tone(text, words, profile, evidence));
        dimensions.put(ScoreDimension.APPROACH, approach(text, words, profile, evidence));
        dimensions.put(ScoreDimension.CADENCE, cadence(text, words, profile, evidence));
        dimensions.put(ScoreDimension.LEXICAL, lexical(text, words, profile, evidence));
        dimensions.put(ScoreDimension.STRUCTURE, structure(text, profile, evidence));

        if (words < minWords) {
            double factor = (double) words / minWords;
            dimensions.replaceAll((d, v) -> v * factor);
            evidence.add(String.format(Locale.ROOT,
                "floor penalty: %d words below minimum %d, scaled by %.3f", words, minWords, factor));
        }
        dimensions.replaceAll((d, v) -> clip(v));

        double overall = 0.0;
        ScoreDimension weakest = ScoreDimension.TONE;
        for (ScoreDimension d : ScoreDimension.values()) {
            double value = dimensions.get(d);
            overall += profile.weight(d) * value;
            if (value < dimensions.get(weakest)) weakest = d;
        }

        return new ScoreBreakdown(dimensions, overall, weakest, evidence,
                                  warnings(dimensions, overall), words);
    }

    // ── dimensions ────────────────────────────────────────────────────────────

    private double tone(String text, int words, TargetProfile profile, List<String> evidence) {
        PatternHits hits = countHits(text, profile.patterns(ScoreDimension.TONE));
        PatternHits intensifiers = countHits(text, profile.intensifiers());
        double density = Math.min((double) hits.total() / words, 1.0);
        double bonus = Math.min(intensifiers.total() * INTENSIFIER_STEP, INTENSIFIER_CAP);
        evidence.add(String.format(Locale.ROOT, "tone: %d hits %s, %d intensifiers",
                                   hits.total(), hits.samples(), intensifiers.total()));
        return Math.min(density * TONE_DENSITY_GAIN + bonus, 1.0);
    }

    private double approach(String text, int words, TargetProfile profile, List<String> evidence) {
        List<Pattern> patterns = profile.patterns(ScoreDimension.APPROACH);
        PatternHits hits = countHits(text, patterns);
        double coverage = coverage(hits, patterns);
        double density = Math.min((double) hits.total() / words, 1.0);
        evidence.add(String.format(Locale.ROOT, "approach: %d/%d patterns matched %s",
                                   hits.matched(), patterns.size(), hits.samples()));
        return coverage * COVERAGE_SHARE + density * DENSITY_SHARE;
    }

    private double cadence(String text, int words, TargetProfile profile, List<String> evidence) {
        double variance = variance(sentenceLengths(text));
        double consistency = 1.0 / (1.0 + variance / VARIANCE_SCALE);
        PatternHits hits = countHits(text, profile.patterns(ScoreDimension.CADENCE));
        double indicatorDensity = (double) hits.total() / words;
        evidence.add(String.format(Locale.ROOT, "cadence: sentence-length variance %.2f, %d indicators %s",
                                   variance, hits.total(), hits.samples()));
        return consistency * CONSISTENCY_SHARE
             + Math.min(indicatorDensity * CADENCE_INDICATOR_GAIN, 1.0) * INDICATOR_SHARE;
    }

    private double lexical(String text, int words, TargetProfile profile, List<String> evidence) {
        List<Pattern> patterns = profile.patterns(ScoreDimension.LEXICAL);
        PatternHits hits = countHits(text, patterns);
        double coverage = coverage(hits, patterns);
        double density = (double) hits.matched() / words;
        evidence.add(String.format(Locale.ROOT, "lexical: %d/%d keywords present %s",
                                   hits.matched(), patterns.size(), hits.samples()));
        return coverage * COVERAGE_SHARE + Math.min(density * LEXICAL_DENSITY_GAIN, 1.0) * DENSITY_SHARE;
    }

    private double structure(String text, TargetProfile profile, List<String> evidence) {
        List<Pattern> patterns = profile.patterns(ScoreDimension.STRUCTURE);
        PatternHits hits = countHits(text, patterns);
        evidence.add(String.format(Locale.ROOT, "structure: %d/%d markers present %s",
                                   hits.matched(), patterns.size(), hits.samples()));
        return coverage(hits, patterns);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private record PatternHits(int matched, int total, List<String> samples) {}

    private static PatternHits countHits(String text, List<Pattern> patterns) {
        int matched = 0;
        int total = 0;
        List<String> samples = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            int count = 0;
            while (m.find()) {
                if (count == 0 && samples.size() < EVIDENCE_SAMPLES) {
                    samples.add(m.group().toLowerCase(Locale.ROOT));
                }
                count++;
            }
            if (count > 0) matched++;
            total += count;
        }
        return new PatternHits(matched, total, List.copyOf(samples));
    }

    private static double coverage(PatternHits hits, List<Pattern> patterns) {
        return patterns.isEmpty() ? 0.0 : (double) hits.matched() / patterns.size();
    }

    static int countWords(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : WHITESPACE.split(stripped).length;
    }

    static List<Integer> sentenceLengths(String text) {
        List<Integer> lengths = new ArrayList<>();
        for (String sentence : SENTENCE_END.split(text)) {
            int words = countWords(sentence);
            if (words > 0) lengths.add(words);
        }
        return lengths;
    }

    static double variance(List<Integer> values) {
        if (values.size() < 2) return 0.0;
        double mean = values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double squares = 0.0;
        for (int v : values) squares += (v - mean) * (v - mean);
        return squares / values.size();
    }

    private static double clip(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static List<String> warnings(Map<ScoreDimension, Double> dimensions, double overall) {
        List<String> warnings = new ArrayList<>();
        if (overall < OVERALL_WARNING) {
            warnings.add(String.format(Locale.ROOT, "overall resonance %.3f is low", overall));
        }
        dimensions.forEach((d, v) -> {
            if (v < DIMENSION_WARNING) {
                warnings.add(String.format(Locale.ROOT, "%s is dissonant at %.3f", d.key(), v));
            }
        });
        return warnings;
    }

    private static ScoreBreakdown empty() {
        Map<ScoreDimension, Double> zeros = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension d : ScoreDimension.values()) zeros.put(d, 0.0);
        return new ScoreBreakdown(zeros, 0.0, ScoreDimension.TONE,
                                  List.of("content is empty"),
                                  List.of("no content to score"), 0);
    }
}
