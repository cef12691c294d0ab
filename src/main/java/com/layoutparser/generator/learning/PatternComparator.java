package com.layoutparser.generator.learning;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.config.GeneratorConfig;

/**
 * Scores generated patterns against learned ones and produces advisories.
 *
 * similarity = 0.4 x pattern text + 0.3 x metadata + 0.3 x mean confidence, capped at 1,
 * and 0 when the pattern types differ.
 */
public class PatternComparator {

    private static final Logger log = LoggerFactory.getLogger(PatternComparator.class);

    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final double SUGGESTION_THRESHOLD = 0.6;
    public static final double REVIEW_THRESHOLD = 0.8;

    private final double defaultThreshold;
    private final double suggestionThreshold;
    private final double reviewThreshold;

    public PatternComparator() {
        this(DEFAULT_THRESHOLD, SUGGESTION_THRESHOLD, REVIEW_THRESHOLD);
    }

    public PatternComparator(GeneratorConfig config) {
        this(config.getSimilarityThreshold(), config.getSuggestionThreshold(), config.getReviewThreshold());
    }

    public PatternComparator(double defaultThreshold, double suggestionThreshold, double reviewThreshold) {
        this.defaultThreshold = defaultThreshold;
        this.suggestionThreshold = suggestionThreshold;
        this.reviewThreshold = reviewThreshold;
    }

    public double similarity(LearnedPattern generated, LearnedPattern learned) {
        if (!Objects.equals(generated.getType(), learned.getType())) {
            return 0.0;
        }
        double score = stringSimilarity(generated.getPattern(), learned.getPattern()) * 0.4
                + metadataSimilarity(generated.getMetadata(), learned.getMetadata()) * 0.3
                + (generated.getConfidence() + learned.getConfidence()) / 2.0 * 0.3;
        return Math.max(0.0, Math.min(1.0, score));
    }

    public double stringSimilarity(String a, String b) {
        String left = a == null ? "" : a;
        String right = b == null ? "" : b;
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int distance = levenshtein(left, right);
        return 1.0 - (double) distance / Math.max(left.length(), right.length());
    }

    public int levenshtein(String s, String t) {
        int n = s.length();
        int m = t.length();
        if (n == 0) {
            return m;
        }
        if (m == 0) {
            return n;
        }
        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= n; i++) {
            current[0] = i;
            for (int j = 1; j <= m; j++) {
                int cost = s.charAt(i - 1) == t.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }

    public double metadataSimilarity(Map<String, Object> a, Map<String, Object> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        long matches = a.keySet().stream()
                .filter(b::containsKey)
                .filter(key -> Objects.equals(stringify(a.get(key)), stringify(b.get(key))))
                .count();
        return (double) matches / Math.max(a.size(), b.size());
    }

    public List<SimilarityResult> findMostSimilar(LearnedPattern generated, List<LearnedPattern> learned) {
        return findMostSimilar(generated, learned, defaultThreshold);
    }

    public List<SimilarityResult> findMostSimilar(LearnedPattern generated, List<LearnedPattern> learned, double threshold) {
        List<SimilarityResult> results = new ArrayList<>();
        for (LearnedPattern candidate : learned) {
            double score = similarity(generated, candidate);
            if (score >= threshold) {
                results.add(new SimilarityResult(candidate, score));
            }
        }
        results.sort(Comparator.comparingDouble(SimilarityResult::getSimilarity).reversed());
        return results;
    }

    /**
     * Human-readable advisories. Nothing here is applied automatically.
     */
    public List<String> suggestImprovements(LearnedPattern generated, List<LearnedPattern> learned) {
        List<String> suggestions = new ArrayList<>();
        List<SimilarityResult> similar = findMostSimilar(generated, learned, suggestionThreshold);

        if (similar.isEmpty()) {
            suggestions.add(label(generated) + ": no similar learned pattern, possibly novel");
            return suggestions;
        }

        SimilarityResult best = similar.get(0);
        log.debug("Best learned match for {} is {} ({})", generated.getName(), best.getPattern().getName(), best.getSimilarity());

        if (best.getSimilarity() < reviewThreshold) {
            suggestions.add(String.format("%s: similar learned pattern '%s' at %.0f%% similarity, consider reviewing",
                    label(generated), best.getPattern().getName(), best.getSimilarity() * 100));
        }
        if (generated.getConfidence() < best.getPattern().getConfidence()) {
            suggestions.add(String.format("%s: learned pattern has higher confidence (%.0f%%), consider using it as reference",
                    label(generated), best.getPattern().getConfidence() * 100));
        }
        if (generated.getFrequency() < best.getPattern().getFrequency()) {
            suggestions.add(String.format("%s: learned pattern appears more often (%d times) and may be more common",
                    label(generated), best.getPattern().getFrequency()));
        }
        return suggestions;
    }

    private static String label(LearnedPattern pattern) {
        return pattern.getType() + " " + pattern.getName();
    }

    private static String stringify(Object value) {
        return value == null ? null : value.toString();
    }
}
