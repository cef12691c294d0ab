package com.layoutparser.generator.learning;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.layoutparser.generator.config.GeneratorConfig;

import static org.assertj.core.api.Assertions.*;

class PatternComparatorTest {

    private final PatternComparator comparator = new PatternComparator();

    @Test
    void testIdenticalPatternScoresOne() {
        LearnedPattern pattern = tclLine("A:numero(9)", 1.0, 1);

        assertThat(comparator.similarity(pattern, pattern)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void testDifferentTypeScoresZero() {
        LearnedPattern line = tclLine("A:numero(9)", 1.0, 1);
        LearnedPattern template = LearnedPattern.builder()
                .type(LearnedPattern.XSL_TEMPLATE)
                .name(line.getName())
                .pattern(line.getPattern())
                .confidence(1.0)
                .metadata(line.getMetadata())
                .build();

        assertThat(comparator.similarity(line, template)).isZero();
    }

    @Test
    void testScoreWithoutMetadata() {
        LearnedPattern a = LearnedPattern.builder().type("T").name("x").pattern("same").confidence(0.5).build();
        LearnedPattern b = LearnedPattern.builder().type("T").name("y").pattern("same").confidence(0.5).build();

        assertThat(comparator.similarity(a, b)).isCloseTo(0.55, within(1e-9));
    }

    @Test
    void testStringSimilarity() {
        assertThat(comparator.stringSimilarity("ABC", "ABC")).isEqualTo(1.0);
        assertThat(comparator.stringSimilarity("", "ABC")).isZero();
        assertThat(comparator.stringSimilarity(null, null)).isEqualTo(1.0);
        assertThat(comparator.stringSimilarity("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7.0, within(1e-9));
    }

    @Test
    void testLevenshtein() {
        assertThat(comparator.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(comparator.levenshtein("", "abc")).isEqualTo(3);
        assertThat(comparator.levenshtein("flaw", "lawn")).isEqualTo(2);
    }

    @Test
    void testMetadataSimilarityComparesStringForms() {
        double score = comparator.metadataSimilarity(
                Map.of("fieldCount", 1, "identifier", "A"),
                Map.of("fieldCount", "1", "identifier", "B", "totalWidth", 9));

        assertThat(score).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(comparator.metadataSimilarity(Map.of(), Map.of("a", 1))).isZero();
    }

    @Test
    void testFindMostSimilarSortsAndFilters() {
        LearnedPattern generated = tclLine("A:numero(9)", 1.0, 1);
        LearnedPattern exact = tclLine("A:numero(9)", 1.0, 1);
        LearnedPattern close = tclLine("A:numero(8)", 1.0, 1);
        LearnedPattern far = tclLine("Z:qualquer(99),outro(1)", 0.1, 1);

        List<SimilarityResult> results = comparator.findMostSimilar(generated, List.of(close, far, exact));

        assertThat(results).extracting(SimilarityResult::getPattern).containsExactly(exact, close);
    }

    @Test
    void testSuggestNovelPattern() {
        List<String> suggestions = comparator.suggestImprovements(tclLine("A:numero(9)", 1.0, 1), List.of());

        assertThat(suggestions).containsExactly("TclLine LINHA000: no similar learned pattern, possibly novel");
    }

    @Test
    void testSuggestReviewForModerateMatch() {
        List<String> suggestions = comparator.suggestImprovements(
                tclLine("A:cnpj(14)", 1.0, 1), List.of(tclLine("A:xxxx(99)", 1.0, 1)));

        assertThat(suggestions).containsExactly(
                "TclLine LINHA000: similar learned pattern 'LINHA000' at 76% similarity, consider reviewing");
    }

    @Test
    void testThresholdsComeFromConfig() {
        LearnedPattern generated = tclLine("A:cnpj(14)", 1.0, 1);
        List<LearnedPattern> learned = List.of(tclLine("A:xxxx(99)", 1.0, 1));
        PatternComparator strict = new PatternComparator(GeneratorConfig.builder().suggestionThreshold(0.8).build());
        PatternComparator lenient = new PatternComparator(GeneratorConfig.builder().reviewThreshold(0.7).build());

        assertThat(strict.suggestImprovements(generated, learned))
                .containsExactly("TclLine LINHA000: no similar learned pattern, possibly novel");
        assertThat(lenient.suggestImprovements(generated, learned)).isEmpty();
        assertThat(new PatternComparator(GeneratorConfig.builder().similarityThreshold(0.8).build())
                .findMostSimilar(generated, learned)).isEmpty();
    }

    @Test
    void testSuggestMoreTrustedAndMoreFrequentPattern() {
        List<String> suggestions = comparator.suggestImprovements(
                tclLine("A:cnpj(14)", 0.5, 1), List.of(tclLine("A:cnpj(15)", 0.9, 7)));

        assertThat(suggestions).containsExactly(
                "TclLine LINHA000: learned pattern has higher confidence (90%), consider using it as reference",
                "TclLine LINHA000: learned pattern appears more often (7 times) and may be more common");
    }

    private static LearnedPattern tclLine(String pattern, double confidence, int frequency) {
        return LearnedPattern.builder()
                .type(LearnedPattern.TCL_LINE)
                .name("LINHA000")
                .pattern(pattern)
                .confidence(confidence)
                .frequency(frequency)
                .metadataEntry("identifier", "A")
                .build();
    }
}
