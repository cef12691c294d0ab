package com.layoutparser.generator.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for the generators and the synthesis loop.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    int maxLookupCandidates = 5;
    @Builder.Default
    int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
    // Upper bound on occurrences per line; also the count used for unbounded lines
    @Builder.Default
    int occurrenceCap = 1;
    // Overrides the layout's line width when positive
    int lineWidthOverride;
    boolean preferEmbeddedXsl;
    @Builder.Default
    Duration collaboratorTimeout = Duration.ofSeconds(30);

    // Output document defaults when no example document is supplied
    @Builder.Default
    String defaultRootElement = "NFe";
    @Builder.Default
    String defaultNamespace = "http://www.portalfiscal.inf.br/nfe";

    @Builder.Default
    double similarityThreshold = 0.7;
    @Builder.Default
    double suggestionThreshold = 0.6;
    @Builder.Default
    double reviewThreshold = 0.8;
    @Builder.Default
    double transformReviewThreshold = 0.9;
    @Builder.Default
    double learnedHintConfidence = 0.8;

    Long seed;
    LocalDate referenceDate;

    Path outputDir;
    boolean force;

    public LocalDate effectiveReferenceDate() {
        return referenceDate != null ? referenceDate : LocalDate.now();
    }

    public int effectiveLineWidth(int layoutWidth) {
        return lineWidthOverride > 0 ? lineWidthOverride : layoutWidth;
    }

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
