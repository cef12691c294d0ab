package com.layoutparser.generator.learning;

import lombok.Value;

@Value
public class SimilarityResult {
    LearnedPattern pattern;
    double similarity;
}
