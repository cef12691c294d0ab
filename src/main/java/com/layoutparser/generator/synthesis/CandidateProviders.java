package com.layoutparser.generator.synthesis;

import java.util.List;
import java.util.Map;
import java.util.Random;

import com.layoutparser.generator.config.GeneratorConfig;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Factories for the built-in content providers.
 */
public final class CandidateProviders {

    private CandidateProviders() {
        // Utility class
    }

    public static CandidateProviderFactory deterministic(GeneratorConfig config) {
        ComposingCandidateProvider provider = new ComposingCandidateProvider(
                new DeterministicFieldValues(config.effectiveReferenceDate()));
        return recordIndex -> provider;
    }

    /**
     * Each record draws from its own {@link Random} seeded with {@code seed + recordIndex},
     * so output does not depend on thread scheduling.
     */
    public static CandidateProviderFactory random(GeneratorConfig config) {
        long seed = config.getSeed() != null ? config.getSeed() : System.nanoTime();
        return recordIndex -> new ComposingCandidateProvider(
                new RandomFieldValues(new Random(seed + recordIndex), config.effectiveReferenceDate()));
    }

    public static CandidateProviderFactory llm(ChatModel chatModel, GeneratorConfig config,
            Map<String, List<String>> examplesByLine) {
        LlmCandidateProvider provider = new LlmCandidateProvider(chatModel, config.getCollaboratorTimeout(), examplesByLine);
        return recordIndex -> provider;
    }
}
