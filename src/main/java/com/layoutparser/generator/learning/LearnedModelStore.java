package com.layoutparser.generator.learning;

import java.util.Optional;

/**
 * Read-only source of learned models.
 */
public interface LearnedModelStore {

    Optional<LearnedModel> load(String layoutName, ModelKind kind);

    static LearnedModelStore none() {
        return (layoutName, kind) -> Optional.empty();
    }
}
