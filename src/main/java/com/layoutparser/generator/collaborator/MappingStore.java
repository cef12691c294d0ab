package com.layoutparser.generator.collaborator;

import java.util.Optional;

import com.layoutparser.generator.model.Mapping;

/**
 * Source of mapping definitions.
 */
public interface MappingStore {

    Optional<Mapping> fetchByInputLayout(String layoutId);

    Optional<Mapping> fetchByTargetLayout(String layoutId);
}
