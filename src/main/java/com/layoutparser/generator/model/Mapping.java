package com.layoutparser.generator.model;

import java.util.Comparator;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Connects an input layout to a target layout through rules and link mappings.
 */
@Value
@Builder(toBuilder = true)
public class Mapping {
    String id;
    String name;
    String description;
    String inputLayoutId;
    String targetLayoutId;
    @Singular
    List<Rule> rules;
    @Singular
    List<LinkMapping> linkMappings;
    String embeddedXsl;

    public boolean hasEmbeddedXsl() {
        return embeddedXsl != null && !embeddedXsl.isBlank();
    }

    public boolean isEmpty() {
        return rules.isEmpty() && linkMappings.isEmpty();
    }

    public List<LinkMapping> orderedLinkMappings() {
        return linkMappings.stream().sorted(Comparator.comparingInt(LinkMapping::getSequence)).toList();
    }
}
