package com.layoutparser.generator.learning;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.codegen.GeneratedMap;
import com.layoutparser.generator.codegen.LineIdentifiers;

import lombok.Value;

/**
 * Replaces low-confidence map attributes with learned values.
 *
 * Only identifiers of lines that are neither HEADER, TRAILER nor numbered are touched;
 * those come from the first-letter fallback. A learned {@code TclLine} pattern for the
 * same line name with enough confidence and an {@code identifier} entry replaces it.
 */
public class LearnedMapRefiner {

    private static final Logger log = LoggerFactory.getLogger(LearnedMapRefiner.class);

    private final double minConfidence;

    public LearnedMapRefiner(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    @Value
    public static class Refinement {
        GeneratedMap map;
        List<String> changes;
    }

    public Refinement refine(GeneratedMap map, LearnedModel model) {
        List<String> changes = new ArrayList<>();
        GeneratedMap.GeneratedMapBuilder refined = GeneratedMap.builder().layoutName(map.getLayoutName());

        for (GeneratedMap.MapLine line : map.getLines()) {
            Optional<String> learnedIdentifier = LineIdentifiers.sequenceKeyFor(line.getName()) == LineIdentifiers.UNNUMBERED_KEY
                    ? learnedIdentifierFor(line.getName(), model)
                    : Optional.empty();

            if (learnedIdentifier.isPresent() && !learnedIdentifier.get().equals(line.getIdentifier())) {
                changes.add("Line " + line.getName() + ": identifier " + line.getIdentifier()
                        + " replaced by learned " + learnedIdentifier.get());
                log.info("Using learned identifier {} for line {}", learnedIdentifier.get(), line.getName());
                refined.line(GeneratedMap.MapLine.builder()
                        .identifier(learnedIdentifier.get())
                        .name(line.getName())
                        .sequenceKey(line.getSequenceKey())
                        .fields(line.getFields())
                        .children(line.getChildren())
                        .build());
            } else {
                refined.line(line);
            }
        }
        return new Refinement(refined.build(), changes);
    }

    private Optional<String> learnedIdentifierFor(String lineName, LearnedModel model) {
        return model.patternsOfType(LearnedPattern.TCL_LINE).stream()
                .filter(p -> lineName.equalsIgnoreCase(p.getName()))
                .filter(p -> p.getConfidence() >= minConfidence)
                .map(p -> p.getMetadata().get("identifier"))
                .filter(v -> v != null && !v.toString().isBlank())
                .map(Object::toString)
                .findFirst();
    }
}
