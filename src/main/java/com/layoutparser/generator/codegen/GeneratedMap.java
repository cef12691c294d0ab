package com.layoutparser.generator.codegen;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Intermediate form of a map before rendering.
 */
@Value
@Builder
public class GeneratedMap {
    String layoutName;
    @Singular
    List<MapLine> lines;

    @Value
    @Builder
    public static class MapLine {
        String identifier;
        String name;
        int sequenceKey;
        @Singular
        List<MapField> fields;
        @Singular
        List<String> children;
    }

    @Value
    public static class MapField {
        String name;
        FieldLength length;

        public String getLengthAttribute() {
            return length.toAttribute();
        }
    }
}
