package com.layoutparser.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of generating a map for a layout.
 */
@Data
@Builder
public class MapGenerationResult {
    private boolean success;
    private String errorMessage;
    private String layoutName;
    private GeneratedMap map;
    private String content;
    private Path outputPath;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    public static MapGenerationResult failure(String errorMessage) {
        List<String> errors = new ArrayList<>();
        errors.add(errorMessage);
        return MapGenerationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errors(errors)
                .build();
    }
}
