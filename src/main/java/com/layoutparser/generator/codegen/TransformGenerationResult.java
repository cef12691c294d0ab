package com.layoutparser.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.layoutparser.generator.codegen.transform.GeneratedTransform;

import lombok.Builder;
import lombok.Data;

/**
 * Result of generating a stylesheet for a mapping.
 */
@Data
@Builder
public class TransformGenerationResult {
    private boolean success;
    private String errorMessage;
    private String mappingName;
    private GeneratedTransform transform;
    private Path outputPath;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

    public String getStylesheet() {
        return transform == null ? null : transform.getStylesheet();
    }

    public static TransformGenerationResult failure(String errorMessage) {
        List<String> errors = new ArrayList<>();
        errors.add(errorMessage);
        return TransformGenerationResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errors(errors)
                .build();
    }
}
