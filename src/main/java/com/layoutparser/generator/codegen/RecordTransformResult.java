package com.layoutparser.generator.codegen;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of running a record through its mapping's stylesheet.
 */
@Data
@Builder
public class RecordTransformResult {
    private boolean success;
    private String errorMessage;
    private String layoutName;
    private String mappingName;
    private String intermediateXml;
    private String output;
    private Path outputPath;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public static RecordTransformResult failure(String errorMessage) {
        List<String> errors = new ArrayList<>();
        errors.add(errorMessage);
        return RecordTransformResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errors(errors)
                .build();
    }
}
