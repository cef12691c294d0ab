package com.layoutparser.generator.synthesis;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of synthesizing records for a layout.
 */
@Data
@Builder
public class SynthesisResult {
    private boolean success;
    private String errorMessage;
    private String layoutName;
    private Path outputPath;
    @Builder.Default
    private List<RecordSynthesis> records = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public int lineCount() {
        return records.stream().mapToInt(r -> r.getLines().size()).sum();
    }

    public List<UnresolvedDefect> defects() {
        return records.stream().flatMap(r -> r.getDefects().stream()).toList();
    }

    public static SynthesisResult failure(String errorMessage) {
        List<String> errors = new ArrayList<>();
        errors.add(errorMessage);
        return SynthesisResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errors(errors)
                .build();
    }
}
