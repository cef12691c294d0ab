package com.layoutparser.generator.validation;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of validating one line against its definition.
 */
@Data
@Builder
public class LineValidationResult {
    private String lineName;
    private int expectedLength;
    private int actualLength;
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<FieldSlice> fields = new ArrayList<>();

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isSuccess() {
        return isValid();
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public static LineValidationResult failure(String lineName, String error) {
        LineValidationResult result = LineValidationResult.builder().lineName(lineName).build();
        result.addError(error);
        return result;
    }
}
