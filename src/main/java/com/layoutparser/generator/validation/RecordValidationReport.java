package com.layoutparser.generator.validation;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Per-line validation results of a whole record, keyed by 1-based line number.
 */
@Getter
public class RecordValidationReport {

    private final String layoutName;
    private final Map<Integer, LineValidationResult> lines = new LinkedHashMap<>();

    public RecordValidationReport(String layoutName) {
        this.layoutName = layoutName;
    }

    void add(int lineNumber, LineValidationResult result) {
        lines.put(lineNumber, result);
    }

    public boolean isValid() {
        return lines.values().stream().allMatch(LineValidationResult::isValid);
    }

    public long invalidLineCount() {
        return lines.values().stream().filter(r -> !r.isValid()).count();
    }
}
