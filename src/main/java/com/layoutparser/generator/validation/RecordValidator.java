package com.layoutparser.generator.validation;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

/**
 * Checks a fixed-width line against its line definition.
 *
 * Fields are walked in sequence order starting after the line prefix (initial value, plus
 * the six character counter on non-header lines). Messages read {@code field: problem}.
 */
public class RecordValidator {

    private static final Logger log = LoggerFactory.getLogger(RecordValidator.class);

    public LineValidationResult validateLine(String line, LineDef def, int lineWidth) {
        LineValidationResult result = LineValidationResult.builder()
                .lineName(def.getName())
                .expectedLength(lineWidth)
                .actualLength(line == null ? 0 : line.length())
                .build();

        if (line == null || line.isEmpty()) {
            result.addError(def.getName() + ": line is empty");
            return result;
        }

        if (line.length() != lineWidth) {
            result.addError(def.getName() + ": expected " + lineWidth + " characters but found " + line.length());
        }

        String initialValue = def.getInitialValue();
        if (initialValue != null && !initialValue.isEmpty() && !line.startsWith(initialValue)) {
            result.addError(def.getName() + ": line does not start with '" + initialValue + "'");
        }

        if (def.contentWidth() > lineWidth) {
            result.addError(def.getName() + ": fields need " + def.contentWidth()
                    + " characters but the line width is " + lineWidth);
        }

        int position = def.prefixLength();
        for (FieldDef field : def.positionalFields()) {
            result.getFields().add(checkField(line, field, position, result));
            position += field.getLength();
        }

        if (!result.isValid()) {
            log.debug("Line {} failed validation: {}", def.getName(), result.getErrors());
        }
        return result;
    }

    private FieldSlice checkField(String line, FieldDef field, int start, LineValidationResult result) {
        String name = field.getName();
        int end = start + field.getLength();

        if (start >= line.length()) {
            result.addError(name + ": out of bounds (starts at " + start + ", line has " + line.length() + " characters)");
            return new FieldSlice(name, start, field.getLength(), "", FieldSlice.Status.ERROR);
        }

        FieldSlice.Status status = FieldSlice.Status.VALID;
        String value;
        if (end > line.length()) {
            value = line.substring(start);
            result.addError(name + ": out of bounds (ends at " + end + ", line has " + line.length() + " characters)");
            result.addWarning(name + ": truncated, " + value.length() + " of " + field.getLength() + " characters present");
            status = FieldSlice.Status.ERROR;
        } else {
            value = line.substring(start, end);
        }

        if (field.isRequired() && value.isBlank()) {
            result.addError(name + ": required field is empty");
            status = FieldSlice.Status.ERROR;
        }
        return new FieldSlice(name, start, field.getLength(), value, status);
    }

    /**
     * Validates every line of a record, resolving each to its definition by initial value.
     */
    public RecordValidationReport validateRecord(List<String> lines, Layout layout, int lineWidth) {
        LineResolver resolver = new LineResolver(layout);
        RecordValidationReport report = new RecordValidationReport(layout.getName());
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i);
            int lineNumber = i + 1;
            resolver.resolve(text, i).ifPresentOrElse(
                    def -> report.add(lineNumber, validateLine(text, def, lineWidth)),
                    () -> report.add(lineNumber, LineValidationResult.failure("?",
                            "no line definition matches line " + lineNumber)));
        }
        return report;
    }
}
