package com.layoutparser.generator.synthesis;

import com.layoutparser.generator.model.FieldDef;
import com.layoutparser.generator.model.LineDef;

/**
 * Builds a line field by field: initial value, sequence counter (non-header lines), then
 * each field aligned in its slot, padded with spaces to the line width.
 */
public class ComposingCandidateProvider implements CandidateContentProvider {

    private final FieldValueGenerator values;

    public ComposingCandidateProvider(FieldValueGenerator values) {
        this.values = values;
    }

    @Override
    public String generate(LineRequest request) {
        LineDef line = request.getLine();
        StringBuilder sb = new StringBuilder(request.getLineWidth());
        if (line.getInitialValue() != null) {
            sb.append(line.getInitialValue());
        }
        if (!line.isHeader()) {
            sb.append(request.sequenceCounter());
        }
        for (FieldDef field : line.positionalFields()) {
            String value = values.valueFor(field, request.getRecordIndex(), request.getOccurrence());
            sb.append(field.getAlignment().fit(value, field.getLength()));
        }
        return fitLine(sb.toString(), request.getLineWidth());
    }

    static String fitLine(String text, int width) {
        if (text.length() >= width) {
            return text.substring(0, width);
        }
        return text + " ".repeat(width - text.length());
    }
}
