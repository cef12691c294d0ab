package com.layoutparser.generator.synthesis;

import java.util.List;

import com.layoutparser.generator.model.Layout;
import com.layoutparser.generator.model.LineDef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything a content provider needs to produce one line, including the feedback of a
 * rejected previous attempt.
 */
@Value
@Builder(toBuilder = true)
public class LineRequest {
    @NonNull
    Layout layout;
    @NonNull
    LineDef line;
    int lineWidth;
    int recordIndex;
    int occurrence;
    // 1-based position of the line inside its record
    int lineNumber;
    String priorAttempt;
    @Singular
    List<String> priorErrors;

    public boolean isRetry() {
        return priorAttempt != null;
    }

    public String sequenceCounter() {
        return FieldValueGenerator.zeroPad(String.valueOf(lineNumber), LineDef.SEQUENCE_WIDTH);
    }
}
