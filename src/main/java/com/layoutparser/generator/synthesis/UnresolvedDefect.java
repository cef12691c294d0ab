package com.layoutparser.generator.synthesis;

import java.util.List;

import lombok.Value;

@Value
public class UnresolvedDefect {
    int recordIndex;
    String lineName;
    int occurrence;
    List<String> errors;

    public String describe() {
        return "record " + (recordIndex + 1) + ", line " + lineName + " #" + (occurrence + 1) + ": "
                + String.join("; ", errors);
    }
}
