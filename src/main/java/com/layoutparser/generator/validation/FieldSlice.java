package com.layoutparser.generator.validation;

import lombok.Value;

/**
 * The characters a field occupies in a validated line.
 */
@Value
public class FieldSlice {

    public enum Status {
        VALID,
        ERROR
    }

    String name;
    int start;
    int length;
    String value;
    Status status;
}
