package com.layoutparser.generator.codegen;

import lombok.Value;

/**
 * Length attribute of a map field: a plain width, or {@code width,decimals,scale} for
 * monetary fields.
 */
@Value
public class FieldLength {
    int width;
    int decimals;
    boolean decimal;

    public static FieldLength plain(int width) {
        return new FieldLength(width, 0, false);
    }

    public static FieldLength decimal(int width, int decimals) {
        return new FieldLength(width, decimals, true);
    }

    public String toAttribute() {
        return decimal ? width + "," + decimals + ",0" : String.valueOf(width);
    }

    @Override
    public String toString() {
        return toAttribute();
    }
}
