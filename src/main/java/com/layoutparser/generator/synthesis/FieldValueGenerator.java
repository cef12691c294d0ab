package com.layoutparser.generator.synthesis;

import com.layoutparser.generator.model.FieldDef;

/**
 * Produces a raw value for one field; the caller aligns and pads it.
 */
public interface FieldValueGenerator {

    String valueFor(FieldDef field, int recordIndex, int occurrence);

    /**
     * Left-pads with zeros to {@code length}, keeping the rightmost digits when too long.
     */
    static String zeroPad(String digits, int length) {
        if (digits.length() >= length) {
            return digits.substring(digits.length() - length);
        }
        return "0".repeat(length - digits.length()) + digits;
    }
}
