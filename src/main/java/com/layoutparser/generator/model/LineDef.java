package com.layoutparser.generator.model;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A line (record type) of a positional layout.
 *
 * Non-header lines reserve a six character sequence counter after the initial value;
 * the header carries only its initial value before the first field.
 */
@Value
@Builder(toBuilder = true)
public class LineDef {

    public static final String HEADER = "HEADER";
    public static final String TRAILER = "TRAILER";
    public static final String SEQUENCE_FIELD = "Sequencia";
    public static final int SEQUENCE_WIDTH = 6;

    @NonNull
    String name;
    @Builder.Default
    String initialValue = "";
    int sequence;
    @Builder.Default
    int minOccurs = 1;
    @Builder.Default
    int maxOccurs = 1;
    boolean required;
    String parentLine;
    @Singular
    List<FieldDef> fields;

    public boolean isHeader() {
        return HEADER.equalsIgnoreCase(name);
    }

    public boolean isTrailer() {
        return name.toUpperCase(Locale.ROOT).contains(TRAILER);
    }

    /**
     * Offset at which the first positional field starts.
     */
    public int prefixLength() {
        int base = isHeader() ? 0 : SEQUENCE_WIDTH;
        return base + (initialValue == null ? 0 : initialValue.length());
    }

    /**
     * Fields in ascending sequence, excluding the implicit sequence counter.
     */
    public List<FieldDef> positionalFields() {
        return fields.stream()
                .filter(f -> !SEQUENCE_FIELD.equalsIgnoreCase(f.getName()))
                .sorted(Comparator.comparingInt(FieldDef::getSequence))
                .toList();
    }

    public int contentWidth() {
        return prefixLength() + positionalFields().stream().mapToInt(FieldDef::getLength).sum();
    }
}
