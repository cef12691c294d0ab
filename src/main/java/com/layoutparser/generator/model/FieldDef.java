package com.layoutparser.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One fixed-width field inside a {@link LineDef}.
 */
@Value
@Builder(toBuilder = true)
public class FieldDef {
    @NonNull
    String name;
    String description;
    int sequence;
    int relativeStart;
    int length;
    @Builder.Default
    Alignment alignment = Alignment.LEFT;
    boolean required;
    boolean sequential;
    @Singular("domainValue")
    List<String> domain;
    String fixedValue;
    @Builder.Default
    FieldKind kind = FieldKind.TEXT;

    public boolean hasFixedValue() {
        return fixedValue != null && !fixedValue.isEmpty();
    }

    public boolean hasDomain() {
        return !domain.isEmpty();
    }

    public boolean isFiller() {
        return kind == FieldKind.FILLER;
    }
}
