package com.layoutparser.generator.model;

/**
 * Semantic kind of a positional field, used when synthesizing values.
 */
public enum FieldKind {
    TEXT,
    NUMERIC,
    DECIMAL,
    DATE,
    TIME,
    CNPJ,
    CPF,
    EMAIL,
    FILLER
}
