package com.layoutparser.generator.synthesis;

import static com.layoutparser.generator.synthesis.FieldValueGenerator.zeroPad;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import com.layoutparser.generator.model.FieldDef;

/**
 * Repeatable values: fixed value, then first domain value, then a default per field kind.
 */
public class DeterministicFieldValues implements FieldValueGenerator {

    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    static final String SAMPLE_CNPJ = FiscalDocumentNumbers.completeCnpj("123456780001");
    static final String SAMPLE_CPF = FiscalDocumentNumbers.completeCpf("123456789");

    private final LocalDate referenceDate;

    public DeterministicFieldValues(LocalDate referenceDate) {
        this.referenceDate = referenceDate;
    }

    @Override
    public String valueFor(FieldDef field, int recordIndex, int occurrence) {
        if (field.hasFixedValue()) {
            return field.getFixedValue();
        }
        if (field.hasDomain()) {
            return field.getDomain().get(0);
        }
        if (field.isSequential()) {
            return zeroPad(String.valueOf(occurrence + 1), field.getLength());
        }
        int length = field.getLength();
        return switch (field.getKind()) {
            case CNPJ -> SAMPLE_CNPJ;
            case CPF -> SAMPLE_CPF;
            case DATE -> referenceDate.format(DATE_FORMAT);
            case TIME -> "120000";
            case DECIMAL -> zeroPad("100", length);
            case NUMERIC -> zeroPad(String.valueOf(recordIndex + 1), length);
            case EMAIL -> "teste@exemplo.com.br";
            case FILLER -> " ".repeat(length);
            case TEXT -> "CAMPO_" + field.getName();
        };
    }
}
