package com.layoutparser.generator.synthesis;

import static com.layoutparser.generator.synthesis.FieldValueGenerator.zeroPad;

import java.time.LocalDate;
import java.util.Random;

import com.layoutparser.generator.model.FieldDef;

/**
 * Plausible random values drawn from a caller-supplied (usually seeded) {@link Random}.
 * CNPJ and CPF carry valid check digits; dates fall within 30 days of the reference date.
 */
public class RandomFieldValues implements FieldValueGenerator {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int DATE_SPREAD_DAYS = 30;

    private final Random random;
    private final LocalDate referenceDate;

    public RandomFieldValues(Random random, LocalDate referenceDate) {
        this.random = random;
        this.referenceDate = referenceDate;
    }

    @Override
    public String valueFor(FieldDef field, int recordIndex, int occurrence) {
        if (field.hasFixedValue()) {
            return field.getFixedValue();
        }
        if (field.hasDomain()) {
            return field.getDomain().get(random.nextInt(field.getDomain().size()));
        }
        if (field.isSequential()) {
            return zeroPad(String.valueOf(occurrence + 1), field.getLength());
        }
        int length = field.getLength();
        return switch (field.getKind()) {
            case CNPJ -> FiscalDocumentNumbers.completeCnpj(digits(8) + "0001");
            case CPF -> FiscalDocumentNumbers.completeCpf(digits(9));
            case DATE -> referenceDate.plusDays(random.nextInt(2 * DATE_SPREAD_DAYS + 1) - DATE_SPREAD_DAYS)
                    .format(DeterministicFieldValues.DATE_FORMAT);
            case TIME -> String.format("%02d%02d%02d", random.nextInt(24), random.nextInt(60), random.nextInt(60));
            case DECIMAL -> zeroPad(String.valueOf(decimalValue(length)), length);
            case NUMERIC -> digits(length);
            case EMAIL -> "usuario" + random.nextInt(10_000) + "@exemplo.com.br";
            case FILLER -> " ".repeat(length);
            case TEXT -> text(length);
        };
    }

    private long decimalValue(int length) {
        // Cents between 1.00 and the largest value the width can hold
        int digits = Math.min(length, 18);
        long upper = digits <= 3 ? 999L : (long) Math.pow(10, digits) - 1;
        long lower = Math.min(100L, upper);
        return lower + (long) (random.nextDouble() * (upper - lower));
    }

    private String digits(int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        return sb.toString();
    }

    private String text(int maxLength) {
        int length = 1 + random.nextInt(Math.max(1, maxLength));
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
