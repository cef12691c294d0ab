package com.layoutparser.generator.synthesis;

/**
 * Check digits for Brazilian company (CNPJ) and person (CPF) registration numbers.
 */
public final class FiscalDocumentNumbers {

    private static final int[] CNPJ_FIRST = { 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2 };
    private static final int[] CNPJ_SECOND = { 6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2 };
    private static final int[] CPF_FIRST = { 10, 9, 8, 7, 6, 5, 4, 3, 2 };
    private static final int[] CPF_SECOND = { 11, 10, 9, 8, 7, 6, 5, 4, 3, 2 };

    private FiscalDocumentNumbers() {
        // Utility class
    }

    /**
     * Appends both check digits to a 12 digit CNPJ base.
     */
    public static String completeCnpj(String base12) {
        requireDigits(base12, 12);
        String withFirst = base12 + checkDigit(base12, CNPJ_FIRST);
        return withFirst + checkDigit(withFirst, CNPJ_SECOND);
    }

    /**
     * Appends both check digits to a 9 digit CPF base.
     */
    public static String completeCpf(String base9) {
        requireDigits(base9, 9);
        String withFirst = base9 + checkDigit(base9, CPF_FIRST);
        return withFirst + checkDigit(withFirst, CPF_SECOND);
    }

    public static boolean isValidCnpj(String cnpj) {
        return cnpj != null && cnpj.matches("\\d{14}") && completeCnpj(cnpj.substring(0, 12)).equals(cnpj);
    }

    public static boolean isValidCpf(String cpf) {
        return cpf != null && cpf.matches("\\d{11}") && completeCpf(cpf.substring(0, 9)).equals(cpf);
    }

    static int checkDigit(String digits, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += (digits.charAt(i) - '0') * weights[i];
        }
        int remainder = sum % 11;
        return remainder < 2 ? 0 : 11 - remainder;
    }

    private static void requireDigits(String value, int count) {
        if (value == null || value.length() != count || !value.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("Expected " + count + " digits but got: " + value);
        }
    }
}
