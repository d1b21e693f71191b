package com.delta.cnpjresolver.resolve.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checksum validation, formatting and text extraction for CNPJ identifiers.
 * All methods are pure and accept {@code null} as "no value".
 */
public final class CnpjValidator {
    public static final Pattern PUNCTUATED = Pattern.compile("\\d{2}\\.\\d{3}\\.\\d{3}/\\d{4}-\\d{2}");

    private static final Pattern BARE = Pattern.compile("\\b\\d{14}\\b");
    private static final Pattern FOURTEEN_DIGITS = Pattern.compile("\\d{14}");
    private static final Pattern TWELVE_DIGITS = Pattern.compile("\\d{12}");
    private static final int[] FIRST_WEIGHTS = {5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] SECOND_WEIGHTS = {6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};

    private CnpjValidator() {}

    public static String extractDigits(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder digits = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        return digits.toString();
    }

    public static boolean isValid(String digits14) {
        if (digits14 == null || !FOURTEEN_DIGITS.matcher(digits14).matches()) {
            return false;
        }
        if (allSameDigit(digits14)) {
            return false;
        }
        return computeCheckDigits(digits14.substring(0, 12)).equals(digits14.substring(12));
    }

    public static boolean validate(String value) {
        return isValid(extractDigits(value));
    }

    /**
     * Computes the two mod-11 check digits for a 12-digit CNPJ base.
     */
    public static String computeCheckDigits(String digits12) {
        if (digits12 == null || !TWELVE_DIGITS.matcher(digits12).matches()) {
            throw new IllegalArgumentException("CNPJ base must have exactly 12 digits");
        }
        int first = checkDigit(digits12, FIRST_WEIGHTS);
        int second = checkDigit(digits12 + first, SECOND_WEIGHTS);
        return String.valueOf(first) + second;
    }

    public static String format(String value) {
        String digits = extractDigits(value);
        if (digits.length() != 14) {
            return "";
        }
        return digits.substring(0, 2) + "."
            + digits.substring(2, 5) + "."
            + digits.substring(5, 8) + "/"
            + digits.substring(8, 12) + "-"
            + digits.substring(12, 14);
    }

    /**
     * Punctuated matches first, in text order, then bare 14-digit runs not already seen.
     */
    public static List<String> extractCandidates(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        Matcher punctuated = PUNCTUATED.matcher(text);
        while (punctuated.find()) {
            seen.add(punctuated.group());
        }
        Matcher bare = BARE.matcher(text);
        while (bare.find()) {
            seen.add(format(bare.group()));
        }
        return new ArrayList<>(seen);
    }

    public static List<String> extractValid(String text) {
        List<String> valid = new ArrayList<>();
        for (String candidate : extractCandidates(text)) {
            if (validate(candidate)) {
                valid.add(candidate);
            }
        }
        return valid;
    }

    private static int checkDigit(String digits, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += (digits.charAt(i) - '0') * weights[i];
        }
        int remainder = sum % 11;
        return remainder < 2 ? 0 : 11 - remainder;
    }

    private static boolean allSameDigit(String digits) {
        char first = digits.charAt(0);
        for (int i = 1; i < digits.length(); i++) {
            if (digits.charAt(i) != first) {
                return false;
            }
        }
        return true;
    }
}
