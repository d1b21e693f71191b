package com.delta.cnpjresolver.resolve.util;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class SlugNormalizer {
    private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");
    private static final Pattern SOCIEDADE_ANONIMA = Pattern.compile("\\bs\\.?\\s*a\\.?\\b");
    private static final Pattern LIMITADA = Pattern.compile("\\bltda\\.?\\b");
    private static final Pattern SLUG_PUNCTUATION = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-+");
    private static final Pattern TOKEN_PUNCTUATION = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Longer forms first so "s.a.s." is not reduced to "s" by the "s.a." rule.
    private static final List<Pattern> LEGAL_SUFFIXES = List.of(
        Pattern.compile("\\bs\\.?a\\.?s\\.?(?=\\W|$)"),
        Pattern.compile("\\bs\\.?a\\.?(?=\\W|$)"),
        Pattern.compile("\\bsa\\b"),
        Pattern.compile("\\bltda\\.?(?=\\W|$)"),
        Pattern.compile("\\bme\\b"),
        Pattern.compile("\\bepp\\b"),
        Pattern.compile("\\bholding\\b"),
        Pattern.compile("\\bgrupo\\b"),
        Pattern.compile("\\bcia\\.?(?=\\W|$)"),
        Pattern.compile("\\bcompanhia\\b"),
        Pattern.compile("\\bempresa\\b")
    );

    private SlugNormalizer() {}

    /**
     * Directory slug: "Embraer S.A." becomes "embraer-sa".
     */
    public static String normalize(String companyName) {
        String text = asciiLowercase(companyName);
        text = SOCIEDADE_ANONIMA.matcher(text).replaceAll("sa");
        text = LIMITADA.matcher(text).replaceAll("ltda");
        text = SLUG_PUNCTUATION.matcher(text).replaceAll("");
        text = SEPARATORS.matcher(text).replaceAll("-");
        text = stripHyphens(text);
        return REPEATED_HYPHENS.matcher(text).replaceAll("-");
    }

    /**
     * Bare token used to guess corporate domains: legal suffixes and whitespace removed.
     */
    public static String domainToken(String companyName) {
        String text = asciiLowercase(companyName);
        for (Pattern suffix : LEGAL_SUFFIXES) {
            text = suffix.matcher(text).replaceAll("");
        }
        text = TOKEN_PUNCTUATION.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll("");
        return text.replace("_", "").trim();
    }

    private static String asciiLowercase(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        return NON_ASCII.matcher(decomposed).replaceAll("");
    }

    private static String stripHyphens(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
