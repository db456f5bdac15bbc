package com.sectracker.resolver.lookup.registry;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public final class NameNormalizer {
    private static final Pattern STRIPPED_PUNCTUATION = Pattern.compile("[.,'\u2019]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TICKER_TOKEN = Pattern.compile("[A-Z0-9]*[A-Z][A-Z0-9]*([.-][A-Z0-9]+)?");

    private NameNormalizer() {
    }

    /**
     * Uppercases, drops periods, commas and apostrophes, and collapses whitespace.
     * Returns an empty string for null input.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.replace('\u00A0', ' ').toUpperCase(Locale.ROOT);
        cleaned = STRIPPED_PUNCTUATION.matcher(cleaned).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    /**
     * A raw query typed as a ticker symbol: one uppercase token containing a letter. Share-class
     * dots map to the directory's dash form, so {@code BRK.B} becomes {@code BRK-B}.
     */
    public static Optional<String> tickerToken(String rawQuery) {
        if (rawQuery == null) {
            return Optional.empty();
        }
        String trimmed = rawQuery.trim();
        if (trimmed.isEmpty() || !TICKER_TOKEN.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(trimmed.replace('.', '-'));
    }
}
