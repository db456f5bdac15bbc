package com.sectracker.resolver.lookup.model;

import java.util.Locale;

/**
 * One row of the ticker directory. The identifier is the SEC CIK, zero-padded to ten digits.
 */
public record RegistryEntry(String ticker, String legalName, String identifier) {

    public RegistryEntry {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("ticker is required");
        }
        if (legalName == null || legalName.isBlank()) {
            throw new IllegalArgumentException("legalName is required for " + ticker);
        }
        ticker = ticker.trim().toUpperCase(Locale.ROOT);
        legalName = legalName.trim();
    }

    public static String padIdentifier(String rawCik) {
        if (rawCik == null) {
            return null;
        }
        String digits = rawCik.trim();
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
            return null;
        }
        if (digits.length() >= 10) {
            return digits;
        }
        return "0".repeat(10 - digits.length()) + digits;
    }
}
