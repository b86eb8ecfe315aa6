package com.signalwatch.scan.util;

import com.signalwatch.scan.service.InvalidScanRequestException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registry company numbers are always handled in their 8-character, zero-padded form.
 * Purely numeric numbers pad to 8 digits, prefixed numbers (SC, NI, OC, ...) pad the digit part to 6.
 */
public final class CompanyNumbers {
    private static final int LENGTH = 8;
    private static final Pattern NUMERIC = Pattern.compile("\\d{1,8}");
    private static final Pattern PREFIXED = Pattern.compile("([A-Z]{2})(\\d{1,6})");
    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Z0-9]{8}");

    private CompanyNumbers() {
    }

    public static String normalize(String raw) {
        String normalized = tryNormalize(raw);
        if (normalized == null) {
            throw new InvalidScanRequestException("Invalid company number: '" + (raw == null ? "" : raw.trim()) + "'");
        }
        return normalized;
    }

    public static boolean isValid(String raw) {
        return tryNormalize(raw) != null;
    }

    private static String tryNormalize(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (value.isEmpty()) {
            return null;
        }
        if (NUMERIC.matcher(value).matches()) {
            return "0".repeat(LENGTH - value.length()) + value;
        }
        Matcher prefixed = PREFIXED.matcher(value);
        if (prefixed.matches()) {
            String digits = prefixed.group(2);
            return prefixed.group(1) + "0".repeat(LENGTH - 2 - digits.length()) + digits;
        }
        if (ALPHANUMERIC.matcher(value).matches()) {
            return value;
        }
        return null;
    }
}
