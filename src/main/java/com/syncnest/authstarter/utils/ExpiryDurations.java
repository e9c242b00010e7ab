package com.syncnest.authstarter.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses expiry strings of the form {@code <integer><unit>} where unit is one of
 * {@code s}, {@code m}, {@code h}, {@code d}. A bare integer is read as seconds.
 * <p>
 * Examples: {@code "3600s"}, {@code "60m"}, {@code "1h"}, {@code "7d"}, {@code "900"}.
 * Anything else (unknown unit, negative, blank) is rejected so a typo in
 * configuration fails start-up instead of silently producing a different lifetime.
 */
public final class ExpiryDurations {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)([smhd]?)$");

    private ExpiryDurations() {}

    /** Parse to whole seconds. */
    public static long toSeconds(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Expiry duration must not be blank.");
        }
        Matcher m = FORMAT.matcher(value.trim().toLowerCase());
        if (!m.matches()) {
            throw new IllegalArgumentException("Unsupported expiry duration '" + value
                    + "'. Expected <integer>[s|m|h|d].");
        }

        final long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expiry duration out of range: " + value, e);
        }

        return switch (m.group(2)) {
            case "m" -> Math.multiplyExact(amount, 60L);
            case "h" -> Math.multiplyExact(amount, 3_600L);
            case "d" -> Math.multiplyExact(amount, 86_400L);
            default -> amount; // "s" or bare number
        };
    }

    /** Parse to (possibly fractional) days, e.g. {@code "36h"} is 1.5. */
    public static double toDays(String value) {
        return toSeconds(value) / 86_400d;
    }
}
