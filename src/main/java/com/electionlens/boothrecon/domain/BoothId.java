package com.electionlens.boothrecon.domain;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Polling-station identifier: a positive number with an optional alphabetic suffix
 * ("12", "12A", "12W"), which may end in a parenthesised letter ("7A(W)"). Auxiliary and
 * women-only stations share the number of their parent station and differ by suffix.
 *
 * <p>Natural ordering is numeric first, then suffix (no suffix sorts first), which is
 * the stable booth ordering used by the reconciler.
 *
 * @param number numeric part (leading zeros dropped)
 * @param suffix upper-case suffix, empty when absent
 */
public record BoothId(int number, String suffix) implements Comparable<BoothId> {

    private static final Pattern FORMAT = Pattern.compile("^0*(\\d+)((?:[A-Za-z]+(?:\\([A-Za-z]\\))?)?)$");

    private static final Comparator<BoothId> ORDER = Comparator
            .comparingInt(BoothId::number)
            .thenComparing(BoothId::suffix);

    public BoothId {
        if (number < 0) {
            throw new IllegalArgumentException("Booth number must not be negative, got: " + number);
        }
        suffix = suffix == null ? "" : suffix.toUpperCase(Locale.ROOT);
    }

    public static BoothId of(int number) {
        return new BoothId(number, "");
    }

    /**
     * Parses "12", "012", "12A", "12w" or "7A(W)".
     *
     * @throws IllegalArgumentException if text is not a booth identifier
     */
    public static BoothId parse(String text) {
        Objects.requireNonNull(text, "text");
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a booth identifier: '" + text + "'");
        }
        try {
            return new BoothId(Integer.parseInt(m.group(1)), m.group(2));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Booth number out of range: '" + text + "'", e);
        }
    }

    @Override
    public int compareTo(BoothId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return number + suffix;
    }
}
