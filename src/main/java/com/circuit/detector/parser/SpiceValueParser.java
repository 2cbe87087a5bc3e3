package com.circuit.detector.parser;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses SPICE numeric values with engineering suffixes ({@code 10f}, {@code 1.5k}, {@code 2meg}).
 */
public final class SpiceValueParser {

    private static final Pattern VALUE_PATTERN = Pattern.compile(
            "^([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:e[-+]?\\d+)?)(meg|[afpnumkgt])?[a-z]*$",
            Pattern.CASE_INSENSITIVE
    );

    private static final Map<String, Double> SUFFIXES = Map.ofEntries(
            Map.entry("a", 1e-18),
            Map.entry("f", 1e-15),
            Map.entry("p", 1e-12),
            Map.entry("n", 1e-9),
            Map.entry("u", 1e-6),
            Map.entry("m", 1e-3),
            Map.entry("k", 1e3),
            Map.entry("meg", 1e6),
            Map.entry("g", 1e9),
            Map.entry("t", 1e12)
    );

    private SpiceValueParser() {
        // Utility class
    }

    public static Optional<Double> tryParse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = VALUE_PATTERN.matcher(text.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        double base = Double.parseDouble(m.group(1));
        String suffix = m.group(2);
        if (suffix == null) {
            return Optional.of(base);
        }
        return Optional.of(base * SUFFIXES.get(suffix.toLowerCase(Locale.ROOT)));
    }

    public static boolean isValue(String text) {
        return tryParse(text).isPresent();
    }
}
