package com.eyelevel.tableingestor.service.csv;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces arbitrary header and file names to identifiers that are safe to use unquoted or quoted
 * in any SQL dialect: lowercase {@code [a-z0-9_]+}, at most 63 characters, never starting with a
 * digit. All methods are pure.
 */
public final class IdentifierSanitizer {

    public static final int MAX_IDENTIFIER_LENGTH = 63;
    public static final Pattern VALID_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9_]");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_{2,}");

    private IdentifierSanitizer() {
    }

    /**
     * Sanitizes one raw name. Returns an empty string when nothing usable is left.
     *
     * @param raw         the raw header or file name.
     * @param digitPrefix prefix applied when the result would start with a digit.
     */
    public static String sanitize(String raw, String digitPrefix) {
        if (raw == null) {
            return "";
        }
        String ascii = COMBINING_MARKS.matcher(Normalizer.normalize(raw.trim(), Normalizer.Form.NFKD)).replaceAll("");
        String name = INVALID_CHARS.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("_");
        name = trimUnderscores(UNDERSCORE_RUNS.matcher(name).replaceAll("_"));
        if (name.isEmpty()) {
            return name;
        }
        if (Character.isDigit(name.charAt(0))) {
            name = digitPrefix + name;
        }
        return truncate(name, MAX_IDENTIFIER_LENGTH);
    }

    /**
     * Derives a table name from a file base name; {@code unnamed_table} when nothing is left.
     */
    public static String tableName(String baseName) {
        String name = sanitize(baseName, "t_");
        return name.isEmpty() ? "unnamed_table" : name;
    }

    /**
     * Sanitizes a header row. Empty results fall back to {@code column_<position>} (1-based) and
     * collisions get {@code _2}, {@code _3}, ... so the returned names are unique.
     */
    public static List<String> columnNames(List<String> rawHeaders) {
        List<String> names = new ArrayList<>(rawHeaders.size());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < rawHeaders.size(); i++) {
            String base = sanitize(rawHeaders.get(i), "c_");
            if (base.isEmpty()) {
                base = "column_" + (i + 1);
            }
            String candidate = base;
            for (int suffix = 2; used.contains(candidate); suffix++) {
                String tail = "_" + suffix;
                candidate = truncate(base, MAX_IDENTIFIER_LENGTH - tail.length()) + tail;
            }
            used.add(candidate);
            names.add(candidate);
        }
        return names;
    }

    public static boolean isValid(String identifier) {
        return identifier != null && VALID_IDENTIFIER.matcher(identifier).matches();
    }

    private static String truncate(String name, int maxLength) {
        if (name.length() <= maxLength) {
            return name;
        }
        String truncated = trimUnderscores(name.substring(0, maxLength));
        return truncated.isEmpty() ? name.substring(0, maxLength) : truncated;
    }

    private static String trimUnderscores(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && name.charAt(start) == '_') {
            start++;
        }
        while (end > start && name.charAt(end - 1) == '_') {
            end--;
        }
        return name.substring(start, end);
    }
}
