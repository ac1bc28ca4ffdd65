package com.eyelevel.tableingestor.service.csv;

import com.eyelevel.tableingestor.model.ColumnType;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Infers a {@link ColumnType} over a fully materialized column and converts raw values to it.
 * Precedence is INTEGER, then REAL, then DATE, then TEXT; empty values are ignored and a column
 * with no values at all is TEXT.
 * <p>
 * A whole number outside the 64-bit range makes its column TEXT, never REAL: a double would not
 * hold its digits.
 */
public final class ColumnTypeInferrer {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern REAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private ColumnTypeInferrer() {
    }

    public static ColumnType infer(Collection<String> values) {
        boolean any = false;
        boolean integer = true;
        boolean real = true;
        boolean date = true;
        for (String raw : values) {
            if (isEmpty(raw)) {
                continue;
            }
            any = true;
            String value = raw.trim();
            if (INTEGER.matcher(value).matches() && !fitsInLong(value)) {
                return ColumnType.TEXT;
            }
            integer = integer && isInteger(value);
            real = real && REAL.matcher(value).matches();
            date = date && isDate(value);
            if (!integer && !real && !date) {
                return ColumnType.TEXT;
            }
        }
        if (!any) {
            return ColumnType.TEXT;
        }
        if (integer) {
            return ColumnType.INTEGER;
        }
        if (real) {
            return ColumnType.REAL;
        }
        return date ? ColumnType.DATE : ColumnType.TEXT;
    }

    /**
     * Converts a raw value to the Java type backing {@code type}. Empty values become {@code null}.
     * Only valid for values the column's type was inferred from.
     */
    public static Object convert(String raw, ColumnType type) {
        if (isEmpty(raw)) {
            return null;
        }
        return switch (type) {
            case INTEGER -> Long.parseLong(raw.trim());
            case REAL -> Double.parseDouble(raw.trim());
            case DATE -> LocalDate.parse(raw.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
            case TEXT -> raw;
        };
    }

    private static boolean isInteger(String value) {
        return INTEGER.matcher(value).matches() && fitsInLong(value);
    }

    private static boolean fitsInLong(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDate(String value) {
        if (!ISO_DATE.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
