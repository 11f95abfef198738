package com.hypmag.model;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Helpers for field identifiers. Identifiers are kept as text so that both numeric
 * pointing numbers and survey tile names can be used.
 */
public final class FieldIds {

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Field assigned to every source when no field column is configured. */
    public static final String DEFAULT_FIELD = "0";

    /**
     * Numbers sort numerically and before text; text sorts lexicographically.
     */
    public static final Comparator<String> ORDER = (a, b) -> {
        Double da = parse(a);
        Double db = parse(b);
        if (da != null && db != null) {
            int c = Double.compare(da, db);
            return c != 0 ? c : a.compareTo(b);
        }
        if (da != null) return -1;
        if (db != null) return 1;
        return a.compareTo(b);
    };

    private FieldIds() {
    }

    /**
     * Label of a numeric field identifier; integral values drop the fraction so that
     * 12.0 and 12 name the same field.
     */
    public static String label(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Canonical label of a textual identifier: numeric text is relabelled with
     * {@link #label(double)} (so "12.0" becomes "12"), anything else is trimmed.
     */
    public static String normalize(String id) {
        String s = id.trim();
        Double value = parse(s);
        return value != null ? label(value) : s;
    }

    private static Double parse(String s) {
        if (!NUMBER.matcher(s).matches()) return null;
        return Double.valueOf(s);
    }
}
