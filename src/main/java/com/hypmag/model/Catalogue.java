package com.hypmag.model;

import com.hypmag.exception.ColumnNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory source table made of named columns of equal length.
 * <p>
 * Columns are {@code double[]}, {@code float[]} or {@code String[]} and keep their
 * insertion order. Arrays are stored as given, callers must not modify them afterwards.
 */
public class Catalogue {

    private final Map<String, Object> columns = new LinkedHashMap<>();
    private int rows = -1;

    public int size() {
        return Math.max(rows, 0);
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public Catalogue addColumn(String name, double[] values) {
        return put(name, values, values.length);
    }

    public Catalogue addColumn(String name, float[] values) {
        return put(name, values, values.length);
    }

    public Catalogue addColumn(String name, String[] values) {
        return put(name, values, values.length);
    }

    private Catalogue put(String name, Object values, int length) {
        if (rows >= 0 && length != rows) {
            throw new IllegalArgumentException(String.format(
                    "column '%s' has %d rows, catalogue has %d", name, length, rows));
        }
        columns.put(name, values);
        rows = length;
        return this;
    }

    /** Raw column array ({@code double[]}, {@code float[]} or {@code String[]}). */
    public Object getColumn(String name) {
        Object col = columns.get(name);
        if (col == null) throw new ColumnNotFoundException(name);
        return col;
    }

    /**
     * Numeric column widened to double precision.
     *
     * @throws ColumnNotFoundException if the column does not exist
     * @throws IllegalArgumentException if the column holds text
     */
    public double[] getDoubles(String name) {
        Object col = getColumn(name);
        if (col instanceof double[]) return (double[]) col;
        if (col instanceof float[]) {
            float[] f = (float[]) col;
            double[] d = new double[f.length];
            for (int i = 0; i < f.length; i++) d[i] = f[i];
            return d;
        }
        throw new IllegalArgumentException("column '" + name + "' is not numeric");
    }

    /**
     * Column converted to field labels, see {@link FieldIds#label(double)}.
     */
    public String[] getLabels(String name) {
        Object col = getColumn(name);
        if (col instanceof String[]) {
            String[] s = (String[]) col;
            String[] labels = new String[s.length];
            for (int i = 0; i < s.length; i++) labels[i] = s[i] == null ? "" : FieldIds.normalize(s[i]);
            return labels;
        }
        double[] values = getDoubles(name);
        String[] labels = new String[values.length];
        for (int i = 0; i < values.length; i++) labels[i] = FieldIds.label(values[i]);
        return labels;
    }

    @Override
    public String toString() {
        return "Catalogue[rows=" + size() + ", columns=" + columns.keySet() + "]";
    }
}
