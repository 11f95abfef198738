package com.hypmag.model;

import com.hypmag.exception.MissingStatisticsException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Field statistics keyed by (filter, field).
 * <p>
 * Filters keep the order in which they were added (configuration order), fields are
 * sorted with {@link FieldIds#ORDER}. Tables are built once and then only read.
 */
public class StatsTable {

    private final Map<String, SortedMap<String, FieldStats>> filters = new LinkedHashMap<>();

    public StatsTable() {
    }

    public void put(String filter, String field, FieldStats stats) {
        filters.computeIfAbsent(filter, k -> new TreeMap<>(FieldIds.ORDER)).put(field, stats);
    }

    public void putAll(String filter, Map<String, FieldStats> fields) {
        fields.forEach((field, stats) -> put(filter, field, stats));
    }

    public List<String> filters() {
        return new ArrayList<>(filters.keySet());
    }

    /**
     * Statistics of all fields of one filter.
     *
     * @throws MissingStatisticsException if the filter is not in the table
     */
    public SortedMap<String, FieldStats> forFilter(String filter) {
        SortedMap<String, FieldStats> fields = filters.get(filter);
        if (fields == null) throw MissingStatisticsException.forFilter(filter);
        return Collections.unmodifiableSortedMap(fields);
    }

    public int size() {
        int n = 0;
        for (SortedMap<String, FieldStats> fields : filters.values()) n += fields.size();
        return n;
    }

    /** Text rendering of one filter's rows, used for verbose logging. */
    public String describe(String filter) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.US, "%-8s %-12s", Keys.FILTER, Keys.FIELD));
        for (String col : Keys.VALUE_COLUMNS) sb.append(String.format(Locale.US, " %14s", col));
        for (Map.Entry<String, FieldStats> e : forFilter(filter).entrySet()) {
            sb.append('\n').append(String.format(Locale.US, "%-8s %-12s", filter, e.getKey()));
            for (double v : e.getValue().values()) sb.append(String.format(Locale.US, " %14.6g", v));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatsTable)) return false;
        StatsTable other = (StatsTable) o;
        return filters().equals(other.filters()) && filters.equals(other.filters);
    }

    @Override
    public int hashCode() {
        return filters.hashCode();
    }
}
