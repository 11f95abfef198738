package com.hypmag.model;

import com.hypmag.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of one run. The filter map comes from the JSON configuration file
 * (see {@link com.hypmag.service.ConfigLoader}); the remaining options are set with
 * the {@code with...} methods, each returning a new instance.
 */
public class HyperbolicConfig {

    private final Map<String, FilterColumns> filters;
    private final String fieldsColumn;
    private final Double zeropoint;
    private final boolean bGlobal;
    private final boolean verbose;

    public HyperbolicConfig(Map<String, FilterColumns> filters) {
        this(filters, null, null, false, false);
    }

    private HyperbolicConfig(Map<String, FilterColumns> filters, String fieldsColumn, Double zeropoint,
                             boolean bGlobal, boolean verbose) {
        if (filters == null || filters.isEmpty()) {
            throw new ConfigurationException("configuration does not define any filter");
        }
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        this.fieldsColumn = fieldsColumn;
        this.zeropoint = zeropoint;
        this.bGlobal = bGlobal;
        this.verbose = verbose;
    }

    /** Column that identifies the pointing of each source, or null for a single field. */
    public HyperbolicConfig withFieldsColumn(String column) {
        return new HyperbolicConfig(filters, column, zeropoint, bGlobal, verbose);
    }

    /** Fixed magnitude zeropoint; magnitude columns are ignored when set. */
    public HyperbolicConfig withZeropoint(Double value) {
        return new HyperbolicConfig(filters, fieldsColumn, value, bGlobal, verbose);
    }

    public HyperbolicConfig withGlobalB(boolean value) {
        return new HyperbolicConfig(filters, fieldsColumn, zeropoint, value, verbose);
    }

    public HyperbolicConfig withVerbose(boolean value) {
        return new HyperbolicConfig(filters, fieldsColumn, zeropoint, bGlobal, value);
    }

    public List<String> getFilters() {
        return new ArrayList<>(filters.keySet());
    }

    public FilterColumns getColumns(String filter) {
        FilterColumns columns = filters.get(filter);
        if (columns == null) throw new ConfigurationException("unknown filter '" + filter + "'");
        return columns;
    }

    public String getFieldsColumn() {
        return fieldsColumn;
    }

    public Double getZeropoint() {
        return zeropoint;
    }

    public boolean hasFixedZeropoint() {
        return zeropoint != null;
    }

    public boolean isGlobalB() {
        return bGlobal;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
