package com.hypmag.service;

import com.hypmag.exception.ColumnNotFoundException;
import com.hypmag.exception.ConfigurationException;
import com.hypmag.model.Catalogue;
import com.hypmag.model.FieldIds;
import com.hypmag.model.FilterColumns;
import com.hypmag.model.HyperbolicConfig;

import java.util.Arrays;

/**
 * Picks the configured columns of a catalogue.
 */
final class ColumnSelector {

    private ColumnSelector() {
    }

    static String[] fields(Catalogue data, HyperbolicConfig config) {
        String column = config.getFieldsColumn();
        if (column == null) {
            String[] fields = new String[data.size()];
            Arrays.fill(fields, FieldIds.DEFAULT_FIELD);
            return fields;
        }
        if (!data.hasColumn(column)) throw new ColumnNotFoundException("fields", column);
        return data.getLabels(column);
    }

    static double[] flux(Catalogue data, FilterColumns columns) {
        return require(data, "flux", columns.flux);
    }

    static double[] error(Catalogue data, FilterColumns columns) {
        return require(data, "flux error", columns.error);
    }

    /** Magnitudes of the filter, or null when a fixed zeropoint replaces them. */
    static double[] magnitude(Catalogue data, String filter, FilterColumns columns, HyperbolicConfig config) {
        if (config.hasFixedZeropoint()) return null;
        if (columns.magnitude == null || columns.magnitude.isBlank()) {
            throw ConfigurationException.noZeropointSource(filter);
        }
        return require(data, "magnitude", columns.magnitude);
    }

    private static double[] require(Catalogue data, String role, String column) {
        if (!data.hasColumn(column)) throw new ColumnNotFoundException(role, column);
        if (data.getColumn(column) instanceof String[]) {
            throw new ConfigurationException(String.format("%s column '%s' is not numeric", role, column));
        }
        return data.getDoubles(column);
    }
}
