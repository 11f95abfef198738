package com.hypmag.service;

import com.hypmag.model.FieldStats;
import com.hypmag.model.StatsTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * Collapses per-field smoothing parameters to one value per filter.
 */
public class SmoothingDerivation {

    private static final Logger log = LoggerFactory.getLogger(SmoothingDerivation.class);

    private final StatsRepair repair;

    public SmoothingDerivation() {
        this(new StatsRepair());
    }

    public SmoothingDerivation(StatsRepair repair) {
        this.repair = repair;
    }

    /**
     * Median relative b of the (repaired) fields of each filter. In global mode every
     * filter gets the median of these per-filter medians.
     *
     * @param source  statistics to derive b from, either the calibration table or an
     *                external smoothing table
     * @param filters filters in configuration order; the result keeps this order
     * @throws com.hypmag.exception.MissingStatisticsException if a filter is not in {@code source}
     */
    public Map<String, Double> deriveB(StatsTable source, List<String> filters, boolean global) {
        Map<String, Double> b = new LinkedHashMap<>();
        for (String filter : filters) {
            SortedMap<String, FieldStats> fields = repair.fillMissingStats(filter, source.forFilter(filter));
            double[] values = fields.values().stream().mapToDouble(s -> s.bRelative).toArray();
            b.put(filter, RobustStats.nanMedian(values));
        }
        if (global) {
            double shared = RobustStats.nanMedian(b.values().stream().mapToDouble(Double::doubleValue).toArray());
            b.replaceAll((filter, value) -> shared);
        }
        b.forEach((filter, value) -> {
            if (!(value > 0.0) || Double.isInfinite(value)) {
                log.warn("filter {}: smoothing parameter b={} is not usable, magnitudes will be NaN", filter, value);
            }
        });
        return b;
    }

    /** Text table of the smoothing parameters in the given order. */
    public static String describe(Map<String, Double> b) {
        StringBuilder sb = new StringBuilder(String.format(Locale.US, "%-8s %14s", "filter", "b relative"));
        b.forEach((filter, value) -> sb.append('\n').append(String.format(Locale.US, "%-8s %14.6g", filter, value)));
        return sb.toString();
    }
}
