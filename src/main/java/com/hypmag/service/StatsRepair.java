package com.hypmag.service;

import com.hypmag.model.FieldIds;
import com.hypmag.model.FieldStats;
import com.hypmag.model.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Replaces the statistics of fields with any non-finite value by the mean over all
 * fields with finite statistics.
 */
public class StatsRepair {

    private static final Logger log = LoggerFactory.getLogger(StatsRepair.class);

    /**
     * @return a new map; identical content if all fields are finite. If no field is
     * finite the bad rows are kept as they are.
     */
    public SortedMap<String, FieldStats> fillMissingStats(String filter, Map<String, FieldStats> stats) {
        SortedMap<String, FieldStats> fixed = new TreeMap<>(FieldIds.ORDER);
        fixed.putAll(stats);

        // first pass: mean over the good rows only
        double[] sum = new double[Keys.VALUE_COLUMNS.length];
        int good = 0;
        List<String> bad = new ArrayList<>();
        for (Map.Entry<String, FieldStats> e : fixed.entrySet()) {
            if (e.getValue().isFinite()) {
                double[] values = e.getValue().values();
                for (int c = 0; c < sum.length; c++) sum[c] += values[c];
                good++;
            } else {
                bad.add(e.getKey());
            }
        }
        if (bad.isEmpty()) return fixed;
        if (good == 0) {
            log.warn("filter {}: no field with valid statistics, cannot replace: {}", filter, String.join(", ", bad));
            return fixed;
        }
        for (int c = 0; c < sum.length; c++) sum[c] /= good;

        // second pass: substitute
        FieldStats mean = FieldStats.fromValues(sum);
        for (String field : bad) fixed.put(field, mean);
        log.warn("filter {}: replaced statistics of fields with global mean: {}", filter, String.join(", ", bad));
        return fixed;
    }
}
