package com.hypmag.service;

import com.hypmag.exception.ConfigurationException;
import com.hypmag.model.FieldIds;
import com.hypmag.model.FieldStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives zeropoint, median flux error and smoothing parameter of every field of one filter.
 */
public class StatsEstimator {

    private static final Logger log = LoggerFactory.getLogger(StatsEstimator.class);

    /**
     * @param filter         filter name, used in messages only
     * @param flux           source fluxes
     * @param fluxError      source flux errors; sources with error &lt;= 0 are ignored
     * @param magnitude      classical magnitudes, or null if {@code fixedZeropoint} is given
     * @param fields         field label of every source
     * @param fixedZeropoint zeropoint used for all fields, or null to estimate it
     * @return statistics per field, sorted by field label
     */
    public SortedMap<String, FieldStats> estimate(String filter, double[] flux, double[] fluxError, double[] magnitude,
                                                  String[] fields, Double fixedZeropoint) {
        if (magnitude == null && fixedZeropoint == null) {
            throw ConfigurationException.noZeropointSource(filter);
        }
        int n = flux.length;
        if (fluxError.length != n || fields.length != n || (magnitude != null && magnitude.length != n)) {
            throw new IllegalArgumentException("filter '" + filter + "': input columns differ in length");
        }

        Map<String, List<Integer>> members = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            members.computeIfAbsent(fields[i], k -> new ArrayList<>()).add(i);
        }

        SortedMap<String, FieldStats> result = new TreeMap<>(FieldIds.ORDER);
        for (Map.Entry<String, List<Integer>> e : members.entrySet()) {
            List<Integer> rows = e.getValue();
            double[] errors = new double[rows.size()];
            double[] zeropoints = new double[rows.size()];
            int good = 0;
            for (int k = 0; k < rows.size(); k++) {
                int i = rows.get(k);
                boolean isGood = fluxError[i] > 0.0;
                if (isGood) good++;
                errors[k] = isGood ? fluxError[i] : Double.NaN;
                if (fixedZeropoint == null) {
                    zeropoints[k] = isGood ? ZeropointModel.estimateZp(magnitude[i], flux[i]) : Double.NaN;
                }
            }
            double zp = fixedZeropoint != null ? fixedZeropoint : RobustStats.nanMedian(zeropoints);
            double medianError = RobustStats.nanMedian(errors);
            FieldStats stats = fromZeropoint(zp, medianError);
            log.debug("filter {} field {}: {} of {} sources good, {}", filter, e.getKey(), good, rows.size(), stats);
            result.put(e.getKey(), stats);
        }
        return result;
    }

    /** Completes the statistics of a field from its zeropoint and median flux error. */
    public static FieldStats fromZeropoint(double zeropoint, double fluxError) {
        double refFlux = ZeropointModel.refFluxFromZp(zeropoint);
        double b = ZeropointModel.estimateB(zeropoint, fluxError);
        return new FieldStats(zeropoint, fluxError, refFlux, b, refFlux * b);
    }
}
