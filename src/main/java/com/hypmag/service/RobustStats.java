package com.hypmag.service;

import java.util.Arrays;

/**
 * NaN-aware aggregates over plain arrays.
 */
final class RobustStats {

    private RobustStats() {
    }

    /** Median ignoring NaN; NaN if no value remains. Infinite values take part. */
    static double nanMedian(double[] values) {
        double[] valid = Arrays.stream(values).filter(v -> !Double.isNaN(v)).sorted().toArray();
        int n = valid.length;
        if (n == 0) return Double.NaN;
        int mid = n / 2;
        if (n % 2 == 0) return (valid[mid - 1] + valid[mid]) / 2.0;
        return valid[mid];
    }
}
