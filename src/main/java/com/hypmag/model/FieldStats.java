package com.hypmag.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Photometric statistics of one field in one filter.
 */
public class FieldStats {

    public final double zeropoint;
    public final double fluxError;  // median flux error of the good sources
    public final double refFlux;    // flux corresponding to the zeropoint
    public final double bRelative;
    public final double bAbsolute;  // bRelative in flux units

    public FieldStats(double zeropoint, double fluxError, double refFlux, double bRelative, double bAbsolute) {
        this.zeropoint = zeropoint;
        this.fluxError = fluxError;
        this.refFlux = refFlux;
        this.bRelative = bRelative;
        this.bAbsolute = bAbsolute;
    }

    public static FieldStats fromValues(double[] values) {
        if (values.length != Keys.VALUE_COLUMNS.length) {
            throw new IllegalArgumentException("expected " + Keys.VALUE_COLUMNS.length + " values, got " + values.length);
        }
        return new FieldStats(values[0], values[1], values[2], values[3], values[4]);
    }

    /** Values in the order of {@link Keys#VALUE_COLUMNS}. */
    public double[] values() {
        return new double[]{zeropoint, fluxError, refFlux, bRelative, bAbsolute};
    }

    public boolean isFinite() {
        for (double v : values()) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldStats)) return false;
        FieldStats other = (FieldStats) o;
        return Double.compare(zeropoint, other.zeropoint) == 0
                && Double.compare(fluxError, other.fluxError) == 0
                && Double.compare(refFlux, other.refFlux) == 0
                && Double.compare(bRelative, other.bRelative) == 0
                && Double.compare(bAbsolute, other.bAbsolute) == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values());
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "FieldStats[zp=%.4f, err=%.4g, ref=%.4g, b=%.4g, b_abs=%.4g]",
                zeropoint, fluxError, refFlux, bRelative, bAbsolute);
    }
}
