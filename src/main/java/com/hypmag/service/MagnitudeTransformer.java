package com.hypmag.service;

import com.hypmag.exception.MissingStatisticsException;
import com.hypmag.model.FieldStats;

import org.apache.commons.math3.util.FastMath;

import java.util.Map;

import static com.hypmag.service.ZeropointModel.POGSON;

/**
 * Converts fluxes into hyperbolic magnitudes and their errors.
 */
public class MagnitudeTransformer {

    /** Output of sources without a valid flux error. */
    public static final float SENTINEL = -99.0f;

    public static class Result {
        public final float[] magnitude;
        public final float[] magnitudeError;

        public Result(float[] magnitude, float[] magnitudeError) {
            this.magnitude = magnitude;
            this.magnitudeError = magnitudeError;
        }
    }

    /**
     * @param filter    filter name, used in messages only
     * @param stats     repaired statistics of the filter, keyed by field
     * @param b         relative smoothing parameter of the filter
     * @throws MissingStatisticsException if a source's field has no statistics
     */
    public Result transform(String filter, double[] flux, double[] fluxError, String[] fields,
                            Map<String, FieldStats> stats, double b) {
        int n = flux.length;
        if (fluxError.length != n || fields.length != n) {
            throw new IllegalArgumentException("filter '" + filter + "': input columns differ in length");
        }
        float[] mag = new float[n];
        float[] magErr = new float[n];
        for (int i = 0; i < n; i++) {
            if (!(fluxError[i] > 0.0)) {
                mag[i] = SENTINEL;
                magErr[i] = SENTINEL;
                continue;
            }
            FieldStats field = stats.get(fields[i]);
            if (field == null) throw MissingStatisticsException.forField(filter, fields[i]);
            double normFlux = flux[i] / field.refFlux;
            double normFluxErr = fluxError[i] / field.refFlux;
            mag[i] = (float) computeMagnitude(normFlux, b);
            magErr[i] = (float) computeMagnitudeError(normFlux, b, normFluxErr);
        }
        return new Result(mag, magErr);
    }

    public static double computeMagnitude(double normFlux, double b) {
        return -POGSON * (FastMath.asinh(0.5 * normFlux / b) + Math.log(b));
    }

    public static double computeMagnitudeError(double normFlux, double b, double normFluxErr) {
        return POGSON * normFluxErr / Math.sqrt(normFlux * normFlux + 4.0 * b * b);
    }

    /** Classical magnitude, or {@code fill} for non-positive flux. */
    public static double computeClassicMagnitude(double flux, double zeropoint, double fill) {
        if (flux > 0.0) return -POGSON * Math.log(flux) + zeropoint;
        return fill;
    }

    public static double computeClassicMagnitude(double flux, double zeropoint) {
        return computeClassicMagnitude(flux, zeropoint, Double.NaN);
    }
}
