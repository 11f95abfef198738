package com.hypmag.service;

/**
 * Relations between magnitude zeropoint, reference flux and the smoothing parameter b
 * of asinh magnitudes (Lupton, Gunn &amp; Szalay 1999).
 */
public final class ZeropointModel {

    /** Pogson's constant, 2.5 / ln(10). */
    public static final double POGSON = 2.5 / Math.log(10.0);

    private static final double SQRT_POGSON = Math.sqrt(POGSON);

    private ZeropointModel() {
    }

    public static double refFluxFromZp(double zeropoint) {
        return Math.exp(zeropoint / POGSON);
    }

    public static double zpFromRefFlux(double flux) {
        return POGSON * Math.log(flux);
    }

    /**
     * Zeropoint implied by a classical magnitude and its flux. Non-positive fluxes give
     * NaN or -infinity, which the NaN-aware aggregation downstream ignores or flags.
     */
    public static double estimateZp(double magnitude, double flux) {
        return magnitude + POGSON * Math.log(flux);
    }

    /**
     * Relative smoothing parameter for a field with the given zeropoint and median flux
     * error: b = sqrt(POGSON) * flux_error / ref_flux.
     */
    public static double estimateB(double zeropoint, double fluxError) {
        return SQRT_POGSON * Math.exp(-zeropoint / POGSON) * fluxError;
    }
}
