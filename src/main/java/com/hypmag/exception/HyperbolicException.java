package com.hypmag.exception;

/**
 * Base unchecked exception for all errors raised while computing hyperbolic magnitudes.
 *
 * <p>Numeric domain problems (empty fields, logarithms of non-positive fluxes) are
 * never reported through this hierarchy; they propagate as NaN and are repaired or
 * flagged downstream.
 */
public class HyperbolicException extends RuntimeException {

    public HyperbolicException(String message) {
        super(message);
    }

    public HyperbolicException(String message, Throwable cause) {
        super(message, cause);
    }
}
