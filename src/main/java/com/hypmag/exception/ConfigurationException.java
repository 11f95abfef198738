package com.hypmag.exception;

/**
 * Invalid or incomplete configuration, or a malformed statistics file.
 */
public class ConfigurationException extends HyperbolicException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Neither a magnitude column nor a fixed zeropoint is available for a filter.
     */
    public static ConfigurationException noZeropointSource(String filter) {
        return new ConfigurationException(String.format(
                "filter '%s': a magnitude column is required unless a fixed zeropoint is given", filter));
    }
}
