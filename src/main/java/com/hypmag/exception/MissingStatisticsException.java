package com.hypmag.exception;

/**
 * The statistics table has no entry for a requested filter or field.
 */
public class MissingStatisticsException extends HyperbolicException {

    public MissingStatisticsException(String message) {
        super(message);
    }

    public static MissingStatisticsException forFilter(String filter) {
        return new MissingStatisticsException(String.format("no statistics for filter '%s'", filter));
    }

    public static MissingStatisticsException forField(String filter, String field) {
        return new MissingStatisticsException(
                String.format("no statistics for field '%s' in filter '%s'", field, filter));
    }
}
