package com.hypmag.model;

/**
 * Column names of the persisted statistics table.
 */
public final class Keys {

    public static final String FILTER = "filter";
    public static final String FIELD = "field ID";
    public static final String ZEROPOINT = "zeropoint";
    public static final String FLUX_ERROR = "flux error";
    public static final String REF_FLUX = "ref. flux";
    public static final String B_RELATIVE = "b relative";
    public static final String B_ABSOLUTE = "b absolute";

    // order of the value columns in the table
    public static final String[] VALUE_COLUMNS = {ZEROPOINT, FLUX_ERROR, REF_FLUX, B_RELATIVE, B_ABSOLUTE};

    private Keys() {
    }
}
