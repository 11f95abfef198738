package com.hypmag.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalogue column names of one filter and the name of its output magnitude column.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterColumns {

    public static final String ERROR_SUFFIX = "_err";
    private static final String KIDS_PREFIX = "HMAG_";
    private static final String KIDS_ERROR_PREFIX = "HMAGERR_";

    @JsonProperty("outname")
    public final String outname;
    @JsonProperty("flux")
    public final String flux;
    @JsonProperty("error")
    public final String error;
    @JsonProperty("magnitude")
    public final String magnitude; // may be null when a fixed zeropoint is used

    @JsonCreator
    public FilterColumns(@JsonProperty("outname") String outname,
                         @JsonProperty("flux") String flux,
                         @JsonProperty("error") String error,
                         @JsonProperty("magnitude") String magnitude) {
        this.outname = outname;
        this.flux = flux;
        this.error = error;
        this.magnitude = magnitude;
    }

    /**
     * Name of the magnitude error column. KiDS catalogues name the error of
     * {@code HMAG_X} {@code HMAGERR_X}; everything else gets the {@code _err} suffix.
     */
    public String errorOutname() {
        return errorColumnName(outname);
    }

    public static String errorColumnName(String magnitudeColumn) {
        if (magnitudeColumn.startsWith(KIDS_PREFIX)) {
            return KIDS_ERROR_PREFIX + magnitudeColumn.substring(KIDS_PREFIX.length());
        }
        return magnitudeColumn + ERROR_SUFFIX;
    }

    @Override
    public String toString() {
        return "FilterColumns[outname=" + outname + ", flux=" + flux + ", error=" + error + ", magnitude=" + magnitude + "]";
    }
}
