package com.foodtrace.types.common;

/**
 * Global constants shared across the traceability modules.
 */
public class Constants {

    /** Separator used inside run codes. */
    public final static String SPLIT = "-";

    /** Run code prefix, followed by date, site and a daily sequence. */
    public final static String RUN_CODE_PREFIX = "RUN";

    /** Site used when {@code trace.run.site-code} is not configured. */
    public final static String DEFAULT_SITE_CODE = "DUNA";

    /** Minimum trimmed length of QC notes for HOLD and FAIL decisions. */
    public final static int QC_NOTES_MIN_LENGTH = 10;

    public final static int QC_NOTES_MAX_LENGTH = 1000;

    /** Upper bound of a genealogy traversal when nothing is configured. */
    public final static int DEFAULT_GENEALOGY_MAX_DEPTH = 10;

    public final static double LOT_WEIGHT_MIN_KG = 0D;
    public final static double LOT_WEIGHT_MAX_KG = 10000D;
    public final static double LOT_TEMPERATURE_MIN_C = -50D;
    public final static double LOT_TEMPERATURE_MAX_C = 100D;

}
