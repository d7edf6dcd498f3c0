package com.labtrace.lims.common.quality;

/**
 * How a numeric result is compared with a specification's threshold.
 */
public enum OosComparator {
    /** result must be greater than or equal to the threshold */
    GTE,
    /** result must be less than or equal to the threshold */
    LTE,
    /** result must equal the threshold */
    EQUALS,
    /** result must lie within min/max; the threshold is not used */
    RANGE,
}
