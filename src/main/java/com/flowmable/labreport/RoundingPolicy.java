package com.flowmable.labreport;

/**
 * When rounding happens relative to differencing. The two orders are not numerically equivalent.
 */
public enum RoundingPolicy {
    /** Difference full-precision averages, then round the delta. Averages are rounded only for output. */
    FINAL_VALUES,
    /** Round each average to the display precision first, then difference and round the delta. */
    AVERAGES_FIRST
}
