package com.tracescope.domain;

/**
 * Adjustments a caller may ask to have applied to fetched traces.
 */
public enum Adjust {
    NOTHING,
    TIME_SKEW
}
