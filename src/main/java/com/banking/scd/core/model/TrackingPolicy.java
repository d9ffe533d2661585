package com.banking.scd.core.model;

/**
 * How changes to a dimension attribute are recorded.
 */
public enum TrackingPolicy {
    /**
     * Overwrite the current version in place. No history is kept.
     */
    TYPE1,

    /**
     * Close the current version and open a new one.
     */
    TYPE2
}
