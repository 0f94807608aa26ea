package com.detox.datashift.model;

/**
 * Lifecycle of a single check.
 *
 * IDLE -> FETCHING -> AGGREGATING -> COMPARING -> DONE, with NO_DATA and ERROR
 * as the two failure exits. The phase goes back to IDLE once the result is published.
 */
public enum CheckPhase {
    IDLE,
    FETCHING,
    AGGREGATING,
    COMPARING,
    DONE,
    NO_DATA,
    ERROR
}
