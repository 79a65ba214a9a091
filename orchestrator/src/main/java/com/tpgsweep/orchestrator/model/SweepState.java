package com.tpgsweep.orchestrator.model;

/**
 * States of a whole sweep run.
 *
 *   RUNNING → AGGREGATING → DONE
 *   RUNNING → CANCELLED   (termination requested)
 *   any     → FAILED      (structural failure, e.g. results table not writable)
 */
public enum SweepState {
    RUNNING,
    AGGREGATING,
    DONE,
    CANCELLED,
    FAILED
}
