package com.tpgsweep.orchestrator.model;

/**
 * Criterion the trainer uses to stop.
 */
public enum StopMode {
    /** Stop once {@code timeMaxTraining} seconds have elapsed. */
    TIME,
    /** Stop after {@code nbGenerations} generations. */
    GENERATIONS
}
