package com.tpgsweep.orchestrator.model;

/**
 * Lifecycle of an experiment unit.
 *
 * Transitions:
 *   CREATED   → SUBMITTED (scheduler accepted the job)
 *   SUBMITTED → RUNNING   (job started)
 *   RUNNING   → COMPLETED (all stages exited 0)
 *   any       → FAILED    (materialization error, non-zero exit, scheduler error)
 *
 * Failed units are never retried automatically.
 */
public enum UnitState {
    CREATED,
    SUBMITTED,
    RUNNING,
    COMPLETED,
    FAILED
}
