package com.tpgsweep.orchestrator.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One materialized, schedulable work item for exactly one parameter tuple.
 *
 * The id and work directory are fixed at creation. Only the state (and the
 * bookkeeping that goes with it) changes, driven by dispatch outcomes.
 * Workers of different units never share an instance, but the API reads
 * units concurrently, so mutable fields are volatile.
 */
public class ExperimentUnit {

    private final String         id;
    private final Path           workDir;
    private final ParameterTuple tuple;

    private volatile UnitState state = UnitState.CREATED;

    // Job id of the stage currently held by the scheduler, null otherwise.
    private volatile String  schedulerJobId;
    private volatile String  failureReason;
    private volatile Instant updatedAt = Instant.now();

    public ExperimentUnit(String id, Path workDir, ParameterTuple tuple) {
        this.id      = Objects.requireNonNull(id, "id cannot be null");
        this.workDir = Objects.requireNonNull(workDir, "workDir cannot be null");
        this.tuple   = Objects.requireNonNull(tuple, "tuple cannot be null");
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String         getId()             { return id; }
    public Path           getWorkDir()        { return workDir; }
    public ParameterTuple getTuple()          { return tuple; }
    public UnitState      getState()          { return state; }
    public String         getSchedulerJobId() { return schedulerJobId; }
    public String         getFailureReason()  { return failureReason; }
    public Instant        getUpdatedAt()      { return updatedAt; }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markSubmitted(String jobId) {
        this.schedulerJobId = jobId;
        transition(UnitState.SUBMITTED);
    }

    public void markRunning() {
        transition(UnitState.RUNNING);
    }

    public void markCompleted() {
        this.schedulerJobId = null;
        transition(UnitState.COMPLETED);
    }

    public void markFailed(String reason) {
        this.schedulerJobId = null;
        this.failureReason  = reason;
        transition(UnitState.FAILED);
    }

    public boolean isFailed()    { return state == UnitState.FAILED; }
    public boolean isCompleted() { return state == UnitState.COMPLETED; }

    private void transition(UnitState next) {
        this.state     = next;
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "ExperimentUnit[" + id + ", " + state + "]";
    }
}
