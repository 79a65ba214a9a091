package com.tpgsweep.orchestrator.model;

import com.tpgsweep.orchestrator.sweep.SweepDefinition;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One launched sweep: its definition, its units and where its table went.
 *
 * Held in memory only. The aggregated table and the resume list on disk are
 * the durable record of a sweep's outcome.
 */
public class SweepRun {

    private final UUID                 id = UUID.randomUUID();
    private final SweepDefinition      definition;
    private final Path                 root;
    private final List<ExperimentUnit> units;
    private final Instant              createdAt = Instant.now();

    private volatile SweepState state = SweepState.RUNNING;
    private volatile Path       resultsFile;
    private volatile Instant    finishedAt;

    public SweepRun(SweepDefinition definition, Path root, List<ExperimentUnit> units) {
        this.definition = definition;
        this.root       = root;
        this.units      = List.copyOf(units);
    }

    public UUID                 getId()          { return id; }
    public SweepDefinition      getDefinition()  { return definition; }
    public Path                 getRoot()        { return root; }
    public List<ExperimentUnit> getUnits()       { return units; }
    public Instant              getCreatedAt()   { return createdAt; }
    public SweepState           getState()       { return state; }
    public Path                 getResultsFile() { return resultsFile; }
    public Instant              getFinishedAt()  { return finishedAt; }

    public synchronized void setState(SweepState state) {
        this.state = state;
        if (state == SweepState.DONE || state == SweepState.CANCELLED || state == SweepState.FAILED) {
            this.finishedAt = Instant.now();
        }
    }

    /** Move to {@code next} only if the run is still in {@code expected}. */
    public synchronized boolean transition(SweepState expected, SweepState next) {
        if (state != expected) {
            return false;
        }
        setState(next);
        return true;
    }

    /** RUNNING and AGGREGATING runs can be cancelled; a finished run keeps its state. */
    public synchronized boolean cancel() {
        if (!isActive()) {
            return false;
        }
        setState(SweepState.CANCELLED);
        return true;
    }

    public boolean isActive() {
        SweepState current = state;
        return current == SweepState.RUNNING || current == SweepState.AGGREGATING;
    }

    public void setResultsFile(Path resultsFile) { this.resultsFile = resultsFile; }

    public boolean isCancelled() { return state == SweepState.CANCELLED; }

    public long countIn(UnitState unitState) {
        return units.stream().filter(u -> u.getState() == unitState).count();
    }
}
