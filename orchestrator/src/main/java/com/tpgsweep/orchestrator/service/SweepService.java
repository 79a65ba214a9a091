package com.tpgsweep.orchestrator.service;

import com.tpgsweep.orchestrator.aggregate.ResultTable;
import com.tpgsweep.orchestrator.aggregate.ResultsAggregator;
import com.tpgsweep.orchestrator.config.SweepProperties;
import com.tpgsweep.orchestrator.dispatch.JobDispatcher;
import com.tpgsweep.orchestrator.dispatch.JobStage;
import com.tpgsweep.orchestrator.materialize.ExperimentMaterializer;
import com.tpgsweep.orchestrator.materialize.MaterializationContext;
import com.tpgsweep.orchestrator.materialize.MaterializationException;
import com.tpgsweep.orchestrator.model.ExperimentUnit;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import com.tpgsweep.orchestrator.model.SweepRun;
import com.tpgsweep.orchestrator.model.SweepState;
import com.tpgsweep.orchestrator.model.UnitState;
import com.tpgsweep.orchestrator.patch.CodePatchEngine;
import com.tpgsweep.orchestrator.patch.PatchException;
import com.tpgsweep.orchestrator.patch.PatchReport;
import com.tpgsweep.orchestrator.sweep.ParameterSpaceExpander;
import com.tpgsweep.orchestrator.sweep.SweepDefinition;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Drives a sweep from definition to results table.
 *
 * Every unit runs its own chain on the dispatch pool:
 * materialize, train, generate code, patch. Units never wait on each other;
 * a failure stays with its unit. Aggregation starts once every chain has
 * ended, whatever its outcome.
 */
@Service
public class SweepService {

    private static final Logger log = LoggerFactory.getLogger(SweepService.class);

    static final String RESULTS_PREFIX = "results-";

    static final String MDC_SWEEP = "sweepId";
    static final String MDC_UNIT  = "unitId";
    static final String MDC_STAGE = "stage";

    private final ParameterSpaceExpander expander;
    private final ExperimentMaterializer materializer;
    private final JobDispatcher          dispatcher;
    private final CodePatchEngine        patchEngine;
    private final ResultsAggregator      aggregator;
    private final SweepProperties        props;
    private final ExecutorService        dispatchWorkers;

    private final Map<UUID, SweepRun> sweeps = new ConcurrentHashMap<>();

    public SweepService(ParameterSpaceExpander expander,
                        ExperimentMaterializer materializer,
                        JobDispatcher dispatcher,
                        CodePatchEngine patchEngine,
                        ResultsAggregator aggregator,
                        SweepProperties props,
                        ExecutorService dispatchWorkers) {
        this.expander        = expander;
        this.materializer    = materializer;
        this.dispatcher      = dispatcher;
        this.patchEngine     = patchEngine;
        this.aggregator      = aggregator;
        this.props           = props;
        this.dispatchWorkers = dispatchWorkers;
    }

    // ------------------------------------------------------------------
    // Launch
    // ------------------------------------------------------------------

    /**
     * Register a sweep and start its units in the background.
     *
     * @throws MaterializationException if the trainer template is missing
     *                                  (nothing is started)
     * @throws IllegalArgumentException if two points of the sweep map to one directory
     * @throws IllegalStateException    if a unit directory belongs to a sweep still in flight
     */
    public SweepRun launch(SweepDefinition definition) {
        SweepRun run = prepare(definition);
        execute(run);
        return run;
    }

    /**
     * Expand and plan a sweep without touching the scheduler.
     * Work directories are not created yet.
     */
    SweepRun prepare(SweepDefinition definition) {
        MaterializationContext ctx = context();
        materializer.checkTemplate(ctx);

        List<ParameterTuple> tuples = expander.expand(definition);
        List<ExperimentUnit> units = tuples.stream()
                .map(t -> materializer.plan(t, ctx))
                .toList();
        Set<String> ids = new HashSet<>();
        for (ExperimentUnit unit : units) {
            if (!ids.add(unit.getId())) {
                throw new IllegalArgumentException("Two sweep points share the experiment id " + unit.getId()
                        + "; instruction sets differing only by name are not distinct");
            }
        }

        SweepRun run = new SweepRun(definition, ctx.sweepRoot(), units);
        register(run, ids);
        log.info("Sweep {} planned: {} units under {}", run.getId(), units.size(), run.getRoot());
        return run;
    }

    /** A unit directory has one writer at a time. */
    private synchronized void register(SweepRun run, Set<String> ids) {
        for (SweepRun other : sweeps.values()) {
            if (!other.isActive() || !other.getRoot().equals(run.getRoot())) continue;
            List<String> shared = other.getUnits().stream()
                    .map(ExperimentUnit::getId)
                    .filter(ids::contains)
                    .toList();
            if (!shared.isEmpty()) {
                throw new IllegalStateException("Sweep " + other.getId() + " is still " + other.getState()
                        + " on " + shared.size() + " of these units, e.g. " + shared.get(0));
            }
        }
        sweeps.put(run.getId(), run);
    }

    /**
     * Start every unit chain and aggregate when all of them have ended.
     *
     * @return completes with the run once its table is written (or aggregation failed)
     */
    CompletableFuture<SweepRun> execute(SweepRun run) {
        MaterializationContext ctx = context();
        CompletableFuture<?>[] chains = run.getUnits().stream()
                .map(unit -> CompletableFuture.runAsync(() -> runUnit(run, unit, ctx), dispatchWorkers))
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(chains).handle((ignored, error) -> {
            if (error != null) {
                log.error("Sweep {}: a unit chain ended abnormally", run.getId(), error);
            }
            finish(run);
            return run;
        });
    }

    private void runUnit(SweepRun run, ExperimentUnit unit, MaterializationContext ctx) {
        MDC.put(MDC_SWEEP, run.getId().toString());
        MDC.put(MDC_UNIT, unit.getId());
        try {
            if (stopped(run, unit)) return;
            MDC.put(MDC_STAGE, "materialize");
            try {
                materializer.materialize(unit, ctx);
            } catch (MaterializationException e) {
                unit.markFailed("materialize: " + e.getMessage());
                log.warn("Unit {} FAILED at materialize: {}", unit.getId(), e.getMessage());
                return;
            }

            if (stopped(run, unit)) return;
            MDC.put(MDC_STAGE, JobStage.TRAIN.tag());
            if (!dispatcher.runStage(unit, JobStage.TRAIN)) return;

            if (stopped(run, unit)) return;
            MDC.put(MDC_STAGE, JobStage.CODEGEN.tag());
            if (!dispatcher.runStage(unit, JobStage.CODEGEN)) return;

            unit.markCompleted();
            log.info("Unit {} COMPLETED", unit.getId());

            MDC.put(MDC_STAGE, "patch");
            patch(unit);
        } catch (RuntimeException e) {
            unit.markFailed("unexpected: " + e.getMessage());
            log.error("Unit {} FAILED with an unexpected error", unit.getId(), e);
        } finally {
            MDC.clear();
        }
    }

    /** A patch failure is reported but does not undo the unit's training. */
    private void patch(ExperimentUnit unit) {
        try {
            PatchReport report = patchEngine.patch(unit.getWorkDir());
            log.info("Unit {} patched to {}: rewritten={}, missing={}",
                    unit.getId(), report.target(), report.appliedRules().keySet(), report.missing());
        } catch (PatchException e) {
            log.error("Patch step of unit {} failed: {}", unit.getId(), e.getMessage());
        }
    }

    private boolean stopped(SweepRun run, ExperimentUnit unit) {
        if (run.isCancelled()) {
            unit.markFailed("cancelled");
            return true;
        }
        return false;
    }

    private void finish(SweepRun run) {
        MDC.put(MDC_SWEEP, run.getId().toString());
        try {
            run.transition(SweepState.RUNNING, SweepState.AGGREGATING);
            Path csv = resultsFile(run);
            ResultTable table = aggregator.aggregateTo(run.getUnits(), csv);
            run.setResultsFile(csv);
            run.transition(SweepState.AGGREGATING, SweepState.DONE);
            log.info("Sweep {} {}: {} completed, {} failed, {} result rows",
                    run.getId(), run.getState(), run.countIn(UnitState.COMPLETED),
                    run.countIn(UnitState.FAILED), table.size());
        } catch (RuntimeException e) {
            run.setState(SweepState.FAILED);
            log.error("Sweep {} aggregation failed", run.getId(), e);
        } finally {
            MDC.clear();
        }
    }

    /** Each sweep writes its own table next to the unit directories. */
    static Path resultsFile(SweepRun run) {
        return run.getRoot().resolve(RESULTS_PREFIX + run.getId() + ".csv");
    }

    // ------------------------------------------------------------------
    // Queries and cancellation
    // ------------------------------------------------------------------

    public Optional<SweepRun> findById(UUID id) {
        return Optional.ofNullable(sweeps.get(id));
    }

    public Collection<SweepRun> all() {
        return List.copyOf(sweeps.values());
    }

    /**
     * Stop submitting stages for the sweep and ask the scheduler to stop its
     * running jobs. Jobs the scheduler refuses to stop run to completion.
     * A sweep that has already finished is left as it is.
     */
    public Optional<CancelResult> cancel(UUID id) {
        SweepRun run = sweeps.get(id);
        if (run == null) {
            return Optional.empty();
        }
        if (!run.cancel()) {
            log.info("Sweep {} already {}, nothing to cancel", id, run.getState());
            return Optional.of(new CancelResult(run.getState(), false, 0));
        }
        int accepted = 0;
        for (ExperimentUnit unit : run.getUnits()) {
            UnitState state = unit.getState();
            if ((state == UnitState.SUBMITTED || state == UnitState.RUNNING) && unit.getSchedulerJobId() != null
                    && dispatcher.cancel(unit.getSchedulerJobId())) {
                accepted++;
            }
        }
        log.info("Sweep {} CANCELLED, {} job(s) asked to stop", id, accepted);
        return Optional.of(new CancelResult(SweepState.CANCELLED, true, accepted));
    }

    /** Orchestrator shutdown is a pipeline-level stop: every sweep is cancelled. */
    @PreDestroy
    void cancelAll() {
        sweeps.values().forEach(SweepRun::cancel);
        int accepted = dispatcher.cancelAll();
        if (accepted > 0) {
            log.info("Shutdown: cancel requested for {} in-flight job(s)", accepted);
        }
    }

    @Scheduled(fixedDelayString = "${tpgsweep.progress-interval:PT1M}")
    public void reportProgress() {
        for (SweepRun run : sweeps.values()) {
            if (run.getState() != SweepState.RUNNING) continue;
            log.info("Sweep {} progress: created={} submitted={} running={} completed={} failed={}",
                    run.getId(),
                    run.countIn(UnitState.CREATED), run.countIn(UnitState.SUBMITTED),
                    run.countIn(UnitState.RUNNING), run.countIn(UnitState.COMPLETED),
                    run.countIn(UnitState.FAILED));
        }
    }

    MaterializationContext context() {
        SweepProperties.Training training = props.training();
        return new MaterializationContext(
                props.root(),
                props.templateDir(),
                training.cores(),
                training.time(),
                training.stopMode(),
                training.nbGenerations(),
                training.localParams());
    }
}
