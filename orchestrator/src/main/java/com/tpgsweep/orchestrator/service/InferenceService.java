package com.tpgsweep.orchestrator.service;

import com.tpgsweep.orchestrator.aggregate.InferenceResultsAggregator;
import com.tpgsweep.orchestrator.config.SweepProperties;
import com.tpgsweep.orchestrator.dispatch.JobDispatcher;
import com.tpgsweep.orchestrator.materialize.ConfigDocuments;
import com.tpgsweep.orchestrator.reconcile.InferenceConfig;
import com.tpgsweep.orchestrator.reconcile.InferencePlanner;
import com.tpgsweep.orchestrator.reconcile.ReconciliationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Inference over trained TPGs: plan the simulator runs, find the ones still
 * missing and dispatch them, summarise the latencies.
 */
@Service
public class InferenceService {

    private static final Logger log = LoggerFactory.getLogger(InferenceService.class);

    private final InferencePlanner           planner;
    private final ReconciliationEngine       reconciler;
    private final InferenceResultsAggregator aggregator;
    private final JobDispatcher              dispatcher;
    private final ConfigDocuments            documents;
    private final SweepProperties            props;
    private final ExecutorService            dispatchWorkers;

    public InferenceService(InferencePlanner planner,
                            ReconciliationEngine reconciler,
                            InferenceResultsAggregator aggregator,
                            JobDispatcher dispatcher,
                            ConfigDocuments documents,
                            SweepProperties props,
                            ExecutorService dispatchWorkers) {
        this.planner         = planner;
        this.reconciler      = reconciler;
        this.aggregator      = aggregator;
        this.dispatcher      = dispatcher;
        this.documents       = documents;
        this.props           = props;
        this.dispatchWorkers = dispatchWorkers;
    }

    /**
     * @param root sweep root; null means the configured one
     */
    public InferencePlanner.InferencePlan plan(Path root, int mini) {
        return planner.plan(rootOrDefault(root), mini);
    }

    /**
     * Outcome of a resume request.
     *
     * @param dispatch completes with the number of simulator jobs that exited 0;
     *                 already complete when nothing was dispatched
     */
    public record Resume(ReconciliationEngine.ResumePlan plan,
                         Path missingList,
                         CompletableFuture<Integer> dispatch) {}

    /**
     * Compute the missing inference runs, write them to the resume list and,
     * when asked, dispatch them.
     */
    public Resume resume(Path root, boolean dispatch) {
        Path base = rootOrDefault(root);
        ReconciliationEngine.ResumePlan plan = reconciler.reconcile(base);
        Path list = reconciler.writeMissingList(plan, base.resolve(props.inference().missingListFile()));

        if (!dispatch || plan.complete()) {
            return new Resume(plan, list, CompletableFuture.completedFuture(0));
        }
        return new Resume(plan, list, dispatchMissing(plan.missing()));
    }

    private CompletableFuture<Integer> dispatchMissing(List<Path> configs) {
        AtomicInteger succeeded = new AtomicInteger();
        List<CompletableFuture<Void>> jobs = new ArrayList<>();
        for (Path configFile : configs) {
            InferenceConfig config;
            try {
                config = documents.readValue(configFile, InferenceConfig.class);
            } catch (UncheckedIOException e) {
                log.warn("Skipping unreadable inference config {}: {}", configFile, e.getMessage());
                continue;
            }
            Path tpgDir = reconciler.owningTpgDir(configFile);
            jobs.add(CompletableFuture.runAsync(() -> {
                MDC.put(SweepService.MDC_UNIT, config.tpg());
                MDC.put(SweepService.MDC_STAGE, "inference");
                try {
                    if (dispatcher.runInference(tpgDir, config)) {
                        succeeded.incrementAndGet();
                    }
                } finally {
                    MDC.clear();
                }
            }, dispatchWorkers));
        }
        log.info("Dispatched {} missing inference runs", jobs.size());
        return CompletableFuture.allOf(jobs.toArray(CompletableFuture[]::new))
                .thenApply(v -> {
                    log.info("Resumed inference finished: {}/{} succeeded", succeeded.get(), jobs.size());
                    return succeeded.get();
                });
    }

    /**
     * @param outDir where the two CSV files go; null means the sweep root
     */
    public InferenceResultsAggregator.Summary aggregate(Path root, Path outDir) {
        Path base = rootOrDefault(root);
        return aggregator.aggregateTo(base, outDir != null ? outDir : base);
    }

    private Path rootOrDefault(Path root) {
        return root != null ? root : props.root();
    }
}
