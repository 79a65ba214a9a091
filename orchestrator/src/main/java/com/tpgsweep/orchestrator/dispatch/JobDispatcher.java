package com.tpgsweep.orchestrator.dispatch;

import com.tpgsweep.orchestrator.config.SweepProperties;
import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.model.ExperimentUnit;
import com.tpgsweep.orchestrator.reconcile.InferenceConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds scheduler requests for experiment units and runs them.
 *
 * <p>Bind contract for the trainer and the code generator:
 * <pre>
 *   &lt;unit&gt;/params  → /params    (configuration in)
 *   &lt;unit&gt;/outLogs → /outLogs   (artifacts out)
 * </pre>
 * The simulator additionally gets the TPG's {@code inference/} directory and
 * the simulator sources (read-only).
 *
 * <p>Every run is timed and counted:
 * <pre>
 *   tpgsweep.dispatch.jobs{stage, outcome="success|failed|error"}
 *   tpgsweep.dispatch.duration{stage}
 * </pre>
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    static final String PARAMS_MOUNT     = "/params";
    static final String OUT_LOGS_MOUNT   = "/outLogs";
    static final String INFERENCE_MOUNT  = "/inference";
    static final String SIMULATORS_MOUNT = "/x-heep/experimentations/microarchitectures/simulators";

    private final SchedulerClient           scheduler;
    private final SweepProperties.Training  training;
    private final SweepProperties.Scheduler settings;
    private final SweepLayout               layout;
    private final MeterRegistry             meterRegistry;

    // jobId → label of every job currently held by the scheduler
    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    public JobDispatcher(SchedulerClient scheduler,
                         SweepProperties properties,
                         SweepLayout layout,
                         MeterRegistry meterRegistry) {
        this.scheduler     = scheduler;
        this.training      = properties.training();
        this.settings      = properties.scheduler();
        this.layout        = layout;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Request construction
    // ------------------------------------------------------------------

    public JobRequest trainingRequest(ExperimentUnit unit) {
        ResourceSpec resources = new ResourceSpec(
                training.cores(),
                settings.memoryMb(),
                WallTimePolicy.training(training.stopMode(), training.time(),
                        settings.safetyMargin(), settings.generationCeiling()));
        return new JobRequest("train_" + unit.getId(), JobStage.TRAIN,
                settings.trainerImage(), settings.trainerCommand(),
                resources, unitMounts(unit.getWorkDir()), unit.getWorkDir());
    }

    public JobRequest codegenRequest(ExperimentUnit unit) {
        ResourceSpec resources = new ResourceSpec(1, settings.memoryMb(), settings.codegenWallTime());
        return new JobRequest("codegen_" + unit.getId(), JobStage.CODEGEN,
                settings.codegenImage(), settings.codegenCommand(),
                resources, unitMounts(unit.getWorkDir()), unit.getWorkDir());
    }

    /**
     * The simulator reads the TPG's params and generated code, and writes its
     * timing document into {@code inference/results}.
     */
    public JobRequest inferenceRequest(Path tpgDir, InferenceConfig config) {
        List<BindMount> mounts = new ArrayList<>(unitMounts(tpgDir));
        mounts.add(BindMount.readWrite(layout.inferenceDir(tpgDir), INFERENCE_MOUNT));
        if (settings.simulatorsDir() != null) {
            mounts.add(BindMount.readOnly(settings.simulatorsDir(), SIMULATORS_MOUNT));
        }
        List<String> command = new ArrayList<>(settings.simulatorCommand());
        command.add(config.uarch());
        command.add(config.isa());
        command.add(config.abi());
        command.add(config.dtype().toUpperCase(Locale.ROOT));
        command.add(config.compiler());

        ResourceSpec resources = new ResourceSpec(1, settings.memoryMb(), settings.inferenceWallTime());
        return new JobRequest("inference_" + config.fileStem(), JobStage.INFERENCE,
                settings.simulatorImage(), command, resources, mounts, tpgDir);
    }

    private List<BindMount> unitMounts(Path dir) {
        return List.of(
                BindMount.readWrite(layout.paramsDir(dir), PARAMS_MOUNT),
                BindMount.readWrite(layout.outLogsDir(dir), OUT_LOGS_MOUNT));
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Run one stage of a unit and block until the scheduler reports back.
     *
     * The unit moves to SUBMITTED when the scheduler assigns a job id and to
     * RUNNING when the job starts. A non-zero exit or a scheduler error marks
     * it FAILED; nothing it produced is used downstream. Completion of the
     * whole unit is left to the caller, which knows whether more stages follow.
     *
     * @return true if the stage exited 0
     */
    public boolean runStage(ExperimentUnit unit, JobStage stage) {
        JobRequest request = switch (stage) {
            case TRAIN     -> trainingRequest(unit);
            case CODEGEN   -> codegenRequest(unit);
            case INFERENCE -> throw new IllegalArgumentException(
                    "inference jobs belong to a TPG, not to an experiment unit");
        };
        String failure = execute(request, new SchedulerClient.JobListener() {
            @Override public void onSubmitted(String jobId) { unit.markSubmitted(jobId); }
            @Override public void onStarted(String jobId)   { unit.markRunning(); }
        });
        if (failure != null) {
            unit.markFailed(stage.tag() + ": " + failure);
            log.warn("Unit {} FAILED at {}: {}", unit.getId(), stage, failure);
            return false;
        }
        return true;
    }

    /**
     * Run one simulator job.
     *
     * @return true if the job exited 0
     */
    public boolean runInference(Path tpgDir, InferenceConfig config) {
        String failure = execute(inferenceRequest(tpgDir, config), jobId -> {});
        if (failure != null) {
            log.warn("Inference {} of {} FAILED: {}", config.fileStem(), config.tpg(), failure);
            return false;
        }
        return true;
    }

    /**
     * @return null on success, otherwise a one-line failure reason
     */
    private String execute(JobRequest request, SchedulerClient.JobListener listener) {
        String stageTag = request.stage().tag();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        String[] jobIdHolder = new String[1];
        try {
            JobOutcome result = scheduler.run(request, new SchedulerClient.JobListener() {
                @Override public void onSubmitted(String jobId) {
                    jobIdHolder[0] = jobId;
                    inFlight.put(jobId, request.name());
                    listener.onSubmitted(jobId);
                }
                @Override public void onStarted(String jobId) {
                    listener.onStarted(jobId);
                }
            });
            if (!result.success()) {
                outcome = "failed";
                return result.describe();
            }
            log.info("{} finished: {} in {}", request.name(), result.describe(), result.elapsed());
            return null;
        } catch (SchedulerException e) {
            outcome = "error";
            return e.getMessage();
        } finally {
            if (jobIdHolder[0] != null) {
                inFlight.remove(jobIdHolder[0]);
            }
            sample.stop(meterRegistry.timer("tpgsweep.dispatch.duration", "stage", stageTag));
            meterRegistry.counter("tpgsweep.dispatch.jobs", "stage", stageTag, "outcome", outcome).increment();
        }
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Forward a stop request for every job this dispatcher is waiting on.
     * Best effort: scheduler refusals are logged, never thrown.
     *
     * @return number of jobs the scheduler accepted a cancel request for
     */
    public int cancelAll() {
        int accepted = 0;
        for (Map.Entry<String, String> job : Map.copyOf(inFlight).entrySet()) {
            if (cancel(job.getKey())) {
                accepted++;
            }
        }
        return accepted;
    }

    public boolean cancel(String jobId) {
        boolean ok = scheduler.cancel(jobId);
        if (ok) {
            log.info("Cancel requested for job {} ({})", jobId, inFlight.getOrDefault(jobId, "unknown"));
        } else {
            log.warn("Scheduler did not accept cancel for job {}; it may keep running", jobId);
        }
        return ok;
    }

    public Map<String, String> inFlightJobs() {
        return Map.copyOf(inFlight);
    }
}
