package com.tpgsweep.orchestrator.dispatch;

import com.tpgsweep.orchestrator.TestFixtures;
import com.tpgsweep.orchestrator.layout.SweepLayout;
import com.tpgsweep.orchestrator.model.DataType;
import com.tpgsweep.orchestrator.model.ExperimentUnit;
import com.tpgsweep.orchestrator.model.ParameterTuple;
import com.tpgsweep.orchestrator.model.StopMode;
import com.tpgsweep.orchestrator.model.UnitState;
import com.tpgsweep.orchestrator.reconcile.InferenceConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobDispatcherTest {

    @Mock SchedulerClient scheduler;

    SimpleMeterRegistry meters;
    JobDispatcher       dispatcher;
    ExperimentUnit      unit;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        dispatcher = new JobDispatcher(scheduler,
                TestFixtures.properties(Path.of("/scratch/expe"), Path.of("/templates")),
                SweepLayout.standard(), meters);
        unit = new ExperimentUnit("instrType-int_seed-0", Path.of("/scratch/expe/instrType-int_seed-0"),
                new ParameterTuple(0, TestFixtures.instructionSet("A", true, false), DataType.INT));
    }

    /** Scheduler stub: reports submission and start, then returns the given outcome. */
    void schedulerReturns(String jobId, String state, int exitCode) {
        when(scheduler.run(any(), any())).thenAnswer(inv -> {
            SchedulerClient.JobListener listener = inv.getArgument(1);
            listener.onSubmitted(jobId);
            listener.onStarted(jobId);
            return new JobOutcome(jobId, state, exitCode, Duration.ofSeconds(5));
        });
    }

    // ------------------------------------------------------------------
    // Wall time
    // ------------------------------------------------------------------

    @Test
    void wallTime_timeMode_isTrainingTimePlusMargin() {
        assertThat(WallTimePolicy.training(StopMode.TIME, Duration.ofHours(2),
                Duration.ofMinutes(30), Duration.ofHours(48))).isEqualTo(Duration.ofMinutes(150));
    }

    @Test
    void wallTime_generationsMode_isFixedCeiling() {
        assertThat(WallTimePolicy.training(StopMode.GENERATIONS, Duration.ofHours(2),
                Duration.ofMinutes(30), Duration.ofHours(48))).isEqualTo(Duration.ofHours(48));
    }

    @Test
    void resourceSpec_slurmTime_roundsUpAndCarriesDays() {
        assertThat(new ResourceSpec(1, 1, Duration.ofHours(48)).slurmTime()).isEqualTo("2-00:00:00");
        assertThat(new ResourceSpec(1, 1, Duration.ofMillis(1500)).slurmTime()).isEqualTo("0-00:00:02");
    }

    // ------------------------------------------------------------------
    // Requests
    // ------------------------------------------------------------------

    @Test
    void trainingRequest_bindsParamsAndOutLogsWithPolicyWallTime() {
        JobRequest req = dispatcher.trainingRequest(unit);

        assertThat(req.stage()).isEqualTo(JobStage.TRAIN);
        assertThat(req.resources().cpus()).isEqualTo(8);
        assertThat(req.resources().wallTime()).isEqualTo(Duration.ofMinutes(150));
        assertThat(req.bindMounts()).extracting(BindMount::toBindSpec).containsExactly(
                "/scratch/expe/instrType-int_seed-0/params:/params",
                "/scratch/expe/instrType-int_seed-0/outLogs:/outLogs");
        assertThat(req.workDir()).isEqualTo(unit.getWorkDir());
    }

    @Test
    void inferenceRequest_passesQuintupleWithUpperCaseType() {
        Path tpgDir = Path.of("/scratch/expe/training_results/instrType-float_seed-0");
        InferenceConfig config = new InferenceConfig("instrType-float_seed-0",
                "cv32e40px", "rv32imc_zicsr", "ilp32", "float", "/opt/tools/riscv");

        JobRequest req = dispatcher.inferenceRequest(tpgDir, config);

        assertThat(req.name()).isEqualTo("inference_cv32e40px_rv32imc_zicsr_ilp32_float");
        assertThat(req.command()).endsWith("cv32e40px", "rv32imc_zicsr", "ilp32", "FLOAT", "/opt/tools/riscv");
        assertThat(req.bindMounts()).extracting(BindMount::toBindSpec).contains(
                tpgDir.resolve("inference") + ":/inference",
                "/opt/simulators:" + JobDispatcher.SIMULATORS_MOUNT + ":ro");
    }

    // ------------------------------------------------------------------
    // runStage()
    // ------------------------------------------------------------------

    @Test
    void runStage_success_leavesUnitRunningForCaller() {
        schedulerReturns("100", "COMPLETED", 0);

        boolean ok = dispatcher.runStage(unit, JobStage.TRAIN);

        assertThat(ok).isTrue();
        assertThat(unit.getState()).isEqualTo(UnitState.RUNNING);
        assertThat(unit.getSchedulerJobId()).isEqualTo("100");
        assertThat(dispatcher.inFlightJobs()).isEmpty();
        assertThat(meters.counter("tpgsweep.dispatch.jobs", "stage", "train", "outcome", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void runStage_nonZeroExit_marksUnitFailed() {
        schedulerReturns("101", "FAILED", 1);

        boolean ok = dispatcher.runStage(unit, JobStage.CODEGEN);

        assertThat(ok).isFalse();
        assertThat(unit.getState()).isEqualTo(UnitState.FAILED);
        assertThat(unit.getFailureReason()).startsWith("codegen:").contains("exit 1");
        assertThat(meters.counter("tpgsweep.dispatch.jobs", "stage", "codegen", "outcome", "failed").count())
                .isEqualTo(1.0);
    }

    @Test
    void runStage_schedulerError_marksUnitFailed() {
        when(scheduler.run(any(), any())).thenThrow(new SchedulerException("sbatch could not be started"));

        assertThat(dispatcher.runStage(unit, JobStage.TRAIN)).isFalse();
        assertThat(unit.getState()).isEqualTo(UnitState.FAILED);
        assertThat(meters.counter("tpgsweep.dispatch.jobs", "stage", "train", "outcome", "error").count())
                .isEqualTo(1.0);
    }

    @Test
    void runStage_submitsTrainingRequest() {
        schedulerReturns("102", "COMPLETED", 0);

        dispatcher.runStage(unit, JobStage.TRAIN);

        ArgumentCaptor<JobRequest> captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(scheduler).run(captor.capture(), any());
        assertThat(captor.getValue().name()).isEqualTo("train_instrType-int_seed-0");
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancelAll_forwardsToInFlightJobsAndToleratesRefusal() throws Exception {
        java.util.concurrent.CountDownLatch submitted = new java.util.concurrent.CountDownLatch(1);
        java.util.concurrent.CountDownLatch release   = new java.util.concurrent.CountDownLatch(1);
        when(scheduler.run(any(), any())).thenAnswer(inv -> {
            SchedulerClient.JobListener listener = inv.getArgument(1);
            listener.onSubmitted("200");
            submitted.countDown();
            release.await();
            return new JobOutcome("200", "CANCELLED", 0, Duration.ZERO);
        });
        when(scheduler.cancel("200")).thenReturn(false);

        Thread worker = new Thread(() -> dispatcher.runStage(unit, JobStage.TRAIN));
        worker.start();
        submitted.await();

        assertThat(dispatcher.inFlightJobs()).containsKey("200");
        assertThat(dispatcher.cancelAll()).isZero();
        verify(scheduler).cancel("200");

        release.countDown();
        worker.join();
        assertThat(unit.getState()).isEqualTo(UnitState.FAILED);
        assertThat(dispatcher.inFlightJobs()).isEmpty();
    }
}
