package com.tpgsweep.orchestrator.dispatch;

import com.tpgsweep.orchestrator.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SlurmSchedulerClient against a scripted command runner: no sbatch, no cluster.
 */
class SlurmSchedulerClientTest {

    ScriptedRunner       runner;
    SlurmSchedulerClient client;
    List<String>         events;

    @BeforeEach
    void setUp() {
        runner = new ScriptedRunner();
        client = new SlurmSchedulerClient(TestFixtures.scheduler(Duration.ZERO), runner);
        events = new ArrayList<>();
    }

    JobRequest request() {
        Path unit = Path.of("/scratch/expe/instrType-int_seed-0");
        return new JobRequest("train_unit", JobStage.TRAIN, "gegelati.sif",
                List.of("/armlearn-wrapper/build/Release/armlearn-wrapper"),
                new ResourceSpec(8, 4096, Duration.ofMinutes(150)),
                List.of(BindMount.readWrite(unit.resolve("params"), "/params"),
                        BindMount.readWrite(unit.resolve("outLogs"), "/outLogs")),
                unit);
    }

    SchedulerClient.JobListener recorder() {
        return new SchedulerClient.JobListener() {
            @Override public void onSubmitted(String jobId) { events.add("submitted " + jobId); }
            @Override public void onStarted(String jobId)   { events.add("started " + jobId); }
        };
    }

    // ------------------------------------------------------------------
    // run()
    // ------------------------------------------------------------------

    @Test
    void run_jobCompletes_reportsTransitionsAndOutcome() {
        runner.script("sbatch", 0, "1234\n");
        runner.script("sacct", 0, "");
        runner.script("sacct", 0, "PENDING|0:0\n");
        runner.script("sacct", 0, "RUNNING|0:0\n");
        runner.script("sacct", 0, "RUNNING|0:0\n");
        runner.script("sacct", 0, "COMPLETED|0:0\n");

        JobOutcome outcome = client.run(request(), recorder());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.jobId()).isEqualTo("1234");
        assertThat(events).containsExactly("submitted 1234", "started 1234");
    }

    @Test
    void run_nonZeroExit_isNotSuccess() {
        runner.script("sbatch", 0, "77;cluster\n");
        runner.script("sacct", 0, "FAILED|2:0\n");

        JobOutcome outcome = client.run(request(), recorder());

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.state()).isEqualTo("FAILED");
        assertThat(outcome.exitCode()).isEqualTo(2);
        assertThat(outcome.jobId()).isEqualTo("77");
    }

    @Test
    void run_cancelledByUser_stateIsNormalised() {
        runner.script("sbatch", 0, "5\n");
        runner.script("sacct", 0, "CANCELLED by 1000|0:15\n");

        JobOutcome outcome = client.run(request(), recorder());

        assertThat(outcome.state()).isEqualTo("CANCELLED");
        assertThat(outcome.success()).isFalse();
    }

    @Test
    void run_sbatchRejects_throwsWithoutNotifying() {
        runner.script("sbatch", 1, "sbatch: error: invalid partition\n");

        assertThatThrownBy(() -> client.run(request(), recorder()))
                .isInstanceOf(SchedulerException.class)
                .hasMessageContaining("invalid partition");
        assertThat(events).isEmpty();
    }

    @Test
    void run_unparsableJobId_throws() {
        runner.script("sbatch", 0, "Submitted batch job\n");

        assertThatThrownBy(() -> client.run(request(), recorder()))
                .isInstanceOf(SchedulerException.class)
                .hasMessageContaining("Unexpected sbatch output");
    }

    @Test
    void run_sacctFails_throws() {
        runner.script("sbatch", 0, "9\n");
        runner.script("sacct", 1, "slurmdbd unreachable\n");

        assertThatThrownBy(() -> client.run(request(), recorder()))
                .isInstanceOf(SchedulerException.class)
                .hasMessageContaining("sacct failed");
    }

    @Test
    void run_longQueueWait_doesNotCountAgainstWallTime() {
        SteppingClock clock = new SteppingClock();
        runner.advanceOnSacct(clock, Duration.ofSeconds(10));
        client = new SlurmSchedulerClient(TestFixtures.scheduler(Duration.ZERO), runner, clock);
        runner.script("sbatch", 0, "1\n");
        for (int i = 0; i < 30; i++) {
            runner.script("sacct", 0, "PENDING|0:0\n");
        }
        runner.script("sacct", 0, "RUNNING|0:0\n");
        runner.script("sacct", 0, "COMPLETED|0:0\n");

        JobOutcome outcome = client.run(shortRequest(Duration.ofSeconds(5)), recorder());

        assertThat(outcome.success()).isTrue();
        assertThat(events).containsExactly("submitted 1", "started 1");
        assertThat(runner.commands).noneMatch(cmd -> cmd.get(0).equals("scancel"));
    }

    @Test
    void run_runningPastWallTime_isCancelledAndThrows() {
        SteppingClock clock = new SteppingClock();
        runner.advanceOnSacct(clock, Duration.ofSeconds(10));
        client = new SlurmSchedulerClient(TestFixtures.scheduler(Duration.ZERO), runner, clock);
        runner.script("sbatch", 0, "2\n");
        runner.script("sacct", 0, "PENDING|0:0\n");
        runner.script("sacct", 0, "RUNNING|0:0\n");
        runner.script("scancel", 0, "");

        assertThatThrownBy(() -> client.run(shortRequest(Duration.ofSeconds(5)), recorder()))
                .isInstanceOf(SchedulerException.class)
                .hasMessageContaining("still RUNNING");
        assertThat(runner.commands).contains(List.of("scancel", "2"));
    }

    JobRequest shortRequest(Duration wallTime) {
        JobRequest base = request();
        return new JobRequest(base.name(), base.stage(), base.image(), base.command(),
                new ResourceSpec(1, 1024, wallTime), base.bindMounts(), base.workDir());
    }

    // ------------------------------------------------------------------
    // Command line
    // ------------------------------------------------------------------

    @Test
    void sbatchCommand_carriesResourcesAndWrappedContainerCall() {
        List<String> cmd = client.sbatchCommand(request());

        assertThat(cmd).startsWith("sbatch", "--parsable", "--job-name=train_unit");
        assertThat(cmd).contains("--cpus-per-task=8", "--mem=4096M", "--time=0-02:30:00",
                "--chdir=/scratch/expe/instrType-int_seed-0",
                "--output=/scratch/expe/instrType-int_seed-0/slurm-%j.out");
        assertThat(cmd).noneMatch(arg -> arg.startsWith("--partition"));
        assertThat(cmd.get(cmd.size() - 1)).isEqualTo("--wrap=apptainer exec"
                + " --bind /scratch/expe/instrType-int_seed-0/params:/params"
                + " --bind /scratch/expe/instrType-int_seed-0/outLogs:/outLogs"
                + " gegelati.sif /armlearn-wrapper/build/Release/armlearn-wrapper");
    }

    @Test
    void shellQuote_quotesOnlyWhenNeeded() {
        assertThat(SlurmSchedulerClient.shellQuote("/x-heep/sim.sh")).isEqualTo("/x-heep/sim.sh");
        assertThat(SlurmSchedulerClient.shellQuote("a b")).isEqualTo("'a b'");
        assertThat(SlurmSchedulerClient.shellQuote("it's")).isEqualTo("'it'\\''s'");
    }

    @Test
    void parseExitCode_handlesSignalSuffixAndGarbage() {
        assertThat(SlurmSchedulerClient.parseExitCode("0:0")).isZero();
        assertThat(SlurmSchedulerClient.parseExitCode("137:9")).isEqualTo(137);
        assertThat(SlurmSchedulerClient.parseExitCode("")).isEqualTo(-1);
        assertThat(SlurmSchedulerClient.parseExitCode("x")).isEqualTo(-1);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_scancelRefuses_returnsFalseWithoutThrowing() {
        runner.script("scancel", 1, "scancel: error: Invalid job id specified\n");

        assertThat(client.cancel("42")).isFalse();
        assertThat(runner.commands).containsExactly(List.of("scancel", "42"));
    }

    @Test
    void cancel_scancelAccepts_returnsTrue() {
        runner.script("scancel", 0, "");

        assertThat(client.cancel("42")).isTrue();
    }

    /** Returns canned results per program name, in order. */
    static class ScriptedRunner implements CommandRunner {

        final Map<String, Deque<Result>> scripts  = new HashMap<>();
        final List<List<String>>         commands = new ArrayList<>();
        SteppingClock                    clock;
        Duration                         step;

        /** Each sacct call moves {@code clock} forward by {@code step}. */
        void advanceOnSacct(SteppingClock clock, Duration step) {
            this.clock = clock;
            this.step  = step;
        }

        void script(String program, int exitCode, String output) {
            scripts.computeIfAbsent(program, k -> new ArrayDeque<>()).add(new Result(exitCode, output));
        }

        @Override
        public Result run(List<String> command) throws IOException {
            commands.add(command);
            if (clock != null && command.get(0).equals("sacct")) {
                clock.advance(step);
            }
            Deque<Result> queue = scripts.get(command.get(0));
            if (queue == null || queue.isEmpty()) {
                throw new IOException("no scripted result for " + command.get(0));
            }
            // the last scripted result repeats
            return queue.size() == 1 ? queue.peek() : queue.poll();
        }
    }

    /** Clock that only moves when told to. */
    static class SteppingClock extends Clock {

        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override public ZoneId getZone()                { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone)     { return this; }
        @Override public Instant instant()               { return now; }
    }
}
