package com.tpgsweep.orchestrator.dispatch;

import com.tpgsweep.orchestrator.config.SweepProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link SchedulerClient} for Slurm.
 *
 * Submission wraps the container call in {@code sbatch --wrap}:
 * <pre>
 *   sbatch --parsable --job-name=… --cpus-per-task=… --mem=…M --time=D-HH:MM:SS
 *          --chdir=&lt;workDir&gt; --output=&lt;workDir&gt;/slurm-%j.out
 *          --wrap="apptainer exec --bind host:/params … image command…"
 * </pre>
 * The job is then polled with {@code sacct} until it reaches a terminal
 * state. Time spent queued is not bounded here. Once the job is seen
 * RUNNING, the wait is bounded by the requested wall time plus one poll
 * interval and a minute of grace for accounting lag, the same clock Slurm
 * applies {@code --time} on.
 */
@Component
public class SlurmSchedulerClient implements SchedulerClient {

    private static final Logger log = LoggerFactory.getLogger(SlurmSchedulerClient.class);

    private static final Set<String> ACTIVE_STATES = Set.of(
            "PENDING", "CONFIGURING", "REQUEUED", "RESIZING", "SUSPENDED");
    private static final String RUNNING = "RUNNING";
    private static final Duration ACCOUNTING_GRACE = Duration.ofMinutes(1);

    private final SweepProperties.Scheduler settings;
    private final CommandRunner             runner;
    private final Clock                     clock;

    @Autowired
    public SlurmSchedulerClient(SweepProperties properties) {
        this(properties.scheduler(), CommandRunner.local(), Clock.systemUTC());
    }

    SlurmSchedulerClient(SweepProperties.Scheduler settings, CommandRunner runner) {
        this(settings, runner, Clock.systemUTC());
    }

    SlurmSchedulerClient(SweepProperties.Scheduler settings, CommandRunner runner, Clock clock) {
        this.settings = settings;
        this.runner   = runner;
        this.clock    = clock;
    }

    // ------------------------------------------------------------------
    // SchedulerClient
    // ------------------------------------------------------------------

    @Override
    public JobOutcome run(JobRequest request, JobListener listener) {
        Instant submittedAt = clock.instant();
        String jobId = submit(request);
        listener.onSubmitted(jobId);

        Duration ceiling = request.resources().wallTime()
                .plus(settings.pollInterval())
                .plus(ACCOUNTING_GRACE);
        Instant startedAt = null;
        try {
            while (true) {
                String[] status = query(jobId);
                String state = status[0];
                if (state.equals(RUNNING) && startedAt == null) {
                    startedAt = clock.instant();
                    listener.onStarted(jobId);
                } else if (!state.isEmpty() && !state.equals(RUNNING) && !ACTIVE_STATES.contains(state)) {
                    return new JobOutcome(jobId, state, parseExitCode(status[1]),
                            Duration.between(submittedAt, clock.instant()));
                }
                if (startedAt != null && Duration.between(startedAt, clock.instant()).compareTo(ceiling) > 0) {
                    cancel(jobId);
                    throw new SchedulerException("Job " + jobId + " still " + state
                            + " " + ceiling + " after it started, giving up on it");
                }
                Thread.sleep(settings.pollInterval().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerException("Interrupted while waiting for job " + jobId, e);
        }
    }

    @Override
    public boolean cancel(String jobId) {
        try {
            CommandRunner.Result result = runner.run(List.of(settings.scancel(), jobId));
            if (!result.ok()) {
                log.warn("scancel {} exited {}: {}", jobId, result.exitCode(), result.output().strip());
            }
            return result.ok();
        } catch (IOException e) {
            log.warn("Could not run scancel for job {}: {}", jobId, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while cancelling job {}", jobId);
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Command construction
    // ------------------------------------------------------------------

    List<String> sbatchCommand(JobRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(settings.sbatch());
        cmd.add("--parsable");
        cmd.add("--job-name=" + request.name());
        cmd.add("--cpus-per-task=" + request.resources().cpus());
        cmd.add("--mem=" + request.resources().memoryMb() + "M");
        cmd.add("--time=" + request.resources().slurmTime());
        cmd.add("--chdir=" + request.workDir().toAbsolutePath());
        cmd.add("--output=" + request.workDir().toAbsolutePath().resolve("slurm-%j.out"));
        if (settings.partition() != null && !settings.partition().isBlank()) {
            cmd.add("--partition=" + settings.partition());
        }
        cmd.add("--wrap=" + containerCommand(request));
        return cmd;
    }

    String containerCommand(JobRequest request) {
        List<String> parts = new ArrayList<>();
        parts.add(settings.apptainer());
        parts.add("exec");
        for (BindMount mount : request.bindMounts()) {
            parts.add("--bind");
            parts.add(mount.toBindSpec());
        }
        parts.add(request.image());
        parts.addAll(request.command());
        return parts.stream().map(SlurmSchedulerClient::shellQuote).collect(Collectors.joining(" "));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String submit(JobRequest request) {
        List<String> cmd = sbatchCommand(request);
        CommandRunner.Result result = exec(cmd, "sbatch for " + request.name());
        if (!result.ok()) {
            throw new SchedulerException("sbatch rejected " + request.name()
                    + " (exit " + result.exitCode() + "): " + result.output().strip());
        }
        // --parsable prints "<jobid>" or "<jobid>;<cluster>"
        String jobId = result.output().strip().lines()
                .reduce((first, second) -> second)
                .map(line -> line.split(";", 2)[0].strip())
                .orElse("");
        if (!jobId.matches("\\d+(_\\d+)?")) {
            throw new SchedulerException("Unexpected sbatch output for " + request.name()
                    + ": '" + result.output().strip() + "'");
        }
        log.info("Submitted {} as Slurm job {} (time={}, cpus={})",
                request.name(), jobId, request.resources().slurmTime(), request.resources().cpus());
        return jobId;
    }

    /** Returns {state, exitCode}; state is empty while sacct has no record yet. */
    private String[] query(String jobId) {
        CommandRunner.Result result = exec(
                List.of(settings.sacct(), "-j", jobId, "-n", "-X", "-P", "-o", "State,ExitCode"),
                "sacct for job " + jobId);
        if (!result.ok()) {
            throw new SchedulerException("sacct failed for job " + jobId + ": " + result.output().strip());
        }
        String line = result.output().strip().lines().findFirst().orElse("");
        if (line.isEmpty()) {
            return new String[] {"", ""};
        }
        String[] cols = line.split("\\|", -1);
        // "CANCELLED by 1234" → "CANCELLED"
        String state = cols[0].strip().split("\\s+", 2)[0];
        return new String[] {state, cols.length > 1 ? cols[1].strip() : ""};
    }

    private CommandRunner.Result exec(List<String> cmd, String opName) {
        try {
            return runner.run(cmd);
        } catch (IOException e) {
            throw new SchedulerException(opName + " could not be started", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchedulerException(opName + " interrupted", e);
        }
    }

    /** sacct ExitCode is "code:signal". */
    static int parseExitCode(String exitCode) {
        if (exitCode == null || exitCode.isBlank()) {
            return -1;
        }
        try {
            return Integer.parseInt(exitCode.split(":", 2)[0].strip());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    static String shellQuote(String s) {
        if (s.matches("[A-Za-z0-9_./:=@%+,-]+")) {
            return s;
        }
        return "'" + s.replace("'", "'\\''") + "'";
    }
}
