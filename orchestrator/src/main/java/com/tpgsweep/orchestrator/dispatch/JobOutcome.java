package com.tpgsweep.orchestrator.dispatch;

import java.time.Duration;

/**
 * Terminal result of one scheduler job.
 *
 * @param jobId    scheduler job id
 * @param state    final scheduler state, e.g. COMPLETED, FAILED, TIMEOUT, CANCELLED
 * @param exitCode exit code of the containerised command
 * @param elapsed  time from submission to the terminal state
 */
public record JobOutcome(String jobId, String state, int exitCode, Duration elapsed) {

    public static final String COMPLETED = "COMPLETED";

    /** True only if the scheduler completed the job and the command exited 0. */
    public boolean success() {
        return COMPLETED.equals(state) && exitCode == 0;
    }

    public String describe() {
        return "job " + jobId + " ended " + state + " (exit " + exitCode + ")";
    }
}
