package com.tpgsweep.orchestrator.dispatch;

/**
 * Thrown when the batch scheduler rejects a job, cannot be reached, or a job
 * outlives its wall-time ceiling.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
