package com.tpgsweep.orchestrator.dispatch;

/**
 * Contract with the external batch scheduler.
 *
 * Queuing, placement and parallelism belong to the scheduler. This side only
 * hands over a complete {@link JobRequest} and waits for its outcome.
 */
public interface SchedulerClient {

    /** Progress notifications for one job. */
    interface JobListener {
        /** The scheduler accepted the job and assigned it an id. */
        void onSubmitted(String jobId);

        /** The job left the queue and started. */
        default void onStarted(String jobId) {}
    }

    /**
     * Submit the request and block until the job reaches a terminal state.
     *
     * @return the outcome; a non-zero exit is reported, not thrown
     * @throws SchedulerException if submission fails, the scheduler cannot be
     *         queried, or the wait exceeds the job's wall-time ceiling
     */
    JobOutcome run(JobRequest request, JobListener listener);

    /**
     * Ask the scheduler to stop a job. Best effort: the job may already be
     * gone, and the scheduler may not honour the request.
     *
     * @return true if the scheduler accepted the request
     */
    boolean cancel(String jobId);
}
