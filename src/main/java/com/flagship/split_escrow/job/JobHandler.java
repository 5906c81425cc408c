package com.flagship.split_escrow.job;

/**
 * Executes jobs of one registered type.
 *
 * Handlers must be idempotent: a job can run more than once when a lease
 * expires or a result report is lost. Throwing {@link NonRetryableJobException}
 * dead-letters the job at once; any other exception counts as a retryable attempt.
 */
public interface JobHandler {

    JobDefinition definition();

    /**
     * @return a short result description stored on the job
     */
    String handle(Job job) throws Exception;

    /**
     * Called once when the job is dead-lettered, whether its attempts ran out
     * or it failed permanently.
     */
    default void onDeadLetter(Job job, String lastError) {
    }
}
