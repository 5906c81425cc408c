package com.flagship.split_escrow.port;

import java.util.Map;
import java.util.UUID;

/**
 * Outbound port used by schedulers to hand work to the job runner.
 */
public interface JobQueuePort {

    /**
     * Validates and enqueues a job with the registered policy of its type.
     *
     * @return the id of the queued job
     * @throws com.flagship.split_escrow.exception.JobTypeNotFoundException if the type is not registered
     * @throws com.flagship.split_escrow.exception.SchemaValidationException if the payload is invalid
     */
    UUID enqueue(String jobType, Map<String, Object> payload);
}
