package com.flagship.split_escrow.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the job runner and the expired-lease sweep.
 */
@Component
@ConditionalOnProperty(name = "jobs.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JobRunnerScheduler {

    private final JobRunner runner;
    private final JobQueueService queue;

    @Scheduled(fixedDelayString = "${jobs.runner.poll-interval-ms:500}")
    public void poll() {
        try {
            runner.pollAndDispatch();
        } catch (Exception e) {
            log.error("Error in job runner polling loop", e);
        }
    }

    @Scheduled(fixedDelayString = "${jobs.runner.reclaim-interval-ms:30000}")
    public void reclaim() {
        try {
            int reclaimed = queue.reclaimExpiredLeases();
            if (reclaimed > 0) {
                log.warn("Reclaimed {} jobs with expired leases", reclaimed);
            }
        } catch (Exception e) {
            log.error("Error reclaiming expired job leases", e);
        }
    }
}
