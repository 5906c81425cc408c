package com.flagship.split_escrow.observability;

import com.flagship.split_escrow.job.JobQueueService;
import com.flagship.split_escrow.job.JobStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue depth per job status, cached like {@link OutboxMetrics}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobQueueMetrics {

    private final JobQueueService jobQueueService;
    private final MeterRegistry meterRegistry;

    private final Map<JobStatus, AtomicLong> counts = new EnumMap<>(JobStatus.class);

    @PostConstruct
    public void init() {
        for (JobStatus status : JobStatus.values()) {
            AtomicLong holder = new AtomicLong(0);
            counts.put(status, holder);
            Gauge.builder("jobs.queue.size", holder, AtomicLong::get)
                    .description("Number of jobs by status")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }
    }

    public void refreshMetrics() {
        try {
            for (JobStatus status : JobStatus.values()) {
                counts.get(status).set(jobQueueService.countByStatus(status));
            }
        } catch (Exception e) {
            log.warn("Failed to refresh job queue metrics: {}", e.getMessage());
        }
    }

    public long count(JobStatus status) {
        return counts.get(status).get();
    }
}
