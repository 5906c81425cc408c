package com.flagship.split_escrow.job;

import com.flagship.split_escrow.job.dto.EnqueueJobRequest;
import com.flagship.split_escrow.job.dto.JobResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operator surface for the job queue.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobQueueService jobQueueService;

    @PostMapping
    public ResponseEntity<JobResponse> enqueue(@Valid @RequestBody EnqueueJobRequest request) {
        UUID jobId = jobQueueService.enqueue(request.getType(), request.getPayload(),
                request.getPriority(), request.getRunAt(), request.getMaxAttempts());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(jobQueueService.getJob(jobId)));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobResponse> getJob(@PathVariable UUID jobId) {
        return ResponseEntity.ok(JobResponse.from(jobQueueService.getJob(jobId)));
    }

    @GetMapping("/dead-letter")
    public ResponseEntity<List<JobResponse>> deadLetters() {
        return ResponseEntity.ok(jobQueueService.deadLetters().stream().map(JobResponse::from).toList());
    }

    @PostMapping("/{jobId}/requeue")
    public ResponseEntity<JobResponse> requeue(@PathVariable UUID jobId) {
        log.info("Operator requeue requested: jobId={}", jobId);
        return ResponseEntity.ok(JobResponse.from(jobQueueService.requeueDeadLetter(jobId)));
    }
}
