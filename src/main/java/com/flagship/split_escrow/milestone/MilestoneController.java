package com.flagship.split_escrow.milestone;

import com.flagship.split_escrow.common.CurrencyCode;
import com.flagship.split_escrow.milestone.dto.CreateMilestoneRequest;
import com.flagship.split_escrow.milestone.dto.MilestoneResponse;
import com.flagship.split_escrow.milestone.dto.TransitionRequest;
import com.flagship.split_escrow.project.ProjectController;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class MilestoneController {

    private final MilestoneStateMachine stateMachine;

    @PostMapping("/projects/{projectId}/milestones")
    public ResponseEntity<MilestoneResponse> createMilestone(@PathVariable UUID projectId,
                                                             @RequestHeader(ProjectController.ACTOR_HEADER) UUID actorId,
                                                             @Valid @RequestBody CreateMilestoneRequest request) {
        Milestone milestone = stateMachine.createMilestone(projectId, actorId, request.getTitle(),
                request.getAmount(), CurrencyCode.fromString(request.getCurrency()));
        return ResponseEntity.status(HttpStatus.CREATED).body(MilestoneResponse.from(milestone));
    }

    @GetMapping("/projects/{projectId}/milestones")
    public ResponseEntity<List<MilestoneResponse>> listMilestones(@PathVariable UUID projectId) {
        return ResponseEntity.ok(stateMachine.getMilestones(projectId).stream()
                .map(MilestoneResponse::from)
                .toList());
    }

    @GetMapping("/milestones/{milestoneId}")
    public ResponseEntity<MilestoneResponse> getMilestone(@PathVariable UUID milestoneId) {
        return ResponseEntity.ok(MilestoneResponse.from(stateMachine.getMilestone(milestoneId)));
    }

    @PostMapping("/milestones/{milestoneId}/complete")
    public ResponseEntity<MilestoneResponse> complete(@PathVariable UUID milestoneId,
                                                      @RequestHeader(ProjectController.ACTOR_HEADER) UUID actorId) {
        return ResponseEntity.ok(MilestoneResponse.from(stateMachine.complete(milestoneId, actorId)));
    }

    @PostMapping("/milestones/{milestoneId}/approve")
    public ResponseEntity<MilestoneResponse> approve(@PathVariable UUID milestoneId,
                                                     @RequestHeader(ProjectController.ACTOR_HEADER) UUID actorId) {
        ApprovalResult result = stateMachine.approve(milestoneId, actorId);
        log.info("Milestone approved: milestoneId={}, escrowId={}, batchId={}",
                milestoneId, result.getEscrow().getId(), result.getPayoutBatch().getId());
        return ResponseEntity.ok(MilestoneResponse.from(result));
    }

    @PostMapping("/milestones/{milestoneId}/dispute")
    public ResponseEntity<MilestoneResponse> dispute(@PathVariable UUID milestoneId,
                                                     @RequestHeader(ProjectController.ACTOR_HEADER) UUID actorId,
                                                     @RequestBody(required = false) TransitionRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(MilestoneResponse.from(stateMachine.dispute(milestoneId, actorId, reason)));
    }

    @PostMapping("/milestones/{milestoneId}/reject")
    public ResponseEntity<MilestoneResponse> reject(@PathVariable UUID milestoneId,
                                                    @RequestHeader(ProjectController.ACTOR_HEADER) UUID actorId,
                                                    @RequestBody(required = false) TransitionRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(MilestoneResponse.from(stateMachine.reject(milestoneId, actorId, reason)));
    }
}
