package com.flagship.split_escrow.project;

import com.flagship.split_escrow.project.dto.AddMemberRequest;
import com.flagship.split_escrow.project.dto.CreateProjectRequest;
import com.flagship.split_escrow.project.dto.ProjectResponse;
import com.flagship.split_escrow.project.dto.ReplaceSplitsRequest;
import com.flagship.split_escrow.project.dto.SplitSetResponse;
import com.flagship.split_escrow.split.RevenueSplit;
import com.flagship.split_escrow.split.RevenueSplitService;
import com.flagship.split_escrow.split.dto.SplitEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Project and split-agreement management.
 *
 * The caller's identity arrives in the {@code X-Actor-Id} header, set by the
 * upstream gateway after authentication.
 */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
@Slf4j
public class ProjectController {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    private final ProjectService projectService;
    private final RevenueSplitService splitService;

    @PostMapping
    public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody CreateProjectRequest request) {
        ProjectEntity project = projectService.createProject(
                request.getName(), request.getOwnerId(), request.getMemberIds());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID projectId) {
        return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(projectId)));
    }

    @PostMapping("/{projectId}/members")
    public ResponseEntity<ProjectResponse> addMember(@PathVariable UUID projectId,
                                                     @RequestHeader(ACTOR_HEADER) UUID actorId,
                                                     @Valid @RequestBody AddMemberRequest request) {
        ProjectEntity project = projectService.addMember(projectId, actorId, request.getMemberId());
        return ResponseEntity.ok(ProjectResponse.from(project));
    }

    @PutMapping("/{projectId}/splits")
    public ResponseEntity<SplitSetResponse> replaceSplits(@PathVariable UUID projectId,
                                                          @RequestHeader(ACTOR_HEADER) UUID actorId,
                                                          @Valid @RequestBody ReplaceSplitsRequest request) {
        List<RevenueSplit> splits = request.getSplits().stream().map(SplitEntryRequest::toDomain).toList();
        log.info("Replacing splits: projectId={}, actorId={}, entries={}", projectId, actorId, splits.size());
        return ResponseEntity.ok(SplitSetResponse.from(projectId, splitService.replaceSplits(projectId, actorId, splits)));
    }

    @GetMapping("/{projectId}/splits")
    public ResponseEntity<SplitSetResponse> getSplits(@PathVariable UUID projectId) {
        return ResponseEntity.ok(SplitSetResponse.from(projectId, splitService.activeSplits(projectId)));
    }
}
