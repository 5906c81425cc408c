package com.flagship.split_escrow.project;

import com.flagship.split_escrow.exception.ErrorCode;
import com.flagship.split_escrow.exception.NotFoundException;
import com.flagship.split_escrow.exception.PermissionDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService implements ProjectAccess {

    private final ProjectRepository repository;

    @Transactional
    public ProjectEntity createProject(String name, UUID ownerId, Set<UUID> memberIds) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("Project owner is required");
        }
        ProjectEntity saved = repository.save(ProjectEntity.create(name, ownerId, memberIds));
        log.info("Created project: projectId={}, ownerId={}, members={}",
                saved.getId(), ownerId, saved.getMemberIds().size());
        return saved;
    }

    @Transactional
    public ProjectEntity addMember(UUID projectId, UUID actorId, UUID memberId) {
        ProjectEntity project = getProject(projectId);
        if (!project.isOwner(actorId)) {
            throw new PermissionDeniedException("Only the project owner can add members");
        }
        project.addMember(memberId);
        log.info("Added member {} to project {}", memberId, projectId);
        return project;
    }

    @Transactional(readOnly = true)
    public ProjectEntity getProject(UUID projectId) {
        return repository.findById(projectId)
                .orElseThrow(() -> new NotFoundException(ErrorCode.PROJECT_NOT_FOUND,
                        "Project not found: " + projectId));
    }

    @Override
    @Transactional(readOnly = true)
    public void requireOwner(UUID projectId, UUID actorId) {
        if (!getProject(projectId).isOwner(actorId)) {
            throw new PermissionDeniedException(
                    "Actor " + actorId + " is not the owner of project " + projectId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public void requireMember(UUID projectId, UUID actorId) {
        if (!getProject(projectId).isMember(actorId)) {
            throw new PermissionDeniedException(
                    "Actor " + actorId + " is not a member of project " + projectId);
        }
    }
}
