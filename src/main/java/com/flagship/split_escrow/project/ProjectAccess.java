package com.flagship.split_escrow.project;

import java.util.UUID;

/**
 * Delegated membership checks used by the milestone state machine.
 *
 * Identity itself is established upstream; this only answers whether an
 * already-identified actor holds a role on a project.
 */
public interface ProjectAccess {

    /**
     * @throws com.flagship.split_escrow.exception.NotFoundException if the project does not exist
     * @throws com.flagship.split_escrow.exception.PermissionDeniedException if the actor is not the owner
     */
    void requireOwner(UUID projectId, UUID actorId);

    /**
     * @throws com.flagship.split_escrow.exception.NotFoundException if the project does not exist
     * @throws com.flagship.split_escrow.exception.PermissionDeniedException if the actor is not a member
     */
    void requireMember(UUID projectId, UUID actorId);
}
