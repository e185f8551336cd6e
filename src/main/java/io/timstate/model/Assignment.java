package io.timstate.model;

public record Assignment(
        long id,
        long projectId,
        String planUuid,
        Long planId,
        Long workspaceId,
        String claimedByUser,
        String status,
        long assignedAtMs,
        long updatedAtMs
) {
}
