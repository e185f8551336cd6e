package io.timstate.model;

/**
 * Assignment joined with the path of its workspace, the shape callers print when listing
 * claims.
 */
public record AssignmentView(
        String planUuid,
        Long planId,
        String workspacePath,
        String claimedByUser,
        String status,
        long assignedAtMs,
        long updatedAtMs
) {
}
