package io.timstate.model;

public record Workspace(
        long id,
        long projectId,
        String taskId,
        String workspacePath,
        String originalPlanFilePath,
        String branch,
        String name,
        String description,
        String planId,
        String planTitle,
        long createdAtMs,
        long updatedAtMs
) {
}
