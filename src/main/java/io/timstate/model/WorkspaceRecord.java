package io.timstate.model;

/**
 * Input for recording a workspace. {@code projectId} and {@code workspacePath} are required;
 * the remaining fields are optional and a {@code null} keeps whatever is already stored.
 */
public record WorkspaceRecord(
        long projectId,
        String workspacePath,
        String taskId,
        String originalPlanFilePath,
        String branch,
        String name,
        String description,
        String planId,
        String planTitle
) {
    public static WorkspaceRecord of(long projectId, String workspacePath) {
        return new WorkspaceRecord(projectId, workspacePath, null, null, null, null, null, null, null);
    }
}
