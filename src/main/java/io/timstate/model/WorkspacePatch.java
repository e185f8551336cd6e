package io.timstate.model;

public record WorkspacePatch(
        String taskId,
        String originalPlanFilePath,
        String branch,
        String name,
        String description,
        String planId,
        String planTitle
) {
    public static WorkspacePatch branch(String branch) {
        return new WorkspacePatch(null, null, branch, null, null, null, null);
    }

    public static WorkspacePatch rename(String name, String description) {
        return new WorkspacePatch(null, null, null, name, description, null, null);
    }

    public static WorkspacePatch plan(String planId, String planTitle) {
        return new WorkspacePatch(null, null, null, null, null, planId, planTitle);
    }
}
