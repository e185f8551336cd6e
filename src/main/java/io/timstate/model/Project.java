package io.timstate.model;

public record Project(
        long id,
        String repositoryId,
        String remoteUrl,
        String lastGitRoot,
        String externalConfigPath,
        String externalTasksDir,
        String remoteLabel,
        long highestPlanId,
        long createdAtMs,
        long updatedAtMs
) {
}
