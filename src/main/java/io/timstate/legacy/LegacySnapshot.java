package io.timstate.legacy;

import java.util.List;
import java.util.Map;

/**
 * Parsed content of the JSON files the tool kept before the database existed. Timestamps are
 * converted to epoch milliseconds; everything else mirrors the old file shapes.
 */
public record LegacySnapshot(Map<String, Repository> repositories, Map<String, WorkspaceEntry> workspaces) {
    /** Files found for one repository id; any of the three may be absent. */
    public record Repository(AssignmentsFile assignments, PermissionsFile permissions, RepositoryMetadata metadata) {
        Repository withMetadata(RepositoryMetadata value) {
            return new Repository(assignments, permissions, value);
        }
    }

    /** {@code shared/<repositoryId>/assignments.json}. Version counters are not carried over. */
    public record AssignmentsFile(
            String repositoryId,
            String repositoryRemoteUrl,
            Long highestPlanId,
            Map<String, AssignmentEntry> assignments
    ) {
    }

    public record AssignmentEntry(
            Long planId,
            List<String> workspacePaths,
            Map<String, String> workspaceOwners,
            List<String> users,
            String status,
            long assignedAtMs,
            long updatedAtMs
    ) {
    }

    /** {@code shared/<repositoryId>/permissions.json}. */
    public record PermissionsFile(String repositoryId, List<String> allow, List<String> deny) {
    }

    /** One value of the global {@code workspaces.json} map. */
    public record WorkspaceEntry(
            String workspacePath,
            String taskId,
            String repositoryId,
            String originalPlanFilePath,
            String branch,
            String name,
            String description,
            String planId,
            String planTitle,
            List<String> issueUrls,
            Long createdAtMs,
            Long updatedAtMs
    ) {
    }

    /** {@code repositories/<repositoryId>/metadata.json}. */
    public record RepositoryMetadata(
            String repositoryName,
            String remoteLabel,
            String lastGitRoot,
            String externalConfigPath,
            String externalTasksDir
    ) {
    }
}
