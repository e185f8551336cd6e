package io.timstate.legacy;

import io.timstate.model.PermissionSet;
import io.timstate.model.ProjectDetails;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link LegacySnapshot} to the rows of an {@link ImportPlan}. No I/O.
 *
 * <p>The legacy files allowed one plan to be claimed from several workspaces; the database keeps
 * one. Such claims collapse to the most recently updated workspace, and the other paths are
 * dropped.
 */
public final class ImportPlanner {
    private ImportPlanner() {
    }

    public static ImportPlan plan(LegacySnapshot snapshot) {
        Map<String, LegacySnapshot.WorkspaceEntry> workspaces = snapshot.workspaces();

        List<ImportPlan.WorkspaceImport> workspaceImports = new ArrayList<>();
        Map<String, Boolean> repositoryIds = new LinkedHashMap<>();
        for (Map.Entry<String, LegacySnapshot.WorkspaceEntry> entry : workspaces.entrySet()) {
            LegacySnapshot.WorkspaceEntry workspace = entry.getValue();
            if (workspace.repositoryId() == null) {
                continue;
            }
            repositoryIds.put(workspace.repositoryId(), Boolean.TRUE);
            workspaceImports.add(new ImportPlan.WorkspaceImport(
                    workspace.repositoryId(),
                    entry.getKey(),
                    workspace.taskId(),
                    workspace.originalPlanFilePath(),
                    workspace.branch(),
                    workspace.name(),
                    workspace.description(),
                    workspace.planId(),
                    workspace.planTitle(),
                    workspace.issueUrls()
            ));
        }
        snapshot.repositories().keySet().forEach(id -> repositoryIds.put(id, Boolean.TRUE));

        List<ImportPlan.ProjectImport> projects = new ArrayList<>();
        for (String repositoryId : repositoryIds.keySet()) {
            LegacySnapshot.Repository repository = snapshot.repositories().get(repositoryId);
            if (repository == null) {
                projects.add(new ImportPlan.ProjectImport(repositoryId, null, null, null, List.of()));
                continue;
            }
            projects.add(new ImportPlan.ProjectImport(
                    repositoryId,
                    details(repository),
                    permissions(repository.permissions()),
                    repository.assignments() == null ? null : repository.assignments().highestPlanId(),
                    assignments(repository.assignments(), workspaces)
            ));
        }
        return new ImportPlan(projects, workspaceImports);
    }

    private static ProjectDetails details(LegacySnapshot.Repository repository) {
        String remoteUrl = repository.assignments() == null ? null : repository.assignments().repositoryRemoteUrl();
        LegacySnapshot.RepositoryMetadata metadata = repository.metadata();
        if (metadata == null && remoteUrl == null) {
            return null;
        }
        if (metadata == null) {
            return new ProjectDetails(remoteUrl, null, null, null, null);
        }
        return new ProjectDetails(
                remoteUrl,
                metadata.lastGitRoot(),
                metadata.externalConfigPath(),
                metadata.externalTasksDir(),
                metadata.remoteLabel()
        );
    }

    private static PermissionSet permissions(LegacySnapshot.PermissionsFile file) {
        return file == null ? null : new PermissionSet(file.allow(), file.deny());
    }

    private static List<ImportPlan.AssignmentImport> assignments(
            LegacySnapshot.AssignmentsFile file,
            Map<String, LegacySnapshot.WorkspaceEntry> workspaces
    ) {
        if (file == null) {
            return List.of();
        }
        List<ImportPlan.AssignmentImport> out = new ArrayList<>();
        for (Map.Entry<String, LegacySnapshot.AssignmentEntry> entry : file.assignments().entrySet()) {
            LegacySnapshot.AssignmentEntry assignment = entry.getValue();
            String path = mostRecentWorkspacePath(assignment.workspacePaths(), workspaces);
            String owner = path == null ? null : assignment.workspaceOwners().get(path);
            if (owner == null && !assignment.users().isEmpty()) {
                owner = assignment.users().get(0);
            }
            if (path == null && owner == null) {
                continue;
            }
            out.add(new ImportPlan.AssignmentImport(
                    entry.getKey(),
                    assignment.planId(),
                    path,
                    owner,
                    assignment.status(),
                    assignment.assignedAtMs(),
                    assignment.updatedAtMs()
            ));
        }
        return out;
    }

    /**
     * Picks the path whose workspace was updated (else created) last. Paths with no known
     * timestamp lose to any that has one; with no timestamps at all the first path wins.
     */
    static String mostRecentWorkspacePath(List<String> paths, Map<String, LegacySnapshot.WorkspaceEntry> workspaces) {
        if (paths == null || paths.isEmpty()) {
            return null;
        }
        String best = null;
        long bestTimestamp = Long.MIN_VALUE;
        for (String path : paths) {
            Long timestamp = timestamp(workspaces.get(path));
            if (timestamp == null) {
                continue;
            }
            if (best == null || timestamp > bestTimestamp) {
                best = path;
                bestTimestamp = timestamp;
            }
        }
        return best != null ? best : paths.get(0);
    }

    private static Long timestamp(LegacySnapshot.WorkspaceEntry workspace) {
        if (workspace == null) {
            return null;
        }
        return workspace.updatedAtMs() != null ? workspace.updatedAtMs() : workspace.createdAtMs();
    }
}
