package io.timstate.legacy;

import io.timstate.model.PermissionSet;
import io.timstate.model.ProjectDetails;

import java.util.List;

/** Rows the importer will write, in the order it writes them. Built by {@link ImportPlanner}. */
public record ImportPlan(List<ProjectImport> projects, List<WorkspaceImport> workspaces) {

    public int assignmentCount() {
        return projects.stream().mapToInt(project -> project.assignments().size()).sum();
    }

    /**
     * One project. {@code details} and {@code permissions} are null when no legacy file supplied
     * them, in which case the stored values are left alone.
     */
    public record ProjectImport(
            String repositoryId,
            ProjectDetails details,
            PermissionSet permissions,
            Long highestPlanId,
            List<AssignmentImport> assignments
    ) {
    }

    public record WorkspaceImport(
            String repositoryId,
            String workspacePath,
            String taskId,
            String originalPlanFilePath,
            String branch,
            String name,
            String description,
            String planId,
            String planTitle,
            List<String> issueUrls
    ) {
    }

    /** A collapsed assignment: at most one workspace path and one user. */
    public record AssignmentImport(
            String planUuid,
            Long planId,
            String workspacePath,
            String claimedByUser,
            String status,
            long assignedAtMs,
            long updatedAtMs
    ) {
    }
}
