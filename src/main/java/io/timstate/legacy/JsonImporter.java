package io.timstate.legacy;

import io.timstate.config.TimStateConfig;
import io.timstate.model.Project;
import io.timstate.model.Workspace;
import io.timstate.model.WorkspaceRecord;
import io.timstate.storage.AssignmentStore;
import io.timstate.storage.Database;
import io.timstate.storage.PermissionStore;
import io.timstate.storage.ProjectStore;
import io.timstate.storage.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.HashMap;
import java.util.Map;

/**
 * One-time migration of the legacy JSON state into the database.
 *
 * <p>Every write is idempotent, so running the import twice over the same files leaves the same
 * rows. The legacy files are only read.
 */
public final class JsonImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonImporter.class);

    private final Database database;
    private final ProjectStore projects;
    private final WorkspaceStore workspaces;
    private final PermissionStore permissions;
    private final AssignmentStore assignments;

    public JsonImporter(Database database) {
        this.database = database;
        this.projects = new ProjectStore(database);
        this.workspaces = new WorkspaceStore(database);
        this.permissions = new PermissionStore(database);
        this.assignments = new AssignmentStore(database);
    }

    /**
     * Imports once per database: skipped when the import flag is already set or any project row
     * exists. The check and the writes share one immediate transaction, so two processes opening
     * a fresh file do not both import.
     *
     * @return the summary, or {@link ImportSummary#SKIPPED} when nothing ran
     */
    public ImportSummary importIfNeeded(TimStateConfig config) {
        return database.inTransaction("import legacy state", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT import_completed,(SELECT COUNT(*) FROM project) FROM schema_version WHERE id=1");
                 ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getInt(1) == 1 || rs.getLong(2) > 0) {
                    log.debug("Legacy import already done or not needed");
                    return ImportSummary.SKIPPED;
                }
            }
            ImportSummary summary = importFromJsonFiles(config);
            database.markImportCompleted();
            if (summary.isEmpty()) {
                log.debug("No legacy state found under {}", config.configRoot());
            } else {
                log.info("Imported legacy state from {}: {} project(s), {} workspace(s), {} assignment(s)",
                        config.configRoot(), summary.projects(), summary.workspaces(), summary.assignments());
            }
            return summary;
        });
    }

    /** Reads and applies the legacy files without consulting the import flag. */
    public ImportSummary importFromJsonFiles(TimStateConfig config) {
        LegacySnapshot snapshot = new LegacyJsonReader(config).read();
        return apply(ImportPlanner.plan(snapshot));
    }

    ImportSummary apply(ImportPlan plan) {
        return database.inTransaction("apply legacy import", c -> {
            Map<String, Long> projectIds = new HashMap<>();
            Map<String, Long> workspaceIds = new HashMap<>();

            for (ImportPlan.ProjectImport project : plan.projects()) {
                Project row = projects.getOrCreate(project.repositoryId(), project.details());
                projectIds.put(project.repositoryId(), row.id());
            }

            for (ImportPlan.WorkspaceImport workspace : plan.workspaces()) {
                Workspace row = workspaces.record(new WorkspaceRecord(
                        projectIds.get(workspace.repositoryId()),
                        workspace.workspacePath(),
                        workspace.taskId(),
                        workspace.originalPlanFilePath(),
                        workspace.branch(),
                        workspace.name(),
                        workspace.description(),
                        workspace.planId(),
                        workspace.planTitle()
                ));
                workspaceIds.put(workspace.workspacePath(), row.id());
                if (!workspace.issueUrls().isEmpty()) {
                    workspaces.setIssues(row.id(), workspace.issueUrls());
                }
            }

            int imported = 0;
            int skipped = 0;
            for (ImportPlan.ProjectImport project : plan.projects()) {
                long projectId = projectIds.get(project.repositoryId());
                if (project.details() != null && !project.details().isEmpty()) {
                    projects.update(projectId, project.details());
                }
                if (project.permissions() != null) {
                    permissions.replaceAll(projectId, project.permissions());
                }
                if (project.highestPlanId() != null) {
                    projects.raiseHighestPlanId(projectId, project.highestPlanId());
                }
                for (ImportPlan.AssignmentImport assignment : project.assignments()) {
                    Long workspaceId = resolveWorkspaceId(workspaceIds, assignment.workspacePath());
                    if (workspaceId == null && assignment.claimedByUser() == null) {
                        log.warn("Skipping legacy assignment {}: workspace {} is unknown and no user claims it",
                                assignment.planUuid(), assignment.workspacePath());
                        skipped++;
                        continue;
                    }
                    if (assignments.importAssignment(
                            projectId,
                            assignment.planUuid(),
                            assignment.planId(),
                            workspaceId,
                            assignment.claimedByUser(),
                            assignment.status(),
                            assignment.assignedAtMs(),
                            assignment.updatedAtMs())) {
                        imported++;
                    }
                }
            }
            return new ImportSummary(plan.projects().size(), plan.workspaces().size(), imported, skipped);
        });
    }

    private Long resolveWorkspaceId(Map<String, Long> known, String workspacePath) {
        if (workspacePath == null) {
            return null;
        }
        Long id = known.get(workspacePath);
        if (id != null) {
            return id;
        }
        id = workspaces.getByPath(workspacePath).map(Workspace::id).orElse(null);
        if (id != null) {
            known.put(workspacePath, id);
        }
        return id;
    }

    /**
     * Counts from one import run. {@code assignments} only counts rows actually inserted;
     * {@code skippedAssignments} those dropped because nothing was left to point at.
     */
    public record ImportSummary(int projects, int workspaces, int assignments, int skippedAssignments) {
        public static final ImportSummary SKIPPED = new ImportSummary(0, 0, 0, 0);

        public boolean isEmpty() {
            return projects == 0 && workspaces == 0 && assignments == 0;
        }
    }
}
