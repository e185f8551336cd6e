package io.timstate.storage;

import io.timstate.model.Assignment;
import io.timstate.model.AssignmentView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Which workspace and user currently claim a plan. Only current state is kept: a released claim
 * is a deleted row.
 */
public final class AssignmentStore {
    public static final String CLAIMED_STATUS = "in_progress";
    private static final long DAY_MS = 24L * 60L * 60L * 1_000L;
    private static final String COLUMNS = "id,project_id,plan_uuid,plan_id,workspace_id,claimed_by_user,status,"
            + "assigned_at_ms,updated_at_ms";
    private static final String VIEW_SELECT = """
            SELECT a.plan_uuid,a.plan_id,a.claimed_by_user,a.status,a.assigned_at_ms,a.updated_at_ms,
                   w.workspace_path
            FROM assignment a
            LEFT JOIN workspace w ON w.id=a.workspace_id
            """;

    private final Database database;

    public AssignmentStore(Database database) {
        this.database = database;
    }

    /**
     * Claims a plan for a workspace and/or user. An existing claim is overwritten (its status is
     * kept); a new one starts as {@value #CLAIMED_STATUS}. At least one of {@code workspaceId} and
     * {@code user} is required; use {@link #release} to drop both sides.
     */
    public ClaimResult claim(long projectId, String planUuid, Long planId, Long workspaceId, String user) {
        String uuid = Sql.requireText(planUuid, "planUuid");
        String claimant = user == null || user.isBlank() ? null : user.trim();
        if (workspaceId == null && claimant == null) {
            throw new IllegalArgumentException("claim needs a workspace or a user, plan_uuid=" + uuid);
        }
        return database.inTransaction("claim assignment " + uuid, c -> {
            Optional<Assignment> existing = find(c, projectId, uuid);
            long now = System.currentTimeMillis();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO assignment(project_id,plan_uuid,plan_id,workspace_id,claimed_by_user,status,
                                           assigned_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,?,?)
                    ON CONFLICT(project_id,plan_uuid) DO UPDATE SET
                        plan_id=excluded.plan_id,
                        workspace_id=excluded.workspace_id,
                        claimed_by_user=excluded.claimed_by_user,
                        updated_at_ms=excluded.updated_at_ms
                    """)) {
                ps.setLong(1, projectId);
                ps.setString(2, uuid);
                Sql.setNullableLong(ps, 3, planId);
                Sql.setNullableLong(ps, 4, workspaceId);
                ps.setString(5, claimant);
                ps.setString(6, CLAIMED_STATUS);
                ps.setLong(7, now);
                ps.setLong(8, now);
                ps.executeUpdate();
            }
            Assignment assignment = find(c, projectId, uuid)
                    .orElseThrow(() -> new StorageException("Failed to claim assignment for project_id="
                            + projectId + ", plan_uuid=" + uuid));
            boolean created = existing.isEmpty();
            return new ClaimResult(
                    assignment,
                    created,
                    !created && !Objects.equals(existing.get().workspaceId(), assignment.workspaceId()),
                    !created && !Objects.equals(existing.get().claimedByUser(), assignment.claimedByUser())
            );
        });
    }

    /**
     * Drops a claim, or part of one.
     *
     * <p>With neither {@code workspacePath} nor {@code user} the row is deleted. Otherwise the
     * workspace pointer is cleared when it matches {@code workspacePath}, and the user is cleared
     * when it matches {@code user} and the workspace side is gone (or was not asked about). A row
     * left with neither is deleted. A missing row is a no-op.
     */
    public ReleaseResult release(long projectId, String planUuid, String workspacePath, String user) {
        String uuid = Sql.requireText(planUuid, "planUuid");
        return database.inTransaction("release assignment " + uuid, c -> {
            Optional<Assignment> found = find(c, projectId, uuid);
            if (found.isEmpty()) {
                return ReleaseResult.NOT_FOUND;
            }
            Assignment existing = found.get();
            if (workspacePath == null && user == null) {
                delete(c, projectId, uuid);
                return new ReleaseResult(true, true, existing.workspaceId() != null, existing.claimedByUser() != null);
            }

            Long nextWorkspaceId = existing.workspaceId();
            boolean clearedWorkspace = false;
            if (workspacePath != null && existing.workspaceId() != null) {
                Long matched = workspaceIdByPath(c, workspacePath);
                if (existing.workspaceId().equals(matched)) {
                    nextWorkspaceId = null;
                    clearedWorkspace = true;
                }
            }

            String nextUser = existing.claimedByUser();
            boolean clearedUser = false;
            boolean canClearUser = workspacePath == null || clearedWorkspace || existing.workspaceId() == null;
            if (canClearUser && user != null && user.equals(existing.claimedByUser())) {
                nextUser = null;
                clearedUser = true;
            }

            if (!clearedWorkspace && !clearedUser) {
                return new ReleaseResult(true, false, false, false);
            }
            if (nextWorkspaceId == null && nextUser == null) {
                delete(c, projectId, uuid);
                return new ReleaseResult(true, true, clearedWorkspace, clearedUser);
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE assignment SET workspace_id=?,claimed_by_user=?,updated_at_ms=? "
                            + "WHERE project_id=? AND plan_uuid=?")) {
                Sql.setNullableLong(ps, 1, nextWorkspaceId);
                ps.setString(2, nextUser);
                ps.setLong(3, System.currentTimeMillis());
                ps.setLong(4, projectId);
                ps.setString(5, uuid);
                ps.executeUpdate();
            }
            return new ReleaseResult(true, false, clearedWorkspace, clearedUser);
        });
    }

    public ReleaseResult release(long projectId, String planUuid) {
        return release(projectId, planUuid, null, null);
    }

    public Optional<Assignment> get(long projectId, String planUuid) {
        return database.read("get assignment", c -> find(c, projectId, planUuid));
    }

    public List<Assignment> listByProject(long projectId) {
        return database.read("list assignments", c -> {
            List<Assignment> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM assignment WHERE project_id=? ORDER BY assigned_at_ms,id")) {
                ps.setLong(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    public Optional<AssignmentView> getEntry(long projectId, String planUuid) {
        return database.read("get assignment entry", c -> {
            try (PreparedStatement ps = c.prepareStatement(VIEW_SELECT + "WHERE a.project_id=? AND a.plan_uuid=?")) {
                ps.setLong(1, projectId);
                ps.setString(2, planUuid);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapView(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<AssignmentView> listEntriesByProject(long projectId) {
        return database.read("list assignment entries", c -> {
            List<AssignmentView> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    VIEW_SELECT + "WHERE a.project_id=? ORDER BY a.assigned_at_ms,a.id")) {
                ps.setLong(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapView(rs));
                    }
                }
            }
            return out;
        });
    }

    public boolean remove(long projectId, String planUuid) {
        return database.inTransaction("remove assignment", c -> delete(c, projectId, planUuid));
    }

    /**
     * Deletes assignments of a project not updated within the last {@code staleDays} whole days.
     *
     * @return number of rows deleted
     */
    public int cleanStale(long projectId, double staleDays) {
        if (!Double.isFinite(staleDays) || staleDays < 0) {
            throw new IllegalArgumentException("staleDays must be a non-negative number, received: " + staleDays);
        }
        long cutoff = System.currentTimeMillis() - (long) Math.floor(staleDays) * DAY_MS;
        return database.inTransaction("clean stale assignments", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM assignment WHERE project_id=? AND updated_at_ms<?")) {
                ps.setLong(1, projectId);
                ps.setLong(2, cutoff);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Inserts an assignment with explicit status and timestamps, leaving an existing row for the
     * same plan untouched.
     *
     * @return true when a row was inserted
     */
    public boolean importAssignment(long projectId, String planUuid, Long planId, Long workspaceId, String user,
                                    String status, long assignedAtMs, long updatedAtMs) {
        String uuid = Sql.requireText(planUuid, "planUuid");
        return database.inTransaction("import assignment " + uuid, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO assignment(project_id,plan_uuid,plan_id,workspace_id,claimed_by_user,status,
                                           assigned_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,?,?)
                    ON CONFLICT(project_id,plan_uuid) DO NOTHING
                    """)) {
                ps.setLong(1, projectId);
                ps.setString(2, uuid);
                Sql.setNullableLong(ps, 3, planId);
                Sql.setNullableLong(ps, 4, workspaceId);
                ps.setString(5, user);
                ps.setString(6, status);
                ps.setLong(7, assignedAtMs);
                ps.setLong(8, updatedAtMs);
                return ps.executeUpdate() > 0;
            }
        });
    }

    private static boolean delete(Connection c, long projectId, String planUuid) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM assignment WHERE project_id=? AND plan_uuid=?")) {
            ps.setLong(1, projectId);
            ps.setString(2, planUuid);
            return ps.executeUpdate() > 0;
        }
    }

    private static Long workspaceIdByPath(Connection c, String workspacePath) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT id FROM workspace WHERE workspace_path=?")) {
            ps.setString(1, workspacePath);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    private static Optional<Assignment> find(Connection c, long projectId, String planUuid) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM assignment WHERE project_id=? AND plan_uuid=?")) {
            ps.setLong(1, projectId);
            ps.setString(2, planUuid);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static Assignment map(ResultSet rs) throws SQLException {
        return new Assignment(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("plan_uuid"),
                Sql.getNullableLong(rs, "plan_id"),
                Sql.getNullableLong(rs, "workspace_id"),
                rs.getString("claimed_by_user"),
                rs.getString("status"),
                rs.getLong("assigned_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static AssignmentView mapView(ResultSet rs) throws SQLException {
        return new AssignmentView(
                rs.getString("plan_uuid"),
                Sql.getNullableLong(rs, "plan_id"),
                rs.getString("workspace_path"),
                rs.getString("claimed_by_user"),
                rs.getString("status"),
                rs.getLong("assigned_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record ClaimResult(Assignment assignment, boolean created, boolean updatedWorkspace, boolean updatedUser) {}
    public record ReleaseResult(boolean existed, boolean removed, boolean clearedWorkspace, boolean clearedUser) {
        public static final ReleaseResult NOT_FOUND = new ReleaseResult(false, false, false, false);
    }
}
