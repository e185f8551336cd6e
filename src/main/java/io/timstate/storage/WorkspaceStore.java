package io.timstate.storage;

import io.timstate.model.Workspace;
import io.timstate.model.WorkspacePatch;
import io.timstate.model.WorkspaceRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

public final class WorkspaceStore {
    private static final String COLUMNS = "id,project_id,task_id,workspace_path,original_plan_file_path,branch,"
            + "name,description,plan_id,plan_title,created_at_ms,updated_at_ms";

    private final Database database;

    public WorkspaceStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts or updates the workspace at {@code record.workspacePath()}. Null optional fields keep
     * the stored values. The owning project must already exist.
     *
     * @throws ConstraintViolationException when {@code record.projectId()} names no project
     */
    public Workspace record(WorkspaceRecord record) {
        String path = Sql.requireText(record.workspacePath(), "workspacePath");
        return database.inTransaction("record workspace " + path, c -> {
            long now = System.currentTimeMillis();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO workspace(project_id,task_id,workspace_path,original_plan_file_path,branch,
                                          name,description,plan_id,plan_title,created_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,?,?,?,?,?)
                    ON CONFLICT(workspace_path) DO UPDATE SET
                        project_id=excluded.project_id,
                        task_id=COALESCE(excluded.task_id,workspace.task_id),
                        original_plan_file_path=COALESCE(excluded.original_plan_file_path,workspace.original_plan_file_path),
                        branch=COALESCE(excluded.branch,workspace.branch),
                        name=COALESCE(excluded.name,workspace.name),
                        description=COALESCE(excluded.description,workspace.description),
                        plan_id=COALESCE(excluded.plan_id,workspace.plan_id),
                        plan_title=COALESCE(excluded.plan_title,workspace.plan_title),
                        updated_at_ms=excluded.updated_at_ms
                    """)) {
                ps.setLong(1, record.projectId());
                ps.setString(2, record.taskId());
                ps.setString(3, path);
                ps.setString(4, record.originalPlanFilePath());
                ps.setString(5, record.branch());
                ps.setString(6, record.name());
                ps.setString(7, record.description());
                ps.setString(8, record.planId());
                ps.setString(9, record.planTitle());
                ps.setLong(10, now);
                ps.setLong(11, now);
                ps.executeUpdate();
            }
            return findOne(c, "workspace_path=?", path)
                    .orElseThrow(() -> new StorageException("Workspace vanished after upsert: " + path));
        });
    }

    public Optional<Workspace> getByPath(String workspacePath) {
        if (workspacePath == null || workspacePath.isBlank()) {
            return Optional.empty();
        }
        return database.read("get workspace by path", c -> findOne(c, "workspace_path=?", workspacePath.trim()));
    }

    public Optional<Workspace> getById(long workspaceId) {
        return database.read("get workspace by id", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM workspace WHERE id=?")) {
                ps.setLong(1, workspaceId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<Workspace> findByTaskId(String taskId) {
        return database.read("find workspaces by task", c -> findMany(c,
                "SELECT " + COLUMNS + " FROM workspace WHERE task_id=? ORDER BY id", taskId));
    }

    public List<Workspace> findByProjectId(long projectId) {
        return database.read("find workspaces by project", c -> findMany(c,
                "SELECT " + COLUMNS + " FROM workspace WHERE project_id=? ORDER BY id", projectId));
    }

    public List<Workspace> list() {
        return database.read("list workspaces", c -> findMany(c,
                "SELECT " + COLUMNS + " FROM workspace ORDER BY id"));
    }

    /**
     * Applies the non-null fields of {@code patch}.
     *
     * @return the updated row, or empty when no workspace is recorded at {@code workspacePath}
     */
    public Optional<Workspace> patch(String workspacePath, WorkspacePatch patch) {
        String path = Sql.requireText(workspacePath, "workspacePath");
        List<String> sets = new ArrayList<>();
        List<String> values = new ArrayList<>();
        if (patch != null) {
            addIfPresent(sets, values, "task_id", patch.taskId());
            addIfPresent(sets, values, "original_plan_file_path", patch.originalPlanFilePath());
            addIfPresent(sets, values, "branch", patch.branch());
            addIfPresent(sets, values, "name", patch.name());
            addIfPresent(sets, values, "description", patch.description());
            addIfPresent(sets, values, "plan_id", patch.planId());
            addIfPresent(sets, values, "plan_title", patch.planTitle());
        }
        sets.add("updated_at_ms=?");
        String sql = "UPDATE workspace SET " + String.join(",", sets) + " WHERE workspace_path=?";
        return database.inTransaction("patch workspace " + path, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (String value : values) {
                    ps.setString(i++, value);
                }
                ps.setLong(i++, System.currentTimeMillis());
                ps.setString(i, path);
                if (ps.executeUpdate() == 0) {
                    return Optional.empty();
                }
            }
            return findOne(c, "workspace_path=?", path);
        });
    }

    /**
     * Forgets a workspace. Issues and the lock go with it; assignments lose their workspace
     * pointer and are deleted when no claiming user remains either.
     */
    public boolean delete(String workspacePath) {
        String path = Sql.requireText(workspacePath, "workspacePath");
        return database.inTransaction("delete workspace " + path, c -> {
            Optional<Workspace> existing = findOne(c, "workspace_path=?", path);
            if (existing.isEmpty()) {
                return false;
            }
            long id = existing.get().id();
            try (PreparedStatement orphans = c.prepareStatement(
                    "DELETE FROM assignment WHERE workspace_id=? AND claimed_by_user IS NULL");
                 PreparedStatement detach = c.prepareStatement(
                         "UPDATE assignment SET workspace_id=NULL,updated_at_ms=? WHERE workspace_id=?");
                 PreparedStatement del = c.prepareStatement("DELETE FROM workspace WHERE id=?")) {
                orphans.setLong(1, id);
                orphans.executeUpdate();
                detach.setLong(1, System.currentTimeMillis());
                detach.setLong(2, id);
                detach.executeUpdate();
                del.setLong(1, id);
                return del.executeUpdate() > 0;
            }
        });
    }

    /** Replaces the workspace's issue list. Duplicates collapse, first occurrence order is kept. */
    public void setIssues(long workspaceId, List<String> issueUrls) {
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        if (issueUrls != null) {
            for (String url : issueUrls) {
                if (url != null && !url.isBlank()) {
                    urls.add(url.trim());
                }
            }
        }
        database.inTransaction("set workspace issues", c -> {
            try (PreparedStatement del = c.prepareStatement("DELETE FROM workspace_issue WHERE workspace_id=?")) {
                del.setLong(1, workspaceId);
                del.executeUpdate();
            }
            long now = System.currentTimeMillis();
            for (String url : urls) {
                insertIssue(c, workspaceId, url, now);
            }
            return urls.size();
        });
    }

    /** @return false when the URL was already attached */
    public boolean addIssue(long workspaceId, String issueUrl) {
        String url = Sql.requireText(issueUrl, "issueUrl");
        return database.inTransaction("add workspace issue",
                c -> insertIssue(c, workspaceId, url, System.currentTimeMillis()));
    }

    public List<String> getIssues(long workspaceId) {
        return database.read("get workspace issues", c -> {
            List<String> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT issue_url FROM workspace_issue WHERE workspace_id=? ORDER BY id")) {
                ps.setLong(1, workspaceId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(rs.getString(1));
                    }
                }
            }
            return out;
        });
    }

    private static boolean insertIssue(Connection c, long workspaceId, String url, long now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO workspace_issue(workspace_id,issue_url,created_at_ms) VALUES(?,?,?) "
                        + "ON CONFLICT(workspace_id,issue_url) DO NOTHING")) {
            ps.setLong(1, workspaceId);
            ps.setString(2, url);
            ps.setLong(3, now);
            return ps.executeUpdate() > 0;
        }
    }

    private static Optional<Workspace> findOne(Connection c, String where, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM workspace WHERE " + where)) {
            ps.setString(1, value);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static List<Workspace> findMany(Connection c, String sql, Object... params) throws SQLException {
        List<Workspace> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        }
        return out;
    }

    private static void addIfPresent(List<String> sets, List<String> values, String column, String value) {
        if (value != null) {
            sets.add(column + "=?");
            values.add(value);
        }
    }

    private static Workspace map(ResultSet rs) throws SQLException {
        return new Workspace(
                rs.getLong("id"),
                rs.getLong("project_id"),
                rs.getString("task_id"),
                rs.getString("workspace_path"),
                rs.getString("original_plan_file_path"),
                rs.getString("branch"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("plan_id"),
                rs.getString("plan_title"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
