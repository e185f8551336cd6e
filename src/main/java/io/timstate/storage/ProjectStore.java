package io.timstate.storage;

import io.timstate.model.Project;
import io.timstate.model.ProjectDetails;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class ProjectStore {
    private static final String COLUMNS = "id,repository_id,remote_url,last_git_root,external_config_path,"
            + "external_tasks_dir,remote_label,highest_plan_id,created_at_ms,updated_at_ms";

    private final Database database;

    public ProjectStore(Database database) {
        this.database = database;
    }

    public Project getOrCreate(String repositoryId) {
        return getOrCreate(repositoryId, ProjectDetails.NONE);
    }

    /**
     * Returns the project for {@code repositoryId}, inserting it with {@code details} when absent.
     * A concurrent creator losing the race on the unique key re-reads the winner's row.
     */
    public Project getOrCreate(String repositoryId, ProjectDetails details) {
        String repoId = Sql.requireText(repositoryId, "repositoryId");
        ProjectDetails d = details == null ? ProjectDetails.NONE : details;
        return database.inTransaction("get or create project " + repoId, c -> {
            long now = System.currentTimeMillis();
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO project(repository_id,remote_url,last_git_root,external_config_path,
                                        external_tasks_dir,remote_label,highest_plan_id,created_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,0,?,?)
                    ON CONFLICT(repository_id) DO NOTHING
                    """)) {
                ps.setString(1, repoId);
                ps.setString(2, d.remoteUrl());
                ps.setString(3, d.lastGitRoot());
                ps.setString(4, d.externalConfigPath());
                ps.setString(5, d.externalTasksDir());
                ps.setString(6, d.remoteLabel());
                ps.setLong(7, now);
                ps.setLong(8, now);
                ps.executeUpdate();
            }
            return findByRepositoryId(c, repoId)
                    .orElseThrow(() -> new StorageException("Project vanished after insert: " + repoId));
        });
    }

    public Optional<Project> get(String repositoryId) {
        if (repositoryId == null || repositoryId.isBlank()) {
            return Optional.empty();
        }
        return database.read("get project", c -> findByRepositoryId(c, repositoryId.trim()));
    }

    public Optional<Project> getById(long projectId) {
        return database.read("get project by id", c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM project WHERE id=?")) {
                ps.setLong(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<Project> list() {
        return database.read("list projects", c -> {
            List<Project> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM project ORDER BY id");
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        });
    }

    /**
     * Writes the non-null fields of {@code details} and bumps {@code updated_at_ms}.
     *
     * @return false when no project has that id
     */
    public boolean update(long projectId, ProjectDetails details) {
        List<String> sets = new ArrayList<>();
        List<String> values = new ArrayList<>();
        if (details != null) {
            addIfPresent(sets, values, "remote_url", details.remoteUrl());
            addIfPresent(sets, values, "last_git_root", details.lastGitRoot());
            addIfPresent(sets, values, "external_config_path", details.externalConfigPath());
            addIfPresent(sets, values, "external_tasks_dir", details.externalTasksDir());
            addIfPresent(sets, values, "remote_label", details.remoteLabel());
        }
        sets.add("updated_at_ms=?");
        String sql = "UPDATE project SET " + String.join(",", sets) + " WHERE id=?";
        return database.inTransaction("update project " + projectId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                for (String value : values) {
                    ps.setString(i++, value);
                }
                ps.setLong(i++, System.currentTimeMillis());
                ps.setLong(i, projectId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Reserves {@code count} consecutive plan ids for a repository, creating the project if needed.
     *
     * <p>The new high-water mark is computed by one UPDATE evaluated under the write lock:
     * {@code max(highest_plan_id, localMaxObserved) + count}. Concurrent callers in other processes
     * queue on the lock and can never receive overlapping ranges.
     */
    public PlanIdRange reserveNextPlanId(String repositoryId, long localMaxObserved, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got " + count);
        }
        long localMax = Math.max(0L, localMaxObserved);
        return database.inTransaction("reserve plan id", c -> {
            Project project = getOrCreate(repositoryId);
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE project SET highest_plan_id=max(highest_plan_id,?)+?,updated_at_ms=? WHERE id=?")) {
                ps.setLong(1, localMax);
                ps.setLong(2, count);
                ps.setLong(3, System.currentTimeMillis());
                ps.setLong(4, project.id());
                ps.executeUpdate();
            }
            long last = highestPlanId(c, project.id());
            return new PlanIdRange(last - count + 1, last);
        });
    }

    public PlanIdRange reserveNextPlanId(String repositoryId, long localMaxObserved) {
        return reserveNextPlanId(repositoryId, localMaxObserved, 1);
    }

    /** Raises the high-water mark to at least {@code value}; never lowers it. */
    public void raiseHighestPlanId(long projectId, long value) {
        database.inTransaction("raise highest plan id", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE project SET highest_plan_id=max(highest_plan_id,?),updated_at_ms=? WHERE id=?")) {
                ps.setLong(1, value);
                ps.setLong(2, System.currentTimeMillis());
                ps.setLong(3, projectId);
                return ps.executeUpdate();
            }
        });
    }

    private static long highestPlanId(Connection c, long projectId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT highest_plan_id FROM project WHERE id=?")) {
            ps.setLong(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new StorageException("Project not found: id=" + projectId);
                }
                return rs.getLong(1);
            }
        }
    }

    private static Optional<Project> findByRepositoryId(Connection c, String repositoryId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM project WHERE repository_id=?")) {
            ps.setString(1, repositoryId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static void addIfPresent(List<String> sets, List<String> values, String column, String value) {
        if (value != null) {
            sets.add(column + "=?");
            values.add(value);
        }
    }

    private static Project map(ResultSet rs) throws SQLException {
        return new Project(
                rs.getLong("id"),
                rs.getString("repository_id"),
                rs.getString("remote_url"),
                rs.getString("last_git_root"),
                rs.getString("external_config_path"),
                rs.getString("external_tasks_dir"),
                rs.getString("remote_label"),
                rs.getLong("highest_plan_id"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    public record PlanIdRange(long first, long last) {
        public long count() {
            return last - first + 1;
        }
    }
}
