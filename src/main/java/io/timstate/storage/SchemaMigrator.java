package io.timstate.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies ordered schema scripts and records the result in the one-row {@code schema_version}
 * table.
 *
 * <p>All pending migrations run inside a single immediate transaction, so a concurrent process
 * opening the same file either waits and then sees the new version, or applies them itself;
 * never both. Any failing script rolls the whole run back.
 */
public final class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    static final List<Migration> MIGRATIONS = List.of(
            new Migration(1, "Base schema: projects, workspaces, locks, permissions, assignments", """
                    CREATE TABLE project (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        repository_id TEXT NOT NULL UNIQUE,
                        remote_url TEXT,
                        last_git_root TEXT,
                        external_config_path TEXT,
                        external_tasks_dir TEXT,
                        remote_label TEXT,
                        highest_plan_id INTEGER NOT NULL DEFAULT 0,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    );
                    CREATE TABLE workspace (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL REFERENCES project(id) ON DELETE CASCADE,
                        task_id TEXT,
                        workspace_path TEXT NOT NULL UNIQUE,
                        original_plan_file_path TEXT,
                        branch TEXT,
                        name TEXT,
                        description TEXT,
                        plan_id TEXT,
                        plan_title TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    );
                    CREATE TABLE workspace_issue (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        workspace_id INTEGER NOT NULL REFERENCES workspace(id) ON DELETE CASCADE,
                        issue_url TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(workspace_id, issue_url)
                    );
                    CREATE TABLE workspace_lock (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        workspace_id INTEGER NOT NULL UNIQUE REFERENCES workspace(id) ON DELETE CASCADE,
                        lock_type TEXT NOT NULL CHECK (lock_type IN ('persistent', 'pid')),
                        pid INTEGER,
                        started_at_ms INTEGER NOT NULL,
                        hostname TEXT NOT NULL,
                        command TEXT NOT NULL
                    );
                    CREATE TABLE permission (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL REFERENCES project(id) ON DELETE CASCADE,
                        type TEXT NOT NULL CHECK (type IN ('allow', 'deny')),
                        pattern TEXT NOT NULL,
                        UNIQUE(project_id, type, pattern)
                    );
                    CREATE TABLE assignment (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_id INTEGER NOT NULL REFERENCES project(id) ON DELETE CASCADE,
                        plan_uuid TEXT NOT NULL,
                        plan_id INTEGER,
                        workspace_id INTEGER REFERENCES workspace(id) ON DELETE SET NULL,
                        claimed_by_user TEXT,
                        status TEXT,
                        assigned_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        UNIQUE(project_id, plan_uuid)
                    )
                    """),
            new Migration(2, "Lookup indexes for workspace, lock, permission and assignment queries", """
                    CREATE INDEX IF NOT EXISTS idx_workspace_project ON workspace(project_id);
                    CREATE INDEX IF NOT EXISTS idx_workspace_task ON workspace(task_id);
                    CREATE INDEX IF NOT EXISTS idx_workspace_lock_pid ON workspace_lock(pid);
                    CREATE INDEX IF NOT EXISTS idx_permission_project ON permission(project_id, type);
                    CREATE INDEX IF NOT EXISTS idx_assignment_workspace ON assignment(workspace_id);
                    CREATE INDEX IF NOT EXISTS idx_assignment_project_updated ON assignment(project_id, updated_at_ms)
                    """)
    );

    private final List<Migration> migrations;

    public SchemaMigrator() {
        this(MIGRATIONS);
    }

    SchemaMigrator(List<Migration> migrations) {
        int previous = 0;
        for (Migration migration : migrations) {
            if (migration.version() <= previous) {
                throw new IllegalArgumentException("Migrations must be strictly ordered, got version "
                        + migration.version() + " after " + previous);
            }
            previous = migration.version();
        }
        this.migrations = List.copyOf(migrations);
    }

    public int latestVersion() {
        return migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).version();
    }

    /**
     * Brings the schema up to {@link #latestVersion()}.
     *
     * @return number of migrations applied by this call
     */
    public int migrate(Connection conn) {
        int current = 0;
        int applied = 0;
        Migration running = null;
        try {
            conn.setAutoCommit(false);
            try {
                ensureVersionTable(conn);
                current = currentVersion(conn);
                for (Migration migration : migrations) {
                    if (migration.version() <= current) {
                        continue;
                    }
                    running = migration;
                    try (Statement st = conn.createStatement()) {
                        for (String sql : migration.statements()) {
                            st.execute(sql);
                        }
                    }
                    setVersion(conn, migration.version());
                    applied++;
                }
                conn.setAutoCommit(true);
            } catch (SQLException | RuntimeException e) {
                if (!conn.getAutoCommit()) {
                    conn.rollback();
                    conn.setAutoCommit(true);
                }
                throw e;
            }
        } catch (SQLException e) {
            int failed = running == null ? current : running.version();
            log.error("Schema migration to version {} failed, rolled back to version {}", failed, current, e);
            throw new MigrationFailedException(failed,
                    "Failed to migrate schema to version " + failed
                            + (running == null ? "" : " (" + running.description() + ")"), e);
        }
        if (applied > 0) {
            log.info("Applied {} schema migration(s), schema now at version {}", applied, latestVersion());
        }
        return applied;
    }

    static void ensureVersionTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_version (
                        id INTEGER PRIMARY KEY CHECK (id = 1),
                        version INTEGER NOT NULL,
                        import_completed INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("INSERT OR IGNORE INTO schema_version(id,version,import_completed) VALUES(1,0,0)");
        }
    }

    static int currentVersion(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version FROM schema_version WHERE id=1")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void setVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE schema_version SET version=? WHERE id=1")) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    record Migration(int version, String description, String script) {
        List<String> statements() {
            List<String> out = new ArrayList<>();
            for (String part : script.split(";")) {
                String sql = part.trim();
                if (!sql.isEmpty()) {
                    out.add(sql);
                }
            }
            return out;
        }
    }
}
