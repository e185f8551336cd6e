package io.timstate.storage;

import io.timstate.config.TimStateConfig;
import io.timstate.legacy.JsonImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import java.util.Set;

/**
 * Handle on the shared state database file.
 *
 * <p>Every operation opens its own short-lived connection. Writes run in {@code BEGIN IMMEDIATE}
 * transactions so the write lock is taken up front and SQLite's busy timeout, not application
 * code, serializes concurrent processes. A transaction is bound to the calling thread while it
 * runs; store calls made from inside it join it instead of opening a second connection.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final Set<String> COUNTABLE_TABLES = Set.of(
            "project", "workspace", "workspace_issue", "workspace_lock", "permission", "assignment");

    private static final Object SHARED_LOCK = new Object();
    private static volatile Database shared;

    private final Path dbFile;
    private final TimStateConfig legacyConfig;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final ThreadLocal<Connection> boundConnection = new ThreadLocal<>();
    private boolean createdFresh;

    private Database(Path dbFile, TimStateConfig legacyConfig, int busyTimeoutMs) {
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.legacyConfig = legacyConfig;
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setBusyTimeout(busyTimeoutMs);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    /**
     * Opens (creating if needed) the database of a config root. A file created by this call is
     * populated from the legacy JSON files under the same root before the method returns.
     */
    public static Database open(TimStateConfig config) {
        Database database = new Database(config.dbFile(), config, TimStateConfig.DEFAULT_BUSY_TIMEOUT_MS);
        database.init();
        return database;
    }

    /** Opens a database at an explicit path; legacy files are looked up next to it. */
    public static Database open(Path dbFile) {
        Path absolute = dbFile.toAbsolutePath().normalize();
        Path parent = absolute.getParent() == null ? absolute : absolute.getParent();
        Database database = new Database(absolute, new TimStateConfig(parent), TimStateConfig.DEFAULT_BUSY_TIMEOUT_MS);
        database.init();
        return database;
    }

    /** Process-wide handle for the resolved production config root, initialized once. */
    public static Database shared() {
        Database current = shared;
        if (current != null) {
            return current;
        }
        synchronized (SHARED_LOCK) {
            if (shared == null) {
                shared = open(TimStateConfig.fromEnvironment());
            }
            return shared;
        }
    }

    public static void overrideForTesting(Database database) {
        synchronized (SHARED_LOCK) {
            shared = database;
        }
    }

    public static void resetForTesting() {
        synchronized (SHARED_LOCK) {
            shared = null;
        }
    }

    private void init() {
        boolean existed = Files.exists(dbFile);
        try {
            Path parent = dbFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to create database directory for " + dbFile, e);
        }
        applyAndValidatePragmas();
        try (Connection conn = openConnection()) {
            new SchemaMigrator().migrate(conn);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to open database " + dbFile, e);
        }
        createdFresh = !existed;
        if (createdFresh) {
            log.info("Created state database at {}", dbFile);
            new JsonImporter(this).importIfNeeded(legacyConfig);
        }
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
            validatePragma(st, "busy_timeout", Integer.toString(TimStateConfig.DEFAULT_BUSY_TIMEOUT_MS));
        } catch (SQLException | IllegalStateException e) {
            throw new StorageUnavailableException("Failed to open database " + dbFile, e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    /**
     * Runs {@code work} in one immediate transaction, or inside the transaction already bound to
     * this thread. Commits on return, rolls back on any exception.
     */
    public <T> T inTransaction(String action, SqlWork<T> work) {
        Connection bound = boundConnection.get();
        if (bound != null) {
            try {
                return work.apply(bound);
            } catch (SQLException e) {
                throw translate(action, e);
            }
        }
        try (Connection c = openConnection()) {
            c.setAutoCommit(false);
            boundConnection.set(c);
            try {
                T out = work.apply(c);
                // commit() would open the next immediate transaction straight away
                c.setAutoCommit(true);
                return out;
            } catch (Exception e) {
                if (!c.getAutoCommit()) {
                    c.rollback();
                }
                throw e;
            } finally {
                boundConnection.remove();
            }
        } catch (SQLException e) {
            throw translate(action, e);
        }
    }

    /** Autocommit read, joining the current thread's transaction when there is one. */
    public <T> T read(String action, SqlWork<T> work) {
        Connection bound = boundConnection.get();
        if (bound != null) {
            try {
                return work.apply(bound);
            } catch (SQLException e) {
                throw translate(action, e);
            }
        }
        try (Connection c = openConnection()) {
            return work.apply(c);
        } catch (SQLException e) {
            throw translate(action, e);
        }
    }

    static StorageException translate(String action, SQLException e) {
        int primary = e.getErrorCode() & 0xff;
        String message = "Failed to " + action + ": " + e.getMessage();
        if (primary == SQLiteErrorCode.SQLITE_CONSTRAINT.code) {
            return new ConstraintViolationException(message, e);
        }
        if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
            return new StorageBusyException(message, e);
        }
        return new StorageException(message, e);
    }

    public int schemaVersion() {
        return read("read schema version", SchemaMigrator::currentVersion);
    }

    public boolean importCompleted() {
        return read("read import state", c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT import_completed FROM schema_version WHERE id=1")) {
                return rs.next() && rs.getInt(1) == 1;
            }
        });
    }

    public void markImportCompleted() {
        inTransaction("mark import completed", c -> {
            try (Statement st = c.createStatement()) {
                return st.executeUpdate("UPDATE schema_version SET import_completed=1 WHERE id=1");
            }
        });
    }

    public long count(String table) {
        if (!COUNTABLE_TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        return read("count " + table, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + table);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    public Path dbFile() {
        return dbFile;
    }

    public Path configRoot() {
        return legacyConfig.configRoot();
    }

    /** Whether this handle created the database file. */
    public boolean createdFresh() {
        return createdFresh;
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }
}
