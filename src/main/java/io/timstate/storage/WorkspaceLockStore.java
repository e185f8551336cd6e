package io.timstate.storage;

import io.timstate.config.TimStateConfig;
import io.timstate.model.LockType;
import io.timstate.model.WorkspaceLockInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exclusive execution lock per workspace.
 *
 * <p>The lock is advisory: it is a row that cooperating tim processes check before working in a
 * workspace, not an OS-level mutex. Nothing stops a process that ignores it.
 *
 * <p>{@code pid} locks go stale when their process is gone or after
 * {@link TimStateConfig#STALE_PID_LOCK_AGE_MS}, whichever comes first; the age bound covers pid
 * reuse. {@code persistent} locks never go stale. Stale rows are reclaimed by whichever
 * {@link #acquire} or {@link #inspect} call meets them.
 */
public final class WorkspaceLockStore {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceLockStore.class);
    private static final String COLUMNS = "workspace_id,lock_type,pid,started_at_ms,hostname,command";

    private final Database database;
    private final ProcessProbe processProbe;
    private final Clock clock;

    public WorkspaceLockStore(Database database) {
        this(database, ProcessProbe.system(), Clock.systemUTC());
    }

    public WorkspaceLockStore(Database database, ProcessProbe processProbe, Clock clock) {
        this.database = database;
        this.processProbe = processProbe;
        this.clock = clock;
    }

    /**
     * Takes the lock, reclaiming a stale holder first.
     *
     * @throws WorkspaceLockedException when a live lock is held
     * @throws ConstraintViolationException when the workspace does not exist
     */
    public WorkspaceLockInfo acquire(long workspaceId, LockRequest request) {
        if (request == null || request.type() == null) {
            throw new IllegalArgumentException("lock request with a type is required");
        }
        if (request.type() == LockType.PID && request.pid() == null) {
            throw new IllegalArgumentException("pid locks need a pid");
        }
        return database.inTransaction("acquire workspace lock " + workspaceId, c -> {
            Optional<WorkspaceLockInfo> existing = find(c, workspaceId);
            if (existing.isPresent()) {
                WorkspaceLockInfo holder = existing.get();
                if (!isStale(holder)) {
                    throw new WorkspaceLockedException(holder);
                }
                deleteExact(c, holder);
                log.info("Reclaimed stale {} lock on workspace {} (pid={}, host={})",
                        holder.type().dbValue(), workspaceId, holder.pid(), holder.hostname());
            }
            WorkspaceLockInfo created = new WorkspaceLockInfo(
                    workspaceId,
                    request.type(),
                    request.pid(),
                    clock.millis(),
                    request.hostname() == null || request.hostname().isBlank() ? "unknown" : request.hostname(),
                    request.command() == null ? "" : request.command()
            );
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO workspace_lock(" + COLUMNS + ") VALUES(?,?,?,?,?,?)")) {
                ps.setLong(1, created.workspaceId());
                ps.setString(2, created.type().dbValue());
                Sql.setNullableLong(ps, 3, created.pid());
                ps.setLong(4, created.startedAtMs());
                ps.setString(5, created.hostname());
                ps.setString(6, created.command());
                ps.executeUpdate();
            }
            return created;
        });
    }

    public boolean release(long workspaceId) {
        return release(workspaceId, ReleaseOptions.NONE);
    }

    /**
     * Deletes the lock row.
     *
     * <p>When {@code options} names a caller pid and {@code force} is off, a lock held by a
     * different pid that is still alive is left in place.
     *
     * @return true when a row was deleted
     */
    public boolean release(long workspaceId, ReleaseOptions options) {
        ReleaseOptions opts = options == null ? ReleaseOptions.NONE : options;
        return database.inTransaction("release workspace lock " + workspaceId, c -> {
            Optional<WorkspaceLockInfo> existing = find(c, workspaceId);
            if (existing.isEmpty()) {
                return false;
            }
            WorkspaceLockInfo holder = existing.get();
            if (!opts.force()
                    && opts.pid() != null
                    && holder.pid() != null
                    && !holder.pid().equals(opts.pid())
                    && processProbe.isAlive(holder.pid())) {
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM workspace_lock WHERE workspace_id=?")) {
                ps.setLong(1, workspaceId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /** Current holder, after reclaiming a stale lock. */
    public Optional<WorkspaceLockInfo> inspect(long workspaceId) {
        return database.inTransaction("inspect workspace lock " + workspaceId, c -> {
            Optional<WorkspaceLockInfo> existing = find(c, workspaceId);
            if (existing.isPresent() && isStale(existing.get())) {
                deleteExact(c, existing.get());
                log.info("Reclaimed stale lock on workspace {} during inspection", workspaceId);
                return Optional.empty();
            }
            return existing;
        });
    }

    /** Raw row, stale or not. Nothing is reclaimed. */
    public Optional<WorkspaceLockInfo> inspectIncludingStale(long workspaceId) {
        return database.read("read workspace lock " + workspaceId, c -> find(c, workspaceId));
    }

    public boolean isLocked(long workspaceId) {
        return inspect(workspaceId).isPresent();
    }

    /** Deletes every stale lock row. */
    public int cleanStale() {
        return database.inTransaction("clean stale workspace locks", c -> {
            List<WorkspaceLockInfo> rows = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM workspace_lock WHERE lock_type=? ORDER BY id")) {
                ps.setString(1, LockType.PID.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        rows.add(map(rs));
                    }
                }
            }
            int removed = 0;
            for (WorkspaceLockInfo row : rows) {
                if (isStale(row) && deleteExact(c, row)) {
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Removed {} stale workspace lock(s)", removed);
            }
            return removed;
        });
    }

    public boolean isStale(WorkspaceLockInfo lock) {
        if (lock.type() == LockType.PERSISTENT) {
            return false;
        }
        long age = clock.millis() - lock.startedAtMs();
        if (age > TimStateConfig.STALE_PID_LOCK_AGE_MS) {
            return true;
        }
        return lock.pid() == null || !processProbe.isAlive(lock.pid());
    }

    private static boolean deleteExact(Connection c, WorkspaceLockInfo lock) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM workspace_lock WHERE workspace_id=? AND started_at_ms=? AND pid IS ?")) {
            ps.setLong(1, lock.workspaceId());
            ps.setLong(2, lock.startedAtMs());
            Sql.setNullableLong(ps, 3, lock.pid());
            return ps.executeUpdate() > 0;
        }
    }

    private static Optional<WorkspaceLockInfo> find(Connection c, long workspaceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM workspace_lock WHERE workspace_id=?")) {
            ps.setLong(1, workspaceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static WorkspaceLockInfo map(ResultSet rs) throws SQLException {
        return new WorkspaceLockInfo(
                rs.getLong("workspace_id"),
                LockType.fromString(rs.getString("lock_type")),
                Sql.getNullableLong(rs, "pid"),
                rs.getLong("started_at_ms"),
                rs.getString("hostname"),
                rs.getString("command")
        );
    }

    public record LockRequest(LockType type, Long pid, String hostname, String command) {
        public static LockRequest forCurrentProcess(LockType type, String command) {
            return forCurrentProcess(type, command, null);
        }

        /** Lock for this JVM; a non-blank {@code owner} is appended to the command. */
        public static LockRequest forCurrentProcess(LockType type, String command, String owner) {
            String cmd = command == null ? "" : command;
            if (owner != null && !owner.isBlank()) {
                cmd = cmd + " (owner: " + owner.trim() + ")";
            }
            return new LockRequest(type, ProcessHandle.current().pid(), localHostname(), cmd);
        }

        private static String localHostname() {
            try {
                return InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                return "unknown";
            }
        }
    }

    public record ReleaseOptions(Long pid, boolean force) {
        public static final ReleaseOptions NONE = new ReleaseOptions(null, false);

        public static ReleaseOptions ownedBy(long pid) {
            return new ReleaseOptions(pid, false);
        }

        public static ReleaseOptions forced() {
            return new ReleaseOptions(null, true);
        }
    }
}
