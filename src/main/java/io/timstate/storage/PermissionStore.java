package io.timstate.storage;

import io.timstate.model.PermissionSet;
import io.timstate.model.PermissionType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Pre-approved and denied shell command patterns, per project. Patterns are opaque strings. */
public final class PermissionStore {
    private final Database database;

    public PermissionStore(Database database) {
        this.database = database;
    }

    public PermissionSet get(long projectId) {
        return database.read("get permissions", c -> {
            List<String> allow = new ArrayList<>();
            List<String> deny = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT type,pattern FROM permission WHERE project_id=? ORDER BY id")) {
                ps.setLong(1, projectId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        PermissionType type = PermissionType.fromString(rs.getString("type"));
                        (type == PermissionType.ALLOW ? allow : deny).add(rs.getString("pattern"));
                    }
                }
            }
            return new PermissionSet(allow, deny);
        });
    }

    /** @return false when the identical pattern was already present */
    public boolean add(long projectId, PermissionType type, String pattern) {
        String p = requirePattern(pattern);
        return database.inTransaction("add permission", c -> insert(c, projectId, type, p));
    }

    public boolean remove(long projectId, PermissionType type, String pattern) {
        String p = requirePattern(pattern);
        return database.inTransaction("remove permission", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM permission WHERE project_id=? AND type=? AND pattern=?")) {
                ps.setLong(1, projectId);
                ps.setString(2, type.dbValue());
                ps.setString(3, p);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public void replaceAll(long projectId, PermissionSet permissions) {
        PermissionSet set = permissions == null ? PermissionSet.EMPTY : permissions;
        database.inTransaction("replace permissions", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM permission WHERE project_id=?")) {
                ps.setLong(1, projectId);
                ps.executeUpdate();
            }
            int inserted = 0;
            for (PermissionType type : PermissionType.values()) {
                for (String pattern : set.patterns(type)) {
                    if (pattern != null && !pattern.isEmpty() && insert(c, projectId, type, pattern)) {
                        inserted++;
                    }
                }
            }
            return inserted;
        });
    }

    private static boolean insert(Connection c, long projectId, PermissionType type, String pattern)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO permission(project_id,type,pattern) VALUES(?,?,?) "
                        + "ON CONFLICT(project_id,type,pattern) DO NOTHING")) {
            ps.setLong(1, projectId);
            ps.setString(2, type.dbValue());
            ps.setString(3, pattern);
            return ps.executeUpdate() > 0;
        }
    }

    private static String requirePattern(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        return pattern;
    }
}
