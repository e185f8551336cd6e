package io.timstate.storage;

import io.timstate.config.TimStateConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseTest {

    @Test
    void freshDatabaseIsMigratedAndReopenIsANoOp() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-open-");
        try {
            TimStateConfig config = new TimStateConfig(root.resolve("nested").resolve("config"));
            Database first = Database.open(config);
            Assertions.assertTrue(first.createdFresh());
            Assertions.assertTrue(Files.exists(config.dbFile()));
            Assertions.assertEquals(new SchemaMigrator().latestVersion(), first.schemaVersion());
            Assertions.assertTrue(first.importCompleted());

            Database second = Database.open(config);
            Assertions.assertFalse(second.createdFresh());
            Assertions.assertEquals(first.schemaVersion(), second.schemaVersion());
            Assertions.assertEquals(0L, second.count("project"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void everyConnectionCarriesThePragmas() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-pragmas-");
        try {
            Database db = Database.open(new TimStateConfig(root));
            try (Connection conn = db.openConnection(); Statement st = conn.createStatement()) {
                Assertions.assertEquals("wal", pragma(st, "journal_mode").toLowerCase());
                Assertions.assertEquals("1", pragma(st, "foreign_keys"));
                Assertions.assertEquals("1", pragma(st, "synchronous"));
                Assertions.assertEquals(Integer.toString(TimStateConfig.DEFAULT_BUSY_TIMEOUT_MS),
                        pragma(st, "busy_timeout"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingMigrationRollsBackEveryStepOfTheRun() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-migration-");
        try {
            SchemaMigrator migrator = new SchemaMigrator(List.of(
                    new SchemaMigrator.Migration(1, "good", "CREATE TABLE first_table(x INTEGER)"),
                    new SchemaMigrator.Migration(2, "broken", "CREATE TABLE second_table(")
            ));
            try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + root.resolve("m.db"))) {
                MigrationFailedException failure = Assertions.assertThrows(
                        MigrationFailedException.class, () -> migrator.migrate(conn));
                Assertions.assertEquals(2, failure.failedVersion());

                SchemaMigrator.ensureVersionTable(conn);
                Assertions.assertEquals(0, SchemaMigrator.currentVersion(conn));
                try (Statement st = conn.createStatement();
                     ResultSet rs = st.executeQuery(
                             "SELECT COUNT(*) FROM sqlite_master WHERE type='table' AND name='first_table'")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals(0, rs.getInt(1));
                }
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void migrationsMustBeStrictlyOrdered() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SchemaMigrator(List.of(
                new SchemaMigrator.Migration(2, "b", "SELECT 1"),
                new SchemaMigrator.Migration(1, "a", "SELECT 1")
        )));
    }

    @Test
    void nestedStoreCallsRollBackWithTheOuterTransaction() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-nested-");
        try {
            Database db = Database.open(new TimStateConfig(root));
            ProjectStore projects = new ProjectStore(db);

            Assertions.assertThrows(IllegalStateException.class, () -> db.inTransaction("outer", c -> {
                projects.getOrCreate("repo-rolled-back");
                throw new IllegalStateException("boom");
            }));
            Assertions.assertTrue(projects.get("repo-rolled-back").isEmpty());

            db.inTransaction("outer", c -> projects.getOrCreate("repo-kept"));
            Assertions.assertTrue(projects.get("repo-kept").isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sharedHandleCanBeOverriddenAndReset() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-shared-");
        try {
            Database db = Database.open(new TimStateConfig(root));
            Database.overrideForTesting(db);
            Assertions.assertSame(db, Database.shared());
            Assertions.assertSame(db, Database.shared());
        } finally {
            Database.resetForTesting();
            deleteRecursively(root);
        }
    }

    @Test
    void committedTransactionLeavesTheWriteLockFree() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-commit-");
        try {
            TimStateConfig config = new TimStateConfig(root);
            Database db = Database.open(config);
            ProjectStore projects = new ProjectStore(db);
            db.inTransaction("commit", c -> projects.getOrCreate("repo-committed"));

            try (Connection other = DriverManager.getConnection("jdbc:sqlite:" + config.dbFile());
                 Statement st = other.createStatement()) {
                st.execute("PRAGMA busy_timeout=0");
                st.execute("BEGIN IMMEDIATE");
                try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM project WHERE repository_id='repo-committed'")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals(1, rs.getInt(1));
                }
                st.execute("ROLLBACK");
            }

            Assertions.assertThrows(IllegalStateException.class, () -> db.inTransaction("fail", c -> {
                projects.getOrCreate("repo-failed");
                throw new IllegalStateException("boom");
            }));
            try (Connection other = DriverManager.getConnection("jdbc:sqlite:" + config.dbFile());
                 Statement st = other.createStatement()) {
                st.execute("PRAGMA busy_timeout=0");
                st.execute("BEGIN IMMEDIATE");
                st.execute("ROLLBACK");
            }
            Assertions.assertTrue(projects.get("repo-failed").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exposesItsFileAndConfigRoot() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-paths-");
        try {
            TimStateConfig config = new TimStateConfig(root);
            Database db = Database.open(config);
            Assertions.assertEquals(config.configRoot(), db.configRoot());
            Assertions.assertEquals(config.dbFile(), db.dbFile());

            Database byPath = Database.open(root.resolve("other.db"));
            Assertions.assertEquals(config.configRoot(), byPath.configRoot());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void countOnlyAcceptsKnownTables() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-db-count-");
        try {
            Database db = Database.open(new TimStateConfig(root));
            Assertions.assertThrows(IllegalArgumentException.class, () -> db.count("sqlite_master; DROP TABLE project"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static String pragma(Statement st, String name) throws Exception {
        try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
            Assertions.assertTrue(rs.next());
            return rs.getString(1);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
