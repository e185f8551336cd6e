package io.timstate.legacy;

import io.timstate.config.TimStateConfig;
import io.timstate.model.Assignment;
import io.timstate.model.PermissionSet;
import io.timstate.model.Project;
import io.timstate.model.Workspace;
import io.timstate.storage.AssignmentStore;
import io.timstate.storage.Database;
import io.timstate.storage.PermissionStore;
import io.timstate.storage.ProjectStore;
import io.timstate.storage.WorkspaceStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class JsonImporterTest {
    private static final String U1 = "0b9d4c1e-6a0f-4f4e-9d7a-1f1e2a3b4c5d";
    private static final String U2 = "a3c1f7d2-1b2c-4d3e-8f90-123456789abc";
    private static final String U3 = "c0ffee00-1111-4222-8333-444455556666";
    private static final String U4 = "deadbeef-0000-4000-8000-000000000004";
    private static final String U5 = "deadbeef-0000-4000-8000-000000000005";

    @Test
    void firstOpenImportsLegacyFiles() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-import-fresh-");
        try {
            writeLegacyFixtures(root);
            TimStateConfig config = new TimStateConfig(root);

            Database db = Database.open(config);
            Assertions.assertTrue(db.createdFresh());
            Assertions.assertTrue(db.importCompleted());

            ProjectStore projects = new ProjectStore(db);
            Project project = projects.get("repo-1").orElseThrow();
            Assertions.assertEquals("git@github.com:acme/one.git", project.remoteUrl());
            Assertions.assertEquals("acme/one", project.remoteLabel());
            Assertions.assertEquals("/src/one", project.lastGitRoot());
            Assertions.assertEquals(42L, project.highestPlanId());
            Assertions.assertEquals(1, projects.list().size());

            WorkspaceStore workspaces = new WorkspaceStore(db);
            Assertions.assertEquals(2, workspaces.list().size());
            Workspace a = workspaces.getByPath("/ws/a").orElseThrow();
            Workspace b = workspaces.getByPath("/ws/b").orElseThrow();
            Assertions.assertEquals("t-a", a.taskId());
            Assertions.assertEquals("feature/a", a.branch());
            Assertions.assertEquals(List.of("https://x/1", "https://x/2"), workspaces.getIssues(a.id()));
            Assertions.assertEquals("9", b.planId());
            Assertions.assertEquals("Nine", b.planTitle());
            Assertions.assertTrue(workspaces.getByPath("/ws/orphan").isEmpty());
            Assertions.assertTrue(workspaces.getByPath("/ws/mismatch").isEmpty());

            PermissionSet permissions = new PermissionStore(db).get(project.id());
            Assertions.assertEquals(List.of("Bash(ls)"), permissions.allow());
            Assertions.assertEquals(List.of("Bash(rm:*)"), permissions.deny());

            AssignmentStore assignments = new AssignmentStore(db);
            Assignment collapsed = assignments.get(project.id(), U1).orElseThrow();
            Assertions.assertEquals(b.id(), collapsed.workspaceId());
            Assertions.assertEquals("bob", collapsed.claimedByUser());
            Assertions.assertEquals(5L, collapsed.planId());
            Assertions.assertEquals("in_progress", collapsed.status());
            Assertions.assertEquals(1_704_153_600_000L, collapsed.updatedAtMs());

            Assignment userOnly = assignments.get(project.id(), U2).orElseThrow();
            Assertions.assertNull(userOnly.workspaceId());
            Assertions.assertEquals("carol", userOnly.claimedByUser());
            Assertions.assertEquals(6L, userOnly.planId());

            Assignment freeFormKey = assignments.get(project.id(), "legacy-8").orElseThrow();
            Assertions.assertEquals("dave", freeFormKey.claimedByUser());
            Assertions.assertEquals(8L, freeFormKey.planId());

            Assertions.assertTrue(assignments.get(project.id(), U3).isEmpty());
            Assertions.assertTrue(assignments.get(project.id(), U4).isEmpty());
            Assertions.assertTrue(assignments.get(project.id(), U5).isEmpty());
            Assertions.assertEquals(3, assignments.listByProject(project.id()).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void importIsGuardedOnceAndUnguardedRunsAreIdempotent() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-import-rerun-");
        try {
            TimStateConfig config = new TimStateConfig(root);
            Database db = Database.open(config);
            Assertions.assertTrue(db.importCompleted());
            writeLegacyFixtures(root);
            byte[] before = Files.readAllBytes(config.workspacesFile());

            JsonImporter importer = new JsonImporter(db);
            Assertions.assertEquals(JsonImporter.ImportSummary.SKIPPED, importer.importIfNeeded(config));
            Assertions.assertEquals(0L, db.count("project"));

            JsonImporter.ImportSummary first = importer.importFromJsonFiles(config);
            Assertions.assertEquals(1, first.projects());
            Assertions.assertEquals(2, first.workspaces());
            Assertions.assertEquals(3, first.assignments());
            Assertions.assertEquals(1, first.skippedAssignments());
            long[] counts = counts(db);

            JsonImporter.ImportSummary second = importer.importFromJsonFiles(config);
            Assertions.assertEquals(0, second.assignments());
            Assertions.assertArrayEquals(counts, counts(db));
            Assertions.assertArrayEquals(before, Files.readAllBytes(config.workspacesFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableOrMisshapenFilesAreSkipped() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-import-invalid-");
        try {
            TimStateConfig config = new TimStateConfig(root);
            write(config.workspacesFile(), "{ not json");
            write(config.assignmentsFile("repo-broken"), "[]");
            write(config.permissionsFile("repo-broken"), "{\"repositoryId\":\"repo-broken\"}");
            write(config.metadataFile("repo-meta"), "{\"repositoryName\":\"meta\",\"createdAt\":\"2024-01-01T00:00:00Z\"}");
            write(config.metadataFile("repo-bad-type"), """
                    {"repositoryName":"bad","createdAt":"2024-01-01T00:00:00Z","updatedAt":"2024-01-01T00:00:00Z",
                     "remoteLabel":7}
                    """);

            Database db = Database.open(config);
            Assertions.assertTrue(db.importCompleted());
            Assertions.assertEquals(0L, db.count("project"));
            Assertions.assertEquals(0L, db.count("workspace"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void readerKeepsValidEntriesNextToBrokenOnes() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-import-reader-");
        try {
            writeLegacyFixtures(root);
            LegacySnapshot snapshot = new LegacyJsonReader(new TimStateConfig(root)).read();

            LegacySnapshot.Repository repository = snapshot.repositories().get("repo-1");
            Assertions.assertEquals(List.of(U1, U2, "legacy-8", U4, U5),
                    List.copyOf(repository.assignments().assignments().keySet()));
            Assertions.assertEquals("one", repository.metadata().repositoryName());
            Assertions.assertEquals(List.of("/ws/a", "/ws/b", "/ws/orphan"), List.copyOf(snapshot.workspaces().keySet()));
            Assertions.assertNull(snapshot.workspaces().get("/ws/orphan").repositoryId());
            Assertions.assertNull(LegacyJsonReader.parseInstant("yesterday"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void multiWorkspaceClaimWithShortKeyImportsAgainstTheNewestWorkspace() throws Exception {
        Path root = Files.createTempDirectory("tim-state-test-import-collapse-");
        try {
            TimStateConfig config = new TimStateConfig(root);
            write(config.assignmentsFile("repo-1"), """
                    {"repositoryId": "repo-1", "version": 1, "highestPlanId": 7,
                     "assignments": {"u1": {"planId": 3, "workspacePaths": ["/a", "/b"],
                                            "workspaceOwners": {"/a": "alice", "/b": "bob"},
                                            "users": ["alice", "bob"], "status": "in_progress",
                                            "assignedAt": "2024-01-01T00:00:00Z",
                                            "updatedAt": "2024-01-01T00:00:00Z"}}}
                    """);
            write(config.workspacesFile(), """
                    {"/a": {"taskId": "t-a", "repositoryId": "repo-1",
                            "createdAt": "2024-01-01T00:00:00Z", "updatedAt": "2024-01-02T00:00:00Z"},
                     "/b": {"taskId": "t-b", "repositoryId": "repo-1",
                            "createdAt": "2024-01-01T00:00:00Z", "updatedAt": "2024-01-03T00:00:00Z"}}
                    """);

            Database db = Database.open(config);
            Project project = new ProjectStore(db).get("repo-1").orElseThrow();
            Assertions.assertEquals(7L, project.highestPlanId());

            Assignment assignment = new AssignmentStore(db).get(project.id(), "u1").orElseThrow();
            Workspace newest = new WorkspaceStore(db).getByPath("/b").orElseThrow();
            Assertions.assertEquals(newest.id(), assignment.workspaceId());
            Assertions.assertEquals("bob", assignment.claimedByUser());
            Assertions.assertEquals(3L, assignment.planId());
            Assertions.assertEquals(1L, db.count("assignment"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static long[] counts(Database db) {
        return new long[]{
                db.count("project"),
                db.count("workspace"),
                db.count("workspace_issue"),
                db.count("permission"),
                db.count("assignment")
        };
    }

    private static void writeLegacyFixtures(Path root) throws IOException {
        TimStateConfig config = new TimStateConfig(root);
        write(config.assignmentsFile("repo-1"), """
                {
                  "repositoryId": "repo-1",
                  "repositoryRemoteUrl": "git@github.com:acme/one.git",
                  "version": 3,
                  "highestPlanId": 42,
                  "assignments": {
                    "%s": {
                      "planId": 5,
                      "workspacePaths": ["/ws/a", "/ws/b"],
                      "workspaceOwners": {"/ws/a": "alice", "/ws/b": "bob"},
                      "users": ["alice", "bob"],
                      "status": "in_progress",
                      "assignedAt": "2024-01-01T00:00:00.000Z",
                      "updatedAt": "2024-01-02T00:00:00.000Z"
                    },
                    "%s": {
                      "planId": "6",
                      "workspacePaths": [],
                      "users": ["carol"],
                      "assignedAt": "2024-01-01T00:00:00Z",
                      "updatedAt": "2024-01-01T00:00:00Z"
                    },
                    "legacy-8": {
                      "planId": 8,
                      "users": ["dave"],
                      "assignedAt": "2024-01-01T00:00:00Z",
                      "updatedAt": "2024-01-01T00:00:00Z"
                    },
                    "  ": {
                      "planId": 11,
                      "users": ["frank"],
                      "assignedAt": "2024-01-01T00:00:00Z",
                      "updatedAt": "2024-01-01T00:00:00Z"
                    },
                    "%s": {
                      "planId": -1,
                      "users": ["erin"],
                      "assignedAt": "2024-01-01T00:00:00Z",
                      "updatedAt": "2024-01-01T00:00:00Z"
                    },
                    "%s": {
                      "workspacePaths": [],
                      "users": [],
                      "assignedAt": "2024-01-01T00:00:00Z",
                      "updatedAt": "2024-01-01T00:00:00Z"
                    },
                    "%s": {
                      "workspacePaths": ["/ws/gone"],
                      "users": [],
                      "assignedAt": "2024-01-01T00:00:00Z",
                      "updatedAt": "2024-01-01T00:00:00Z"
                    }
                  }
                }
                """.formatted(U1, U2, U3, U4, U5));
        write(config.permissionsFile("repo-1"), """
                {"repositoryId": "repo-1", "version": 1,
                 "permissions": {"allow": ["Bash(ls)"], "deny": ["Bash(rm:*)"]}}
                """);
        write(config.metadataFile("repo-1"), """
                {"repositoryName": "one", "createdAt": "2024-01-01T00:00:00Z", "updatedAt": "2024-01-05T00:00:00Z",
                 "remoteLabel": "acme/one", "lastGitRoot": "/src/one"}
                """);
        write(config.workspacesFile(), """
                {
                  "/ws/a": {"taskId": "t-a", "workspacePath": "/ws/a", "repositoryId": "repo-1", "branch": "feature/a",
                            "createdAt": "2024-01-01T00:00:00Z", "updatedAt": "2024-01-03T00:00:00Z",
                            "issueUrls": ["https://x/1", "https://x/1", "https://x/2"]},
                  "/ws/b": {"taskId": "t-b", "repositoryId": "repo-1", "planId": "9", "planTitle": "Nine",
                            "createdAt": "2024-01-01T00:00:00Z", "updatedAt": "2024-02-01T00:00:00Z"},
                  "/ws/orphan": {"taskId": "t-o", "createdAt": "2024-01-01T00:00:00Z"},
                  "/ws/no-task": {"createdAt": "2024-01-01T00:00:00Z", "repositoryId": "repo-1"},
                  "/ws/mismatch": {"taskId": "t-m", "workspacePath": "/elsewhere", "repositoryId": "repo-1",
                                   "createdAt": "2024-01-01T00:00:00Z"}
                }
                """);
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
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
