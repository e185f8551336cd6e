package io.timstate.legacy;

import com.fasterxml.jackson.databind.JsonNode;
import io.timstate.config.TimStateConfig;
import io.timstate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Reads the legacy JSON files under a config root. Never writes them.
 *
 * <p>A missing file is silently absent from the snapshot; a file that cannot be parsed, or whose
 * top-level shape is wrong, is skipped with a warning. Inside a readable file, malformed entries
 * are skipped one by one so the rest still imports.
 */
public final class LegacyJsonReader {
    private static final Logger log = LoggerFactory.getLogger(LegacyJsonReader.class);

    private final TimStateConfig config;

    public LegacyJsonReader(TimStateConfig config) {
        this.config = config;
    }

    public LegacySnapshot read() {
        Map<String, LegacySnapshot.Repository> repositories = new TreeMap<>();
        for (String repositoryId : childDirectories(config.sharedRoot())) {
            LegacySnapshot.AssignmentsFile assignments = readAssignments(config.assignmentsFile(repositoryId));
            LegacySnapshot.PermissionsFile permissions = readPermissions(config.permissionsFile(repositoryId));
            if (assignments == null && permissions == null) {
                continue;
            }
            repositories.put(repositoryId, new LegacySnapshot.Repository(assignments, permissions, null));
        }
        for (String repositoryId : childDirectories(config.repositoriesRoot())) {
            LegacySnapshot.RepositoryMetadata metadata = readMetadata(config.metadataFile(repositoryId));
            if (metadata == null) {
                continue;
            }
            LegacySnapshot.Repository existing = repositories.getOrDefault(
                    repositoryId, new LegacySnapshot.Repository(null, null, null));
            repositories.put(repositoryId, existing.withMetadata(metadata));
        }
        Map<String, LegacySnapshot.WorkspaceEntry> workspaces = readWorkspaces(config.workspacesFile());
        return new LegacySnapshot(repositories, workspaces);
    }

    LegacySnapshot.AssignmentsFile readAssignments(Path file) {
        JsonNode root = readObject(file);
        if (root == null) {
            return null;
        }
        String repositoryId = trimmedText(root, "repositoryId");
        JsonNode assignments = root.get("assignments");
        if (repositoryId == null || assignments == null || !assignments.isObject()) {
            log.warn("Skipping legacy assignments file {}: missing repositoryId or assignments", file);
            return null;
        }
        Long highestPlanId = null;
        JsonNode highest = root.get("highestPlanId");
        if (highest != null && highest.canConvertToLong() && highest.isIntegralNumber() && highest.asLong() >= 0) {
            highestPlanId = highest.asLong();
        }
        String remoteUrl = trimmedText(root, "repositoryRemoteUrl");

        Map<String, LegacySnapshot.AssignmentEntry> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = assignments.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            LegacySnapshot.AssignmentEntry entry = parseAssignment(field.getKey(), field.getValue());
            if (entry == null) {
                log.warn("Skipping malformed legacy assignment {} in {}", field.getKey(), file);
                continue;
            }
            entries.put(field.getKey(), entry);
        }
        return new LegacySnapshot.AssignmentsFile(repositoryId, remoteUrl, highestPlanId, entries);
    }

    private static LegacySnapshot.AssignmentEntry parseAssignment(String planUuid, JsonNode node) {
        if (planUuid == null || planUuid.isBlank() || node == null || !node.isObject()) {
            return null;
        }
        Long assignedAt = parseInstant(Jsons.textOrNull(node, "assignedAt"));
        Long updatedAt = parseInstant(Jsons.textOrNull(node, "updatedAt"));
        if (assignedAt == null || updatedAt == null) {
            return null;
        }
        Long planId = null;
        JsonNode rawPlanId = node.get("planId");
        if (rawPlanId != null && !rawPlanId.isNull()) {
            planId = parsePositivePlanId(rawPlanId);
            if (planId == null) {
                return null;
            }
        }
        Map<String, String> owners = new LinkedHashMap<>();
        JsonNode ownerNode = node.get("workspaceOwners");
        if (ownerNode != null && ownerNode.isObject()) {
            ownerNode.fields().forEachRemaining(owner -> {
                if (owner.getValue().isTextual() && !owner.getValue().asText().isBlank()) {
                    owners.put(owner.getKey().trim(), owner.getValue().asText().trim());
                }
            });
        }
        return new LegacySnapshot.AssignmentEntry(
                planId,
                Jsons.textList(node, "workspacePaths"),
                owners,
                Jsons.textList(node, "users"),
                trimmedText(node, "status"),
                assignedAt,
                updatedAt
        );
    }

    LegacySnapshot.PermissionsFile readPermissions(Path file) {
        JsonNode root = readObject(file);
        if (root == null) {
            return null;
        }
        String repositoryId = trimmedText(root, "repositoryId");
        JsonNode permissions = root.get("permissions");
        if (repositoryId == null || permissions == null || !permissions.isObject()) {
            log.warn("Skipping legacy permissions file {}: missing repositoryId or permissions", file);
            return null;
        }
        return new LegacySnapshot.PermissionsFile(
                repositoryId,
                rawTextList(permissions, "allow"),
                rawTextList(permissions, "deny")
        );
    }

    LegacySnapshot.RepositoryMetadata readMetadata(Path file) {
        JsonNode root = readObject(file);
        if (root == null) {
            return null;
        }
        String repositoryName = Jsons.textOrNull(root, "repositoryName");
        boolean valid = repositoryName != null && !repositoryName.isEmpty()
                && !isBlankText(root, "createdAt")
                && !isBlankText(root, "updatedAt")
                && Jsons.isTextOrAbsent(root, "remoteLabel")
                && Jsons.isTextOrAbsent(root, "lastGitRoot")
                && Jsons.isTextOrAbsent(root, "externalConfigPath")
                && Jsons.isTextOrAbsent(root, "externalTasksDir");
        if (!valid) {
            log.warn("Skipping legacy repository metadata {}: invalid fields", file);
            return null;
        }
        return new LegacySnapshot.RepositoryMetadata(
                repositoryName,
                Jsons.textOrNull(root, "remoteLabel"),
                Jsons.textOrNull(root, "lastGitRoot"),
                Jsons.textOrNull(root, "externalConfigPath"),
                Jsons.textOrNull(root, "externalTasksDir")
        );
    }

    Map<String, LegacySnapshot.WorkspaceEntry> readWorkspaces(Path file) {
        Map<String, LegacySnapshot.WorkspaceEntry> out = new LinkedHashMap<>();
        JsonNode root = readObject(file);
        if (root == null) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            LegacySnapshot.WorkspaceEntry entry = parseWorkspace(field.getKey(), field.getValue());
            if (entry == null) {
                log.warn("Skipping malformed legacy workspace entry {} in {}", field.getKey(), file);
                continue;
            }
            out.put(field.getKey(), entry);
        }
        return out;
    }

    private static LegacySnapshot.WorkspaceEntry parseWorkspace(String workspacePath, JsonNode node) {
        if (workspacePath == null || workspacePath.isBlank() || node == null || !node.isObject()) {
            return null;
        }
        String taskId = Jsons.textOrNull(node, "taskId");
        String declaredPath = Jsons.textOrNull(node, "workspacePath");
        String createdAt = Jsons.textOrNull(node, "createdAt");
        if (taskId == null || taskId.isEmpty() || createdAt == null || createdAt.isEmpty()) {
            return null;
        }
        if (node.has("workspacePath") && !workspacePath.equals(declaredPath)) {
            return null;
        }
        String planId = null;
        JsonNode rawPlanId = node.get("planId");
        if (rawPlanId != null && (rawPlanId.isTextual() || rawPlanId.isIntegralNumber())) {
            planId = rawPlanId.asText();
        }
        return new LegacySnapshot.WorkspaceEntry(
                workspacePath,
                taskId,
                trimmedText(node, "repositoryId"),
                Jsons.textOrNull(node, "originalPlanFilePath"),
                Jsons.textOrNull(node, "branch"),
                Jsons.textOrNull(node, "name"),
                Jsons.textOrNull(node, "description"),
                planId,
                Jsons.textOrNull(node, "planTitle"),
                Jsons.textList(node, "issueUrls"),
                parseInstant(createdAt),
                parseInstant(Jsons.textOrNull(node, "updatedAt"))
        );
    }

    private JsonNode readObject(Path file) {
        try {
            Optional<JsonNode> root = Jsons.readTree(file);
            if (root.isEmpty()) {
                return null;
            }
            if (!root.get().isObject()) {
                log.warn("Skipping legacy file {}: top-level value is not an object", file);
                return null;
            }
            return root.get();
        } catch (IOException e) {
            log.warn("Skipping unreadable legacy file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private static List<String> childDirectories(Path root) {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            return out;
        }
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .forEach(out::add);
        } catch (IOException e) {
            log.warn("Failed to list legacy directory {}: {}", root, e.getMessage());
        }
        return out;
    }

    private static List<String> rawTextList(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array != null && array.isArray()) {
            for (JsonNode item : array) {
                if (item.isTextual() && !item.asText().isEmpty()) {
                    out.add(item.asText());
                }
            }
        }
        return out;
    }

    private static String trimmedText(JsonNode node, String field) {
        String value = Jsons.textOrNull(node, field);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean isBlankText(JsonNode node, String field) {
        String value = Jsons.textOrNull(node, field);
        return value == null || value.isEmpty();
    }

    private static Long parsePositivePlanId(JsonNode raw) {
        if (raw.isIntegralNumber() && raw.canConvertToLong() && raw.asLong() > 0) {
            return raw.asLong();
        }
        if (raw.isTextual() && raw.asText().matches("[1-9]\\d{0,17}")) {
            return Long.parseLong(raw.asText());
        }
        return null;
    }

    static Long parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim()).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
