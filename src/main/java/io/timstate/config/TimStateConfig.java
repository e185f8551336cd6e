package io.timstate.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

public final class TimStateConfig {
    public static final String CONFIG_ROOT_ENV = "TIM_CONFIG_ROOT";
    public static final String APP_DIR_NAME = "tim";
    public static final String DB_FILE_NAME = "tim.db";
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    public static final long STALE_PID_LOCK_AGE_MS = 24L * 60L * 60L * 1_000L;

    private static final String SHARED_DIR = "shared";
    private static final String REPOSITORIES_DIR = "repositories";
    private static final String WORKSPACES_FILE = "workspaces.json";

    private final Path configRoot;

    public TimStateConfig(Path configRoot) {
        if (configRoot == null) {
            throw new IllegalArgumentException("configRoot must not be null");
        }
        this.configRoot = configRoot.toAbsolutePath().normalize();
    }

    public static TimStateConfig fromEnvironment() {
        return new TimStateConfig(resolveConfigRoot(
                System.getenv(),
                System.getProperty("os.name", ""),
                System.getProperty("user.home", ".")
        ));
    }

    public static TimStateConfig fromRoot(String root) {
        if (root == null || root.isBlank()) {
            return fromEnvironment();
        }
        return new TimStateConfig(Paths.get(root.trim()));
    }

    /**
     * Resolves the per-user configuration root.
     *
     * <p>{@value #CONFIG_ROOT_ENV} wins when set. Windows uses {@code %APPDATA%}, everything
     * else follows the XDG base directory convention.
     */
    public static Path resolveConfigRoot(Map<String, String> env, String osName, String userHome) {
        String override = nonBlank(env.get(CONFIG_ROOT_ENV));
        if (override != null) {
            return Paths.get(override);
        }
        String home = userHome == null || userHome.isBlank() ? "." : userHome;
        boolean windows = osName != null && osName.toLowerCase(Locale.ROOT).startsWith("windows");
        if (windows) {
            String appData = nonBlank(env.get("APPDATA"));
            Path base = appData != null
                    ? Paths.get(appData)
                    : Paths.get(home, "AppData", "Roaming");
            return base.resolve(APP_DIR_NAME);
        }
        String xdg = nonBlank(env.get("XDG_CONFIG_HOME"));
        Path base = xdg != null ? Paths.get(xdg) : Paths.get(home, ".config");
        return base.resolve(APP_DIR_NAME);
    }

    private static String nonBlank(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public Path configRoot() {
        return configRoot;
    }

    public Path dbFile() {
        return configRoot.resolve(DB_FILE_NAME);
    }

    public Path sharedRoot() {
        return configRoot.resolve(SHARED_DIR);
    }

    public Path repositoriesRoot() {
        return configRoot.resolve(REPOSITORIES_DIR);
    }

    public Path workspacesFile() {
        return configRoot.resolve(WORKSPACES_FILE);
    }

    public Path assignmentsFile(String repositoryId) {
        return sharedRoot().resolve(repositoryId).resolve("assignments.json");
    }

    public Path permissionsFile(String repositoryId) {
        return sharedRoot().resolve(repositoryId).resolve("permissions.json");
    }

    public Path metadataFile(String repositoryId) {
        return repositoriesRoot().resolve(repositoryId).resolve("metadata.json");
    }
}
