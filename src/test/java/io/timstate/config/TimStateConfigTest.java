package io.timstate.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

final class TimStateConfigTest {

    @Test
    void overrideVariableWinsOnEveryPlatform() {
        Map<String, String> env = Map.of(
                TimStateConfig.CONFIG_ROOT_ENV, "/tmp/tim-override",
                "XDG_CONFIG_HOME", "/xdg",
                "APPDATA", "C:\\Users\\a\\AppData\\Roaming"
        );
        Assertions.assertEquals(Paths.get("/tmp/tim-override"),
                TimStateConfig.resolveConfigRoot(env, "Linux", "/home/a"));
        Assertions.assertEquals(Paths.get("/tmp/tim-override"),
                TimStateConfig.resolveConfigRoot(env, "Windows 11", "C:\\Users\\a"));
    }

    @Test
    void unixUsesXdgConfigHomeThenDotConfig() {
        Assertions.assertEquals(Paths.get("/xdg", "tim"),
                TimStateConfig.resolveConfigRoot(Map.of("XDG_CONFIG_HOME", "/xdg"), "Linux", "/home/a"));
        Assertions.assertEquals(Paths.get("/home/a", ".config", "tim"),
                TimStateConfig.resolveConfigRoot(Map.of(), "Mac OS X", "/home/a"));
        Assertions.assertEquals(Paths.get("/home/a", ".config", "tim"),
                TimStateConfig.resolveConfigRoot(Map.of("XDG_CONFIG_HOME", "  "), "Linux", "/home/a"));
    }

    @Test
    void windowsUsesAppDataThenRoamingUnderHome() {
        Assertions.assertEquals(Paths.get("/appdata", "tim"),
                TimStateConfig.resolveConfigRoot(Map.of("APPDATA", "/appdata"), "Windows 10", "/home/a"));
        Assertions.assertEquals(Paths.get("/home/a", "AppData", "Roaming", "tim"),
                TimStateConfig.resolveConfigRoot(Map.of(), "Windows 10", "/home/a"));
    }

    @Test
    void legacyFileLayoutHangsOffTheConfigRoot() {
        TimStateConfig config = TimStateConfig.fromRoot("build/tim-config-test");
        Path root = config.configRoot();

        Assertions.assertTrue(root.isAbsolute());
        Assertions.assertEquals(root.resolve("tim.db"), config.dbFile());
        Assertions.assertEquals(root.resolve("workspaces.json"), config.workspacesFile());
        Assertions.assertEquals(root.resolve("shared").resolve("repo-a").resolve("assignments.json"),
                config.assignmentsFile("repo-a"));
        Assertions.assertEquals(root.resolve("shared").resolve("repo-a").resolve("permissions.json"),
                config.permissionsFile("repo-a"));
        Assertions.assertEquals(root.resolve("repositories").resolve("repo-a").resolve("metadata.json"),
                config.metadataFile("repo-a"));
    }

    @Test
    void nullRootIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TimStateConfig(null));
    }
}
