package io.timstate.cli;

import io.timstate.config.TimStateConfig;
import io.timstate.legacy.JsonImporter;
import io.timstate.model.Project;
import io.timstate.model.Workspace;
import io.timstate.model.WorkspaceLockInfo;
import io.timstate.storage.Database;
import io.timstate.storage.ProjectStore;
import io.timstate.storage.SchemaMigrator;
import io.timstate.storage.StorageException;
import io.timstate.storage.WorkspaceLockStore;
import io.timstate.storage.WorkspaceStore;
import io.timstate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "tim-state",
        mixinStandardHelpOptions = true,
        description = "Inspect and maintain the tim state database",
        subcommands = {
                TimStateCommand.InfoCommand.class,
                TimStateCommand.ProjectsCommand.class,
                TimStateCommand.WorkspacesCommand.class,
                TimStateCommand.CleanLocksCommand.class,
                TimStateCommand.ImportLegacyCommand.class
        }
)
public final class TimStateCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(TimStateCommand.class);
    private static final List<String> COUNTED_TABLES = List.of(
            "project", "workspace", "workspace_issue", "workspace_lock", "permission", "assignment");

    @Option(names = {"--config-root"}, description = "Configuration root (defaults to $TIM_CONFIG_ROOT or the per-user config dir)")
    String configRoot;

    @Override
    public void run() {
        System.out.println("Use subcommands: info | projects | workspaces | clean-locks | import-legacy");
    }

    /** Command line with storage failures reported as a JSON error line and exit code 2. */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new TimStateCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof StorageException) {
                log.error("{} failed", commandLine.getCommandName(), ex);
                System.err.println(Jsons.mapper().createObjectNode().put("error", ex.getMessage()));
                return 2;
            }
            throw ex;
        });
        return cmd;
    }

    TimStateConfig config() {
        return TimStateConfig.fromRoot(configRoot);
    }

    Database database() {
        return Database.open(config());
    }

    @Command(name = "info", description = "Show database location, schema version and row counts")
    static final class InfoCommand implements Callable<Integer> {
        @ParentCommand
        TimStateCommand parent;

        @Override
        public Integer call() {
            Database database = parent.database();
            Map<String, Long> counts = new LinkedHashMap<>();
            for (String table : COUNTED_TABLES) {
                counts.put(table, database.count(table));
            }
            System.out.println(Jsons.toJson(new InfoView(
                    database.dbFile().toString(),
                    database.schemaVersion(),
                    new SchemaMigrator().latestVersion(),
                    database.importCompleted(),
                    counts
            )));
            return 0;
        }
    }

    @Command(name = "projects", description = "List projects")
    static final class ProjectsCommand implements Callable<Integer> {
        @ParentCommand
        TimStateCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(new ProjectStore(parent.database()).list()));
            return 0;
        }
    }

    @Command(name = "workspaces", description = "List workspaces with their issues and lock")
    static final class WorkspacesCommand implements Callable<Integer> {
        @ParentCommand
        TimStateCommand parent;

        @Option(names = {"--repository"}, description = "Only workspaces of this repository id")
        String repositoryId;

        @Override
        public Integer call() {
            Database database = parent.database();
            WorkspaceStore workspaces = new WorkspaceStore(database);
            WorkspaceLockStore locks = new WorkspaceLockStore(database);

            List<Workspace> rows;
            if (repositoryId == null || repositoryId.isBlank()) {
                rows = workspaces.list();
            } else {
                Optional<Project> project = new ProjectStore(database).get(repositoryId.trim());
                if (project.isEmpty()) {
                    System.out.println("{\"error\":\"project not found\"}");
                    return 1;
                }
                rows = workspaces.findByProjectId(project.get().id());
            }

            List<WorkspaceView> out = new ArrayList<>();
            for (Workspace workspace : rows) {
                Optional<WorkspaceLockInfo> lock = locks.inspectIncludingStale(workspace.id());
                out.add(new WorkspaceView(
                        workspace,
                        workspaces.getIssues(workspace.id()),
                        lock.orElse(null),
                        lock.map(locks::isStale).orElse(false)
                ));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "clean-locks", description = "Delete stale pid locks")
    static final class CleanLocksCommand implements Callable<Integer> {
        @ParentCommand
        TimStateCommand parent;

        @Override
        public Integer call() {
            int removed = new WorkspaceLockStore(parent.database()).cleanStale();
            System.out.println(Jsons.toJson(Map.of("removed", removed)));
            return 0;
        }
    }

    @Command(name = "import-legacy", description = "Import legacy JSON state into the database")
    static final class ImportLegacyCommand implements Callable<Integer> {
        @ParentCommand
        TimStateCommand parent;

        @Option(names = {"--force"}, description = "Import even if an import already ran")
        boolean force;

        @Override
        public Integer call() {
            TimStateConfig config = parent.config();
            Database database = Database.open(config);
            JsonImporter importer = new JsonImporter(database);
            JsonImporter.ImportSummary summary = force
                    ? importer.importFromJsonFiles(config)
                    : importer.importIfNeeded(config);
            if (force) {
                database.markImportCompleted();
            }
            System.out.println(Jsons.toJson(summary));
            return 0;
        }
    }

    record InfoView(String dbFile, int schemaVersion, int latestSchemaVersion, boolean importCompleted,
                    Map<String, Long> counts) {
    }

    record WorkspaceView(Workspace workspace, List<String> issueUrls, WorkspaceLockInfo lock, boolean lockStale) {
    }
}
