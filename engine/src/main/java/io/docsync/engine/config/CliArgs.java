// file: engine/src/main/java/io/docsync/engine/config/CliArgs.java
package io.docsync.engine.config;

import io.docsync.core.CategorySet;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line parsed into options plus a command.
 *
 * Supported flags (all optional; flags override values from --config):
 *   --config,      -c   <file>     JSON config file
 *   --data,        -d   <dir>      store directory
 *   --commands          <dir>      command root (repeatable)
 *   --plans             <dir>      plan root
 *   --categories        <a,b,...>  command categories
 *   --project,     -p   <ref>      project to associate documents with
 *   --json                         JSON output
 *   --help,        -h
 */
public record CliArgs(
        Path configFile,
        Path dataDir,
        List<Path> commandRoots,
        Path planRoot,
        List<String> categories,
        String projectRef,
        boolean json,
        boolean help,
        String command,
        List<String> commandArgs
) {
    public static final List<String> COMMANDS = List.of(
            "sync", "preview", "flatten", "history", "rollback",
            "register-project", "remove-project", "verify");

    /**
     * @throws IllegalArgumentException on unknown options, missing values or an unknown command
     */
    public static CliArgs parse(String[] args) {
        Path configFile = null;
        Path dataDir = null;
        List<Path> commandRoots = new ArrayList<>();
        Path planRoot = null;
        List<String> categories = null;
        String projectRef = null;
        boolean json = false;
        boolean help = false;
        String command = null;
        List<String> rest = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            if (command != null) {
                if (args[i].equals("--json")) json = true;
                else rest.add(args[i]);
                continue;
            }
            switch (args[i]) {
                case "--help", "-h" -> help = true;
                case "--config", "-c" -> configFile = Path.of(value(args, i++));
                case "--data", "-d" -> dataDir = Path.of(value(args, i++));
                case "--commands" -> commandRoots.add(Path.of(value(args, i++)));
                case "--plans" -> planRoot = Path.of(value(args, i++));
                case "--categories" -> categories = Arrays.stream(value(args, i++).split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList();
                case "--project", "-p" -> projectRef = value(args, i++);
                case "--json" -> json = true;
                default -> {
                    if (args[i].startsWith("-")) throw new IllegalArgumentException("Unknown option: " + args[i]);
                    if (!COMMANDS.contains(args[i])) throw new IllegalArgumentException("Unknown command: " + args[i]);
                    command = args[i];
                }
            }
        }
        if (command == null && !help) throw new IllegalArgumentException("Missing command");
        return new CliArgs(configFile, dataDir, commandRoots, planRoot, categories, projectRef,
                json, help, command, rest);
    }

    /**
     * Merge: config file (or defaults) first, then flag overrides.
     *
     * @throws ConfigException when the result is not a usable configuration
     */
    public SyncConfig toConfig() {
        SyncConfig base;
        if (configFile != null) {
            base = SyncConfig.fromJsonFile(configFile);
        } else {
            if (commandRoots.isEmpty() && planRoot == null) {
                throw new ConfigException("No source roots: pass --config, --commands or --plans");
            }
            base = SyncConfig.defaults(commandRoots, planRoot);
        }
        try {
            return new SyncConfig(
                    dataDir != null ? dataDir : base.dataDir(),
                    !commandRoots.isEmpty() ? commandRoots : base.commandRoots(),
                    planRoot != null ? planRoot : base.planRoot(),
                    categories != null ? CategorySet.of(categories) : base.categories(),
                    base.extension(),
                    projectRef != null ? projectRef : base.projectRef(),
                    base.projectDescription(),
                    base.loaderThreads(),
                    base.writerThreads(),
                    base.snapshotEveryOps(),
                    base.walRotateBytes()
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid options: " + e.getMessage(), e);
        }
    }

    public static String usage() {
        return """
            Usage: docsync [options] <command> [args]

            Commands:
              sync                              Load documents from disk into the store
              preview                           Show what sync would do, without writing
              flatten                           Write current documents from the store to disk
              history <name>                    List every version of a document
              rollback <name> <version> [note]  Make an old version current again
              register-project <ref> [desc]     Register a project
              remove-project <ref>              Remove a project and clear its references
              verify                            Check stored hashes and history

            Options:
              --config,  -c   JSON config file
              --data,    -d   Store directory (default: ./data/store)
              --commands      Command root directory (repeatable)
              --plans         Plan root directory
              --categories    Comma-separated command categories
                              (default: archive,go,js,mcp,python,tools)
              --project, -p   Project to associate synced documents with
              --json          JSON output
              --help,    -h   Show this help message
            """;
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option: " + args[i]);
        return args[i + 1];
    }
}
