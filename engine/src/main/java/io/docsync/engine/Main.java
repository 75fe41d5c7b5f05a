// file: engine/src/main/java/io/docsync/engine/Main.java
package io.docsync.engine;

import io.docsync.core.ConsistencyException;
import io.docsync.core.Document;
import io.docsync.core.StoreException;
import io.docsync.engine.config.CliArgs;
import io.docsync.engine.config.ConfigException;
import io.docsync.engine.config.SyncConfig;
import io.docsync.engine.load.CategoryResolver;
import io.docsync.engine.load.DocumentLoader;
import io.docsync.engine.load.SourceRoot;
import io.docsync.storage.DurableVersionStore;
import io.docsync.storage.UpsertResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * Responsibilities:
 *  - Parse options and build a {@link SyncConfig}.
 *  - Open the store (holding its directory lock for the whole run).
 *  - Dispatch to SyncEngine, Flattener or a single store operation.
 *  - Map outcomes to exit codes:
 *      0 ok, 1 per-item errors or a failed store operation,
 *      2 usage / configuration error, 3 store consistency failure.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CONSISTENCY = 3;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs cli;
        SyncConfig cfg;
        try {
            cli = CliArgs.parse(args);
            if (cli.help()) {
                out.println(CliArgs.usage());
                return EXIT_OK;
            }
            cfg = cli.toConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println(e.getMessage());
            err.println(CliArgs.usage());
            return EXIT_USAGE;
        }

        ReportPrinter printer = new ReportPrinter(out, cli.json());
        try (DurableVersionStore store = DurableVersionStore.open(
                cfg.dataDir(), cfg.walRotateBytes(), cfg.snapshotEveryOps(), Clock.systemUTC())) {
            return dispatch(cli, cfg, store, printer, err);
        } catch (ConsistencyException e) {
            log.log(Level.SEVERE, "Store integrity check failed", e);
            err.println("Store integrity check failed: " + e.getMessage());
            return EXIT_CONSISTENCY;
        } catch (ConfigException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (StoreException e) {
            err.println(e.reason() + ": " + e.getMessage());
            return EXIT_ERRORS;
        }
    }

    private static int dispatch(
            CliArgs cli,
            SyncConfig cfg,
            DurableVersionStore store,
            ReportPrinter printer,
            PrintStream err
    ) {
        CategoryResolver resolver = new CategoryResolver(cfg.categories());
        DocumentLoader loader = new DocumentLoader(resolver, cfg.extension(), cfg.loaderThreads());
        List<String> args = cli.commandArgs();

        switch (cli.command()) {
            case "sync" -> {
                List<SourceRoot> roots = cfg.roots();
                for (SourceRoot r : roots) resolver.ensureDirectories(r);
                var engine = new SyncEngine(store, loader, cfg.projectRef(), cfg.projectDescription());
                SyncSummary s = engine.sync(roots);
                printer.sync("sync", s);
                return s.hasErrors() ? EXIT_ERRORS : EXIT_OK;
            }
            case "preview" -> {
                SyncSummary s = new SyncEngine(store, loader).preview(cfg.roots());
                printer.sync("preview", s);
                return s.hasErrors() ? EXIT_ERRORS : EXIT_OK;
            }
            case "flatten" -> {
                List<SourceRoot> roots = cfg.roots();
                for (SourceRoot r : roots) resolver.ensureDirectories(r);
                store.verifyIntegrity();
                FlattenSummary s = new Flattener(store, resolver, cfg.extension(), cfg.writerThreads()).flatten(roots);
                printer.flatten(s);
                return s.hasErrors() ? EXIT_ERRORS : EXIT_OK;
            }
            case "history" -> {
                if (args.size() != 1) return usage(err, "history takes exactly one document name");
                Document current = requireDocument(store, args.get(0));
                printer.history(current, store.history(current.id()));
                return EXIT_OK;
            }
            case "rollback" -> {
                if (args.size() < 2) return usage(err, "rollback takes a document name and a version");
                int version;
                try {
                    version = Integer.parseInt(args.get(1));
                } catch (NumberFormatException e) {
                    return usage(err, "Invalid version: " + args.get(1));
                }
                Document current = requireDocument(store, args.get(0));
                String note = args.size() > 2 ? String.join(" ", args.subList(2, args.size())) : null;
                UpsertResult r = store.rollback(current.id(), version, note);
                printer.document("rollback", r);
                return EXIT_OK;
            }
            case "register-project" -> {
                if (args.isEmpty()) return usage(err, "register-project takes a project ref");
                String description = args.size() > 1 ? String.join(" ", args.subList(1, args.size())) : null;
                store.registerProject(args.get(0), description);
                printer.message("registered project " + args.get(0));
                return EXIT_OK;
            }
            case "remove-project" -> {
                if (args.size() != 1) return usage(err, "remove-project takes exactly one project ref");
                int cleared = store.removeProject(args.get(0));
                printer.message("removed project " + args.get(0) + ", cleared " + cleared + " document references");
                return EXIT_OK;
            }
            case "verify" -> {
                store.verifyIntegrity();
                printer.message("store ok");
                return EXIT_OK;
            }
            default -> {
                return usage(err, "Unknown command: " + cli.command());
            }
        }
    }

    private static Document requireDocument(DurableVersionStore store, String name) {
        return store.getCurrent(name).orElseThrow(() ->
                new StoreException(StoreException.Reason.NOT_FOUND, "no document named '" + name + "'"));
    }

    private static int usage(PrintStream err, String message) {
        err.println(message);
        err.println(CliArgs.usage());
        return EXIT_USAGE;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Could not read logging.properties: " + e.getMessage());
        }
    }
}
