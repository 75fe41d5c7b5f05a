// file: engine/src/main/java/io/docsync/engine/config/SyncConfig.java
package io.docsync.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docsync.core.CategorySet;
import io.docsync.engine.dto.JsonSyncConfig;
import io.docsync.engine.load.DocumentLoader;
import io.docsync.engine.load.SourceRoot;
import io.docsync.storage.DurableVersionStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything a sync / flatten run needs to know.
 *
 * Fields:
 *  - dataDir:            store directory (wal/, snap/, LOCK)
 *  - commandRoots:       one or more command trees, each with category subdirectories
 *  - planRoot:           plan tree with drafts/, approved/, completed/ (optional)
 *  - categories:         closed command category list
 *  - extension:          document file extension, including the dot
 *  - projectRef:         project documents get associated with on sync (optional)
 *  - projectDescription: description used when that project is registered
 *  - loaderThreads:      reader pool size
 *  - writerThreads:      flatten writer pool size
 *  - snapshotEveryOps:   mutations between store snapshots
 *  - walRotateBytes:     WAL segment size before rotation
 */
public record SyncConfig(
        Path dataDir,
        List<Path> commandRoots,
        Path planRoot,
        CategorySet categories,
        String extension,
        String projectRef,
        String projectDescription,
        int loaderThreads,
        int writerThreads,
        int snapshotEveryOps,
        long walRotateBytes
) {
    public static final Path DEFAULT_DATA_DIR = Path.of("./data/store");
    public static final int DEFAULT_WRITER_THREADS = 4;

    public SyncConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(categories, "categories");
        Objects.requireNonNull(extension, "extension");
        commandRoots = List.copyOf(commandRoots);
        if (commandRoots.isEmpty() && planRoot == null) {
            throw new IllegalArgumentException("at least one command root or a plan root is required");
        }
        if (!extension.startsWith(".") || extension.length() < 2) {
            throw new IllegalArgumentException("extension must start with '.': " + extension);
        }
        if (projectRef != null && projectRef.isBlank()) projectRef = null;
        if (loaderThreads <= 0 || writerThreads <= 0) throw new IllegalArgumentException("thread counts must be > 0");
        if (snapshotEveryOps <= 0) throw new IllegalArgumentException("snapshotEveryOps must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
    }

    /** Defaults for everything except the roots. */
    public static SyncConfig defaults(List<Path> commandRoots, Path planRoot) {
        return new SyncConfig(
                DEFAULT_DATA_DIR,
                commandRoots,
                planRoot,
                CategorySet.defaults(),
                DocumentLoader.DEFAULT_EXTENSION,
                null,
                null,
                DocumentLoader.DEFAULT_THREADS,
                DEFAULT_WRITER_THREADS,
                DurableVersionStore.DEFAULT_SNAPSHOT_EVERY_OPS,
                DurableVersionStore.DEFAULT_WAL_ROTATE_BYTES
        );
    }

    /** Source roots in a fixed order: command roots first, then the plan root. */
    public List<SourceRoot> roots() {
        List<SourceRoot> out = new ArrayList<>();
        for (Path p : commandRoots) out.add(SourceRoot.commands(p));
        if (planRoot != null) out.add(SourceRoot.plans(planRoot));
        return out;
    }

    /**
     * Load from a JSON file. Relative paths resolve against the file's directory;
     * absent fields take the defaults.
     *
     * @throws ConfigException when the file cannot be read or holds invalid values
     */
    public static SyncConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        JsonSyncConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonSyncConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Failed to load SyncConfig from " + path, e);
        }

        Path base = path.toAbsolutePath().getParent();
        List<Path> commandRoots = new ArrayList<>();
        if (cfg.commandRoots != null) {
            for (String r : cfg.commandRoots) commandRoots.add(base.resolve(r));
        }
        try {
            return new SyncConfig(
                    cfg.dataDir != null ? base.resolve(cfg.dataDir) : base.resolve(DEFAULT_DATA_DIR),
                    commandRoots,
                    cfg.planRoot != null ? base.resolve(cfg.planRoot) : null,
                    cfg.categories != null ? CategorySet.of(cfg.categories) : CategorySet.defaults(),
                    cfg.extension != null ? cfg.extension : DocumentLoader.DEFAULT_EXTENSION,
                    cfg.projectRef,
                    cfg.projectDescription,
                    cfg.loaderThreads != null ? cfg.loaderThreads : DocumentLoader.DEFAULT_THREADS,
                    cfg.writerThreads != null ? cfg.writerThreads : DEFAULT_WRITER_THREADS,
                    cfg.snapshotEveryOps != null ? cfg.snapshotEveryOps : DurableVersionStore.DEFAULT_SNAPSHOT_EVERY_OPS,
                    cfg.walRotateBytes != null ? cfg.walRotateBytes : DurableVersionStore.DEFAULT_WAL_ROTATE_BYTES
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid config in " + path + ": " + e.getMessage(), e);
        }
    }

    public SyncConfig withDataDir(Path dir) {
        return new SyncConfig(dir, commandRoots, planRoot, categories, extension, projectRef,
                projectDescription, loaderThreads, writerThreads, snapshotEveryOps, walRotateBytes);
    }

    public SyncConfig withProject(String ref, String description) {
        return new SyncConfig(dataDir, commandRoots, planRoot, categories, extension, ref,
                description, loaderThreads, writerThreads, snapshotEveryOps, walRotateBytes);
    }
}
