// file: engine/src/main/java/io/docsync/engine/SyncEngine.java
package io.docsync.engine;

import io.docsync.core.ConsistencyException;
import io.docsync.core.Document;
import io.docsync.core.StoreException;
import io.docsync.engine.load.DocumentLoader;
import io.docsync.engine.load.LoadResult;
import io.docsync.engine.load.SourceDocument;
import io.docsync.engine.load.SourceRoot;
import io.docsync.storage.UpsertOutcome;
import io.docsync.storage.UpsertResult;
import io.docsync.storage.VersionStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Disk -> store reconciliation.
 *
 * Responsibilities:
 *  - Verify store integrity before touching anything (ConsistencyException aborts).
 *  - Make sure the configured project exists.
 *  - Load documents, upsert each one and route the outcome into a {@link SyncSummary}.
 *  - Keep going on per-document failures of any kind; only consistency failures propagate.
 *
 * Every upsert is atomic in the store, so an interrupted run leaves each
 * document either fully written or untouched.
 */
public final class SyncEngine {
    private static final Logger log = Logger.getLogger(SyncEngine.class.getName());

    private final VersionStore store;
    private final DocumentLoader loader;
    private final String projectRef;
    private final String projectDescription;

    public SyncEngine(VersionStore store, DocumentLoader loader) {
        this(store, loader, null, null);
    }

    public SyncEngine(VersionStore store, DocumentLoader loader, String projectRef, String projectDescription) {
        this.store = Objects.requireNonNull(store, "store");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.projectRef = projectRef;
        this.projectDescription = projectDescription;
    }

    public SyncSummary sync(List<SourceRoot> roots) {
        long start = System.nanoTime();
        store.verifyIntegrity();

        SyncSummary.Builder summary = new SyncSummary.Builder(false);
        String ref = ensureProject(summary);

        LoadResult loaded = loader.load(roots);
        loaded.errors().forEach(e -> summary.error(SyncError.load(e)));

        for (SourceDocument doc : loaded.documents()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warning("Sync interrupted; stopping before '" + doc.name() + "'");
                break;
            }
            try {
                UpsertResult r = store.upsert(doc.name(), doc.body(), ref, null);
                summary.record(doc.name(), r.outcome());
            } catch (ConsistencyException e) {
                throw e;
            } catch (StoreException e) {
                summary.error(SyncError.store(doc, e));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Upsert of '" + doc.name() + "' failed", e);
                summary.error(SyncError.failed(doc, e));
            }
        }

        SyncSummary result = summary.build();
        RunLogger.logSync(result, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    /** Classify what {@link #sync} would do without writing anything. */
    public SyncSummary preview(List<SourceRoot> roots) {
        long start = System.nanoTime();
        store.verifyIntegrity();

        SyncSummary.Builder summary = new SyncSummary.Builder(true);
        LoadResult loaded = loader.load(roots);
        loaded.errors().forEach(e -> summary.error(SyncError.load(e)));

        for (SourceDocument doc : loaded.documents()) {
            Optional<Document> current = store.getCurrent(doc.name());
            if (current.isEmpty()) {
                summary.record(doc.name(), UpsertOutcome.CREATED);
                continue;
            }
            Document cur = current.get();
            if (cur.kind() != doc.body().kind()) {
                summary.error(SyncError.store(doc, new StoreException(StoreException.Reason.KIND_MISMATCH,
                        "'" + doc.name() + "' is stored as " + cur.kind().label()
                                + ", found on disk as " + doc.body().kind().label())));
            } else if (cur.contentHash().equals(doc.contentHash())) {
                summary.record(doc.name(), UpsertOutcome.UNCHANGED);
            } else {
                summary.record(doc.name(), UpsertOutcome.UPDATED);
            }
        }

        SyncSummary result = summary.build();
        RunLogger.logSync(result, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    private String ensureProject(SyncSummary.Builder summary) {
        if (projectRef == null) return null;
        if (store.findProject(projectRef).isPresent()) return projectRef;
        try {
            store.registerProject(projectRef, projectDescription);
            log.info(() -> "Registered project '" + projectRef + "'");
            return projectRef;
        } catch (StoreException e) {
            summary.error(SyncError.project(projectRef, e));
            return null;
        }
    }
}
