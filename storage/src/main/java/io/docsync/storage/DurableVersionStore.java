// file: storage/src/main/java/io/docsync/storage/DurableVersionStore.java
package io.docsync.storage;

import io.docsync.core.ConsistencyException;
import io.docsync.core.ContentHash;
import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;
import io.docsync.core.StoreException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable version store backed by a write-ahead log and periodic snapshots.
 * <p>
 * Responsibilities:
 *  - Maintain the in-memory tables (current, history, projects, metrics).
 *  - On write:
 *      1) Read-compare under the write lock and build exactly one Mutation.
 *      2) Serialize it to a WAL record, append+fsync.
 *      3) Apply it to memory (only after the record is durable).
 *      4) Rotate WAL segment if needed.
 *      5) Possibly take a snapshot based on SnapshotPolicy, then prune WAL segments it covers.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records whose sequence is newer than the snapshot.
 * <p>
 * Concurrency:
 *  - Writers are serialized by a write lock and evaluate the hash comparison
 *    inside it, so a writer racing on the same name always compares against
 *    the winner's row instead of a stale read.
 *  - Readers share the read lock and receive immutable records.
 */
public final class DurableVersionStore implements VersionStore {
    private static final Logger log = Logger.getLogger(DurableVersionStore.class.getName());

    public static final long DEFAULT_WAL_ROTATE_BYTES = 64L * 1024 * 1024;
    public static final int DEFAULT_SNAPSHOT_EVERY_OPS = 1_000;

    private final StoreState state = new StoreState();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;
    private final Supplier<String> ids;
    private final StoreLock dirLock; // null when constructed from parts
    private boolean closed;

    public DurableVersionStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock) {
        this(wal, snaps, snapPolicy, clock, () -> UUID.randomUUID().toString(), null);
    }

    DurableVersionStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock,
                        Supplier<String> ids, StoreLock dirLock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.dirLock = dirLock;
        recover();
    }

    /** Open (or create) a store directory with default tuning. */
    public static DurableVersionStore open(Path dir) {
        return open(dir, DEFAULT_WAL_ROTATE_BYTES, DEFAULT_SNAPSHOT_EVERY_OPS, Clock.systemUTC());
    }

    /**
     * Open (or create) a store directory laid out as:
     *   dir/LOCK  exclusive lock held while open
     *   dir/wal/  WAL segments
     *   dir/snap/ snapshots
     */
    public static DurableVersionStore open(Path dir, long walRotateBytes, int snapshotEveryOps, Clock clock) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StoreException(StoreException.Reason.IO, "Cannot create store directory " + dir, e);
        }
        StoreLock lock = StoreLock.acquire(dir);
        try {
            var wal = new FileWal(dir.resolve("wal"), walRotateBytes);
            var snaps = new FileSnapshotter(dir.resolve("snap"));
            return new DurableVersionStore(wal, snaps, new SnapshotPolicy(snapshotEveryOps), clock,
                    () -> UUID.randomUUID().toString(), lock);
        } catch (RuntimeException e) {
            lock.close();
            throw e;
        }
    }

    // ---------- reads ----------

    @Override
    public Optional<Document> getCurrent(String name) {
        rw.readLock().lock();
        try {
            return Optional.ofNullable(state.current(name));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<Document> getById(String id) {
        rw.readLock().lock();
        try {
            return Optional.ofNullable(state.currentById(id));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<Document> getVersion(String id, int version) {
        rw.readLock().lock();
        try {
            Document current = state.currentById(id);
            if (current == null) return Optional.empty();
            if (current.version() == version) return Optional.of(current);
            HistoryRecord h = state.history(id, version);
            return h == null ? Optional.empty() : Optional.of(h.document());
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<HistoryRecord> history(String id) {
        rw.readLock().lock();
        try {
            return state.history(id);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<Document> currentSnapshot() {
        rw.readLock().lock();
        try {
            return List.copyOf(state.currentSorted());
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<Project> findProject(String ref) {
        rw.readLock().lock();
        try {
            return Optional.ofNullable(state.project(ref));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<MetricPoint> metrics(String documentId, int version) {
        rw.readLock().lock();
        try {
            return state.metrics(documentId, version);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public void verifyIntegrity() {
        rw.readLock().lock();
        try {
            for (Document d : state.currentSorted()) {
                requireIntact(d);
                List<HistoryRecord> versions = state.history(d.id());
                for (int i = 0; i < versions.size(); i++) {
                    HistoryRecord h = versions.get(i);
                    if (h.version() != i + 1) {
                        throw new ConsistencyException(d.id(), i + 1,
                                "History of '" + d.name() + "' is missing version " + (i + 1));
                    }
                    requireIntact(h.document());
                }
                if (versions.size() != d.version() - 1) {
                    throw new ConsistencyException(d.id(), d.version(),
                            "History of '" + d.name() + "' holds " + versions.size()
                                    + " versions but current version is " + d.version());
                }
            }
        } finally {
            rw.readLock().unlock();
        }
    }

    // ---------- writes ----------

    @Override
    public UpsertResult upsert(String name, DocumentBody body, String projectRef, String changeSummary) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        rw.writeLock().lock();
        try {
            ensureOpen();
            requireProject(projectRef);
            String hash = ContentHash.of(body.content());
            Instant now = clock.instant();

            Document existing = state.current(name);
            if (existing == null) {
                Document created = Document.create(newId(), name, body, projectRef, now);
                commit(new Mutation.Create(state.nextSeq(), created));
                return new UpsertResult(UpsertOutcome.CREATED, created);
            }

            // never archive a row whose own hash is already wrong
            requireIntact(existing);
            if (existing.kind() != body.kind()) {
                throw new StoreException(StoreException.Reason.KIND_MISMATCH,
                        "'" + name + "' is stored as " + existing.kind() + ", not " + body.kind());
            }
            // unchanged content writes nothing, placement included
            if (existing.contentHash().equals(hash)) {
                return new UpsertResult(UpsertOutcome.UNCHANGED, existing);
            }

            String summary = changeSummary != null ? changeSummary : describeChange(existing, body);
            HistoryRecord archived = new HistoryRecord(existing, now, summary);
            Document next = existing.revise(body, projectRef, now);
            commit(new Mutation.Revise(state.nextSeq(), archived, next));
            return new UpsertResult(UpsertOutcome.UPDATED, next);
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public UpsertResult rollback(String id, int version, String changeSummary) {
        rw.writeLock().lock();
        try {
            Document current = state.currentById(id);
            if (current == null) {
                throw new StoreException(StoreException.Reason.NOT_FOUND, "Unknown document id " + id);
            }
            Document target;
            if (version == current.version()) {
                target = current;
            } else {
                HistoryRecord h = state.history(id, version);
                if (h == null) {
                    throw new StoreException(StoreException.Reason.NOT_FOUND,
                            "'" + current.name() + "' has no version " + version);
                }
                target = h.document();
            }
            requireIntact(target);
            String summary = changeSummary != null ? changeSummary : "rollback to version " + version;
            return upsert(current.name(), current.body().withContent(target.content()), null, summary);
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public Project registerProject(String ref, String description) {
        Objects.requireNonNull(ref, "ref");
        rw.writeLock().lock();
        try {
            ensureOpen();
            Project existing = state.project(ref);
            if (existing != null) return existing;
            Project p = new Project(ref, description, clock.instant());
            commit(new Mutation.RegisterProject(state.nextSeq(), p));
            return p;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public int removeProject(String ref) {
        Objects.requireNonNull(ref, "ref");
        rw.writeLock().lock();
        try {
            ensureOpen();
            if (state.project(ref) == null) {
                throw new StoreException(StoreException.Reason.NOT_FOUND, "Unknown project " + ref);
            }
            int cleared = 0;
            for (Document d : state.currentSorted()) {
                if (ref.equals(d.projectRef())) cleared++;
            }
            commit(new Mutation.RemoveProject(state.nextSeq(), ref, clock.instant()));
            return cleared;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public void recordMetric(MetricPoint point) {
        Objects.requireNonNull(point, "point");
        rw.writeLock().lock();
        try {
            ensureOpen();
            Document current = state.currentById(point.documentId());
            boolean known = current != null && (current.version() == point.version()
                    || state.history(point.documentId(), point.version()) != null);
            if (!known) {
                throw new StoreException(StoreException.Reason.NOT_FOUND,
                        "No document version " + point.documentId() + "@" + point.version());
            }
            commit(new Mutation.RecordMetric(state.nextSeq(), point));
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Write a snapshot now and drop the WAL segments it covers.
     * The snapshot policy does this automatically every N mutations.
     */
    public void checkpoint() {
        rw.writeLock().lock();
        try {
            ensureOpen();
            checkpointLocked();
            snapPolicy.reset();
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        rw.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            try {
                wal.close();
            } finally {
                if (dirLock != null) dirLock.close();
            }
        } finally {
            rw.writeLock().unlock();
        }
    }

    // ---------- internals ----------

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records in order, skipping sequences the snapshot covers.
     */
    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            state.restore(loaded);
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                Mutation m = RecordCodec.decode(payload);
                if (m.seq() <= state.lastSeq()) continue;
                state.apply(m);
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("Recovery failed", e);
        }

        int replayedOps = replayed;
        log.info(() -> String.format("Recovered %d documents, %d history rows (snapshot=%s, replayed=%d)",
                state.currentCount(), state.historyCount(),
                loaded == null ? "none" : loaded.id(), replayedOps));
    }

    /** Durable append first, then memory. Must hold the write lock. */
    private void commit(Mutation m) {
        byte[] record = RecordCodec.encode(m);
        try {
            wal.append(record);
        } catch (UncheckedIOException e) {
            throw new StoreException(StoreException.Reason.IO, "WAL append failed for seq " + m.seq(), e);
        }
        state.apply(m);

        try {
            wal.rotateIfNeeded();
            snapPolicy.maybeSnapshot(this::checkpointLocked);
        } catch (RuntimeException e) {
            // the mutation is already durable in the WAL; a later checkpoint retries
            log.log(Level.WARNING, "Snapshot/rotation after seq " + m.seq() + " failed", e);
        }
    }

    private void checkpointLocked() {
        String id = snaps.writeSnapshot(state.copy());
        wal.rollover();
        wal.pruneSealedSegments();
        log.fine(() -> "Wrote snapshot " + id);
    }

    private void requireProject(String projectRef) {
        if (projectRef != null && state.project(projectRef) == null) {
            throw new StoreException(StoreException.Reason.DANGLING_PROJECT_REF,
                    "Project '" + projectRef + "' is not registered");
        }
    }

    private static void requireIntact(Document d) {
        if (!d.hashIntact()) {
            throw new ConsistencyException(d.id(), d.version(),
                    "Stored hash of '" + d.name() + "' v" + d.version() + " does not match its content");
        }
    }

    private static String describeChange(Document existing, DocumentBody next) {
        if (!existing.category().equals(next.category())) {
            return "content changed, moved from " + existing.category() + " to " + next.category();
        }
        return "content changed";
    }

    private String newId() {
        String id;
        do {
            id = ids.get();
        } while (state.currentById(id) != null);
        return id;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("store is closed");
    }
}
