// file: storage/src/main/java/io/docsync/storage/StoreState.java
package io.docsync.storage;

import io.docsync.core.Document;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * In-memory tables of the version store.
 * <p>
 * Tables:
 *  - current:  name -> Document (exactly one row per name)
 *  - ids:      id -> name
 *  - history:  id -> (version -> HistoryRecord), append-only
 *  - projects: ref -> Project
 *  - metrics:  (documentId, version, metric, step) -> MetricPoint
 * <p>
 * Not thread-safe: the owning store guards it with its read/write lock.
 * {@link #apply} is the only way to change the tables, and it is used both
 * for live writes and for WAL replay, so both paths enforce the same rules.
 */
final class StoreState {
    private final Map<String, Document> current = new HashMap<>();
    private final Map<String, String> ids = new HashMap<>();
    private final Map<String, NavigableMap<Integer, HistoryRecord>> history = new HashMap<>();
    private final Map<String, Project> projects = new LinkedHashMap<>();
    private final Map<MetricPoint.Key, MetricPoint> metrics = new LinkedHashMap<>();
    private long lastSeq;

    long lastSeq() { return lastSeq; }

    long nextSeq() { return lastSeq + 1; }

    Document current(String name) { return current.get(name); }

    Document currentById(String id) {
        String name = ids.get(id);
        return name == null ? null : current.get(name);
    }

    HistoryRecord history(String id, int version) {
        NavigableMap<Integer, HistoryRecord> versions = history.get(id);
        return versions == null ? null : versions.get(version);
    }

    List<HistoryRecord> history(String id) {
        NavigableMap<Integer, HistoryRecord> versions = history.get(id);
        return versions == null ? List.of() : List.copyOf(versions.values());
    }

    List<Document> currentSorted() {
        List<Document> all = new ArrayList<>(current.values());
        all.sort(Comparator.comparing(Document::name));
        return all;
    }

    int currentCount() { return current.size(); }

    int historyCount() {
        int n = 0;
        for (var versions : history.values()) n += versions.size();
        return n;
    }

    Project project(String ref) { return projects.get(ref); }

    List<Project> projects() { return List.copyOf(projects.values()); }

    List<MetricPoint> metrics() { return List.copyOf(metrics.values()); }

    List<MetricPoint> metrics(String documentId, int version) {
        List<MetricPoint> out = new ArrayList<>();
        for (MetricPoint p : metrics.values()) {
            if (p.documentId().equals(documentId) && p.version() == version) out.add(p);
        }
        out.sort(Comparator.comparing(MetricPoint::metricName).thenComparingInt(MetricPoint::step));
        return out;
    }

    /**
     * Apply one mutation.
     *
     * @throws IllegalStateException if the mutation does not fit the current
     *         tables (wrong sequence, version gap, duplicate row, ...)
     */
    void apply(Mutation m) {
        if (m.seq() != lastSeq + 1) {
            throw new IllegalStateException("Mutation seq " + m.seq() + " does not follow " + lastSeq);
        }
        if (m instanceof Mutation.Create c) {
            applyCreate(c.document());
        } else if (m instanceof Mutation.Revise r) {
            applyRevise(r.archived(), r.next());
        } else if (m instanceof Mutation.RegisterProject p) {
            projects.put(p.project().ref(), p.project());
        } else if (m instanceof Mutation.RemoveProject p) {
            applyRemoveProject(p);
        } else if (m instanceof Mutation.RecordMetric rm) {
            metrics.put(rm.point().key(), rm.point());
        } else {
            throw new IllegalStateException("Unknown mutation type: " + m);
        }
        lastSeq = m.seq();
    }

    /** Replace the whole state with a snapshot's content. */
    void restore(Snapshotter.LoadedSnapshot snap) {
        current.clear();
        ids.clear();
        history.clear();
        projects.clear();
        metrics.clear();
        for (Document d : snap.current()) {
            current.put(d.name(), d);
            ids.put(d.id(), d.name());
        }
        for (HistoryRecord h : snap.history()) {
            history.computeIfAbsent(h.id(), k -> new TreeMap<>()).put(h.version(), h);
        }
        for (Project p : snap.projects()) projects.put(p.ref(), p);
        for (MetricPoint p : snap.metrics()) metrics.put(p.key(), p);
        lastSeq = snap.lastSeq();
    }

    /** Immutable copy for a snapshot. */
    Snapshotter.LoadedSnapshot copy() {
        List<HistoryRecord> allHistory = new ArrayList<>(historyCount());
        for (var versions : history.values()) allHistory.addAll(versions.values());
        return new Snapshotter.LoadedSnapshot(
                null,
                lastSeq,
                currentSorted(),
                allHistory,
                projects(),
                metrics()
        );
    }

    // ---------- internals ----------

    private void applyCreate(Document d) {
        if (current.containsKey(d.name())) {
            throw new IllegalStateException("Current row already exists for name " + d.name());
        }
        if (ids.containsKey(d.id())) {
            throw new IllegalStateException("Document id already in use: " + d.id());
        }
        if (d.version() != 1) {
            throw new IllegalStateException("New document " + d.name() + " must start at version 1");
        }
        current.put(d.name(), d);
        ids.put(d.id(), d.name());
    }

    private void applyRevise(HistoryRecord archived, Document next) {
        Document existing = current.get(next.name());
        Document old = archived.document();
        if (existing == null || !existing.id().equals(old.id()) || !existing.id().equals(next.id())) {
            throw new IllegalStateException("Revision of " + next.name() + " does not match its current row");
        }
        if (existing.version() != old.version() || next.version() != old.version() + 1) {
            throw new IllegalStateException("Revision of " + next.name() + " skips a version: current="
                    + existing.version() + " archived=" + old.version() + " next=" + next.version());
        }
        NavigableMap<Integer, HistoryRecord> versions = history.computeIfAbsent(old.id(), k -> new TreeMap<>());
        if (versions.containsKey(old.version())) {
            throw new IllegalStateException("History already holds " + old.id() + "@" + old.version());
        }
        versions.put(old.version(), archived);
        current.put(next.name(), next);
    }

    private void applyRemoveProject(Mutation.RemoveProject p) {
        projects.remove(p.ref());
        for (Map.Entry<String, Document> e : current.entrySet()) {
            Document d = e.getValue();
            if (p.ref().equals(d.projectRef())) {
                e.setValue(d.withoutProject(p.at()));
            }
        }
    }
}
