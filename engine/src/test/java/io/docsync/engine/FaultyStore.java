package io.docsync.engine;

import io.docsync.core.ConsistencyException;
import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;
import io.docsync.storage.UpsertResult;
import io.docsync.storage.VersionStore;

import java.util.List;
import java.util.Optional;

/** Delegates everything, except for the faults it was built to inject. */
final class FaultyStore implements VersionStore {
    private final VersionStore delegate;
    private final boolean corruptBaseline;
    private final String brokenName;

    private FaultyStore(VersionStore delegate, boolean corruptBaseline, String brokenName) {
        this.delegate = delegate;
        this.corruptBaseline = corruptBaseline;
        this.brokenName = brokenName;
    }

    /** verifyIntegrity() reports a corrupted baseline. */
    static FaultyStore corruptBaseline(VersionStore delegate) {
        return new FaultyStore(delegate, true, null);
    }

    /** upsert() of the given name fails with an unexpected runtime error. */
    static FaultyStore failingUpsertOf(VersionStore delegate, String name) {
        return new FaultyStore(delegate, false, name);
    }

    @Override
    public void verifyIntegrity() {
        if (corruptBaseline) throw new ConsistencyException("id-broken", 1, "stored hash does not match content");
        delegate.verifyIntegrity();
    }

    @Override
    public UpsertResult upsert(String name, DocumentBody body, String projectRef, String changeSummary) {
        if (name.equals(brokenName)) throw new IllegalStateException("disk went away while writing " + name);
        return delegate.upsert(name, body, projectRef, changeSummary);
    }

    @Override public Optional<Document> getCurrent(String name) { return delegate.getCurrent(name); }
    @Override public Optional<Document> getById(String id) { return delegate.getById(id); }
    @Override public Optional<Document> getVersion(String id, int version) { return delegate.getVersion(id, version); }
    @Override public List<HistoryRecord> history(String id) { return delegate.history(id); }
    @Override public UpsertResult rollback(String id, int version, String changeSummary) {
        return delegate.rollback(id, version, changeSummary);
    }
    @Override public List<Document> currentSnapshot() { return delegate.currentSnapshot(); }
    @Override public Project registerProject(String ref, String description) { return delegate.registerProject(ref, description); }
    @Override public Optional<Project> findProject(String ref) { return delegate.findProject(ref); }
    @Override public int removeProject(String ref) { return delegate.removeProject(ref); }
    @Override public void recordMetric(MetricPoint point) { delegate.recordMetric(point); }
    @Override public List<MetricPoint> metrics(String documentId, int version) { return delegate.metrics(documentId, version); }
    @Override public void close() { delegate.close(); }
}
