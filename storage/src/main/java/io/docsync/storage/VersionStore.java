// file: storage/src/main/java/io/docsync/storage/VersionStore.java
package io.docsync.storage;

import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;

import java.util.List;
import java.util.Optional;

/**
 * Current + history tables for versioned documents.
 * <p>
 * Semantics:
 *  - Every mutation is durable before it returns (WAL+fsync).
 *  - upsert() is atomic: the archive of version N and the update to N+1
 *    are one record; readers never see one without the other.
 *  - History is append-only; versions of an id are exactly 1..current-1.
 *  - Store failures for one document surface as {@link io.docsync.core.StoreException};
 *    a corrupt baseline surfaces as {@link io.docsync.core.ConsistencyException}.
 */
public interface VersionStore extends AutoCloseable {

    Optional<Document> getCurrent(String name);

    Optional<Document> getById(String id);

    /**
     * Insert, update or leave alone the current row for name.
     * <ul>
     *   <li>No row: insert version 1 (CREATED).</li>
     *   <li>Same content hash: no writes (UNCHANGED), even if the category moved.</li>
     *   <li>Otherwise: archive the row as-is, then bump version (UPDATED).</li>
     * </ul>
     *
     * @param projectRef    optional project; must be registered. Null keeps the existing association.
     * @param changeSummary optional note stored on the archived row; a default is derived when null
     */
    UpsertResult upsert(String name, DocumentBody body, String projectRef, String changeSummary);

    default UpsertResult upsert(String name, DocumentBody body) {
        return upsert(name, body, null, null);
    }

    /** Version of a document from either the current row or history. */
    Optional<Document> getVersion(String id, int version);

    /** Archived versions of a document, oldest first. */
    List<HistoryRecord> history(String id);

    /**
     * Make the content of an earlier version current again as a NEW version.
     * Nothing is deleted; rolling back to content equal to the current row is UNCHANGED.
     */
    UpsertResult rollback(String id, int version, String changeSummary);

    /** Consistent view of all current rows, ordered by name. */
    List<Document> currentSnapshot();

    /**
     * Recompute every stored hash and check history contiguity.
     *
     * @throws io.docsync.core.ConsistencyException on the first violation found
     */
    void verifyIntegrity();

    /** Register a project; registering an existing ref returns the stored project unchanged. */
    Project registerProject(String ref, String description);

    Optional<Project> findProject(String ref);

    /**
     * Remove a project and clear project_ref on every current row pointing at it.
     * Documents are never deleted.
     *
     * @return number of current rows whose reference was cleared
     */
    int removeProject(String ref);

    /** Insert or replace one metric sample for an existing document version. */
    void recordMetric(MetricPoint point);

    List<MetricPoint> metrics(String documentId, int version);

    @Override
    void close();
}
