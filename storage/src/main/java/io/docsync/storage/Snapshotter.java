// file: storage/src/main/java/io/docsync/storage/Snapshotter.java
package io.docsync.storage;

import io.docsync.core.Document;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;

import java.util.List;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store tables at some WAL sequence.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records with a higher sequence.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the tables.
     *
     * @param state immutable copy of the tables
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(LoadedSnapshot state);

    /** Load the latest snapshot if present, or null. */
    LoadedSnapshot loadLatest();

    /** Snapshot id (null before it is written) and its data. */
    record LoadedSnapshot(
            String id,
            long lastSeq,
            List<Document> current,
            List<HistoryRecord> history,
            List<Project> projects,
            List<MetricPoint> metrics
    ) {}
}
