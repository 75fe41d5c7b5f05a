// file: storage/src/main/java/io/docsync/storage/Mutation.java
package io.docsync.storage;

import io.docsync.core.Document;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;

import java.time.Instant;

/**
 * One logical store change, persisted as exactly one WAL record.
 * <p>
 * Revise carries both halves of a version transition (the archived row and
 * the new current row), so a crash can never separate them.
 * Every mutation has a store-wide sequence number; recovery skips sequences
 * already covered by the loaded snapshot.
 */
sealed interface Mutation permits Mutation.Create, Mutation.Revise, Mutation.RegisterProject,
        Mutation.RemoveProject, Mutation.RecordMetric {

    long seq();

    record Create(long seq, Document document) implements Mutation {}

    record Revise(long seq, HistoryRecord archived, Document next) implements Mutation {}

    record RegisterProject(long seq, Project project) implements Mutation {}

    record RemoveProject(long seq, String ref, Instant at) implements Mutation {}

    record RecordMetric(long seq, MetricPoint point) implements Mutation {}
}
