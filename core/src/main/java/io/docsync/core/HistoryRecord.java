// file: core/src/main/java/io/docsync/core/HistoryRecord.java
package io.docsync.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Archived copy of a superseded document version, keyed by (id, version).
 * <p>
 * The document is stored verbatim as it was current; changeSummary describes
 * the change that superseded it (may be null). History is append-only.
 */
public record HistoryRecord(Document document, Instant archivedAt, String changeSummary) {

    public HistoryRecord {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(archivedAt, "archivedAt");
    }

    public String id() { return document.id(); }

    public int version() { return document.version(); }
}
