// file: storage/src/main/java/io/docsync/storage/UpsertResult.java
package io.docsync.storage;

import io.docsync.core.Document;

import java.util.Objects;

/** Outcome of an upsert plus the current row after it. */
public record UpsertResult(UpsertOutcome outcome, Document document) {
    public UpsertResult {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(document, "document");
    }

    public int version() { return document.version(); }
}
