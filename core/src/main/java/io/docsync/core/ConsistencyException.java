// file: core/src/main/java/io/docsync/core/ConsistencyException.java
package io.docsync.core;

/**
 * The persisted baseline is corrupt: a stored content hash no longer matches
 * its content, or a document's history has gaps.
 * <p>
 * Not recoverable per document. Sync runs must abort instead of layering new
 * history on top of a corrupted row.
 */
public class ConsistencyException extends RuntimeException {
    private final String documentId;
    private final int version;

    public ConsistencyException(String documentId, int version, String message) {
        super(message);
        this.documentId = documentId;
        this.version = version;
    }

    public String documentId() { return documentId; }

    public int version() { return version; }
}
