// file: core/src/main/java/io/docsync/core/StoreException.java
package io.docsync.core;

/**
 * A store operation failed for one document; other documents are unaffected.
 */
public class StoreException extends RuntimeException {

    public enum Reason {
        /** project_ref names a project that is not registered. */
        DANGLING_PROJECT_REF,
        /** An existing name is being written with a different document kind. */
        KIND_MISMATCH,
        /** Unknown document id or version. */
        NOT_FOUND,
        /** The store directory is held by another process. */
        LOCKED,
        /** The write-ahead log or snapshot could not be written. */
        IO
    }

    private final Reason reason;

    public StoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
}
