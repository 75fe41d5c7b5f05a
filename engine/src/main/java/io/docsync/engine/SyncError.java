// file: engine/src/main/java/io/docsync/engine/SyncError.java
package io.docsync.engine;

import io.docsync.core.StoreException;
import io.docsync.engine.load.LoadError;
import io.docsync.engine.load.SourceDocument;

import java.nio.file.Path;

/**
 * One failed item of a sync run.
 *
 * @param subject document name, project ref or path the error is about
 * @param path    file involved, null when the error is not tied to a file
 */
public record SyncError(String subject, Path path, Stage stage, String reason, String errorType) {

    public enum Stage { LOAD, PROJECT, STORE }

    static SyncError load(LoadError e) {
        return new SyncError(e.path().getFileName() != null ? e.path().getFileName().toString() : e.path().toString(),
                e.path(), Stage.LOAD, e.reason(), e.errorType());
    }

    static SyncError store(SourceDocument doc, StoreException e) {
        return new SyncError(doc.name(), doc.path(), Stage.STORE, e.getMessage(), e.reason().name());
    }

    static SyncError failed(SourceDocument doc, RuntimeException e) {
        return new SyncError(doc.name(), doc.path(), Stage.STORE,
                String.valueOf(e.getMessage()), e.getClass().getSimpleName());
    }

    static SyncError project(String ref, StoreException e) {
        return new SyncError(ref, null, Stage.PROJECT, e.getMessage(), e.reason().name());
    }
}
