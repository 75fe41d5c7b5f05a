// file: engine/src/main/java/io/docsync/engine/load/LoadError.java
package io.docsync.engine.load;

import java.nio.file.Path;

/**
 * A file or directory that could not be turned into a document.
 *
 * @param errorType short machine-friendly label (usually the exception's simple class name)
 */
public record LoadError(Path path, String reason, String errorType) {

    public static LoadError of(Path path, Throwable t) {
        String msg = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return new LoadError(path, msg, t.getClass().getSimpleName());
    }
}
