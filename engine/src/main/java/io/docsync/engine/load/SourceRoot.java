// file: engine/src/main/java/io/docsync/engine/load/SourceRoot.java
package io.docsync.engine.load;

import io.docsync.core.DocumentKind;

import java.nio.file.Path;
import java.util.Objects;

/** A directory tree holding documents of one kind. */
public record SourceRoot(DocumentKind kind, Path path) {
    public SourceRoot {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        path = path.toAbsolutePath().normalize();
    }

    public static SourceRoot commands(Path path) {
        return new SourceRoot(DocumentKind.COMMAND, path);
    }

    public static SourceRoot plans(Path path) {
        return new SourceRoot(DocumentKind.PLAN, path);
    }
}
