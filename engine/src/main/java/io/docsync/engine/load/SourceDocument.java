// file: engine/src/main/java/io/docsync/engine/load/SourceDocument.java
package io.docsync.engine.load;

import io.docsync.core.DocumentBody;

import java.nio.file.Path;

/**
 * A document as found on disk during one load pass: not yet compared with
 * the store, so it has no id or version.
 */
public record SourceDocument(Path path, SourceRoot root, String name, DocumentBody body, String contentHash) {}
