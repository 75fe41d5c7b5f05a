// file: engine/src/main/java/io/docsync/engine/FlattenError.java
package io.docsync.engine;

import java.nio.file.Path;

/**
 * A document that could not be written to disk.
 *
 * @param path target file, null when no target could be computed
 */
public record FlattenError(String name, Path path, String reason) {}
