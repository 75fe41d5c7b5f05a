// file: engine/src/main/java/io/docsync/engine/load/LoadResult.java
package io.docsync.engine.load;

import java.util.List;

/** Documents found in one load pass plus every per-file failure. */
public record LoadResult(List<SourceDocument> documents, List<LoadError> errors) {
    public LoadResult {
        documents = List.copyOf(documents);
        errors = List.copyOf(errors);
    }
}
