// file: engine/src/main/java/io/docsync/engine/FlattenSummary.java
package io.docsync.engine;

import java.util.List;

/** Names written (each once, in name order) and per-document failures. */
public record FlattenSummary(List<String> written, List<FlattenError> errors) {
    public FlattenSummary {
        written = List.copyOf(written);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
