// file: core/src/main/java/io/docsync/core/Project.java
package io.docsync.core;

import java.time.Instant;
import java.util.Objects;

/** External project a document may be associated with. */
public record Project(String ref, String description, Instant createdAt) {
    public Project {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(createdAt, "createdAt");
        if (ref.isBlank()) throw new IllegalArgumentException("ref must not be blank");
        if (description == null) description = "";
    }
}
