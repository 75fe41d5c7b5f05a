// file: core/src/main/java/io/docsync/core/Document.java
package io.docsync.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Current record of a named, versioned document.
 * <p>
 * Fields:
 *  - id:          stable opaque identifier, assigned once at creation.
 *  - name:        logical key (file stem); exactly one current row per name.
 *  - body:        kind-specific payload (category or plan status + content).
 *  - contentHash: {@link ContentHash} of the body content.
 *  - version:     starts at 1, grows by exactly one per accepted change.
 *  - projectRef:  optional project association, null when unset or cleared.
 * <p>
 * Instances are immutable; a change produces a new instance via {@link #revise}.
 */
public record Document(
        String id,
        String name,
        DocumentBody body,
        String contentHash,
        int version,
        String projectRef,
        Instant createdAt,
        Instant updatedAt
) {
    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (version < 1) throw new IllegalArgumentException("version must be >= 1, got " + version);
    }

    /** A brand-new version-1 document. */
    public static Document create(String id, String name, DocumentBody body, String projectRef, Instant now) {
        return new Document(id, name, body, ContentHash.of(body.content()), 1, projectRef, now, now);
    }

    public DocumentKind kind() { return body.kind(); }

    public Category category() { return body.category(); }

    public String content() { return body.content(); }

    /** True when the stored hash still equals the hash recomputed from the content. */
    public boolean hashIntact() {
        return ContentHash.matches(body.content(), contentHash);
    }

    /**
     * Next version of this document.
     * A null projectRef keeps the current association.
     */
    public Document revise(DocumentBody next, String projectRef, Instant now) {
        return new Document(
                id,
                name,
                next,
                ContentHash.of(next.content()),
                version + 1,
                projectRef != null ? projectRef : this.projectRef,
                createdAt,
                now
        );
    }

    /** Same version with the project association cleared; content is untouched. */
    public Document withoutProject(Instant now) {
        return new Document(id, name, body, contentHash, version, null, createdAt, now);
    }
}
