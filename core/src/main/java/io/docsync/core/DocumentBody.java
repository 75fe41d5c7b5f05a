// file: core/src/main/java/io/docsync/core/DocumentBody.java
package io.docsync.core;

import java.util.Objects;

/**
 * Kind-specific payload of a document.
 * <p>
 * A closed union keyed by {@link DocumentKind}:
 *  - Command: category from the configured set (or uncategorized) + content.
 *  - Plan:    lifecycle status + content.
 * <p>
 * Both variants share {@link #SCHEMA_VERSION}; the storage codecs write it
 * next to every body so the layout can evolve without guessing.
 */
public sealed interface DocumentBody permits DocumentBody.Command, DocumentBody.Plan {

    int SCHEMA_VERSION = 1;

    DocumentKind kind();

    String content();

    Category category();

    /** Same variant and placement, new content. */
    DocumentBody withContent(String content);

    record Command(Category category, String content) implements DocumentBody {
        public Command {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(content, "content");
        }

        @Override public DocumentKind kind() { return DocumentKind.COMMAND; }

        @Override public DocumentBody withContent(String content) { return new Command(category, content); }
    }

    record Plan(PlanStatus status, String content) implements DocumentBody {
        public Plan {
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(content, "content");
        }

        @Override public DocumentKind kind() { return DocumentKind.PLAN; }

        @Override public Category category() { return status.category(); }

        @Override public DocumentBody withContent(String content) { return new Plan(status, content); }
    }
}
