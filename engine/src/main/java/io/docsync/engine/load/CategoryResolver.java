// file: engine/src/main/java/io/docsync/engine/load/CategoryResolver.java
package io.docsync.engine.load;

import io.docsync.core.Category;
import io.docsync.core.CategorySet;
import io.docsync.core.DocumentBody;
import io.docsync.core.DocumentKind;
import io.docsync.core.PlanStatus;
import io.docsync.engine.config.ConfigException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Maps directory placement to categories, and back.
 * <p>
 * Commands:
 *  - root/&lt;label&gt;/x.md  -> category &lt;label&gt; when label is configured,
 *  - root/x.md              -> uncategorized,
 *  - anything else          -> uncategorized (the parent directory name decides).
 * <p>
 * Plans:
 *  - root/drafts|approved|completed/x.md -> matching {@link PlanStatus},
 *  - anything else has no status and is not a valid plan location.
 * <p>
 * Only side effect: {@link #ensureDirectories} creates missing directories.
 */
public final class CategoryResolver {
    private static final Logger log = Logger.getLogger(CategoryResolver.class.getName());

    private final CategorySet categories;

    public CategoryResolver(CategorySet categories) {
        this.categories = Objects.requireNonNull(categories, "categories");
    }

    public CategorySet categories() {
        return categories;
    }

    /**
     * Idempotently create the root and every category (commands) or lifecycle
     * (plans) subdirectory.
     *
     * @return directories that did not exist before
     * @throws ConfigException when a directory cannot be created
     */
    public List<Path> ensureDirectories(SourceRoot root) {
        List<Path> required = new ArrayList<>();
        required.add(root.path());
        if (root.kind() == DocumentKind.COMMAND) {
            for (Category c : categories.categories()) required.add(root.path().resolve(c.label()));
        } else {
            for (PlanStatus s : PlanStatus.values()) required.add(root.path().resolve(s.directoryName()));
        }

        List<Path> created = new ArrayList<>();
        for (Path dir : required) {
            if (Files.isDirectory(dir)) continue;
            try {
                Files.createDirectories(dir);
                created.add(dir);
            } catch (IOException e) {
                throw new ConfigException("Cannot create " + root.kind().label() + " directory " + dir, e);
            }
        }
        if (!created.isEmpty()) {
            log.info(() -> "Created " + created.size() + " missing directories under " + root.path());
        }
        return created;
    }

    /** Category of a command file from its parent directory name. */
    public Category categoryOf(Path root, Path file) {
        Path parent = parentOf(file);
        if (parent == null || parent.equals(normalize(root))) return Category.UNCATEGORIZED;
        return categories.find(parent.getFileName().toString()).orElse(Category.UNCATEGORIZED);
    }

    /** Lifecycle status of a plan file, empty when it is not directly inside a lifecycle directory. */
    public Optional<PlanStatus> statusOf(Path root, Path file) {
        Path parent = parentOf(file);
        if (parent == null || parent.equals(normalize(root))) return Optional.empty();
        if (!normalize(root).equals(parent.getParent())) return Optional.empty();
        return PlanStatus.fromDirectoryName(parent.getFileName().toString());
    }

    /**
     * Build the kind-specific body for a file, or empty when the file's placement
     * is not valid for its kind.
     */
    public Optional<DocumentBody> bodyFor(SourceRoot root, Path file, String content) {
        if (root.kind() == DocumentKind.COMMAND) {
            return Optional.of(new DocumentBody.Command(categoryOf(root.path(), file), content));
        }
        return statusOf(root.path(), file).map(s -> new DocumentBody.Plan(s, content));
    }

    /** Directory a document of the given category lives in under root. */
    public Path directoryFor(SourceRoot root, Category category) {
        return category.isUncategorized() ? root.path() : root.path().resolve(category.label());
    }

    private static Path parentOf(Path file) {
        return normalize(file).getParent();
    }

    private static Path normalize(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
