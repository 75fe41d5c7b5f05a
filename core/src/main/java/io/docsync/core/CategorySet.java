// file: core/src/main/java/io/docsync/core/CategorySet.java
package io.docsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finite, ordered set of command categories, built once from configuration.
 * <p>
 * Validation:
 *  - every label must be a valid {@link Category} label,
 *  - duplicates are rejected,
 *  - the reserved default label "uncategorized" cannot be configured.
 * <p>
 * Lookups never fall back silently: callers decide what an unknown
 * directory name means (for commands it becomes {@link Category#UNCATEGORIZED}).
 */
public final class CategorySet {

    /** Used when no categories are configured explicitly. */
    public static final List<String> DEFAULT_LABELS =
            List.of("archive", "go", "js", "mcp", "python", "tools");

    private final Map<String, Category> byLabel;

    private CategorySet(Map<String, Category> byLabel) {
        this.byLabel = Collections.unmodifiableMap(byLabel);
    }

    public static CategorySet of(List<String> labels) {
        if (labels == null) throw new IllegalArgumentException("labels must not be null");
        Map<String, Category> map = new LinkedHashMap<>();
        for (String raw : labels) {
            if (raw == null) throw new IllegalArgumentException("category label must not be null");
            String label = raw.trim();
            Category c = new Category(label);
            if (c.isUncategorized()) {
                throw new IllegalArgumentException("'" + label + "' is reserved and cannot be configured");
            }
            if (map.putIfAbsent(label, c) != null) {
                throw new IllegalArgumentException("duplicate category label: " + label);
            }
        }
        return new CategorySet(map);
    }

    public static CategorySet defaults() {
        return of(DEFAULT_LABELS);
    }

    /** Exact lookup by directory name. */
    public Optional<Category> find(String directoryName) {
        if (directoryName == null) return Optional.empty();
        return Optional.ofNullable(byLabel.get(directoryName));
    }

    /** Configured categories in configuration order (the default is not included). */
    public List<Category> categories() {
        return new ArrayList<>(byLabel.values());
    }

    public boolean contains(Category category) {
        return category.isUncategorized() || byLabel.containsKey(category.label());
    }

    public int size() {
        return byLabel.size();
    }

    @Override
    public String toString() {
        return "CategorySet" + byLabel.keySet();
    }
}
