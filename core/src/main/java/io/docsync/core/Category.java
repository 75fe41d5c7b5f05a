// file: core/src/main/java/io/docsync/core/Category.java
package io.docsync.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Category label derived from the directory a document lives in.
 * <p>
 * Labels are lower-case directory names. {@link #UNCATEGORIZED} is the
 * explicit default for files placed directly under a root or under a
 * directory that is not part of the configured set.
 */
public record Category(String label) {

    private static final Pattern LABEL = Pattern.compile("[a-z0-9][a-z0-9_-]*");

    public static final Category UNCATEGORIZED = new Category("uncategorized");

    public Category {
        Objects.requireNonNull(label, "label");
        if (!LABEL.matcher(label).matches()) {
            throw new IllegalArgumentException("invalid category label: '" + label + "'");
        }
    }

    public boolean isUncategorized() {
        return UNCATEGORIZED.equals(this);
    }

    @Override
    public String toString() {
        return label;
    }
}
