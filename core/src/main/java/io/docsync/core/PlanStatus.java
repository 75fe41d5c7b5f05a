// file: core/src/main/java/io/docsync/core/PlanStatus.java
package io.docsync.core;

import java.util.Optional;

/**
 * Lifecycle status of a plan, implied by the lifecycle directory it lives in.
 * The status is never edited directly; moving the file is the only way to change it.
 */
public enum PlanStatus {
    DRAFT((byte) 1, "drafts"),
    APPROVED((byte) 2, "approved"),
    COMPLETED((byte) 3, "completed");

    private final byte code;
    private final String directoryName;

    PlanStatus(byte code, String directoryName) {
        this.code = code;
        this.directoryName = directoryName;
    }

    public byte code() { return code; }

    public String directoryName() { return directoryName; }

    /** A plan's category is the label of its lifecycle directory. */
    public Category category() {
        return new Category(directoryName);
    }

    public static Optional<PlanStatus> fromDirectoryName(String name) {
        for (PlanStatus s : values()) {
            if (s.directoryName.equals(name)) return Optional.of(s);
        }
        return Optional.empty();
    }

    public static PlanStatus fromCode(byte code) {
        for (PlanStatus s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown plan status code: " + code);
    }
}
