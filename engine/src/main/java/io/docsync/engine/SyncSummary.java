// file: engine/src/main/java/io/docsync/engine/SyncSummary.java
package io.docsync.engine;

import io.docsync.storage.UpsertOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a sync or preview run. Names appear in processing order.
 * Every loaded document lands in exactly one of created / updated /
 * unchanged / errors.
 */
public record SyncSummary(
        boolean dryRun,
        List<String> created,
        List<String> updated,
        List<String> unchanged,
        List<SyncError> errors
) {
    public SyncSummary {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        unchanged = List.copyOf(unchanged);
        errors = List.copyOf(errors);
    }

    public int total() {
        return created.size() + updated.size() + unchanged.size() + errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    static final class Builder {
        private final boolean dryRun;
        private final List<String> created = new ArrayList<>();
        private final List<String> updated = new ArrayList<>();
        private final List<String> unchanged = new ArrayList<>();
        private final List<SyncError> errors = new ArrayList<>();

        Builder(boolean dryRun) {
            this.dryRun = dryRun;
        }

        Builder record(String name, UpsertOutcome outcome) {
            switch (outcome) {
                case CREATED -> created.add(name);
                case UPDATED -> updated.add(name);
                case UNCHANGED -> unchanged.add(name);
            }
            return this;
        }

        Builder error(SyncError e) {
            errors.add(e);
            return this;
        }

        SyncSummary build() {
            return new SyncSummary(dryRun, created, updated, unchanged, errors);
        }
    }
}
