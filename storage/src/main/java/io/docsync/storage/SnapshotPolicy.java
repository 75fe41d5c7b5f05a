// file: storage/src/main/java/io/docsync/storage/SnapshotPolicy.java
package io.docsync.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N writes.
 * <p>
 * Simple but effective:
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Does not consider file size or time.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    public int everyOps() { return everyOps; }

    /**
     * Call after each successful durable write. Runs the snapshot action when
     * the threshold is hit.
     *
     * @return true if a snapshot was taken
     */
    public boolean maybeSnapshot(Runnable snapshot) {
        if (sinceLast.incrementAndGet() >= everyOps) {
            snapshot.run();
            sinceLast.set(0);
            return true;
        }
        return false;
    }

    /** Forget writes counted so far, e.g. after an explicit checkpoint. */
    public void reset() {
        sinceLast.set(0);
    }
}
