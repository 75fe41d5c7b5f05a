// file: engine/src/main/java/io/docsync/engine/RunLogger.java
package io.docsync.engine;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for the one-line summary of each run.
 * INFO when the run was clean, WARNING when it produced errors.
 */
public final class RunLogger {
    private static final Logger log = Logger.getLogger(RunLogger.class.getName());

    private RunLogger() {
        // utility
    }

    public static void logSync(SyncSummary summary, long totalMillis) {
        String msg = String.format(
                "%s: created=%d updated=%d unchanged=%d errors=%d (total=%dms)",
                summary.dryRun() ? "PREVIEW" : "SYNC",
                summary.created().size(),
                summary.updated().size(),
                summary.unchanged().size(),
                summary.errors().size(),
                totalMillis
        );
        if (summary.hasErrors()) {
            log.log(Level.WARNING, msg);
            for (SyncError e : summary.errors()) {
                log.log(Level.FINE, () -> "  " + e.stage() + " " + e.subject() + ": " + e.reason());
            }
        } else {
            log.log(Level.INFO, msg);
        }
    }

    public static void logFlatten(FlattenSummary summary, long totalMillis) {
        String msg = String.format(
                "FLATTEN: written=%d errors=%d (total=%dms)",
                summary.written().size(),
                summary.errors().size(),
                totalMillis
        );
        log.log(summary.hasErrors() ? Level.WARNING : Level.INFO, msg);
    }
}
