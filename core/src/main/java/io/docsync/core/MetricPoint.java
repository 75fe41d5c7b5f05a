// file: core/src/main/java/io/docsync/core/MetricPoint.java
package io.docsync.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One numeric sample for a document version, keyed by
 * (documentId, version, metricName, step).
 */
public record MetricPoint(
        String documentId,
        int version,
        String metricName,
        int step,
        double value,
        Instant timestamp
) {
    public MetricPoint {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(timestamp, "timestamp");
        if (version < 1) throw new IllegalArgumentException("version must be >= 1");
        if (step < 0) throw new IllegalArgumentException("step must be >= 0");
    }

    public Key key() {
        return new Key(documentId, version, metricName, step);
    }

    public record Key(String documentId, int version, String metricName, int step) {}
}
