// file: storage/src/main/java/io/docsync/storage/DocumentCodec.java
package io.docsync.storage;

import io.docsync.core.Category;
import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.DocumentKind;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.PlanStatus;
import io.docsync.core.Project;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Binary field layout shared by WAL records and snapshots.
 * <p>
 * Document:
 *   - id, name:        string
 *   - kind:            byte (DocumentKind code)
 *   - schema:          byte (DocumentBody.SCHEMA_VERSION)
 *   - placement:       COMMAND -> category label string, PLAN -> status code byte
 *   - content, hash:   string
 *   - version:         int32
 *   - projectRef:      nullable string
 *   - createdAt/updatedAt: instant
 * <p>
 * Strings are int32 len + UTF-8 bytes (len == -1 => null); instants are
 * int64 epoch seconds + int32 nanos so they survive a round trip exactly.
 */
final class DocumentCodec {

    private DocumentCodec() {
        // utility
    }

    static void writeDocument(DataOutput out, Document d) throws IOException {
        writeString(out, d.id());
        writeString(out, d.name());
        out.writeByte(d.kind().code());
        out.writeByte(DocumentBody.SCHEMA_VERSION);
        DocumentBody body = d.body();
        if (body instanceof DocumentBody.Command) {
            writeString(out, ((DocumentBody.Command) body).category().label());
        } else if (body instanceof DocumentBody.Plan) {
            out.writeByte(((DocumentBody.Plan) body).status().code());
        } else {
            throw new IllegalStateException("Unknown body type: " + body);
        }
        writeString(out, body.content());
        writeString(out, d.contentHash());
        out.writeInt(d.version());
        writeString(out, d.projectRef());
        writeInstant(out, d.createdAt());
        writeInstant(out, d.updatedAt());
    }

    static Document readDocument(DataInput in) throws IOException {
        String id = readString(in);
        String name = readString(in);
        DocumentKind kind = DocumentKind.fromCode(in.readByte());
        byte schema = in.readByte();
        if (schema != DocumentBody.SCHEMA_VERSION) {
            throw new IOException("Unsupported document schema version " + schema + " for " + name);
        }
        DocumentBody body;
        switch (kind) {
            case COMMAND -> {
                Category category = new Category(readString(in));
                body = new DocumentBody.Command(category, readString(in));
            }
            case PLAN -> {
                PlanStatus status = PlanStatus.fromCode(in.readByte());
                body = new DocumentBody.Plan(status, readString(in));
            }
            default -> throw new IOException("Unhandled kind " + kind);
        }
        String hash = readString(in);
        int version = in.readInt();
        String projectRef = readNullableString(in);
        Instant createdAt = readInstant(in);
        Instant updatedAt = readInstant(in);
        return new Document(id, name, body, hash, version, projectRef, createdAt, updatedAt);
    }

    static void writeHistory(DataOutput out, HistoryRecord h) throws IOException {
        writeDocument(out, h.document());
        writeInstant(out, h.archivedAt());
        writeString(out, h.changeSummary());
    }

    static HistoryRecord readHistory(DataInput in) throws IOException {
        Document d = readDocument(in);
        Instant archivedAt = readInstant(in);
        String summary = readNullableString(in);
        return new HistoryRecord(d, archivedAt, summary);
    }

    static void writeProject(DataOutput out, Project p) throws IOException {
        writeString(out, p.ref());
        writeString(out, p.description());
        writeInstant(out, p.createdAt());
    }

    static Project readProject(DataInput in) throws IOException {
        return new Project(readString(in), readString(in), readInstant(in));
    }

    static void writeMetric(DataOutput out, MetricPoint m) throws IOException {
        writeString(out, m.documentId());
        out.writeInt(m.version());
        writeString(out, m.metricName());
        out.writeInt(m.step());
        out.writeDouble(m.value());
        writeInstant(out, m.timestamp());
    }

    static MetricPoint readMetric(DataInput in) throws IOException {
        String id = readString(in);
        int version = in.readInt();
        String metric = readString(in);
        int step = in.readInt();
        double value = in.readDouble();
        Instant ts = readInstant(in);
        return new MetricPoint(id, version, metric, step, value, ts);
    }

    // ----------------- helpers -----------------

    static void writeInstant(DataOutput out, Instant t) throws IOException {
        out.writeLong(t.getEpochSecond());
        out.writeInt(t.getNano());
    }

    static Instant readInstant(DataInput in) throws IOException {
        long seconds = in.readLong();
        int nanos = in.readInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }

    static void writeString(DataOutput out, String s) throws IOException {
        if (s == null) {
            out.writeInt(-1);
            return;
        }
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    static String readString(DataInput in) throws IOException {
        String s = readNullableString(in);
        if (s == null) throw new IOException("Unexpected null string");
        return s;
    }

    static String readNullableString(DataInput in) throws IOException {
        int len = in.readInt();
        if (len == -1) return null;
        if (len < 0) throw new IOException("Negative string length " + len);
        byte[] b = new byte[len];
        in.readFully(b);
        return new String(b, StandardCharsets.UTF_8);
    }
}
