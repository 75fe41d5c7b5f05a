// file: storage/src/main/java/io/docsync/storage/RecordCodec.java
package io.docsync.storage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD0C5   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - seq:  int64 store-wide sequence number
 *     - type: byte (1=create, 2=revise, 3=register-project, 4=remove-project, 5=metric)
 *     - body: type specific, fields laid out by {@link DocumentCodec}
 *         create:           document
 *         revise:           archived history record, then the new current document
 *         register-project: project
 *         remove-project:   ref string, instant
 *         metric:           metric point
 * <p>
 * The header is validated by magic/version/length and CRC when reading.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD0C5;
    static final byte  VERSION = 1;

    private static final byte CREATE = 1;
    private static final byte REVISE = 2;
    private static final byte REGISTER_PROJECT = 3;
    private static final byte REMOVE_PROJECT = 4;
    private static final byte METRIC = 5;

    private RecordCodec() {
        // utility
    }

    /** Encode a mutation into header+payload bytes ready for append. */
    static byte[] encode(Mutation m) {
        byte[] payload = encodePayload(m);
        int length = payload.length;
        ByteBuffer header = ByteBuffer.allocate(2 + 1 + 4 + 4).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(length).putInt(crc32(payload));
        header.flip();

        byte[] out = new byte[header.remaining() + payload.length];
        header.get(out, 0, header.limit());
        System.arraycopy(payload, 0, out, header.limit(), payload.length);
        return out;
    }

    /** Decode a full payload (not including header). */
    static Mutation decode(byte[] payload) {
        try (var in = new DataInputStream(new ByteArrayInputStream(payload))) {
            long seq = in.readLong();
            byte type = in.readByte();
            return switch (type) {
                case CREATE -> new Mutation.Create(seq, DocumentCodec.readDocument(in));
                case REVISE -> {
                    var archived = DocumentCodec.readHistory(in);
                    var next = DocumentCodec.readDocument(in);
                    yield new Mutation.Revise(seq, archived, next);
                }
                case REGISTER_PROJECT -> new Mutation.RegisterProject(seq, DocumentCodec.readProject(in));
                case REMOVE_PROJECT -> new Mutation.RemoveProject(
                        seq, DocumentCodec.readString(in), DocumentCodec.readInstant(in));
                case METRIC -> new Mutation.RecordMetric(seq, DocumentCodec.readMetric(in));
                default -> throw new IllegalArgumentException("Unknown WAL record type: " + type);
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed WAL payload", e);
        }
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(Mutation m) {
        var bytes = new ByteArrayOutputStream(256);
        try (var out = new DataOutputStream(bytes)) {
            out.writeLong(m.seq());
            if (m instanceof Mutation.Create c) {
                out.writeByte(CREATE);
                DocumentCodec.writeDocument(out, c.document());
            } else if (m instanceof Mutation.Revise r) {
                out.writeByte(REVISE);
                DocumentCodec.writeHistory(out, r.archived());
                DocumentCodec.writeDocument(out, r.next());
            } else if (m instanceof Mutation.RegisterProject p) {
                out.writeByte(REGISTER_PROJECT);
                DocumentCodec.writeProject(out, p.project());
            } else if (m instanceof Mutation.RemoveProject p) {
                out.writeByte(REMOVE_PROJECT);
                DocumentCodec.writeString(out, p.ref());
                DocumentCodec.writeInstant(out, p.at());
            } else if (m instanceof Mutation.RecordMetric rm) {
                out.writeByte(METRIC);
                DocumentCodec.writeMetric(out, rm.point());
            } else {
                throw new IllegalStateException("Unknown mutation type: " + m);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        long v = crc.getValue();
        return (int) v; // CRC32 fits in unsigned int; Java int is fine for compare
    }
}
