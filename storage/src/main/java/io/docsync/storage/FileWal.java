// file: storage/src/main/java/io/docsync/storage/FileWal.java
package io.docsync.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts off a torn tail left by a crash, so new records are never
 *        appended behind garbage the reader would stop at,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - on failure truncates back to the previous end of the segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    static final int HEADER_BYTES = 11;

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) {
        long before = writtenInSegment;
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            discardPartialWrite(before);
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        rollover();
    }

    @Override
    public void rollover() {
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public void pruneSealedSegments() {
        for (Path seg : segments(dir)) {
            if (seg.equals(current)) continue;
            try {
                Files.deleteIfExists(seg);
            } catch (IOException e) {
                log.log(Level.WARNING, "Could not delete sealed WAL segment " + seg, e);
            }
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments(dir)); }

    @Override
    public void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, drop any torn
     *    tail and position at the end of the last valid record.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> existing = segments(dir);
            current = existing.isEmpty() ? dir.resolve(segmentName(1)) : existing.get(existing.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            long size = ch.size();
            if (valid < size) {
                Path segment = current;
                log.warning(() -> "Truncating torn WAL tail in " + segment.getFileName()
                        + " (" + size + " -> " + valid + " bytes)");
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private void discardPartialWrite(long validEnd) {
        try {
            ch.truncate(validEnd);
            ch.position(validEnd);
        } catch (IOException suppressed) {
            // Recovery still stops at the torn record and the next open truncates it.
            log.log(Level.WARNING, "Could not truncate partial WAL write in " + current, suppressed);
        }
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path seg) {
        return Integer.parseInt(seg.getFileName().toString().replace(".log", ""));
    }

    /** Byte length of the prefix made of complete, CRC-valid records. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readPayload(ch, pos);
            if (payload == null) return pos;
            pos += HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the record at pos, or null when it is missing, truncated or fails its CRC. */
    private static byte[] readPayload(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < HEADER_BYTES) return null; // EOF or truncated header at tail
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int r = ch.read(payload, pos + HEADER_BYTES + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail
        return bytes;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     * Once a corrupt record is seen the reader reports end-of-log, even if
     * later segments exist.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segmentIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segmentIdx >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segmentIdx), READ);
                        pos = 0;
                    }
                    if (pos >= ch.size()) {
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] bytes = readPayload(ch, pos);
                    if (bytes == null) {
                        stopped = true;
                        return null;
                    }
                    pos += HEADER_BYTES + bytes.length;
                    return bytes;
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
