// file: storage/src/main/java/io/docsync/storage/FileSnapshotter.java
package io.docsync.storage;

import io.docsync.core.Document;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.Project;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;
import java.util.zip.CheckedOutputStream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format (fields laid out by {@link DocumentCodec}):
 *   int32  format version
 *   int64  lastSeq
 *   int32  count + documents        (current table)
 *   int32  count + history records
 *   int32  count + projects
 *   int32  count + metric points
 *   int64  CRC32 of everything above
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<seq>.bin.tmp" first,
 *   - then move to "snapshot-<seq>.bin" using ATOMIC_MOVE,
 *   - then delete older snapshots.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());
    private static final int FORMAT = 1;

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String writeSnapshot(LoadedSnapshot state) {
        String name = String.format("snapshot-%020d.bin", state.lastSeq());
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        var crc = new CRC32();
        try (var fileOut = Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
             var out = new DataOutputStream(new BufferedOutputStream(new CheckedOutputStream(fileOut, crc)))) {
            out.writeInt(FORMAT);
            out.writeLong(state.lastSeq());

            out.writeInt(state.current().size());
            for (Document d : state.current()) DocumentCodec.writeDocument(out, d);

            out.writeInt(state.history().size());
            for (HistoryRecord h : state.history()) DocumentCodec.writeHistory(out, h);

            out.writeInt(state.projects().size());
            for (Project p : state.projects()) DocumentCodec.writeProject(out, p);

            out.writeInt(state.metrics().size());
            for (MetricPoint m : state.metrics()) DocumentCodec.writeMetric(out, m);

            out.flush();
            // trailer is written outside the checksummed stream
            new DataOutputStream(fileOut).writeLong(crc.getValue());
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        try (var ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
            ch.force(true);
        } catch (IOException ex) { throw new UncheckedIOException(ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        deleteOlderThan(dst);
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> snaps = snapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        var crc = new CRC32();
        try (var fileIn = new BufferedInputStream(Files.newInputStream(snap));
             var in = new DataInputStream(new CheckedInputStream(fileIn, crc))) {
            int format = in.readInt();
            if (format != FORMAT) throw new IOException("Unsupported snapshot format " + format);
            long lastSeq = in.readLong();

            int n = in.readInt();
            List<Document> current = new ArrayList<>(n);
            for (int i = 0; i < n; i++) current.add(DocumentCodec.readDocument(in));

            n = in.readInt();
            List<HistoryRecord> history = new ArrayList<>(n);
            for (int i = 0; i < n; i++) history.add(DocumentCodec.readHistory(in));

            n = in.readInt();
            List<Project> projects = new ArrayList<>(n);
            for (int i = 0; i < n; i++) projects.add(DocumentCodec.readProject(in));

            n = in.readInt();
            List<MetricPoint> metrics = new ArrayList<>(n);
            for (int i = 0; i < n; i++) metrics.add(DocumentCodec.readMetric(in));

            long computed = crc.getValue();
            long stored = new DataInputStream(fileIn).readLong();
            if (computed != stored) {
                throw new IOException("Snapshot checksum mismatch in " + snap.getFileName());
            }
            return new LoadedSnapshot(snap.getFileName().toString(), lastSeq, current, history, projects, metrics);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load snapshot " + snap, e);
        }
    }

    private List<Path> snapshots() {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> {
                        String f = p.getFileName().toString();
                        return f.startsWith("snapshot-") && f.endsWith(".bin");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private void deleteOlderThan(Path keep) {
        for (Path p : snapshots()) {
            if (p.getFileName().toString().compareTo(keep.getFileName().toString()) >= 0) continue;
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                log.log(Level.WARNING, "Could not delete old snapshot " + p, e);
            }
        }
    }
}
