// file: engine/src/main/java/io/docsync/engine/Flattener.java
package io.docsync.engine;

import io.docsync.core.Document;
import io.docsync.core.DocumentKind;
import io.docsync.engine.load.CategoryResolver;
import io.docsync.engine.load.SourceRoot;
import io.docsync.storage.VersionStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Store -> disk projection.
 *
 * Takes one consistent snapshot of the current rows and writes each document to
 * {@code root/<category dir>/<name><ext>} for every root of its kind. A document
 * with any planning error (escaping name, path collision, no root) gets no file
 * at all; other documents are still written. History is never read.
 */
public final class Flattener {
    private static final Logger log = Logger.getLogger(Flattener.class.getName());

    private final VersionStore store;
    private final CategoryResolver resolver;
    private final String extension;
    private final int threads;

    public Flattener(VersionStore store, CategoryResolver resolver, String extension, int threads) {
        this.store = Objects.requireNonNull(store, "store");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.extension = Objects.requireNonNull(extension, "extension");
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        this.threads = threads;
    }

    private record Target(Document document, Path path) {}

    public FlattenSummary flatten(List<SourceRoot> roots) {
        long start = System.nanoTime();
        List<Document> snapshot = store.currentSnapshot();

        Map<DocumentKind, List<SourceRoot>> rootsByKind = new EnumMap<>(DocumentKind.class);
        for (SourceRoot r : roots) rootsByKind.computeIfAbsent(r.kind(), k -> new ArrayList<>()).add(r);

        List<FlattenError> errors = new ArrayList<>();
        Set<String> failed = new HashSet<>();
        // normalized, case-folded path -> targets
        Map<String, List<Target>> byKey = new LinkedHashMap<>();

        for (Document doc : snapshot) {
            List<SourceRoot> kindRoots = rootsByKind.getOrDefault(doc.kind(), List.of());
            if (kindRoots.isEmpty()) {
                errors.add(new FlattenError(doc.name(), null, "no " + doc.kind().label() + " root configured"));
                failed.add(doc.id());
                continue;
            }
            for (SourceRoot root : kindRoots) {
                Path target = targetFor(root, doc);
                if (target == null) {
                    errors.add(new FlattenError(doc.name(), null,
                            "name '" + doc.name() + "' does not map to a file inside " + root.path()));
                    failed.add(doc.id());
                    continue;
                }
                byKey.computeIfAbsent(target.toString().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                        .add(new Target(doc, target));
            }
        }

        List<Target> planned = new ArrayList<>();
        for (List<Target> group : byKey.values()) {
            long ids = group.stream().map(t -> t.document().id()).distinct().count();
            if (ids == 1) {
                planned.add(group.get(0));
                continue;
            }
            for (Target t : group) {
                List<String> others = group.stream()
                        .filter(o -> !o.document().id().equals(t.document().id()))
                        .map(o -> o.document().name())
                        .distinct()
                        .toList();
                errors.add(new FlattenError(t.document().name(), t.path(),
                        "path collision with " + String.join(", ", others)));
                failed.add(t.document().id());
            }
        }
        List<Target> toWrite = planned.stream().filter(t -> !failed.contains(t.document().id())).toList();

        writeAll(toWrite, errors, failed);

        List<String> written = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Target t : toWrite) {
            String id = t.document().id();
            if (!failed.contains(id) && seen.add(id)) written.add(t.document().name());
        }
        written.sort(null);

        FlattenSummary result = new FlattenSummary(written, errors);
        RunLogger.logFlatten(result, (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    /** Target file for a document under a root, or null when the name would leave its directory. */
    private Path targetFor(SourceRoot root, Document doc) {
        String name = doc.name();
        if (name.isBlank() || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) return null;
        Path dir = resolver.directoryFor(root, doc.category()).normalize();
        try {
            Path file = dir.resolve(name + extension).normalize();
            return dir.equals(file.getParent()) ? file : null;
        } catch (InvalidPathException e) {
            log.fine(() -> "Invalid path for '" + name + "': " + e.getMessage());
            return null;
        }
    }

    private void writeAll(List<Target> targets, List<FlattenError> errors, Set<String> failed) {
        if (targets.isEmpty()) return;
        AtomicInteger n = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, targets.size()), r -> {
            Thread t = new Thread(r, "flatten-writer-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(targets.size());
            for (Target t : targets) {
                futures.add(pool.submit(() -> {
                    write(t);
                    return null;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                Target t = targets.get(i);
                try {
                    futures.get(i).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (int j = i; j < targets.size(); j++) {
                        futures.get(j).cancel(true);
                        Target rest = targets.get(j);
                        errors.add(new FlattenError(rest.document().name(), rest.path(), "flatten interrupted"));
                        failed.add(rest.document().id());
                    }
                    return;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    errors.add(new FlattenError(t.document().name(), t.path(),
                            cause.getClass().getSimpleName() + ": " + cause.getMessage()));
                    failed.add(t.document().id());
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    /** Temp file in the target directory, then an atomic rename over the target. */
    private static void write(Target t) throws IOException {
        Path target = t.path();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, t.document().content(), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
