// file: engine/src/main/java/io/docsync/engine/load/DocumentLoader.java
package io.docsync.engine.load;

import io.docsync.core.ContentHash;
import io.docsync.core.DocumentBody;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Scans source roots and turns every matching file into a {@link SourceDocument}.
 * <p>
 * Responsibilities:
 *  - Walk each root recursively, keeping regular files with the configured extension.
 *  - Read and strictly decode files as UTF-8 on a bounded worker pool.
 *  - Resolve category / lifecycle status from directory placement.
 *  - Report every unreadable, undecodable or misplaced file as a {@link LoadError}
 *    and keep going.
 *  - Detect names that occur more than once across the whole pass.
 * <p>
 * The loader never touches the store.
 */
public final class DocumentLoader {
    private static final Logger log = Logger.getLogger(DocumentLoader.class.getName());

    public static final String DEFAULT_EXTENSION = ".md";
    public static final int DEFAULT_THREADS = 4;

    private final CategoryResolver resolver;
    private final String extension;
    private final int threads;

    public DocumentLoader(CategoryResolver resolver) {
        this(resolver, DEFAULT_EXTENSION, DEFAULT_THREADS);
    }

    public DocumentLoader(CategoryResolver resolver, String extension, int threads) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(extension, "extension");
        if (!extension.startsWith(".") || extension.length() < 2) {
            throw new IllegalArgumentException("extension must look like '.md': " + extension);
        }
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        this.extension = extension;
        this.threads = threads;
    }

    public String extension() {
        return extension;
    }

    public LoadResult load(List<SourceRoot> roots) {
        List<LoadError> errors = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();
        for (SourceRoot root : roots) {
            scan(root, candidates, errors);
        }

        List<SourceDocument> read = readAll(candidates, errors);
        List<SourceDocument> documents = resolveDuplicates(read, errors);

        log.fine(() -> "Loaded " + documents.size() + " documents from " + roots.size()
                + " roots (" + errors.size() + " errors)");
        return new LoadResult(documents, errors);
    }

    // ---------- scanning ----------

    private record Candidate(SourceRoot root, Path file) {}

    private void scan(SourceRoot root, List<Candidate> out, List<LoadError> errors) {
        if (!Files.isDirectory(root.path())) {
            errors.add(new LoadError(root.path(), "source root is not a directory", "MissingRoot"));
            return;
        }
        List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root.path(), new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && hasExtension(file)) files.add(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    errors.add(LoadError.of(file, e));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            errors.add(LoadError.of(root.path(), e));
        }
        files.sort(null);
        for (Path f : files) out.add(new Candidate(root, f));
    }

    private boolean hasExtension(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(extension);
    }

    // ---------- reading ----------

    /** Either a document or an error, never both. */
    private record ReadOutcome(SourceDocument document, LoadError error) {}

    private List<SourceDocument> readAll(List<Candidate> candidates, List<LoadError> errors) {
        List<SourceDocument> out = new ArrayList<>();
        if (candidates.isEmpty()) return out;

        ExecutorService pool = Executors.newFixedThreadPool(
                Math.min(threads, candidates.size()), loaderThreads());
        try {
            List<Future<ReadOutcome>> futures = new ArrayList<>(candidates.size());
            for (Candidate c : candidates) {
                futures.add(pool.submit(() -> read(c)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Path file = candidates.get(i).file();
                ReadOutcome outcome;
                try {
                    outcome = futures.get(i).get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (int j = i; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                        errors.add(new LoadError(candidates.get(j).file(), "load interrupted", "Interrupted"));
                    }
                    break;
                } catch (ExecutionException e) {
                    outcome = new ReadOutcome(null, LoadError.of(file, e.getCause()));
                }
                if (outcome.document() != null) out.add(outcome.document());
                else errors.add(outcome.error());
            }
        } finally {
            pool.shutdownNow();
        }
        return out;
    }

    private ReadOutcome read(Candidate c) {
        Path file = c.file();
        String fileName = file.getFileName().toString();
        String name = fileName.substring(0, fileName.length() - extension.length());
        if (name.isBlank()) {
            return new ReadOutcome(null, new LoadError(file,
                    "file name '" + fileName + "' has no usable document name", "BlankName"));
        }
        try {
            String content = decodeUtf8(Files.readAllBytes(file));

            Optional<DocumentBody> body = resolver.bodyFor(c.root(), file, content);
            if (body.isEmpty()) {
                return new ReadOutcome(null, new LoadError(file,
                        "plan is not inside a lifecycle directory (drafts, approved, completed)",
                        "MisplacedPlan"));
            }
            return new ReadOutcome(
                    new SourceDocument(file, c.root(), name, body.get(), ContentHash.of(content)),
                    null);
        } catch (CharacterCodingException e) {
            return new ReadOutcome(null, new LoadError(file, "not valid UTF-8: " + e, "MalformedInput"));
        } catch (IOException e) {
            return new ReadOutcome(null, LoadError.of(file, e));
        }
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    // ---------- duplicates ----------

    /**
     * Same name seen more than once: identical kind, category and hash (a mirrored
     * root) collapse to the first occurrence; anything else is ambiguous and no
     * occurrence is emitted.
     */
    private static List<SourceDocument> resolveDuplicates(List<SourceDocument> read, List<LoadError> errors) {
        Map<String, List<SourceDocument>> byName = new LinkedHashMap<>();
        for (SourceDocument d : read) {
            byName.computeIfAbsent(d.name(), k -> new ArrayList<>()).add(d);
        }

        List<SourceDocument> out = new ArrayList<>(byName.size());
        for (Map.Entry<String, List<SourceDocument>> e : byName.entrySet()) {
            List<SourceDocument> group = e.getValue();
            SourceDocument first = group.get(0);
            if (group.size() == 1) {
                out.add(first);
                continue;
            }
            boolean mirrored = group.stream().allMatch(d ->
                    d.body().kind() == first.body().kind()
                            && d.body().category().equals(first.body().category())
                            && d.contentHash().equals(first.contentHash()));
            if (mirrored) {
                log.fine(() -> "Name '" + e.getKey() + "' mirrored in " + group.size() + " places; using " + first.path());
                out.add(first);
                continue;
            }
            for (SourceDocument d : group) {
                List<String> others = group.stream()
                        .filter(o -> o != d)
                        .map(o -> o.path().toString())
                        .toList();
                errors.add(new LoadError(d.path(),
                        "ambiguous name '" + e.getKey() + "', also found at " + String.join(", ", others),
                        "AmbiguousName"));
            }
        }
        return out;
    }

    private static ThreadFactory loaderThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "doc-loader-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
