package io.docsync.storage;

import io.docsync.core.Category;
import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.HistoryRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class DurableVersionStoreRecoveryTest {

    @TempDir
    Path dir;

    private static DocumentBody cmd(String content) {
        return new DocumentBody.Command(new Category("go"), content);
    }

    private DurableVersionStore open(int snapshotEveryOps) {
        return DurableVersionStore.open(dir, 1L << 60, snapshotEveryOps, Clock.systemUTC());
    }

    private static long count(Path d, String suffix) throws Exception {
        try (Stream<Path> s = Files.list(d)) {
            return s.filter(p -> p.getFileName().toString().endsWith(suffix)).count();
        }
    }

    @Test
    void current_and_history_survive_restart() {
        String id;
        try (var store = open(1_000)) {
            store.registerProject("collect", "main");
            id = store.upsert("deploy", cmd("v1"), "collect", null).document().id();
            store.upsert("deploy", cmd("v2"));
            store.upsert("lint", cmd("l1"));
        }

        try (var store = open(1_000)) {
            Document d = store.getCurrent("deploy").orElseThrow();
            assertEquals(id, d.id());
            assertEquals(2, d.version());
            assertEquals("v2", d.content());
            assertEquals("collect", d.projectRef());
            assertEquals("v1", store.history(id).get(0).document().content());
            assertTrue(store.findProject("collect").isPresent());
            assertEquals(2, store.currentSnapshot().size());
            assertDoesNotThrow(store::verifyIntegrity);
        }
    }

    @Test
    void torn_tail_is_dropped_and_later_writes_still_replay() throws Exception {
        try (var store = open(1_000)) {
            store.upsert("a", cmd("a1"));
            store.upsert("b", cmd("b1"));
        }
        // half of a record that never finished: header claims more bytes than follow
        byte[] partial = RecordCodec.encode(new Mutation.Create(3,
                Document.create("id-x", "c", cmd("c1"), null, Instant.EPOCH)));
        Path seg = dir.resolve("wal").resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(partial, 0, partial.length - 5);
        }

        try (var store = open(1_000)) {
            assertTrue(store.getCurrent("a").isPresent());
            assertTrue(store.getCurrent("b").isPresent());
            assertTrue(store.getCurrent("c").isEmpty());
            store.upsert("d", cmd("d1"));
        }

        try (var store = open(1_000)) {
            assertEquals(List.of("a", "b", "d"),
                    store.currentSnapshot().stream().map(Document::name).toList());
        }
    }

    @Test
    void snapshot_plus_wal_tail_rebuilds_the_same_state() throws Exception {
        String id;
        try (var store = open(3)) {
            id = store.upsert("deploy", cmd("v1")).document().id();
            for (int i = 2; i <= 7; i++) store.upsert("deploy", cmd("v" + i));
        }
        assertEquals(1, count(dir.resolve("snap"), ".bin"), "older snapshots are removed");
        assertEquals(1, count(dir.resolve("wal"), ".log"), "sealed segments are pruned");

        try (var store = open(3)) {
            Document d = store.getCurrent("deploy").orElseThrow();
            assertEquals(7, d.version());
            assertEquals("v7", d.content());
            List<HistoryRecord> history = store.history(id);
            assertEquals(6, history.size());
            for (int i = 0; i < history.size(); i++) {
                assertEquals(i + 1, history.get(i).version());
                assertEquals("v" + (i + 1), history.get(i).document().content());
            }
            assertDoesNotThrow(store::verifyIntegrity);
        }
    }

    @Test
    void explicit_checkpoint_then_restart() {
        try (var store = open(1_000)) {
            store.upsert("a", cmd("a1"));
            store.checkpoint();
            store.upsert("a", cmd("a2"));
        }
        try (var store = open(1_000)) {
            assertEquals(2, store.getCurrent("a").orElseThrow().version());
        }
    }

    @Test
    void replay_walks_every_rotated_segment() throws Exception {
        try (var store = DurableVersionStore.open(dir, 64, 1_000, Clock.systemUTC())) {
            for (int i = 0; i < 10; i++) store.upsert("doc-" + i, cmd("body " + i));
        }
        assertTrue(count(dir.resolve("wal"), ".log") > 1);

        try (var store = open(1_000)) {
            assertEquals(10, store.currentSnapshot().size());
        }
    }

    @Test
    void lock_is_released_on_close() {
        open(1_000).close();
        assertDoesNotThrow(() -> open(1_000).close());
    }
}
