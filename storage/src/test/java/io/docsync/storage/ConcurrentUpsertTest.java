package io.docsync.storage;

import io.docsync.core.Category;
import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.HistoryRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentUpsertTest {

    @TempDir
    Path dir;

    @Test
    void racing_writers_on_one_name_produce_a_gapless_history() throws Exception {
        int writers = 8;
        int perWriter = 10;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);

        try (var store = DurableVersionStore.open(dir)) {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    int updates = 0;
                    for (int i = 0; i < perWriter; i++) {
                        var body = new DocumentBody.Command(new Category("go"), "writer " + writer + " edit " + i);
                        switch (store.upsert("shared", body).outcome()) {
                            case CREATED, UPDATED -> updates++;
                            case UNCHANGED -> { }
                        }
                    }
                    return updates;
                }));
            }
            start.countDown();

            int writes = 0;
            for (Future<Integer> f : futures) writes += f.get(30, TimeUnit.SECONDS);

            // every payload is distinct, so every call is a real write
            assertEquals(writers * perWriter, writes);
            Document current = store.getCurrent("shared").orElseThrow();
            assertEquals(writers * perWriter, current.version());

            List<HistoryRecord> history = store.history(current.id());
            assertEquals(current.version() - 1, history.size());
            for (int i = 0; i < history.size(); i++) {
                assertEquals(i + 1, history.get(i).version());
            }
            assertDoesNotThrow(store::verifyIntegrity);
        } finally {
            pool.shutdownNow();
        }
    }
}
