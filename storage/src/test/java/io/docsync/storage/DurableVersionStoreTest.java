package io.docsync.storage;

import io.docsync.core.Category;
import io.docsync.core.ContentHash;
import io.docsync.core.Document;
import io.docsync.core.DocumentBody;
import io.docsync.core.HistoryRecord;
import io.docsync.core.MetricPoint;
import io.docsync.core.PlanStatus;
import io.docsync.core.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DurableVersionStoreTest {

    @TempDir
    Path dir;

    private DurableVersionStore store;

    @BeforeEach
    void open() {
        store = DurableVersionStore.open(dir);
    }

    @AfterEach
    void close() {
        store.close();
    }

    private static DocumentBody cmd(String category, String content) {
        return new DocumentBody.Command(new Category(category), content);
    }

    @Test
    void first_upsert_creates_version_one() {
        UpsertResult r = store.upsert("deploy", cmd("go", "v1"));

        assertEquals(UpsertOutcome.CREATED, r.outcome());
        assertEquals(1, r.version());
        Document d = store.getCurrent("deploy").orElseThrow();
        assertEquals(ContentHash.of("v1"), d.contentHash());
        assertEquals(d, store.getById(d.id()).orElseThrow());
        assertTrue(store.history(d.id()).isEmpty());
    }

    @Test
    void same_content_is_unchanged_and_writes_nothing() {
        store.upsert("deploy", cmd("go", "v1"));
        Document before = store.getCurrent("deploy").orElseThrow();

        UpsertResult r = store.upsert("deploy", cmd("go", "v1"));

        assertEquals(UpsertOutcome.UNCHANGED, r.outcome());
        assertEquals(before, store.getCurrent("deploy").orElseThrow());
        assertTrue(store.history(before.id()).isEmpty());
    }

    @Test
    void changed_content_archives_the_previous_row_verbatim() {
        Document v1 = store.upsert("deploy", cmd("go", "v1")).document();

        UpsertResult r = store.upsert("deploy", cmd("go", "v2"));

        assertEquals(UpsertOutcome.UPDATED, r.outcome());
        assertEquals(2, r.version());
        assertEquals(v1.id(), r.document().id());

        List<HistoryRecord> history = store.history(v1.id());
        assertEquals(1, history.size());
        assertEquals(v1, history.get(0).document());
        assertEquals("content changed", history.get(0).changeSummary());
        assertEquals("v1", store.getVersion(v1.id(), 1).orElseThrow().content());
        assertEquals("v2", store.getVersion(v1.id(), 2).orElseThrow().content());
        assertTrue(store.getVersion(v1.id(), 3).isEmpty());
    }

    @Test
    void category_move_with_same_content_is_unchanged() {
        Document v1 = store.upsert("deploy", cmd("go", "v1")).document();

        UpsertResult r = store.upsert("deploy", cmd("tools", "v1"));

        assertEquals(UpsertOutcome.UNCHANGED, r.outcome());
        assertEquals(v1, store.getCurrent("deploy").orElseThrow());
        assertTrue(store.history(v1.id()).isEmpty());
    }

    @Test
    void category_move_with_new_content_takes_the_new_category() {
        Document v1 = store.upsert("deploy", cmd("go", "v1")).document();

        UpsertResult r = store.upsert("deploy", cmd("tools", "v2"));

        assertEquals(UpsertOutcome.UPDATED, r.outcome());
        assertEquals("tools", r.document().category().label());
        assertEquals("content changed, moved from go to tools", store.history(v1.id()).get(0).changeSummary());
    }

    @Test
    void explicit_change_summary_is_kept_on_the_archived_row() {
        Document v1 = store.upsert("deploy", cmd("go", "v1")).document();
        store.upsert("deploy", cmd("go", "v2"), null, "tightened wording");
        assertEquals("tightened wording", store.history(v1.id()).get(0).changeSummary());
    }

    @Test
    void changing_kind_of_an_existing_name_is_rejected() {
        store.upsert("deploy", cmd("go", "v1"));

        StoreException e = assertThrows(StoreException.class,
                () -> store.upsert("deploy", new DocumentBody.Plan(PlanStatus.DRAFT, "v1")));
        assertEquals(StoreException.Reason.KIND_MISMATCH, e.reason());
        assertEquals(1, store.getCurrent("deploy").orElseThrow().version());
    }

    @Test
    void rollback_creates_a_new_version_with_old_content() {
        String id = store.upsert("p", cmd("go", "v1")).document().id();
        store.upsert("p", cmd("go", "v2"));

        UpsertResult r = store.rollback(id, 1, null);

        assertEquals(UpsertOutcome.UPDATED, r.outcome());
        assertEquals(3, r.version());
        assertEquals("v1", r.document().content());
        assertEquals(ContentHash.of("v1"), r.document().contentHash());

        List<HistoryRecord> history = store.history(id);
        assertEquals(List.of(1, 2), history.stream().map(HistoryRecord::version).toList());
        assertEquals("v2", history.get(1).document().content());
        assertEquals("rollback to version 1", history.get(1).changeSummary());
    }

    @Test
    void rollback_of_unknown_id_or_version_fails() {
        String id = store.upsert("p", cmd("go", "v1")).document().id();

        assertEquals(StoreException.Reason.NOT_FOUND,
                assertThrows(StoreException.class, () -> store.rollback("nope", 1, null)).reason());
        assertEquals(StoreException.Reason.NOT_FOUND,
                assertThrows(StoreException.class, () -> store.rollback(id, 7, null)).reason());
    }

    @Test
    void current_snapshot_is_ordered_by_name() {
        store.upsert("zeta", cmd("go", "z"));
        store.upsert("alpha", cmd("js", "a"));
        store.upsert("mid", new DocumentBody.Plan(PlanStatus.APPROVED, "m"));

        assertEquals(List.of("alpha", "mid", "zeta"),
                store.currentSnapshot().stream().map(Document::name).toList());
    }

    @Test
    void unknown_project_ref_is_rejected() {
        StoreException e = assertThrows(StoreException.class,
                () -> store.upsert("deploy", cmd("go", "v1"), "ghost", null));
        assertEquals(StoreException.Reason.DANGLING_PROJECT_REF, e.reason());
        assertTrue(store.getCurrent("deploy").isEmpty());
    }

    @Test
    void removing_a_project_clears_refs_but_keeps_documents_and_history() {
        store.registerProject("collect", "main repo");
        store.registerProject("other", null);
        Document a = store.upsert("a", cmd("go", "a1"), "collect", null).document();
        store.upsert("a", cmd("go", "a2"), "collect", null);
        store.upsert("b", cmd("go", "b1"), "collect", null);
        store.upsert("c", cmd("go", "c1"), "other", null);

        int cleared = store.removeProject("collect");

        assertEquals(2, cleared);
        assertTrue(store.findProject("collect").isEmpty());
        assertNull(store.getCurrent("a").orElseThrow().projectRef());
        assertNull(store.getCurrent("b").orElseThrow().projectRef());
        assertEquals("other", store.getCurrent("c").orElseThrow().projectRef());
        assertEquals(2, store.getCurrent("a").orElseThrow().version(), "clearing a ref is not a new version");
        assertEquals("collect", store.history(a.id()).get(0).document().projectRef());
        assertDoesNotThrow(store::verifyIntegrity);
    }

    @Test
    void register_project_is_idempotent_and_remove_unknown_fails() {
        var first = store.registerProject("collect", "main");
        var second = store.registerProject("collect", "ignored");
        assertEquals(first, second);

        assertEquals(StoreException.Reason.NOT_FOUND,
                assertThrows(StoreException.class, () -> store.removeProject("ghost")).reason());
    }

    @Test
    void null_project_ref_on_update_keeps_the_association() {
        store.registerProject("collect", null);
        store.upsert("a", cmd("go", "a1"), "collect", null);
        store.upsert("a", cmd("go", "a2"), null, null);
        assertEquals("collect", store.getCurrent("a").orElseThrow().projectRef());
    }

    @Test
    void metrics_are_keyed_and_replace_on_same_key() {
        Document d = store.upsert("a", cmd("go", "a1")).document();
        Instant t = Instant.parse("2025-08-10T00:00:00Z");

        store.recordMetric(new MetricPoint(d.id(), 1, "score", 0, 0.5, t));
        store.recordMetric(new MetricPoint(d.id(), 1, "score", 0, 0.9, t));
        store.recordMetric(new MetricPoint(d.id(), 1, "score", 1, 0.7, t));

        List<MetricPoint> points = store.metrics(d.id(), 1);
        assertEquals(2, points.size());
        assertEquals(0.9, points.get(0).value());
        assertEquals(1, points.get(1).step());

        assertThrows(StoreException.class,
                () -> store.recordMetric(new MetricPoint(d.id(), 5, "score", 0, 1.0, t)));
    }

    @Test
    void second_open_of_the_same_directory_is_locked() {
        StoreException e = assertThrows(StoreException.class, () -> DurableVersionStore.open(dir));
        assertEquals(StoreException.Reason.LOCKED, e.reason());
    }

    @Test
    void closed_store_rejects_writes() {
        store.close();
        assertThrows(IllegalStateException.class, () -> store.upsert("a", cmd("go", "x")));
    }
}
