package io.docsync.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2025-01-02T00:00:00Z");

    private static DocumentBody cmd(String category, String content) {
        return new DocumentBody.Command(new Category(category), content);
    }

    @Test
    void create_starts_at_version_one_with_matching_hash() {
        Document d = Document.create("id-1", "deploy", cmd("go", "v1"), null, T0);
        assertEquals(1, d.version());
        assertEquals(ContentHash.of("v1"), d.contentHash());
        assertTrue(d.hashIntact());
        assertEquals(T0, d.createdAt());
        assertEquals(T0, d.updatedAt());
    }

    @Test
    void revise_bumps_version_and_keeps_identity() {
        Document d = Document.create("id-1", "deploy", cmd("go", "v1"), "proj", T0);
        Document next = d.revise(cmd("tools", "v2"), null, T1);

        assertEquals("id-1", next.id());
        assertEquals(2, next.version());
        assertEquals("tools", next.category().label());
        assertEquals(ContentHash.of("v2"), next.contentHash());
        assertEquals("proj", next.projectRef(), "null ref keeps the existing association");
        assertEquals(T0, next.createdAt());
        assertEquals(T1, next.updatedAt());
    }

    @Test
    void hash_intact_detects_a_stale_hash() {
        Document d = new Document("id-1", "deploy", cmd("go", "v2"), ContentHash.of("v1"), 1, null, T0, T0);
        assertFalse(d.hashIntact());
    }

    @Test
    void rejects_version_zero_and_blank_names() {
        String h = ContentHash.of("x");
        assertThrows(IllegalArgumentException.class,
                () -> new Document("id", "n", cmd("go", "x"), h, 0, null, T0, T0));
        assertThrows(IllegalArgumentException.class,
                () -> new Document("id", " ", cmd("go", "x"), h, 1, null, T0, T0));
    }

    @Test
    void with_content_keeps_kind_and_placement() {
        DocumentBody plan = new DocumentBody.Plan(PlanStatus.COMPLETED, "old");
        DocumentBody swapped = plan.withContent("new");
        assertEquals(DocumentKind.PLAN, swapped.kind());
        assertEquals(PlanStatus.COMPLETED, ((DocumentBody.Plan) swapped).status());
        assertEquals("new", swapped.content());
    }
}
