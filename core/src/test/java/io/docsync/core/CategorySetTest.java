package io.docsync.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategorySetTest {

    @Test
    void defaults_are_the_six_command_categories() {
        CategorySet set = CategorySet.defaults();
        assertEquals(6, set.size());
        assertEquals(List.of("archive", "go", "js", "mcp", "python", "tools"),
                set.categories().stream().map(Category::label).toList());
    }

    @Test
    void find_returns_configured_labels_only() {
        CategorySet set = CategorySet.of(List.of("go", "tools"));
        assertEquals(new Category("go"), set.find("go").orElseThrow());
        assertTrue(set.find("python").isEmpty());
        assertTrue(set.find("uncategorized").isEmpty());
    }

    @Test
    void rejects_duplicates_and_reserved_label() {
        assertThrows(IllegalArgumentException.class, () -> CategorySet.of(List.of("go", "go")));
        assertThrows(IllegalArgumentException.class, () -> CategorySet.of(List.of("uncategorized")));
    }

    @Test
    void rejects_malformed_labels() {
        assertThrows(IllegalArgumentException.class, () -> CategorySet.of(List.of("Go")));
        assertThrows(IllegalArgumentException.class, () -> CategorySet.of(List.of("a/b")));
        assertThrows(IllegalArgumentException.class, () -> CategorySet.of(List.of("")));
    }

    @Test
    void plan_status_maps_to_lifecycle_directories() {
        assertEquals(PlanStatus.DRAFT, PlanStatus.fromDirectoryName("drafts").orElseThrow());
        assertEquals(PlanStatus.APPROVED, PlanStatus.fromDirectoryName("approved").orElseThrow());
        assertEquals(PlanStatus.COMPLETED, PlanStatus.fromDirectoryName("completed").orElseThrow());
        assertTrue(PlanStatus.fromDirectoryName("draft").isEmpty());
        assertEquals("approved", new DocumentBody.Plan(PlanStatus.APPROVED, "x").category().label());
    }
}
