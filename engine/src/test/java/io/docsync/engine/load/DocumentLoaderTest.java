package io.docsync.engine.load;

import io.docsync.core.CategorySet;
import io.docsync.core.ContentHash;
import io.docsync.core.DocumentKind;
import io.docsync.core.PlanStatus;
import io.docsync.core.DocumentBody;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentLoaderTest {

    @TempDir
    Path tmp;

    private final DocumentLoader loader = new DocumentLoader(new CategoryResolver(CategorySet.defaults()), ".md", 3);

    private static Path write(Path file, String content) throws Exception {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Test
    void loads_commands_and_plans_with_placement_and_hash() throws Exception {
        Path cmds = tmp.resolve("commands");
        Path plans = tmp.resolve("plans");
        write(cmds.resolve("go/build.md"), "go build ./...");
        write(cmds.resolve("readme.md"), "top level");
        write(cmds.resolve("go/notes.txt"), "ignored extension");
        write(plans.resolve("approved/migrate.md"), "the plan");

        LoadResult r = loader.load(List.of(SourceRoot.commands(cmds), SourceRoot.plans(plans)));

        assertTrue(r.errors().isEmpty(), r.errors().toString());
        assertEquals(List.of("build", "readme", "migrate"), r.documents().stream().map(SourceDocument::name).toList());

        SourceDocument build = r.documents().get(0);
        assertEquals(DocumentKind.COMMAND, build.body().kind());
        assertEquals("go", build.body().category().label());
        assertEquals(ContentHash.of("go build ./..."), build.contentHash());
        assertEquals("uncategorized", r.documents().get(1).body().category().label());

        SourceDocument plan = r.documents().get(2);
        assertEquals(PlanStatus.APPROVED, ((DocumentBody.Plan) plan.body()).status());
    }

    @Test
    void invalid_utf8_is_a_load_error_and_the_scan_continues() throws Exception {
        Path cmds = tmp.resolve("commands");
        Files.createDirectories(cmds.resolve("go"));
        Files.write(cmds.resolve("go/broken.md"), new byte[]{'o', 'k', (byte) 0xC3, (byte) 0x28});
        write(cmds.resolve("go/fine.md"), "fine");

        LoadResult r = loader.load(List.of(SourceRoot.commands(cmds)));

        assertEquals(List.of("fine"), r.documents().stream().map(SourceDocument::name).toList());
        assertEquals(1, r.errors().size());
        assertEquals("MalformedInput", r.errors().get(0).errorType());
        assertTrue(r.errors().get(0).path().endsWith("broken.md"));
    }

    @Test
    void missing_root_is_reported_not_thrown() {
        LoadResult r = loader.load(List.of(SourceRoot.commands(tmp.resolve("nope"))));
        assertTrue(r.documents().isEmpty());
        assertEquals("MissingRoot", r.errors().get(0).errorType());
    }

    @Test
    void plan_outside_lifecycle_directory_is_an_error() throws Exception {
        Path plans = tmp.resolve("plans");
        write(plans.resolve("loose.md"), "where am i");
        write(plans.resolve("drafts/ok.md"), "fine");

        LoadResult r = loader.load(List.of(SourceRoot.plans(plans)));

        assertEquals(List.of("ok"), r.documents().stream().map(SourceDocument::name).toList());
        assertEquals("MisplacedPlan", r.errors().get(0).errorType());
    }

    @Test
    void same_plan_in_two_lifecycle_directories_is_ambiguous() throws Exception {
        Path plans = tmp.resolve("plans");
        write(plans.resolve("drafts/p.md"), "draft text");
        write(plans.resolve("approved/p.md"), "approved text");

        LoadResult r = loader.load(List.of(SourceRoot.plans(plans)));

        assertTrue(r.documents().isEmpty());
        assertEquals(2, r.errors().size());
        assertTrue(r.errors().stream().allMatch(e -> e.errorType().equals("AmbiguousName")));
    }

    @Test
    void identical_copies_in_mirrored_roots_collapse_to_one() throws Exception {
        Path a = tmp.resolve("a");
        Path b = tmp.resolve("b");
        write(a.resolve("tools/fmt.md"), "same");
        write(b.resolve("tools/fmt.md"), "same");

        LoadResult r = loader.load(List.of(SourceRoot.commands(a), SourceRoot.commands(b)));

        assertTrue(r.errors().isEmpty());
        assertEquals(1, r.documents().size());
        assertTrue(r.documents().get(0).path().startsWith(a));
    }

    @Test
    void diverging_copies_in_mirrored_roots_are_ambiguous() throws Exception {
        Path a = tmp.resolve("a");
        Path b = tmp.resolve("b");
        write(a.resolve("tools/fmt.md"), "one");
        write(b.resolve("tools/fmt.md"), "two");

        LoadResult r = loader.load(List.of(SourceRoot.commands(a), SourceRoot.commands(b)));

        assertTrue(r.documents().isEmpty());
        assertEquals(2, r.errors().size());
    }

    @Test
    void many_files_load_in_path_order() throws Exception {
        Path cmds = tmp.resolve("commands");
        for (int i = 0; i < 40; i++) write(cmds.resolve(String.format("python/f%02d.md", i)), "body " + i);

        LoadResult r = loader.load(List.of(SourceRoot.commands(cmds)));

        assertEquals(40, r.documents().size());
        for (int i = 0; i < 40; i++) {
            assertEquals(String.format("f%02d", i), r.documents().get(i).name());
            assertEquals("body " + i, r.documents().get(i).body().content());
        }
    }

    @Test
    void files_without_a_usable_stem_are_load_errors() throws Exception {
        Path cmds = tmp.resolve("commands");
        write(cmds.resolve("go/ .md"), "blank stem");
        write(cmds.resolve("go/.md"), "extension only");
        write(cmds.resolve("go/real.md"), "real");

        LoadResult r = loader.load(List.of(SourceRoot.commands(cmds)));

        assertEquals(List.of("real"), r.documents().stream().map(SourceDocument::name).toList());
        assertEquals(2, r.errors().size());
        assertTrue(r.errors().stream().allMatch(e -> e.errorType().equals("BlankName")), r.errors().toString());
    }
}
