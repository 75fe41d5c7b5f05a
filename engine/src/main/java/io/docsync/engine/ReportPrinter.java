// file: engine/src/main/java/io/docsync/engine/ReportPrinter.java
package io.docsync.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docsync.core.Document;
import io.docsync.core.HistoryRecord;
import io.docsync.engine.dto.DocumentReport;
import io.docsync.engine.dto.HistoryReport;
import io.docsync.engine.dto.RunReport;
import io.docsync.storage.UpsertResult;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders run results for the command line, as plain text or as JSON.
 */
public final class ReportPrinter {
    private final ObjectMapper json = new ObjectMapper();
    private final PrintStream out;
    private final boolean asJson;

    public ReportPrinter(PrintStream out, boolean asJson) {
        this.out = out;
        this.asJson = asJson;
    }

    public void sync(String command, SyncSummary s) {
        if (asJson) {
            RunReport r = new RunReport();
            r.command = command;
            r.dryRun = s.dryRun();
            r.created = s.created();
            r.updated = s.updated();
            r.unchanged = s.unchanged();
            r.errors = s.errors().stream().map(ReportPrinter::entry).toList();
            print(r);
            return;
        }
        String verb = s.dryRun() ? "would be " : "";
        out.printf("%s: %d %screated, %d %supdated, %d unchanged, %d errors%n",
                command, s.created().size(), verb, s.updated().size(), verb,
                s.unchanged().size(), s.errors().size());
        s.created().forEach(n -> out.println("  + " + n));
        s.updated().forEach(n -> out.println("  ~ " + n));
        for (SyncError e : s.errors()) {
            out.println("  ! [" + e.stage() + "] " + e.subject() + ": " + e.reason());
        }
    }

    public void flatten(FlattenSummary s) {
        if (asJson) {
            RunReport r = new RunReport();
            r.command = "flatten";
            r.written = s.written();
            List<RunReport.ErrorEntry> errors = new ArrayList<>();
            for (FlattenError e : s.errors()) {
                RunReport.ErrorEntry entry = new RunReport.ErrorEntry();
                entry.subject = e.name();
                entry.path = e.path() != null ? e.path().toString() : null;
                entry.reason = e.reason();
                errors.add(entry);
            }
            r.errors = errors;
            print(r);
            return;
        }
        out.printf("flatten: %d written, %d errors%n", s.written().size(), s.errors().size());
        for (FlattenError e : s.errors()) {
            out.println("  ! " + e.name() + (e.path() != null ? " (" + e.path() + ")" : "") + ": " + e.reason());
        }
    }

    public void history(Document current, List<HistoryRecord> history) {
        if (asJson) {
            HistoryReport r = new HistoryReport();
            r.name = current.name();
            r.id = current.id();
            r.kind = current.kind().label();
            List<HistoryReport.VersionEntry> versions = new ArrayList<>();
            for (HistoryRecord h : history) {
                HistoryReport.VersionEntry v = version(h.document());
                v.archivedAt = h.archivedAt().toString();
                v.changeSummary = h.changeSummary();
                versions.add(v);
            }
            HistoryReport.VersionEntry cur = version(current);
            cur.current = true;
            versions.add(cur);
            r.versions = versions;
            print(r);
            return;
        }
        out.println(current.name() + " (" + current.kind().label() + ", id " + current.id() + ")");
        for (HistoryRecord h : history) {
            Document d = h.document();
            out.printf("  v%d  %s  %s  %s%n", d.version(), d.category(), shortHash(d.contentHash()),
                    h.changeSummary() != null ? h.changeSummary() : "");
        }
        out.printf("  v%d  %s  %s  (current)%n", current.version(), current.category(), shortHash(current.contentHash()));
    }

    public void document(String command, UpsertResult result) {
        Document d = result.document();
        if (asJson) {
            DocumentReport r = new DocumentReport();
            r.command = command;
            r.outcome = result.outcome().name();
            r.name = d.name();
            r.id = d.id();
            r.version = d.version();
            r.category = d.category().label();
            r.contentHash = d.contentHash();
            r.projectRef = d.projectRef();
            print(r);
            return;
        }
        out.printf("%s: %s is now version %d (%s)%n", command, d.name(), d.version(),
                result.outcome().name().toLowerCase(Locale.ROOT));
    }

    public void message(String text) {
        if (asJson) {
            print(Map.of("message", text));
            return;
        }
        out.println(text);
    }

    private void print(Object value) {
        try {
            out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render JSON output", e);
        }
    }

    private static RunReport.ErrorEntry entry(SyncError e) {
        RunReport.ErrorEntry entry = new RunReport.ErrorEntry();
        entry.subject = e.subject();
        entry.path = e.path() != null ? e.path().toString() : null;
        entry.stage = e.stage().name();
        entry.reason = e.reason();
        entry.errorType = e.errorType();
        return entry;
    }

    private static HistoryReport.VersionEntry version(Document d) {
        HistoryReport.VersionEntry v = new HistoryReport.VersionEntry();
        v.version = d.version();
        v.category = d.category().label();
        v.contentHash = d.contentHash();
        v.projectRef = d.projectRef();
        v.updatedAt = d.updatedAt().toString();
        return v;
    }

    private static String shortHash(String hash) {
        return hash.substring(0, 12);
    }
}
