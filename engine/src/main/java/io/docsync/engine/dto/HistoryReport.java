// file: engine/src/main/java/io/docsync/engine/dto/HistoryReport.java
package io.docsync.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON output of the history command: every archived version followed by the
 * current one (current = true).
 */
public class HistoryReport {
    public String name;
    public String id;
    public String kind;
    public List<VersionEntry> versions;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class VersionEntry {
        public int version;
        public boolean current;
        public String category;
        public String contentHash;
        public String projectRef;
        public String updatedAt;
        public String archivedAt;
        public String changeSummary;
    }
}
