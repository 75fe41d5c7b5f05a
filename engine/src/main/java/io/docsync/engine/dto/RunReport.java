// file: engine/src/main/java/io/docsync/engine/dto/RunReport.java
package io.docsync.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON output of sync, preview and flatten.
 * Example for sync:
 *   {
 *     "command": "sync",
 *     "dryRun": false,
 *     "created": ["deploy"],
 *     "updated": [],
 *     "unchanged": ["lint"],
 *     "errors": [
 *       { "subject": "bad.md", "path": "/cmds/go/bad.md", "stage": "LOAD",
 *         "reason": "not valid UTF-8: ...", "errorType": "MalformedInput" }
 *     ]
 *   }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {
    public String command;
    public boolean dryRun;
    public List<String> created;
    public List<String> updated;
    public List<String> unchanged;
    public List<String> written;
    public List<ErrorEntry> errors;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorEntry {
        public String subject;
        public String path;
        public String stage;
        public String reason;
        public String errorType;
    }
}
