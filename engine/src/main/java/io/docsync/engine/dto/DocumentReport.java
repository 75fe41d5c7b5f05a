// file: engine/src/main/java/io/docsync/engine/dto/DocumentReport.java
package io.docsync.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** JSON output of single-document commands such as rollback. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentReport {
    public String command;
    public String outcome;
    public String name;
    public String id;
    public int version;
    public String category;
    public String contentHash;
    public String projectRef;
}
