// file: engine/src/main/java/io/docsync/engine/dto/JsonSyncConfig.java
package io.docsync.engine.dto;

import java.util.List;

public class JsonSyncConfig {
    public String dataDir;
    public List<String> commandRoots;
    public String planRoot;
    public List<String> categories;
    public String extension;
    public String projectRef;
    public String projectDescription;
    public Integer loaderThreads;
    public Integer writerThreads;
    public Integer snapshotEveryOps;
    public Long walRotateBytes;
}
