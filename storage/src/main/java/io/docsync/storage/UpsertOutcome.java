// file: storage/src/main/java/io/docsync/storage/UpsertOutcome.java
package io.docsync.storage;

/** Classification of one upsert, a pure function of the hash and placement comparison. */
public enum UpsertOutcome {
    CREATED,
    UPDATED,
    UNCHANGED
}
