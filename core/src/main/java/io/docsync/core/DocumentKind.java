// file: core/src/main/java/io/docsync/core/DocumentKind.java
package io.docsync.core;

/**
 * Closed set of document kinds tracked by the store.
 * <p>
 * The code is the stable on-disk tag used by the WAL and snapshot formats;
 * never renumber an existing constant.
 */
public enum DocumentKind {
    COMMAND((byte) 1, "cmd"),
    PLAN((byte) 2, "plan");

    private final byte code;
    private final String label;

    DocumentKind(byte code, String label) {
        this.code = code;
        this.label = label;
    }

    public byte code() { return code; }

    public String label() { return label; }

    public static DocumentKind fromCode(byte code) {
        for (DocumentKind k : values()) {
            if (k.code == code) return k;
        }
        throw new IllegalArgumentException("Unknown document kind code: " + code);
    }
}
