// file: core/src/main/java/io/docsync/core/ContentHash.java
package io.docsync.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hashing scheme used for change detection.
 * <p>
 * Scheme "sha256-utf8-hex": SHA-256 over the UTF-8 bytes of the text,
 * rendered as 64 lower-case hex characters. Persisted hashes are only
 * comparable within one scheme, so the scheme is fixed.
 */
public final class ContentHash {

    public static final String SCHEME = "sha256-utf8-hex";
    public static final int HEX_LENGTH = 64;

    private ContentHash() {
        // utility
    }

    public static String of(String content) {
        if (content == null) throw new NullPointerException("content");
        return HexFormat.of().formatHex(newDigest().digest(content.getBytes(StandardCharsets.UTF_8)));
    }

    public static boolean matches(String content, String expectedHash) {
        return expectedHash != null && of(content).equals(expectedHash);
    }

    static MessageDigest newDigest() {
        try { return MessageDigest.getInstance("SHA-256"); }
        catch (NoSuchAlgorithmException e) { throw new IllegalStateException("SHA-256 unavailable", e); }
    }
}
