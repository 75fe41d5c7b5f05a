package io.docsync.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentHashTest {

    @Test
    void matches_known_sha256_vectors() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", ContentHash.of("abc"));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", ContentHash.of(""));
    }

    @Test
    void hashes_utf8_bytes_not_chars() {
        // same glyph, different code points
        String composed = "caf\u00e9";
        String decomposed = "cafe\u0301";
        assertNotEquals(ContentHash.of(composed), ContentHash.of(decomposed));
        assertEquals(ContentHash.HEX_LENGTH, ContentHash.of(composed).length());
    }

    @Test
    void output_is_lower_case_hex() {
        String h = ContentHash.of("Hello, World");
        assertTrue(h.matches("[0-9a-f]{64}"), h);
    }

    @Test
    void matches_detects_tampering() {
        String h = ContentHash.of("v1");
        assertTrue(ContentHash.matches("v1", h));
        assertFalse(ContentHash.matches("v1 ", h));
    }
}
