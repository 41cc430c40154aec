package com.chatbridge.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextTest {

    @Test
    void previewFlattensNewlines() {
        assertEquals("hello world", Text.preview("hello\nworld", 80));
        assertEquals("a b", Text.preview("a\r\nb", 80));
    }

    @Test
    void previewTruncatesWithEllipsis() {
        assertEquals("abc…", Text.preview("abcdef", 3));
        assertEquals("abc", Text.preview("abc", 3));
    }

    @Test
    void previewOfNullIsEmpty() {
        assertEquals("", Text.preview(null, 10));
    }

    @Test
    void lengthCountsTrimmedCodePoints() {
        assertEquals(3, Text.length("  hé! "));
        assertEquals(0, Text.length(null));
    }
}
