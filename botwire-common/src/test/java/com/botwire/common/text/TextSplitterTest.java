package com.botwire.common.text;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextSplitterTest {

    @Nested
    class SmartSplit {
        @Test
        void shortText_singleChunk() {
            assertEquals(List.of("hello"), TextSplitter.smartSplit("hello", 100));
            assertEquals(List.of(""), TextSplitter.smartSplit("", 100));
        }

        @Test
        void prefersNewline() {
            List<String> chunks = TextSplitter.smartSplit("first line. more\nsecond line", 20);

            assertEquals(List.of("first line. more\n", "second line"), chunks);
        }

        @Test
        void fallsBackToSentenceEnd() {
            List<String> chunks = TextSplitter.smartSplit("One two. Three four five six", 15);

            assertEquals(List.of("One two. ", "Three four ", "five six"), chunks);
        }

        @Test
        void fallsBackToWhitespace() {
            List<String> chunks = TextSplitter.smartSplit("alpha beta gamma", 12);

            assertEquals(List.of("alpha beta ", "gamma"), chunks);
        }

        @Test
        void hardCutWithoutSeparators() {
            List<String> chunks = TextSplitter.smartSplit("abcdefghij", 4);

            assertEquals(List.of("abcd", "efgh", "ij"), chunks);
        }

        @Test
        void stripsLeadingWhitespaceOfNextChunk() {
            List<String> chunks = TextSplitter.smartSplit("aaaa\n   bbbb", 6);

            assertEquals(List.of("aaaa\n", "bbbb"), chunks);
        }

        @Test
        void everyChunkWithinLimit() {
            String text = "word ".repeat(3000);
            List<String> chunks = TextSplitter.smartSplit(text, 4096);

            assertTrue(chunks.size() > 1);
            chunks.forEach(c -> assertTrue(c.length() <= 4096));
        }

        @Test
        void limitIsClamped() {
            String text = "x".repeat(5000);
            List<String> chunks = TextSplitter.smartSplit(text, 10_000);

            assertEquals(4096, chunks.get(0).length());
            assertEquals(904, chunks.get(1).length());
            assertEquals(5, TextSplitter.smartSplit("abcde", 0).size());
        }
    }

    @Nested
    class SplitString {
        @Test
        void fixedWidth() {
            assertEquals(List.of("abc", "def", "g"), TextSplitter.splitString("abcdefg", 3));
        }

        @Test
        void rejectsNonPositiveWidth() {
            assertThrows(IllegalArgumentException.class, () -> TextSplitter.splitString("abc", 0));
        }
    }
}
