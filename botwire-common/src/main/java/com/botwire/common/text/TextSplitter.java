package com.botwire.common.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long outgoing text into chunks that fit the platform's message size limit.
 */
public final class TextSplitter {

    private TextSplitter() {
    }

    /** Maximum characters in one outgoing text message. */
    public static final int MAX_MESSAGE_LENGTH = 4096;

    private static final String[] SENTENCE_ENDS = {". ", "! ", "? "};

    /**
     * Split with the default limit of {@value #MAX_MESSAGE_LENGTH} characters.
     */
    public static List<String> smartSplit(String text) {
        return smartSplit(text, MAX_MESSAGE_LENGTH);
    }

    /**
     * Split {@code text} into chunks of at most {@code maxChars} characters.
     * <p>
     * Each cut happens after the last newline in the window, else after the last sentence end
     * ({@code ". "}, {@code "! "}, {@code "? "}), else after the last whitespace, else at the limit.
     * The separator stays with the preceding chunk; leading whitespace of the next chunk is dropped.
     *
     * @param maxChars clamped to 1..{@value #MAX_MESSAGE_LENGTH}
     */
    public static List<String> smartSplit(String text, int maxChars) {
        if (text == null)
            return List.of();
        int limit = Math.max(1, Math.min(maxChars, MAX_MESSAGE_LENGTH));

        List<String> chunks = new ArrayList<>();
        String rest = text;
        while (rest.length() > limit) {
            String window = rest.substring(0, limit);
            int cut = cutPoint(window);
            chunks.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty() || chunks.isEmpty()) {
            chunks.add(rest);
        }
        return chunks;
    }

    /**
     * Fixed-width split: consecutive slices of {@code chunkSize} characters.
     */
    public static List<String> splitString(String text, int chunkSize) {
        if (chunkSize < 1)
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        if (text == null)
            return List.of();
        List<String> chunks = new ArrayList<>((text.length() / chunkSize) + 1);
        for (int i = 0; i < text.length(); i += chunkSize) {
            chunks.add(text.substring(i, Math.min(text.length(), i + chunkSize)));
        }
        return chunks;
    }

    private static int cutPoint(String window) {
        int nl = window.lastIndexOf('\n');
        if (nl >= 0)
            return nl + 1;

        int sentence = -1;
        for (String end : SENTENCE_ENDS) {
            int idx = window.lastIndexOf(end);
            if (idx >= 0)
                sentence = Math.max(sentence, idx + end.length());
        }
        if (sentence > 0)
            return sentence;

        for (int i = window.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(window.charAt(i)))
                return i + 1;
        }

        int hard = window.length();
        // keep surrogate pairs together
        if (hard > 1 && Character.isHighSurrogate(window.charAt(hard - 1)))
            hard--;
        return hard;
    }
}
