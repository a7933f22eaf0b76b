package com.botwire.common.logging;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks bot tokens in text bound for logs and exception messages.
 */
public final class TokenRedactor {

    private TokenRedactor() {
    }

    private static final int KEEP_START = 4;
    private static final int KEEP_END = 2;

    /** {@code <digits>:<secret>}, optionally as the {@code bot<token>} URL segment. */
    private static final Pattern TOKEN_PATTERN = Pattern.compile("(\\d{5,}:[A-Za-z0-9_-]{20,})");

    private static final Pattern JSON_TOKEN_FIELD = Pattern.compile(
            "\"(token|secretToken|secret_token)\"\\s*:\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

    /**
     * Redact every token-shaped value in {@code text}.
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = replaceGroup(TOKEN_PATTERN.matcher(text), 1);
        return replaceGroup(JSON_TOKEN_FIELD.matcher(result), 2);
    }

    /**
     * Redact a known token wherever it appears, then any other token-shaped value.
     */
    public static String redact(String text, String token) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        if (token != null && !token.isEmpty()) {
            result = result.replace(token, mask(token));
        }
        return redact(result);
    }

    /**
     * Keep a few leading and trailing characters; short values are fully masked.
     */
    public static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        if (value.length() < 12) {
            return "***";
        }
        return value.substring(0, KEEP_START) + "…" + value.substring(value.length() - KEEP_END);
    }

    private static String replaceGroup(Matcher matcher, int group) {
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String full = matcher.group(0);
            String secret = matcher.group(group);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(full.replace(secret, mask(secret))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
