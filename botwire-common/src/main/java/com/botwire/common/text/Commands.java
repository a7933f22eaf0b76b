package com.botwire.common.text;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slash-command parsing for message text.
 * <p>
 * A command is the first whitespace-delimited token of the text when it starts with {@code /}.
 * {@code /help@mybot args} yields command {@code help}, mention {@code mybot}, arguments {@code args}.
 */
public final class Commands {

    private Commands() {
    }

    private static final Pattern COMMAND_RE = Pattern.compile("^/([^\\s@]*)(?:@(\\S*))?(?:\\s+([\\s\\S]*))?$");

    /** Whether {@code text} starts with a slash. */
    public static boolean isCommand(String text) {
        return text != null && text.startsWith("/");
    }

    /**
     * The command name without slash or bot mention, or null when the text is not a command.
     * {@code "/start"} and {@code "/start@mybot hi"} both yield {@code "start"}.
     */
    public static String extractCommand(String text) {
        Matcher m = match(text);
        return m != null ? m.group(1) : null;
    }

    /** The {@code @botname} suffix of the command token without the at-sign, or null. */
    public static String extractMention(String text) {
        Matcher m = match(text);
        if (m == null || m.group(2) == null || m.group(2).isEmpty())
            return null;
        return m.group(2);
    }

    /**
     * Everything after the command token, trimmed; empty when there is none, null when not a command.
     */
    public static String extractArguments(String text) {
        Matcher m = match(text);
        if (m == null)
            return null;
        return m.group(3) != null ? m.group(3).strip() : "";
    }

    private static Matcher match(String text) {
        if (!isCommand(text))
            return null;
        Matcher m = COMMAND_RE.matcher(text);
        return m.matches() ? m : null;
    }
}
