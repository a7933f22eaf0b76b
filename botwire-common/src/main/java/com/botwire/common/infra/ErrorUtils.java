package com.botwire.common.infra;

import com.botwire.common.logging.TokenRedactor;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.HashSet;
import java.util.Set;

/**
 * Error formatting and classification helpers.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely, with tokens redacted.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return TokenRedactor.redact(msg);
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Format the message of {@code err} followed by each distinct cause, joined with " | ".
     */
    public static String formatErrorChain(Throwable err) {
        if (err == null)
            return "Error";
        StringBuilder sb = new StringBuilder(formatErrorMessage(err));
        Set<Throwable> visited = new HashSet<>();
        visited.add(err);
        Throwable cause = err.getCause();
        while (cause != null && visited.add(cause)) {
            String part = formatErrorMessage(cause);
            if (sb.indexOf(part) < 0) {
                sb.append(" | ").append(part);
            }
            cause = cause.getCause();
        }
        return sb.toString();
    }

    /**
     * Whether a network failure is worth retrying: timeouts, refused or reset connections, DNS.
     */
    public static boolean isRecoverableNetworkError(Throwable err) {
        Set<Throwable> visited = new HashSet<>();
        for (Throwable t = err; t != null && visited.add(t); t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t instanceof ConnectException
                    || t instanceof UnknownHostException) {
                return true;
            }
            String msg = t.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase();
                if (lower.contains("connection reset") || lower.contains("broken pipe")
                        || lower.contains("timed out") || lower.contains("unexpected end of stream")) {
                    return true;
                }
            }
        }
        return false;
    }
}
