package com.botwire.dispatch;

/**
 * Where handlers run.
 */
public enum DispatchMode {
    /** On the thread that calls {@code dispatch}; the poll loop waits for every handler. */
    INLINE,
    /** On a fixed worker pool; {@code dispatch} returns once the update is submitted. */
    POOLED;

    /**
     * @return the mode for a config value ("inline" or "pooled"), INLINE when null or blank
     */
    public static DispatchMode fromConfig(String value) {
        if (value == null || value.isBlank())
            return INLINE;
        return switch (value.trim().toLowerCase()) {
            case "inline" -> INLINE;
            case "pooled" -> POOLED;
            default -> throw new IllegalArgumentException("unknown dispatch mode: " + value);
        };
    }
}
