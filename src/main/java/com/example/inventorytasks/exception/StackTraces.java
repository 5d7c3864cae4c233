package com.example.inventorytasks.exception;

/**
 * Compact stack traces for storage in the task attempt log.
 */
public final class StackTraces {

    static final int MAX_FRAMES = 20;
    static final int MAX_LENGTH = 4000;

    private StackTraces() {
    }

    public static String summarize(Throwable error) {
        if (error == null) {
            return null;
        }

        var out = new StringBuilder(error.toString());
        var frames = error.getStackTrace();
        var shown = Math.min(frames.length, MAX_FRAMES);
        for (var i = 0; i < shown; i++) {
            out.append("\n\tat ").append(frames[i]);
        }
        if (frames.length > shown) {
            out.append("\n\t... ").append(frames.length - shown).append(" more");
        }
        if (error.getCause() != null && error.getCause() != error) {
            out.append("\nCaused by: ").append(error.getCause());
        }

        return out.length() > MAX_LENGTH ? out.substring(0, MAX_LENGTH) : out.toString();
    }
}
