package com.questrail.phaseseq.api;

import java.nio.file.Path;

/**
 * Indicates a malformed text artifact: a timestamp table row, a registration
 * log transform line, or a timestamp count that does not match the stack.
 */
public final class SequenceParseException extends RuntimeException
{
    private final Path path;
    private final int lineNumber;

    public SequenceParseException(Path path, int lineNumber, String message) {
        super(format(path, lineNumber, message));
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public SequenceParseException(Path path, int lineNumber, String message, Throwable cause) {
        super(format(path, lineNumber, message), cause);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public Path path() {
        return path;
    }

    /**
     * 1-based line number, or 0 when the failure is not tied to one line.
     */
    public int lineNumber() {
        return lineNumber;
    }

    private static String format(Path path, int lineNumber, String message) {
        StringBuilder sb = new StringBuilder(message);
        if (path != null) {
            sb.append(" [").append(path);
            if (lineNumber > 0) {
                sb.append(':').append(lineNumber);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
