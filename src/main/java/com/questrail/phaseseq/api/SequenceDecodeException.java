package com.questrail.phaseseq.api;

import java.nio.file.Path;

/**
 * Indicates that a source frame, image stack or encoded container could not be
 * decoded.
 *
 * This typically reflects:
 * <ul>
 *   <li>A truncated or malformed phase-map file</li>
 *   <li>A stack with no pages or with non-float pages</li>
 *   <li>Frames whose dimensions differ within one sequence</li>
 * </ul>
 */
public final class SequenceDecodeException extends RuntimeException
{
    private final Path path;

    public SequenceDecodeException(Path path, String message) {
        super(format(path, message));
        this.path = path;
    }

    public SequenceDecodeException(Path path, String message, Throwable cause) {
        super(format(path, message), cause);
        this.path = path;
    }

    /**
     * The file that failed to decode.
     */
    public Path path() {
        return path;
    }

    private static String format(Path path, String message) {
        return path == null ? message : message + " [" + path + "]";
    }
}
