package com.questrail.phaseseq.api;

/**
 * Receives fractional progress (0-100) from a streaming stage.
 *
 * <p>Stages report {@code round(index * 100 / total)} after each frame and a
 * final {@code 0} once done. Listeners are invoked on the worker thread; a
 * listener that feeds a UI must hand the value off (see
 * {@code ProgressDispatcher}).</p>
 */
@FunctionalInterface
public interface ProgressListener
{
    ProgressListener NONE = percent -> {};

    void onProgress(int percent);

    static int percentOf(int index, int total)
    {
        if (total <= 0) {
            return 0;
        }
        return Math.round(index * 100f / total);
    }
}
