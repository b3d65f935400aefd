package com.questrail.phaseseq.runtime;

import java.nio.file.Path;
import java.util.List;

/**
 * Asked before a run replaces existing output files.
 *
 * <p>Invoked on the worker thread. A UI implementation must marshal the
 * question to its own thread and wait for the answer.</p>
 */
@FunctionalInterface
public interface OverwriteConfirmation
{
    OverwriteConfirmation ALWAYS = existing -> true;
    OverwriteConfirmation NEVER = existing -> false;

    /**
     * @param existing output files that already exist, never empty
     * @return {@code true} to replace them, {@code false} to abandon the run
     */
    boolean confirmOverwrite(List<Path> existing);
}
