package com.questrail.phaseseq.registration;

import com.questrail.phaseseq.api.CancellationSignal;

import java.nio.file.Path;

/**
 * Boundary to the external image-registration step.
 *
 * <p>Implementations align the frames of {@code input}, write the aligned stack
 * to {@code output} and a text log to {@code log}. The call blocks until the
 * work is done, fails, times out or {@code cancellation} fires.</p>
 */
public interface RegistrationTool
{
    /**
     * @throws RegistrationException if the tool is unavailable, fails, times out
     *                               or is cancelled, or if its outputs are missing
     */
    void register(Path input, Path output, Path log, CancellationSignal cancellation);
}
