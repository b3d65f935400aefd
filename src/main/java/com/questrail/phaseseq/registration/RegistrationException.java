package com.questrail.phaseseq.registration;

/**
 * Indicates that the external registration step could not produce its outputs.
 *
 * This typically reflects:
 * <ul>
 *   <li>A missing tool executable or macro file</li>
 *   <li>A non-zero exit status</li>
 *   <li>A run that exceeded its time box or was cancelled</li>
 *   <li>A missing log or aligned stack after the tool exited</li>
 * </ul>
 */
public final class RegistrationException extends RuntimeException
{
    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
