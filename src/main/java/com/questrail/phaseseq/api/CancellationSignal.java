package com.questrail.phaseseq.api;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CancellationSignal
 * =============================================================================
 * One-shot cancellation flag shared between the thread that requests a stop and
 * the worker that runs a pipeline.
 *
 * <p>Blocking stages (the external registration process) register a callback
 * so that a cancel request terminates the process instead of waiting for it.
 * Callbacks registered after cancellation run immediately.</p>
 */
public final class CancellationSignal
{
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Returns a signal that is never cancelled by anyone holding a reference to it.
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            // remove() decides ownership so a callback racing with onCancel runs once
            for (Runnable callback : callbacks) {
                if (callbacks.remove(callback)) {
                    callback.run();
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    public void removeCallback(Runnable callback) {
        callbacks.remove(callback);
    }
}
