package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.api.ProgressListener;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ProgressDispatcher
 * =============================================================================
 * Hands progress and status messages from the pipeline worker to the UI.
 *
 * <h2>Threading</h2>
 * <p>Every notification is submitted to the caller-supplied {@link Executor},
 * typically the UI's own dispatch queue. The worker never calls the
 * {@link Listener} directly and never blocks on it; the executor must accept
 * tasks without waiting for them to run.</p>
 *
 * <p>Repeated identical percentages for the same stage are dropped so that a
 * long sequence does not flood the UI queue.</p>
 */
public final class ProgressDispatcher
{
    /**
     * UI-side receiver. Runs on the dispatch executor's thread.
     */
    public interface Listener
    {
        void onProgress(PipelineStage stage, int percent);

        default void onMessage(String message) {}
    }

    /** Dispatcher that drops everything. */
    public static final ProgressDispatcher NONE = new ProgressDispatcher(Runnable::run, (stage, percent) -> {});

    private final Executor uiExecutor;
    private final Listener listener;

    public ProgressDispatcher(Executor uiExecutor, Listener listener)
    {
        this.uiExecutor = Objects.requireNonNull(uiExecutor, "uiExecutor");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * A {@link ProgressListener} for one stage, to be passed to the streaming
     * components.
     */
    public ProgressListener forStage(PipelineStage stage)
    {
        final AtomicInteger last = new AtomicInteger(-1);
        return percent -> {
            if (last.getAndSet(percent) != percent) {
                uiExecutor.execute(() -> listener.onProgress(stage, percent));
            }
        };
    }

    public void message(String text)
    {
        uiExecutor.execute(() -> listener.onMessage(text));
    }
}
