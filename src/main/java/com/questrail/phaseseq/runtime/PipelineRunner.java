package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.api.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * PipelineRunner
 * =============================================================================
 * Runs pipeline work off the UI thread, one run at a time.
 *
 * <h2>Threading model</h2>
 * <p>A single worker thread executes submitted runs. While a run is in
 * progress the runner is busy and further submissions are refused rather than
 * queued; the UI disables its actions while {@link #isBusy()} is true.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   runner.trySubmit(...)  → starts a run if idle
 *   runner.cancel()        → fires the current run's cancellation signal
 *   runner.close()         → cancels and stops the worker thread
 * </pre>
 */
public final class PipelineRunner implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final ConversionPipeline pipeline;
    private final ExecutorService worker;
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicReference<CancellationSignal> current = new AtomicReference<>();

    public PipelineRunner(ConversionPipeline pipeline)
    {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.worker = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "phase-sequence-pipeline");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isBusy()
    {
        return busy.get();
    }

    /**
     * Starts {@code task} on the worker thread unless a run is already in
     * progress.
     *
     * @return the run's future, or empty if the runner was busy
     */
    public <T> Optional<CompletableFuture<T>> trySubmit(Function<CancellationSignal, T> task)
    {
        Objects.requireNonNull(task, "task");
        if (!busy.compareAndSet(false, true)) {
            log.debug("Run refused, pipeline busy");
            return Optional.empty();
        }

        final CancellationSignal signal = new CancellationSignal();
        current.set(signal);
        final CompletableFuture<T> future = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                T result = null;
                Throwable failure = null;
                try {
                    result = task.apply(signal);
                }
                catch (Throwable e) {
                    log.error("Pipeline run failed: {}", e.getMessage(), e);
                    failure = e;
                }
                finally {
                    current.set(null);
                    busy.set(false);
                }
                // idle before completion so callers joining the future can resubmit
                if (failure == null) {
                    future.complete(result);
                }
                else {
                    future.completeExceptionally(failure);
                }
            });
        }
        catch (RuntimeException e) {
            current.set(null);
            busy.set(false);
            throw e;
        }
        return Optional.of(future);
    }

    public Optional<CompletableFuture<ConversionReport>> trySubmit(SequenceJob job, OverwriteConfirmation confirmation)
    {
        return trySubmit(signal -> pipeline.run(job, confirmation, signal));
    }

    public Optional<CompletableFuture<BatchConversionReport>> trySubmitBatch(List<SequenceJob> jobs,
                                                                             OverwriteConfirmation confirmation)
    {
        final List<SequenceJob> copy = List.copyOf(jobs);
        return trySubmit(signal -> pipeline.runBatch(copy, confirmation, signal));
    }

    /**
     * Requests cancellation of the run in progress, if any.
     */
    public void cancel()
    {
        final CancellationSignal signal = current.get();
        if (signal != null) {
            log.info("Cancelling pipeline run");
            signal.cancel();
        }
    }

    @Override
    public void close()
    {
        cancel();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
