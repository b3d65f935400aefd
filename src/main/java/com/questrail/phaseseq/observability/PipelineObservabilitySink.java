package com.questrail.phaseseq.observability;

import com.questrail.phaseseq.validation.RangeViolation;

/**
 * Main interface for receiving conversion pipeline observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface PipelineObservabilitySink {
    /**
     * Called when a stage begins.
     * @param event the stage and the artifact it produces
     */
    void onStageStarted(PipelineStageEvent event);

    /**
     * Called when a stage finished successfully.
     * @param event the stage, its artifact and elapsed time
     */
    void onStageCompleted(PipelineStageEvent event);

    /**
     * Called when a container fails the range check. The run continues.
     * @param violation the offending container and its extremes
     */
    void onRangeViolation(RangeViolation violation);

    /**
     * Called when a batch leaves out a sequence whose frame folder is missing.
     * The rest of the batch continues.
     * @param event the sequence and the folder that was not found
     */
    void onSequenceSkipped(SequenceSkippedEvent event);

    /**
     * Called when a stage failure aborts a run.
     * @param event the error event
     */
    void onError(PipelineErrorEvent event);
}
