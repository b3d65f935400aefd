package com.questrail.phaseseq.observability;

import com.questrail.phaseseq.validation.RangeViolation;

/**
 * No-op implementation of PipelineObservabilitySink.
 */
public final class NullObservabilitySink implements PipelineObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStageStarted(PipelineStageEvent event) {}

    @Override
    public void onStageCompleted(PipelineStageEvent event) {}

    @Override
    public void onRangeViolation(RangeViolation violation) {}

    @Override
    public void onSequenceSkipped(SequenceSkippedEvent event) {}

    @Override
    public void onError(PipelineErrorEvent event) {}
}
