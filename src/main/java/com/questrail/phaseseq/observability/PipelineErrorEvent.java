package com.questrail.phaseseq.observability;

import com.questrail.phaseseq.runtime.PipelineStage;

import java.time.Instant;

/**
 * Record representing a failure that aborted a pipeline run.
 */
public record PipelineErrorEvent(
    Instant timestamp,
    String sequence,
    PipelineStage stage,
    String message,
    Throwable cause
) {
}
