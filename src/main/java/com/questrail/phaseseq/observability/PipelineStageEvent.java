package com.questrail.phaseseq.observability;

import com.questrail.phaseseq.runtime.PipelineStage;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Record representing the start or completion of one pipeline stage.
 *
 * @param elapsed {@link Duration#ZERO} for a start event
 */
public record PipelineStageEvent(
    Instant timestamp,
    String sequence,
    PipelineStage stage,
    Path artifact,
    Duration elapsed
) {
}
