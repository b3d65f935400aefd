package com.questrail.phaseseq.observability;

import com.questrail.phaseseq.validation.RangeViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PipelineObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jPipelineObservabilitySink implements PipelineObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPipelineObservabilitySink.class);

    @Override
    public void onStageStarted(PipelineStageEvent event) {
        log.info("[{}] {}: {}", event.sequence(), event.stage(), event.stage().description());
    }

    @Override
    public void onStageCompleted(PipelineStageEvent event) {
        log.info("[{}] {} done in {} ms -> {}",
            event.sequence(),
            event.stage(),
            event.elapsed().toMillis(),
            event.artifact());
    }

    @Override
    public void onRangeViolation(RangeViolation violation) {
        log.warn("Problem with sequence container: {}", violation.describe());
    }

    @Override
    public void onSequenceSkipped(SequenceSkippedEvent event) {
        log.warn("[{}] Files missing for well, skipped: {}", event.sequence(), event.frameFolder());
    }

    @Override
    public void onError(PipelineErrorEvent event) {
        log.error("[{}] {} failed: {}", event.sequence(), event.stage(), event.message(), event.cause());
    }
}
