package com.questrail.phaseseq.observability;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Record representing a batch sequence left out because its frame folder is missing.
 */
public record SequenceSkippedEvent(
    Instant timestamp,
    String sequence,
    Path frameFolder
) {
}
