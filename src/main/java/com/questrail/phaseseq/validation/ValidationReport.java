package com.questrail.phaseseq.validation;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.codec.SequenceContainerHeader;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of validating one container.
 *
 * @param container    the validated file
 * @param header       its decoded header
 * @param firstFrame   frame 0 as reconstructed from the file
 * @param min          smallest sample over the scanned frames
 * @param max          largest sample over the scanned frames
 * @param framesScanned number of frames included in {@code min}/{@code max}
 * @param violation    present when the range check failed
 */
public record ValidationReport(
    Path container,
    SequenceContainerHeader header,
    Frame firstFrame,
    float min,
    float max,
    int framesScanned,
    Optional<RangeViolation> violation
) {
    public ValidationReport {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(firstFrame, "firstFrame");
        Objects.requireNonNull(violation, "violation");
    }

    public boolean hasViolation() {
        return violation.isPresent();
    }
}
