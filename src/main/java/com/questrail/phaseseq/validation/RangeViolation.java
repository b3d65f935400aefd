package com.questrail.phaseseq.validation;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A container whose samples fall outside the physically expected phase range.
 *
 * <p>Informational: it is recorded and surfaced after a run, never thrown.</p>
 *
 * @param container  the offending container
 * @param min        smallest sample seen
 * @param max        largest sample seen
 * @param frameIndex first frame in which a sample was out of range
 * @param limit      the symmetric limit that was exceeded
 */
public record RangeViolation(
    Path container,
    float min,
    float max,
    int frameIndex,
    float limit
) {
    public RangeViolation {
        Objects.requireNonNull(container, "container");
    }

    public String describe() {
        return "Samples of " + container.getFileName() + " outside [-" + limit + ", " + limit
                + "] (min " + min + ", max " + max + ", frame " + frameIndex + ")";
    }
}
