package com.questrail.phaseseq.validation;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.codec.SequenceContainerHeader;
import com.questrail.phaseseq.codec.SequenceContainerReader;
import com.questrail.phaseseq.config.PipelineConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * ContainerValidator
 * =============================================================================
 * Sanity check of an encoded sequence container.
 *
 * <h2>Procedure</h2>
 * <ol>
 *   <li>Read the seven header scalars.</li>
 *   <li>Skip the timestamp block without interpreting it.</li>
 *   <li>Reconstruct frame 0, {@code height} rows of {@code width} values.</li>
 *   <li>In {@link ValidationMode#FULL_SCAN}, stream the remaining frames too.</li>
 *   <li>Flag a {@link RangeViolation} when {@code min < -limit} or
 *       {@code max > limit}. Both bounds are exclusive: a sample equal to
 *       {@code +/-limit} passes. A NaN sample is always a violation.</li>
 * </ol>
 *
 * <p>A violation is returned in the report, not thrown. Structural problems
 * (a truncated file, a container without frames) are decode failures.</p>
 */
public final class ContainerValidator
{
    private final ValidationMode mode;
    private final float limit;

    public ContainerValidator()
    {
        this(ValidationMode.FIRST_FRAME, PipelineConfig.DEFAULT_RANGE_LIMIT);
    }

    public ContainerValidator(ValidationMode mode, float limit)
    {
        this.mode = Objects.requireNonNull(mode, "mode");
        if (!(limit > 0)) {
            throw new IllegalArgumentException("limit must be positive");
        }
        this.limit = limit;
    }

    public static ContainerValidator from(PipelineConfig config)
    {
        return new ContainerValidator(config.validationMode(), config.rangeLimit());
    }

    /**
     * @throws SequenceDecodeException if the container is truncated or has no frames
     * @throws IOException             if the container cannot be read
     */
    public ValidationReport validate(Path container) throws IOException
    {
        try (SequenceContainerReader reader = SequenceContainerReader.open(container)) {
            final SequenceContainerHeader header = reader.header();
            if (header.frameCount() == 0) {
                throw new SequenceDecodeException(container, "Container holds no frames");
            }

            final Frame first = reader.readFrame(0);
            final RangeAccumulator range = new RangeAccumulator();
            range.accept(first, 0);

            final int frames = mode == ValidationMode.FULL_SCAN ? header.frameCount() : 1;
            for (int k = 1; k < frames; k++) {
                range.accept(reader.readFrame(k), k);
            }

            final Optional<RangeViolation> violation = range.firstOffender < 0
                    ? Optional.empty()
                    : Optional.of(new RangeViolation(container, range.min, range.max, range.firstOffender, limit));
            return new ValidationReport(container, header, first, range.min, range.max, frames, violation);
        }
    }

    private final class RangeAccumulator
    {
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        int firstOffender = -1;

        void accept(Frame frame, int index)
        {
            boolean offends = false;
            for (float v : frame.samples()) {
                if (Float.isNaN(v)) {
                    offends = true;
                    continue;
                }
                if (v < min) min = v;
                if (v > max) max = v;
                if (v < -limit || v > limit) {
                    offends = true;
                }
            }
            if (offends && firstOffender < 0) {
                firstOffender = index;
            }
        }
    }
}
