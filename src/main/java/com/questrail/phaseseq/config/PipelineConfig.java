package com.questrail.phaseseq.config;

import com.questrail.phaseseq.validation.ValidationMode;

import java.util.Objects;

/**
 * Aggregated configuration of one conversion pipeline.
 *
 * @param validationMode    how much of each container the validator scans
 * @param rangeLimit        samples outside {@code [-rangeLimit, rangeLimit]} are a range violation
 * @param keepIntermediates keep the composed and aligned TIFF stacks after encoding
 */
public record PipelineConfig(
    ValidationMode validationMode,
    float rangeLimit,
    boolean keepIntermediates
) {
    public static final float DEFAULT_RANGE_LIMIT = 100f;

    public PipelineConfig {
        Objects.requireNonNull(validationMode, "validationMode");
        if (!(rangeLimit > 0) || Float.isInfinite(rangeLimit)) {
            throw new IllegalArgumentException("rangeLimit must be positive and finite");
        }
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ValidationMode validationMode = ValidationMode.FIRST_FRAME;
        private float rangeLimit = DEFAULT_RANGE_LIMIT;
        private boolean keepIntermediates = false;

        public Builder withValidationMode(ValidationMode mode) {
            this.validationMode = mode;
            return this;
        }

        public Builder withRangeLimit(float limit) {
            this.rangeLimit = limit;
            return this;
        }

        public Builder withKeepIntermediates(boolean keep) {
            this.keepIntermediates = keep;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(validationMode, rangeLimit, keepIntermediates);
        }
    }
}
