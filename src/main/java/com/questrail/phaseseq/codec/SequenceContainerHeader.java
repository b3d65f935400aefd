package com.questrail.phaseseq.codec;

import com.questrail.phaseseq.api.AcquisitionMetadata;

/**
 * The seven scalars at the start of a sequence container, in file order.
 */
public record SequenceContainerHeader(
        int frameCount,
        int width,
        int height,
        float pixelSize,
        float wavelengthNm,
        float refractiveIndex1,
        float refractiveIndex2
) {
    public SequenceContainerHeader {
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must be non-negative");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
    }

    public static SequenceContainerHeader of(int frameCount, int width, int height, AcquisitionMetadata metadata) {
        return new SequenceContainerHeader(frameCount, width, height,
                metadata.pixelSize(),
                metadata.wavelengthNm(),
                metadata.refractiveIndex1(),
                metadata.refractiveIndex2());
    }

    public AcquisitionMetadata metadata() {
        return new AcquisitionMetadata(pixelSize, wavelengthNm, refractiveIndex1, refractiveIndex2);
    }
}
