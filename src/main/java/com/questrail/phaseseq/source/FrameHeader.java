package com.questrail.phaseseq.source;

import java.nio.ByteOrder;

/**
 * Header record of a single-frame phase-map file.
 *
 * @param version          format version byte
 * @param byteOrder        byte order of the header fields and samples
 * @param headerSize       offset of the first sample, in bytes
 * @param width            samples per row
 * @param height           rows
 * @param pixelSize        physical pixel size in metres
 * @param heightConversion phase-to-height conversion factor
 * @param unitCode         unit of the stored samples (1 = radians)
 */
public record FrameHeader(
        int version,
        ByteOrder byteOrder,
        int headerSize,
        int width,
        int height,
        float pixelSize,
        float heightConversion,
        int unitCode
) {
    public long sampleCount() {
        return (long) width * height;
    }
}
