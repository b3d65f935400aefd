package com.questrail.phaseseq.codec;

import java.nio.ByteOrder;

/**
 * SequenceContainerLayout
 * -----------------------------------------------------------------------------
 * Byte layout of the sequence container ({@code .bnr}).
 *
 * <pre>
 *   offset            size       field
 *   0                 4          frameCount        (i32)
 *   4                 4          width             (i32)
 *   8                 4          height            (i32)
 *   12                4          pixelSize         (f32)
 *   16                4          wavelengthNm      (f32)
 *   20                4          refractiveIndex1  (f32)
 *   24                4          refractiveIndex2  (f32)
 *   28                4*N        timestamps        (f32 each)
 *   28+4N             4*W*H*N    frames            (f32, row-major, frame-major)
 * </pre>
 *
 * <p>No magic number, version field, length prefix or padding. All values are
 * little-endian, the byte order of the acquisition workstations that read the
 * format.</p>
 */
public final class SequenceContainerLayout
{
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    /** Number of 4-byte header scalars. */
    public static final int HEADER_FIELDS = 7;

    public static final int VALUE_BYTES = 4;

    public static final int HEADER_BYTES = HEADER_FIELDS * VALUE_BYTES;

    private SequenceContainerLayout() {}

    public static long timestampOffset()
    {
        return HEADER_BYTES;
    }

    public static long frameBytes(int width, int height)
    {
        return (long) width * height * VALUE_BYTES;
    }

    public static long frameOffset(SequenceContainerHeader header, int frameIndex)
    {
        return HEADER_BYTES
                + (long) header.frameCount() * VALUE_BYTES
                + frameIndex * frameBytes(header.width(), header.height());
    }

    /**
     * Exact size of a well-formed container with {@code header}.
     */
    public static long totalBytes(SequenceContainerHeader header)
    {
        return frameOffset(header, header.frameCount());
    }
}
