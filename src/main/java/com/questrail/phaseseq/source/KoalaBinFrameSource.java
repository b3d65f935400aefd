package com.questrail.phaseseq.source;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.SequenceDecodeException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * KoalaBinFrameSource
 * -----------------------------------------------------------------------------
 * {@link FrameSource} for the single-frame {@code *_phase.bin} files written by
 * the holographic microscope acquisition software.
 *
 * <p>File layout (packed, no alignment):</p>
 * <pre>
 *   offset  size  field
 *   0       1     version        (u8)
 *   1       1     endianness     (u8, 0 = little, 1 = big)
 *   2       4     header size    (i32, offset of the first sample)
 *   6       4     width          (i32)
 *   10      4     height         (i32)
 *   14      4     pixel size     (f32, metres)
 *   18      4     height conv.   (f32)
 *   22      1     unit code      (u8)
 *   headerSize    width*height f32 samples, row-major
 * </pre>
 */
public final class KoalaBinFrameSource implements FrameSource
{
    /** Size of the fixed header fields; {@code headerSize} may be larger. */
    static final int HEADER_FIELDS_LENGTH = 23;

    @Override
    public DecodedFrame decode(Path path)
    {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            final FrameHeader header = readHeader(channel, path);
            final long expected = header.headerSize() + header.sampleCount() * Float.BYTES;
            if (channel.size() < expected) {
                throw new SequenceDecodeException(path, "Phase file truncated: expected "
                        + expected + " bytes, found " + channel.size());
            }

            final ByteBuffer data = ByteBuffer.allocate((int) (header.sampleCount() * Float.BYTES))
                    .order(header.byteOrder());
            readFully(channel, data, header.headerSize(), path);
            data.flip();

            final float[] samples = new float[(int) header.sampleCount()];
            data.asFloatBuffer().get(samples);
            return new DecodedFrame(new Frame(header.width(), header.height(), samples), header);
        }
        catch (IOException e) {
            throw new SequenceDecodeException(path, "Cannot read phase file", e);
        }
    }

    /**
     * Reads only the header and returns its pixel size. Used to pre-fill
     * acquisition metadata from the first frame of a sequence.
     */
    @Override
    public float readPixelSize(Path path)
    {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return readHeader(channel, path).pixelSize();
        }
        catch (IOException e) {
            throw new SequenceDecodeException(path, "Cannot read phase file header", e);
        }
    }

    private static FrameHeader readHeader(FileChannel channel, Path path) throws IOException
    {
        if (channel.size() < HEADER_FIELDS_LENGTH) {
            throw new SequenceDecodeException(path, "Phase file shorter than its header");
        }
        final ByteBuffer raw = ByteBuffer.allocate(HEADER_FIELDS_LENGTH);
        readFully(channel, raw, 0, path);
        raw.flip();

        final int version = raw.get(0) & 0xFF;
        final ByteOrder order = (raw.get(1) & 0xFF) == 1 ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
        raw.order(order);

        final int headerSize = raw.getInt(2);
        final int width = raw.getInt(6);
        final int height = raw.getInt(10);
        final float pixelSize = raw.getFloat(14);
        final float heightConversion = raw.getFloat(18);
        final int unitCode = raw.get(22) & 0xFF;

        if (headerSize < HEADER_FIELDS_LENGTH) {
            throw new SequenceDecodeException(path, "Invalid header size " + headerSize);
        }
        if (width <= 0 || height <= 0 || (long) width * height > Integer.MAX_VALUE / Float.BYTES) {
            throw new SequenceDecodeException(path, "Invalid frame dimensions " + width + "x" + height);
        }
        return new FrameHeader(version, order, headerSize, width, height, pixelSize, heightConversion, unitCode);
    }

    private static void readFully(FileChannel channel, ByteBuffer target, long position, Path path)
            throws IOException
    {
        long pos = position;
        while (target.hasRemaining()) {
            final int n = channel.read(target, pos);
            if (n < 0) {
                throw new SequenceDecodeException(path, "Unexpected end of phase file at byte " + pos);
            }
            pos += n;
        }
    }
}
