package com.questrail.phaseseq.codec;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.api.TimestampSeries;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * SequenceContainerReader
 * -----------------------------------------------------------------------------
 * Random-access reader for an encoded sequence container.
 *
 * <p>The header is decoded on {@link #open}. Timestamps and frames are read on
 * demand; a frame is reconstructed row by row, {@code width} consecutive values
 * per row. Reads past the end of the file are decode failures, so a truncated
 * container is reported rather than padded.</p>
 */
public final class SequenceContainerReader implements Closeable
{
    private final Path path;
    private final FileChannel channel;
    private final SequenceContainerHeader header;

    private SequenceContainerReader(Path path, FileChannel channel, SequenceContainerHeader header)
    {
        this.path = path;
        this.channel = channel;
        this.header = header;
    }

    /**
     * @throws SequenceDecodeException if the header is truncated or invalid
     * @throws IOException             if the file cannot be opened
     */
    public static SequenceContainerReader open(Path path) throws IOException
    {
        final FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            final ByteBuffer raw = read(channel, path, 0, SequenceContainerLayout.HEADER_BYTES);
            final int frameCount = raw.getInt();
            final int width = raw.getInt();
            final int height = raw.getInt();
            if (frameCount < 0 || width <= 0 || height <= 0) {
                throw new SequenceDecodeException(path, "Invalid container header: " + frameCount
                        + " frames of " + width + "x" + height);
            }
            final SequenceContainerHeader header = new SequenceContainerHeader(frameCount, width, height,
                    raw.getFloat(), raw.getFloat(), raw.getFloat(), raw.getFloat());
            return new SequenceContainerReader(path, channel, header);
        }
        catch (RuntimeException | IOException e) {
            channel.close();
            throw e;
        }
    }

    public Path path()
    {
        return path;
    }

    public SequenceContainerHeader header()
    {
        return header;
    }

    /**
     * {@code true} if the file size matches the header exactly.
     */
    public boolean isComplete() throws IOException
    {
        return channel.size() == SequenceContainerLayout.totalBytes(header);
    }

    public TimestampSeries readTimestamps() throws IOException
    {
        final ByteBuffer raw = read(channel, path, SequenceContainerLayout.timestampOffset(),
                header.frameCount() * SequenceContainerLayout.VALUE_BYTES);
        final float[] values = new float[header.frameCount()];
        raw.asFloatBuffer().get(values);
        return new TimestampSeries(values);
    }

    /**
     * Reconstructs frame {@code index} (0-based) row by row.
     */
    public Frame readFrame(int index) throws IOException
    {
        if (index < 0 || index >= header.frameCount()) {
            throw new IndexOutOfBoundsException("Frame " + index + " outside 0.." + (header.frameCount() - 1));
        }
        final int width = header.width();
        final int rowBytes = width * SequenceContainerLayout.VALUE_BYTES;
        final float[] samples = new float[width * header.height()];
        long position = SequenceContainerLayout.frameOffset(header, index);
        for (int row = 0; row < header.height(); row++) {
            read(channel, path, position, rowBytes).asFloatBuffer().get(samples, row * width, width);
            position += rowBytes;
        }
        return new Frame(width, header.height(), samples);
    }

    @Override
    public void close() throws IOException
    {
        channel.close();
    }

    private static ByteBuffer read(FileChannel channel, Path path, long position, int length) throws IOException
    {
        final ByteBuffer buffer = ByteBuffer.allocate(length).order(SequenceContainerLayout.BYTE_ORDER);
        long pos = position;
        while (buffer.hasRemaining()) {
            final int n = channel.read(buffer, pos);
            if (n < 0) {
                throw new SequenceDecodeException(path, "Container truncated at byte " + pos
                        + ", expected " + (position + length));
            }
            pos += n;
        }
        buffer.flip();
        return buffer;
    }
}
