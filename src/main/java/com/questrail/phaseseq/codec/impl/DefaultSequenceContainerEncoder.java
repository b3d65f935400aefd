package com.questrail.phaseseq.codec.impl;

import com.questrail.phaseseq.api.AcquisitionMetadata;
import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.ProgressListener;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.api.SequenceParseException;
import com.questrail.phaseseq.api.TimestampSeries;
import com.questrail.phaseseq.codec.SequenceContainerEncoder;
import com.questrail.phaseseq.codec.SequenceContainerHeader;
import com.questrail.phaseseq.codec.SequenceContainerLayout;
import com.questrail.phaseseq.stack.PageStack;
import com.questrail.phaseseq.stack.TiffPageReader;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.function.Function;

/**
 * DefaultSequenceContainerEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SequenceContainerEncoder}.
 *
 * <p>This encoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Parse the timestamp table; its row count is the frame count</li>
 *   <li>Open the stack and take width and height from its first page</li>
 *   <li>Check the frame count against the stack's page count</li>
 *   <li>Write the seven header scalars</li>
 *   <li>Write all timestamps</li>
 *   <li>Stream every page, row-major, reporting progress per page</li>
 * </ol>
 *
 * <p>Steps 1-3 complete before the destination is touched, so a malformed
 * table or a count mismatch leaves any existing destination unchanged. The
 * output depends only on the inputs: encoding the same inputs twice yields
 * byte-identical containers. A failure while writing deletes the partial
 * container.</p>
 */
public final class DefaultSequenceContainerEncoder implements SequenceContainerEncoder
{
    private final TimestampTableParser timestampParser;
    private final Function<Path, PageStack> stackOpener;

    public DefaultSequenceContainerEncoder()
    {
        this(new TimestampTableParser(), TiffPageReader::open);
    }

    public DefaultSequenceContainerEncoder(TimestampTableParser timestampParser,
                                           Function<Path, PageStack> stackOpener)
    {
        this.timestampParser = Objects.requireNonNull(timestampParser, "timestampParser");
        this.stackOpener = Objects.requireNonNull(stackOpener, "stackOpener");
    }

    @Override
    public SequenceContainerHeader encode(Path stackPath,
                                          Path timestampTable,
                                          AcquisitionMetadata metadata,
                                          Path destination,
                                          ProgressListener progress) throws IOException
    {
        Objects.requireNonNull(metadata, "metadata");
        final ProgressListener listener = progress == null ? ProgressListener.NONE : progress;

        // 1) Timestamps
        final TimestampSeries timestamps = timestampParser.parse(timestampTable);

        // 2) Dimensions from the first page
        final PageStack stack = stackOpener.apply(stackPath);
        if (stack.pageCount() == 0) {
            throw new SequenceDecodeException(stackPath, "Image stack has no pages");
        }

        // 3) Cross-check
        if (timestamps.size() != stack.pageCount()) {
            throw new SequenceParseException(timestampTable, 0, "Timestamp table has " + timestamps.size()
                    + " rows but the stack " + stackPath + " has " + stack.pageCount() + " pages");
        }

        final SequenceContainerHeader header =
                SequenceContainerHeader.of(timestamps.size(), stack.width(), stack.height(), metadata);

        boolean complete = false;
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(destination,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))) {
            // 4) Header
            writeHeader(out, header);

            // 5) Timestamps
            final ByteBuffer times = allocate(timestamps.size());
            times.asFloatBuffer().put(timestamps.toArray());
            out.write(times.array());

            // 6) Frames
            final ByteBuffer page = allocate(header.width() * header.height());
            for (int k = 0; k < header.frameCount(); k++) {
                final Frame frame = stack.readPage(k);
                if (frame.width() != header.width() || frame.height() != header.height()) {
                    throw new SequenceDecodeException(stackPath, "Page " + k + " is " + frame.width() + "x"
                            + frame.height() + ", expected " + header.width() + "x" + header.height());
                }
                page.clear();
                page.asFloatBuffer().put(frame.samples());
                out.write(page.array());
                listener.onProgress(ProgressListener.percentOf(k, header.frameCount()));
            }
            complete = true;
        }
        finally {
            if (!complete) {
                Files.deleteIfExists(destination);
            }
            listener.onProgress(0);
        }
        return header;
    }

    static void writeHeader(OutputStream out, SequenceContainerHeader header) throws IOException
    {
        final ByteBuffer buffer = ByteBuffer.allocate(SequenceContainerLayout.HEADER_BYTES)
                .order(SequenceContainerLayout.BYTE_ORDER);
        buffer.putInt(header.frameCount());
        buffer.putInt(header.width());
        buffer.putInt(header.height());
        buffer.putFloat(header.pixelSize());
        buffer.putFloat(header.wavelengthNm());
        buffer.putFloat(header.refractiveIndex1());
        buffer.putFloat(header.refractiveIndex2());
        out.write(buffer.array());
    }

    private static ByteBuffer allocate(int values)
    {
        return ByteBuffer.allocate(values * SequenceContainerLayout.VALUE_BYTES)
                .order(SequenceContainerLayout.BYTE_ORDER);
    }
}
