package com.questrail.phaseseq.stack;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.ProgressListener;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.source.BinFrameListing;
import com.questrail.phaseseq.source.FrameSource;
import ij.io.FileInfo;
import ij.io.TiffEncoder;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * SequenceCompositor
 * =============================================================================
 * Merges an ordered list of single-frame phase files into one multi-page
 * 32-bit float TIFF stack.
 *
 * <h2>Streaming</h2>
 * <p>Frames are decoded lazily by {@link FrameStreamingStack} while the TIFF
 * encoder writes them, so memory use is bounded by one frame regardless of the
 * sequence length.</p>
 *
 * <h2>Destination</h2>
 * <p>Any existing file at the destination is removed first; the stack is never
 * appended to stale data. A partially written destination is removed again when
 * a frame fails to decode. Input files are never deleted.</p>
 *
 * <h2>Ordering</h2>
 * <p>Pages are written in ascending file-name order whatever order the caller
 * passes, see {@link BinFrameListing#sorted}.</p>
 */
public final class SequenceCompositor
{
    private final FrameSource source;

    public SequenceCompositor(FrameSource source)
    {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Writes all {@code frames} into {@code destination}.
     *
     * @return the number of pages written
     * @throws SequenceDecodeException if any frame cannot be decoded or has a different shape
     * @throws IOException             if the destination cannot be created or written
     */
    public int compose(List<Path> frames, Path destination, ProgressListener progress) throws IOException
    {
        Objects.requireNonNull(destination, "destination");
        final ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        if (frames == null || frames.isEmpty()) {
            throw new SequenceDecodeException(destination, "No frames to compose");
        }

        final List<Path> ordered = BinFrameListing.sorted(frames);
        final Frame first = source.decode(ordered.get(0)).frame();

        final FileInfo fi = new FileInfo();
        fi.fileFormat = FileInfo.TIFF;
        fi.fileType = FileInfo.GRAY32_FLOAT;
        fi.width = first.width();
        fi.height = first.height();
        fi.nImages = ordered.size();
        if (ordered.size() == 1) {
            // the TIFF writer takes single images from fi.pixels, not from a stack
            fi.pixels = first.samples();
            listener.onProgress(0);
        }
        else {
            fi.virtualStack = new FrameStreamingStack(first.width(), first.height(), ordered, source, listener);
        }

        Files.deleteIfExists(destination);
        boolean complete = false;
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(destination,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE))) {
            new TiffEncoder(fi).write(out);
            complete = true;
        }
        finally {
            if (!complete) {
                Files.deleteIfExists(destination);
            }
            listener.onProgress(0);
        }
        return ordered.size();
    }

    /**
     * Lists the frame files of {@code folder} and composes them.
     */
    public int composeFolder(Path folder, Path destination, ProgressListener progress) throws IOException
    {
        return compose(BinFrameListing.list(folder), destination, progress);
    }
}
