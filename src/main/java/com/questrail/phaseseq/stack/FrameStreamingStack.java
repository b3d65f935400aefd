package com.questrail.phaseseq.stack;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.ProgressListener;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.source.FrameSource;
import ij.VirtualStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.nio.file.Path;
import java.util.List;

/**
 * ImageJ {@link VirtualStack} whose slices are decoded from frame files on
 * demand. The TIFF writer pulls slices one at a time, so at most one decoded
 * frame is alive while a stack is written.
 */
final class FrameStreamingStack extends VirtualStack
{
    private final List<Path> frames;
    private final FrameSource source;
    private final ProgressListener progress;

    FrameStreamingStack(int width, int height, List<Path> frames, FrameSource source, ProgressListener progress)
    {
        super(width, height, null, null);
        this.frames = List.copyOf(frames);
        this.source = source;
        this.progress = progress;
        setBitDepth(32);
    }

    /**
     * Decodes slice {@code n} (1-based) and reports {@code (n - 1) / total}.
     */
    @Override
    public ImageProcessor getProcessor(int n)
    {
        final Path path = frames.get(n - 1);
        final Frame frame = source.decode(path).frame();
        if (frame.width() != getWidth() || frame.height() != getHeight()) {
            throw new SequenceDecodeException(path, "Frame is " + frame.width() + "x" + frame.height()
                    + " but the sequence is " + getWidth() + "x" + getHeight());
        }
        progress.onProgress(ProgressListener.percentOf(n - 1, frames.size()));
        return new FloatProcessor(frame.width(), frame.height(), frame.samples());
    }

    @Override
    public int getSize()
    {
        return frames.size();
    }

    @Override
    public String getSliceLabel(int n)
    {
        return frames.get(n - 1).getFileName().toString();
    }

    @Override
    public String getFileName(int n)
    {
        return getSliceLabel(n);
    }
}
