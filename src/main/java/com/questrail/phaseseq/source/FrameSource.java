package com.questrail.phaseseq.source;

import com.questrail.phaseseq.api.SequenceDecodeException;

import java.nio.file.Path;

/**
 * FrameSource
 * -----------------------------------------------------------------------------
 * Decodes one stored phase-map file into a {@link DecodedFrame}.
 *
 * <p>The source is responsible only for:</p>
 * <ul>
 *   <li>Reading the file header</li>
 *   <li>Reading exactly one frame of samples</li>
 *   <li>Detecting truncation or inconsistent header fields</li>
 * </ul>
 *
 * <p>Ordering of files and assembly into a stack belong to the caller.</p>
 */
public interface FrameSource
{
    /**
     * Decode a single frame file.
     *
     * @param path the frame file
     * @return the decoded frame and its header
     * @throws SequenceDecodeException if the file is missing, unreadable or malformed
     */
    DecodedFrame decode(Path path);

    /**
     * Pixel size recorded in a frame file's header. Sources that can read the
     * header alone should override this to skip the samples.
     *
     * @param path the frame file
     * @return the pixel size in metres
     * @throws SequenceDecodeException if the file is missing, unreadable or malformed
     */
    default float readPixelSize(Path path)
    {
        return decode(path).header().pixelSize();
    }
}
