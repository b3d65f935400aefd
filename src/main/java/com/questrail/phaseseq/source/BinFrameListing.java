package com.questrail.phaseseq.source;

import com.questrail.phaseseq.api.SequenceDecodeException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the frame files of one acquisition folder in acquisition order.
 *
 * <p>Frame files end in {@code _NNNNN_phase.bin} with a zero-padded index, so
 * ascending lexicographic order of the file names is acquisition order. The
 * order never depends on how the file system lists the directory.</p>
 */
public final class BinFrameListing
{
    public static final String FRAME_EXTENSION = ".bin";

    private BinFrameListing() {}

    /**
     * @throws SequenceDecodeException if the folder holds no frame files
     * @throws IOException             if the folder cannot be listed
     */
    public static List<Path> list(Path folder) throws IOException
    {
        if (!Files.isDirectory(folder)) {
            throw new SequenceDecodeException(folder, "Frame folder does not exist");
        }
        final List<Path> frames;
        try (Stream<Path> entries = Files.list(folder)) {
            frames = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(FRAME_EXTENSION))
                    .collect(Collectors.toList());
        }
        if (frames.isEmpty()) {
            throw new SequenceDecodeException(folder, "No " + FRAME_EXTENSION + " frames found");
        }
        return sorted(frames);
    }

    /**
     * Returns {@code frames} sorted by file name, ascending.
     */
    public static List<Path> sorted(List<Path> frames)
    {
        return frames.stream()
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
    }
}
