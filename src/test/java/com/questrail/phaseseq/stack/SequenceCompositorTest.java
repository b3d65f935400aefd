package com.questrail.phaseseq.stack;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.source.KoalaBinFrameSource;
import com.questrail.phaseseq.support.KoalaBinFiles;
import com.questrail.phaseseq.support.RecordingProgressListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SequenceCompositorTest
 * -----------------------------------------------------------------------------
 * Composes synthetic frame folders into TIFF stacks and reads them back with
 * {@link TiffPageReader}.
 */
final class SequenceCompositorTest
{
    private final SequenceCompositor compositor = new SequenceCompositor(new KoalaBinFrameSource());

    @TempDir
    Path dir;

    @Test
    void writesPagesInFileNameOrder() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        Path f2 = KoalaBinFiles.write(frames.resolve("w_00002_phase.bin"), 3, 2, 1f, KoalaBinFiles.filled(3, 2, 2f));
        Path f0 = KoalaBinFiles.write(frames.resolve("w_00000_phase.bin"), 3, 2, 1f, KoalaBinFiles.filled(3, 2, 0f));
        Path f1 = KoalaBinFiles.write(frames.resolve("w_00001_phase.bin"), 3, 2, 1f, KoalaBinFiles.filled(3, 2, 1f));
        Path stack = dir.resolve("w_phase.tif");

        int pages = compositor.compose(List.of(f2, f0, f1), stack, null);

        assertEquals(3, pages);
        TiffPageReader reader = TiffPageReader.open(stack);
        assertEquals(3, reader.pageCount());
        assertEquals(3, reader.width());
        assertEquals(2, reader.height());
        for (int k = 0; k < 3; k++) {
            assertEquals(new Frame(3, 2, KoalaBinFiles.filled(3, 2, k)), reader.readPage(k));
        }
    }

    @Test
    void keepsSampleValuesExactly() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        float[] a = { -3.14159f, 0f, 1e-7f, 99.99f };
        float[] b = { Float.MIN_VALUE, -0f, 2.5f, -100f };
        KoalaBinFiles.write(frames.resolve("x_00000_phase.bin"), 2, 2, 1f, a);
        KoalaBinFiles.write(frames.resolve("x_00001_phase.bin"), 2, 2, 1f, b);
        Path stack = dir.resolve("x.tif");

        compositor.composeFolder(frames, stack, null);

        TiffPageReader reader = TiffPageReader.open(stack);
        assertArrayEquals(a, reader.readPage(0).samples());
        assertArrayEquals(b, reader.readPage(1).samples());
    }

    @Test
    void singleFrameProducesOnePageStack() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        KoalaBinFiles.write(frames.resolve("s_00000_phase.bin"), 4, 3, 1f, KoalaBinFiles.filled(4, 3, 7f));
        Path stack = dir.resolve("s.tif");

        assertEquals(1, compositor.composeFolder(frames, stack, null));

        TiffPageReader reader = TiffPageReader.open(stack);
        assertEquals(1, reader.pageCount());
        assertEquals(7f, reader.readPage(0).sample(3, 2));
    }

    @Test
    void reportsProgressPerFrameAndResetsToZero() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        for (int k = 0; k < 4; k++) {
            KoalaBinFiles.write(frames.resolve(String.format("p_%05d_phase.bin", k)), 2, 2, 1f,
                    KoalaBinFiles.filled(2, 2, k));
        }
        RecordingProgressListener progress = new RecordingProgressListener();

        compositor.composeFolder(frames, dir.resolve("p.tif"), progress);

        List<Integer> values = progress.values();
        assertTrue(values.containsAll(List.of(0, 25, 50, 75)), values.toString());
        assertEquals(0, values.get(values.size() - 1));
        assertTrue(values.stream().allMatch(v -> v >= 0 && v <= 100));
    }

    @Test
    void replacesExistingDestination() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        KoalaBinFiles.write(frames.resolve("r_00000_phase.bin"), 2, 2, 1f, KoalaBinFiles.filled(2, 2, 1f));
        KoalaBinFiles.write(frames.resolve("r_00001_phase.bin"), 2, 2, 1f, KoalaBinFiles.filled(2, 2, 2f));
        Path stack = dir.resolve("r.tif");
        Files.write(stack, new byte[100_000]);

        compositor.composeFolder(frames, stack, null);

        assertEquals(2, TiffPageReader.open(stack).pageCount());
        assertTrue(Files.size(stack) < 100_000);
    }

    @Test
    void mismatchedFrameShapeFailsAndRemovesPartialOutput() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        KoalaBinFiles.write(frames.resolve("m_00000_phase.bin"), 2, 2, 1f, KoalaBinFiles.filled(2, 2, 1f));
        KoalaBinFiles.write(frames.resolve("m_00001_phase.bin"), 3, 2, 1f, KoalaBinFiles.filled(3, 2, 1f));
        Path stack = dir.resolve("m.tif");

        assertThrows(SequenceDecodeException.class, () -> compositor.composeFolder(frames, stack, null));
        assertFalse(Files.exists(stack));
        assertEquals(2, Files.list(frames).count());
    }

    @Test
    void unopenableDestinationIsIoErrorAndKeepsInputs() throws Exception
    {
        Path frames = Files.createDirectory(dir.resolve("frames"));
        Path f0 = KoalaBinFiles.write(frames.resolve("u_00000_phase.bin"), 2, 2, 1f, KoalaBinFiles.filled(2, 2, 1f));
        Path f1 = KoalaBinFiles.write(frames.resolve("u_00001_phase.bin"), 2, 2, 1f, KoalaBinFiles.filled(2, 2, 2f));
        Path stack = dir.resolve("missing").resolve("u.tif");
        RecordingProgressListener progress = new RecordingProgressListener();

        assertThrows(IOException.class, () -> compositor.composeFolder(frames, stack, progress));

        assertFalse(Files.exists(stack));
        assertTrue(Files.exists(f0));
        assertTrue(Files.exists(f1));
        List<Integer> values = progress.values();
        assertEquals(0, values.get(values.size() - 1));
    }

    @Test
    void emptyFrameListIsDecodeError()
    {
        assertThrows(SequenceDecodeException.class,
                () -> compositor.compose(List.of(), dir.resolve("e.tif"), null));
    }
}
