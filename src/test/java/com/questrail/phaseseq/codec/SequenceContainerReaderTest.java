package com.questrail.phaseseq.codec;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.SequenceDecodeException;
import com.questrail.phaseseq.support.ContainerFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

final class SequenceContainerReaderTest
{
    @TempDir
    Path dir;

    @Test
    void readsHeaderTimestampsAndFrames() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("c.bnr"), 3, 2,
                new float[] { 0f, 0.5f },
                new float[] { 1, 2, 3, 4, 5, 6 },
                new float[] { 7, 8, 9, 10, 11, 12 });

        try (SequenceContainerReader reader = SequenceContainerReader.open(file)) {
            assertEquals(new SequenceContainerHeader(2, 3, 2, 1.1520307e-6f, 665.8f, 1f, 2f), reader.header());
            assertTrue(reader.isComplete());
            assertArrayEquals(new float[] { 0f, 0.5f }, reader.readTimestamps().toArray());
            Frame second = reader.readFrame(1);
            assertArrayEquals(new float[] { 10, 11, 12 }, second.row(1));
            assertEquals(7f, second.sample(0, 0));
        }
    }

    @Test
    void truncatedHeaderIsDecodeError() throws Exception
    {
        Path file = Files.write(dir.resolve("c.bnr"), new byte[12]);

        assertThrows(SequenceDecodeException.class, () -> SequenceContainerReader.open(file));
    }

    @Test
    void truncatedFrameIsDecodeError() throws Exception
    {
        Path full = ContainerFiles.write(dir.resolve("full.bnr"), 2, 2, new float[] { 0f }, new float[] { 1, 2, 3, 4 });
        byte[] bytes = Files.readAllBytes(full);
        Path file = Files.write(dir.resolve("cut.bnr"), Arrays.copyOf(bytes, bytes.length - 6));

        try (SequenceContainerReader reader = SequenceContainerReader.open(file)) {
            assertFalse(reader.isComplete());
            assertThrows(SequenceDecodeException.class, () -> reader.readFrame(0));
        }
    }

    @Test
    void invalidDimensionsAreDecodeError() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("c.bnr"), 0, 2, new float[0]);

        assertThrows(SequenceDecodeException.class, () -> SequenceContainerReader.open(file));
    }

    @Test
    void frameIndexOutsideContainerIsRejected() throws Exception
    {
        Path file = ContainerFiles.write(dir.resolve("c.bnr"), 1, 1, new float[] { 0f }, new float[] { 1 });

        try (SequenceContainerReader reader = SequenceContainerReader.open(file)) {
            assertThrows(IndexOutOfBoundsException.class, () -> reader.readFrame(1));
        }
    }

    @Test
    void layoutOffsets()
    {
        SequenceContainerHeader header = new SequenceContainerHeader(3, 4, 5, 1f, 1f, 1f, 1f);

        assertEquals(28, SequenceContainerLayout.timestampOffset());
        assertEquals(28 + 12, SequenceContainerLayout.frameOffset(header, 0));
        assertEquals(28 + 12 + 2 * 80, SequenceContainerLayout.frameOffset(header, 2));
        assertEquals(28 + 12 + 3 * 80, SequenceContainerLayout.totalBytes(header));
    }
}
