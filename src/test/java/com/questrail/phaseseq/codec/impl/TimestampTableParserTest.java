package com.questrail.phaseseq.codec.impl;

import com.questrail.phaseseq.api.SequenceParseException;
import com.questrail.phaseseq.api.TimestampSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class TimestampTableParserTest
{
    private final TimestampTableParser parser = new TimestampTableParser();

    @TempDir
    Path dir;

    @Test
    void readsFourthColumnOfEachRow() throws Exception
    {
        Path table = Files.writeString(dir.resolve("timestamps.txt"),
                "0 0 0 0.0 x\n1 1 1 0.5 y\n2  2\t2 1.0 z\n");

        TimestampSeries series = parser.parse(table);

        assertArrayEquals(new float[] { 0.0f, 0.5f, 1.0f }, series.toArray());
    }

    @Test
    void narrowsDoublePrecisionValues() throws Exception
    {
        Path table = Files.writeString(dir.resolve("t.txt"), "0 0 0 1234.5678901234\n");

        assertEquals((float) 1234.5678901234, parser.parse(table).get(0));
    }

    @Test
    void skipsBlankLinesAndSurroundingWhitespace() throws Exception
    {
        Path table = Files.writeString(dir.resolve("t.txt"), "\n  0 0 0 2.0  \n\n1 1 1 3.0\n\n");

        assertEquals(2, parser.parse(table).size());
    }

    @Test
    void shortRowIsParseErrorWithLineNumber() throws Exception
    {
        Path table = Files.writeString(dir.resolve("t.txt"), "0 0 0 1.0\n1 1 1\n");

        SequenceParseException e = assertThrows(SequenceParseException.class, () -> parser.parse(table));
        assertEquals(2, e.lineNumber());
    }

    @Test
    void nonNumericTimeIsParseError() throws Exception
    {
        Path table = Files.writeString(dir.resolve("t.txt"), "0 0 0 soon\n");

        SequenceParseException e = assertThrows(SequenceParseException.class, () -> parser.parse(table));
        assertEquals(1, e.lineNumber());
    }

    @Test
    void emptyTableYieldsEmptySeries() throws Exception
    {
        Path table = Files.writeString(dir.resolve("t.txt"), "");

        assertEquals(0, parser.parse(table).size());
    }

    @Test
    void growsBeyondInitialCapacity() throws Exception
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            sb.append(i).append(" a b ").append(i * 0.25).append('\n');
        }
        Path table = Files.writeString(dir.resolve("t.txt"), sb.toString());

        TimestampSeries series = parser.parse(table);
        assertEquals(200, series.size());
        assertEquals(49.75f, series.get(199));
    }
}
