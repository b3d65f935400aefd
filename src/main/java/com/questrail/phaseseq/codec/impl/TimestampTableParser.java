package com.questrail.phaseseq.codec.impl;

import com.questrail.phaseseq.api.SequenceParseException;
import com.questrail.phaseseq.api.TimestampSeries;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * TimestampTableParser
 * -----------------------------------------------------------------------------
 * Reads the per-frame time column of an acquisition timestamp table.
 *
 * <p>One row per frame, whitespace-delimited columns; column index 3 (0-based)
 * holds the time value. Rows may carry more columns. Blank lines are ignored.</p>
 *
 * <p>A row with fewer than four columns, or a non-numeric time value, aborts the
 * parse with {@link SequenceParseException}. There is no partial result.</p>
 */
public final class TimestampTableParser
{
    static final int TIME_COLUMN = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public TimestampSeries parse(Path table) throws IOException
    {
        float[] values = new float[64];
        int count = 0;

        try (BufferedReader reader = Files.newBufferedReader(table, StandardCharsets.ISO_8859_1)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                final String row = line.strip();
                if (row.isEmpty()) {
                    continue;
                }
                final String[] columns = WHITESPACE.split(row);
                if (columns.length <= TIME_COLUMN) {
                    throw new SequenceParseException(table, lineNumber,
                            "Timestamp row has " + columns.length + " columns, expected at least " + (TIME_COLUMN + 1));
                }
                if (count == values.length) {
                    values = Arrays.copyOf(values, values.length * 2);
                }
                values[count++] = parseTime(columns[TIME_COLUMN], table, lineNumber);
            }
        }
        return new TimestampSeries(Arrays.copyOf(values, count));
    }

    private static float parseTime(String token, Path table, int lineNumber)
    {
        try {
            // double first, then narrowed to f32
            return (float) Double.parseDouble(token);
        }
        catch (NumberFormatException e) {
            throw new SequenceParseException(table, lineNumber, "Timestamp is not a number: '" + token + "'", e);
        }
    }
}
