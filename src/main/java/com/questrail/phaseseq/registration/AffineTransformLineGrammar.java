package com.questrail.phaseseq.registration;

import com.questrail.phaseseq.api.SequenceParseException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * AffineTransformLineGrammar
 * -----------------------------------------------------------------------------
 * Tagged-line matcher for the transform lines of a registration log.
 *
 * <p>Grammar:</p>
 * <pre>
 *   line      := any* MARKER matrix any*
 *   MARKER    := "Transformation Matrix: AffineTransform"
 *   matrix    := "[[" m00 "," m01 "," tx "],[" m10 "," m11 "," ty "]]"
 * </pre>
 *
 * <p>After the marker all {@code [} and {@code ]} characters are removed and the
 * rest is split on {@code ,}. The result must be exactly six numeric tokens;
 * tokens 2 and 5 are the translation {@code (tx, ty)} of the row-major 2x3
 * matrix.</p>
 *
 * <ul>
 *   <li>A line without the marker is not a transform line: {@link Optional#empty()}.</li>
 *   <li>A line with the marker but a malformed matrix is rejected with
 *       {@link SequenceParseException}.</li>
 * </ul>
 */
public final class AffineTransformLineGrammar
{
    public static final String MARKER = "Transformation Matrix: AffineTransform";

    static final int TOKEN_COUNT = 6;
    static final int TX_INDEX = 2;
    static final int TY_INDEX = 5;

    private AffineTransformLineGrammar() {}

    /**
     * @param line       one log line
     * @param source     log path, for error context (may be null)
     * @param lineNumber 1-based line number, for error context
     */
    public static Optional<RegistrationShift> parse(String line, Path source, int lineNumber)
    {
        final int at = line.indexOf(MARKER);
        if (at < 0) {
            return Optional.empty();
        }

        final String matrix = line.substring(at + MARKER.length())
                .replace("[", "")
                .replace("]", "");
        final String[] tokens = matrix.split(",", -1);
        if (tokens.length != TOKEN_COUNT) {
            throw new SequenceParseException(source, lineNumber,
                    "Transform matrix has " + tokens.length + " elements, expected " + TOKEN_COUNT);
        }
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = tokens[i].trim();
            requireNumeric(tokens[i], i, source, lineNumber);
        }
        return Optional.of(new RegistrationShift(tokens[TX_INDEX], tokens[TY_INDEX]));
    }

    private static void requireNumeric(String token, int index, Path source, int lineNumber)
    {
        try {
            final double value = Double.parseDouble(token);
            if (!Double.isFinite(value)) {
                throw new SequenceParseException(source, lineNumber,
                        "Transform element " + index + " is not finite: " + token);
            }
        }
        catch (NumberFormatException e) {
            throw new SequenceParseException(source, lineNumber,
                    "Transform element " + index + " is not a number: '" + token + "'", e);
        }
    }
}
