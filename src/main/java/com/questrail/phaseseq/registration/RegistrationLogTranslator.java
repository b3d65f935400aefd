package com.questrail.phaseseq.registration;

import com.questrail.phaseseq.api.SequenceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * RegistrationLogTranslator
 * =============================================================================
 * Turns the raw log of the SIFT registration run into a parameter and shift
 * report.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Read the whole log, extracting one {@link RegistrationShift} per
 *       transform line (see {@link AffineTransformLineGrammar}).</li>
 *   <li>Overwrite the log with {@link #SIFT_PARAMETERS} followed by one
 *       {@code tx,ty} line per transition, in file order.</li>
 * </ol>
 *
 * <p>The log is read completely before it is reopened for writing. A log with
 * no transform lines produces an empty shift section; that is logged as a
 * warning and is not an error. A malformed transform line aborts the
 * translation before anything is written.</p>
 *
 * <p>The log is read as ISO-8859-1 so that console output in any single-byte
 * encoding never fails to decode; the marker itself is plain ASCII.</p>
 */
public final class RegistrationLogTranslator
{
    private static final Logger log = LoggerFactory.getLogger(RegistrationLogTranslator.class);

    /** Configuration of the "Linear Stack Alignment with SIFT" run, written as the report preamble. */
    public static final String SIFT_PARAMETERS =
            "Linear Stack Alignment with SIFT parameter:\n"
            + "\n"
            + "initial_gaussian_blur = 1.60\n"
            + "steps_per_scale_octave = 3\n"
            + "minimum_image_size = 64\n"
            + "maximum_image_size = 1024\n"
            + "feature_descriptor_size = 4\n"
            + "feature_descriptor_orientation_bins = 8\n"
            + "closest/next_closest_ratio = 0.92\n"
            + "maximal_alignment_error = 25\n"
            + "inlier_ratio = 0.05\n"
            + "expected_transformation = Translation\n"
            + "interpolate\n"
            + "show_transformation_matrix\n"
            + "\n"
            + "Translation per frame (x,y):\n"
            + "\n";

    /**
     * Extracts the shifts of {@code logFile} and rewrites it in place.
     *
     * @return the shifts in file order
     * @throws SequenceParseException if a transform line is malformed
     * @throws IOException            if the log cannot be read or rewritten
     */
    public List<RegistrationShift> translate(Path logFile) throws IOException
    {
        final List<RegistrationShift> shifts = readShifts(logFile);
        if (shifts.isEmpty()) {
            log.warn("No transformation lines found in registration log {}", logFile);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.ISO_8859_1)) {
            writer.write(SIFT_PARAMETERS);
            for (RegistrationShift shift : shifts) {
                writer.write(shift.toLogLine());
                writer.write('\n');
            }
        }
        log.debug("Rewrote registration log {} with {} shifts", logFile, shifts.size());
        return shifts;
    }

    /**
     * Parses {@code logFile} without modifying it.
     */
    public List<RegistrationShift> readShifts(Path logFile) throws IOException
    {
        final List<RegistrationShift> shifts = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.ISO_8859_1)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                final Optional<RegistrationShift> shift =
                        AffineTransformLineGrammar.parse(line.strip(), logFile, lineNumber);
                shift.ifPresent(shifts::add);
            }
        }
        return Collections.unmodifiableList(shifts);
    }
}
