package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.api.AcquisitionMetadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * WellLayout
 * -----------------------------------------------------------------------------
 * Folder layout of a multi-well acquisition and the intermediate file names
 * derived from it.
 *
 * <pre>
 *   root/
 *     WELL/Phase/Float/Bin/*_phase.bin     frames
 *     WELL/timestamps.txt                  timestamp table
 *     WELL/SIFT alignment log.txt          registration log / shift report
 *     WELL_phase.tif                       composed stack (intermediate)
 *     WELL_phase_aligned.tif               aligned stack (intermediate)
 * </pre>
 *
 * <p>Container names follow the lab's naming convention and are chosen by the
 * caller.</p>
 */
public final class WellLayout
{
    /** Wells of the four-well stage-control acquisition, in processing order. */
    public static final List<String> DEFAULT_WELLS =
            List.of("00001_00001", "00001_00002", "00002_00001", "00002_00002");

    static final Path FRAME_SUBFOLDER = Path.of("Phase", "Float", "Bin");
    static final String TIMESTAMPS_FILE = "timestamps.txt";
    static final String REGISTRATION_LOG_FILE = "SIFT alignment log.txt";
    static final String COMPOSED_SUFFIX = "_phase.tif";
    static final String ALIGNED_SUFFIX = "_phase_aligned.tif";

    private final Path root;

    public WellLayout(Path root)
    {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root()
    {
        return root;
    }

    public Path frameFolder(String well)
    {
        return root.resolve(well).resolve(FRAME_SUBFOLDER);
    }

    public Path timestampTable(String well)
    {
        return root.resolve(well).resolve(TIMESTAMPS_FILE);
    }

    public Path registrationLog(String well)
    {
        return root.resolve(well).resolve(REGISTRATION_LOG_FILE);
    }

    public Path composedStack(String well)
    {
        return root.resolve(well + COMPOSED_SUFFIX);
    }

    public Path alignedStack(String well)
    {
        return root.resolve(well + ALIGNED_SUFFIX);
    }

    /**
     * Job converting {@code well} into {@code container}.
     */
    public SequenceJob job(String well, Path container, AcquisitionMetadata metadata)
    {
        return new SequenceJob(well,
                frameFolder(well),
                timestampTable(well),
                composedStack(well),
                alignedStack(well),
                registrationLog(well),
                container,
                metadata);
    }
}
