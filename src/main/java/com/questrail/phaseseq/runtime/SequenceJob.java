package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.api.AcquisitionMetadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Inputs, intermediates and output of one sequence conversion.
 *
 * @param name            label used in logs and progress messages
 * @param frameFolder     folder of single-frame phase files
 * @param timestampTable  per-frame timestamp table
 * @param composedStack   intermediate stack written by the compositor
 * @param alignedStack    stack written by the registration tool
 * @param registrationLog log written by the registration tool, rewritten as shift report
 * @param container       the sequence container to produce
 * @param metadata        acquisition metadata for the container header
 */
public record SequenceJob(
    String name,
    Path frameFolder,
    Path timestampTable,
    Path composedStack,
    Path alignedStack,
    Path registrationLog,
    Path container,
    AcquisitionMetadata metadata
) {
    public SequenceJob {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(frameFolder, "frameFolder");
        Objects.requireNonNull(timestampTable, "timestampTable");
        Objects.requireNonNull(composedStack, "composedStack");
        Objects.requireNonNull(alignedStack, "alignedStack");
        Objects.requireNonNull(registrationLog, "registrationLog");
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * Files this job creates or replaces.
     */
    public List<Path> outputs() {
        return List.of(composedStack, alignedStack, container);
    }

    public SequenceJob withMetadata(AcquisitionMetadata metadata) {
        return new SequenceJob(name, frameFolder, timestampTable, composedStack, alignedStack,
                registrationLog, container, metadata);
    }
}
