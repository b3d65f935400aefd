package com.questrail.phaseseq.validation;

/**
 * How much of a container the {@link ContainerValidator} scans.
 */
public enum ValidationMode {
    /** Only frame 0; fast, independent of sequence length. */
    FIRST_FRAME,

    /** Every frame, streamed one at a time, with min/max aggregated over all. */
    FULL_SCAN
}
