package com.questrail.phaseseq.runtime;

public enum ConversionOutcome {
    COMPLETED,
    /** Existing outputs were found and the overwrite was not confirmed; nothing was written. */
    DECLINED,
    /** The frame folder was missing, so the batch left this sequence out. */
    SKIPPED
}
