package com.questrail.phaseseq.runtime;

/**
 * Stages of one conversion run, in execution order.
 */
public enum PipelineStage {
    COMPOSE("Converting phase frames to a TIFF stack"),
    REGISTER("Registering the stack with SIFT"),
    TRANSLATE_LOG("Writing the registration shift report"),
    ENCODE("Encoding the sequence container"),
    VALIDATE("Checking the sequence container");

    private final String description;

    PipelineStage(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
