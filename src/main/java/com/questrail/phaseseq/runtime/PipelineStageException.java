package com.questrail.phaseseq.runtime;

import java.nio.file.Path;

/**
 * Wraps the failure that aborted a pipeline run with the stage and artifact
 * it was working on. The original exception is the cause.
 */
public final class PipelineStageException extends RuntimeException
{
    private final PipelineStage stage;
    private final Path path;

    public PipelineStageException(PipelineStage stage, Path path, Throwable cause) {
        super(stage + " failed for " + path + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.path = path;
    }

    public PipelineStage stage() {
        return stage;
    }

    public Path path() {
        return path;
    }
}
