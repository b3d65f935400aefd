package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.api.ProgressListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

final class ProgressDispatcherTest
{
    private final List<String> received = new ArrayList<>();
    private final List<Runnable> queued = new ArrayList<>();

    private final ProgressDispatcher.Listener listener = new ProgressDispatcher.Listener()
    {
        @Override
        public void onProgress(PipelineStage stage, int percent)
        {
            received.add(stage + ":" + percent);
        }

        @Override
        public void onMessage(String message)
        {
            received.add(message);
        }
    };

    @Test
    void dropsRepeatedPercentages()
    {
        ProgressListener progress = new ProgressDispatcher(Runnable::run, listener).forStage(PipelineStage.ENCODE);

        progress.onProgress(0);
        progress.onProgress(0);
        progress.onProgress(50);
        progress.onProgress(50);
        progress.onProgress(0);

        assertEquals(List.of("ENCODE:0", "ENCODE:50", "ENCODE:0"), received);
    }

    @Test
    void deliversThroughExecutorOnly()
    {
        Executor deferred = queued::add;
        ProgressDispatcher dispatcher = new ProgressDispatcher(deferred, listener);

        dispatcher.forStage(PipelineStage.COMPOSE).onProgress(10);
        dispatcher.message("Converting");

        assertTrue(received.isEmpty());
        queued.forEach(Runnable::run);
        assertEquals(List.of("COMPOSE:10", "Converting"), received);
    }

    @Test
    void stagesTrackDuplicatesSeparately()
    {
        ProgressDispatcher dispatcher = new ProgressDispatcher(Runnable::run, listener);

        dispatcher.forStage(PipelineStage.COMPOSE).onProgress(0);
        dispatcher.forStage(PipelineStage.ENCODE).onProgress(0);

        assertEquals(2, received.size());
    }
}
