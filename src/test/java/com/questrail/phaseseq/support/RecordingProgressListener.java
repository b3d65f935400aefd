package com.questrail.phaseseq.support;

import com.questrail.phaseseq.api.ProgressListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Test listener that records every reported percentage.
 */
public final class RecordingProgressListener implements ProgressListener
{
    private final List<Integer> values = new ArrayList<>();

    @Override
    public synchronized void onProgress(int percent)
    {
        values.add(percent);
    }

    public synchronized List<Integer> values()
    {
        return new ArrayList<>(values);
    }
}
