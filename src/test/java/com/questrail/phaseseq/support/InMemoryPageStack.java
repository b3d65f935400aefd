package com.questrail.phaseseq.support;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.stack.PageStack;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PageStack} over frames held in memory; records which pages were read.
 */
public final class InMemoryPageStack implements PageStack
{
    private final int width;
    private final int height;
    private final List<Frame> pages;
    private final List<Integer> reads = new ArrayList<>();

    public InMemoryPageStack(int width, int height, List<Frame> pages)
    {
        this.width = width;
        this.height = height;
        this.pages = List.copyOf(pages);
    }

    public static InMemoryPageStack of(Frame... pages)
    {
        return new InMemoryPageStack(pages[0].width(), pages[0].height(), List.of(pages));
    }

    @Override
    public int pageCount()
    {
        return pages.size();
    }

    @Override
    public int width()
    {
        return width;
    }

    @Override
    public int height()
    {
        return height;
    }

    @Override
    public Frame readPage(int index)
    {
        reads.add(index);
        return pages.get(index);
    }

    public List<Integer> reads()
    {
        return List.copyOf(reads);
    }
}
