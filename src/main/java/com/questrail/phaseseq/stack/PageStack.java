package com.questrail.phaseseq.stack;

import com.questrail.phaseseq.api.Frame;

/**
 * Read access to an ordered multi-page image stack, one page at a time.
 */
public interface PageStack
{
    int pageCount();

    int width();

    int height();

    /**
     * Reads page {@code index} (0-based). Only the returned frame is held in memory.
     */
    Frame readPage(int index);
}
