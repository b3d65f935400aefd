package com.questrail.phaseseq.stack;

import com.questrail.phaseseq.api.Frame;
import com.questrail.phaseseq.api.SequenceDecodeException;
import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.FileOpener;
import ij.io.TiffDecoder;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * TiffPageReader
 * -----------------------------------------------------------------------------
 * Page-at-a-time access to a multi-page 32-bit float TIFF stack.
 *
 * <p>The IFDs are decoded once on {@link #open}; each {@link #readPage} call
 * then reads exactly one page from disk. Both layouts ImageJ can produce are
 * handled: one IFD per page, and a single IFD describing {@code n}
 * contiguous pages.</p>
 */
public final class TiffPageReader implements PageStack
{
    private final Path path;
    private final FileInfo[] pages;
    private final boolean contiguous;
    private final int pageCount;

    private TiffPageReader(Path path, FileInfo[] pages)
    {
        this.path = path;
        this.pages = pages;
        this.contiguous = pages.length == 1 && pages[0].nImages > 1;
        this.pageCount = contiguous ? pages[0].nImages : pages.length;
    }

    /**
     * @throws SequenceDecodeException if the file is missing, is not a TIFF, has
     *                                 no pages, or its pages are not 32-bit float
     */
    public static TiffPageReader open(Path stack)
    {
        if (!Files.isRegularFile(stack)) {
            throw new SequenceDecodeException(stack, "Image stack not found");
        }
        final Path absolute = stack.toAbsolutePath();
        final String directory = absolute.getParent().toString() + File.separator;
        final FileInfo[] info;
        try {
            info = new TiffDecoder(directory, absolute.getFileName().toString()).getTiffInfo();
        }
        catch (IOException e) {
            throw new SequenceDecodeException(stack, "Cannot decode image stack", e);
        }
        if (info == null || info.length == 0) {
            throw new SequenceDecodeException(stack, "Image stack has no pages");
        }
        for (FileInfo page : info) {
            if (page.fileType != FileInfo.GRAY32_FLOAT) {
                throw new SequenceDecodeException(stack, "Image stack page is not 32-bit float");
            }
            if (page.width != info[0].width || page.height != info[0].height) {
                throw new SequenceDecodeException(stack, "Image stack pages differ in size");
            }
        }
        return new TiffPageReader(stack, info);
    }

    public Path path()
    {
        return path;
    }

    @Override
    public int pageCount()
    {
        return pageCount;
    }

    @Override
    public int width()
    {
        return pages[0].width;
    }

    @Override
    public int height()
    {
        return pages[0].height;
    }

    @Override
    public Frame readPage(int index)
    {
        if (index < 0 || index >= pageCount) {
            throw new IndexOutOfBoundsException("Page " + index + " outside 0.." + (pageCount - 1));
        }
        final ImagePlus page = new FileOpener(pageInfo(index)).openImage();
        if (page == null || !(page.getProcessor().getPixels() instanceof float[])) {
            throw new SequenceDecodeException(path, "Cannot read page " + index);
        }
        return new Frame(width(), height(), (float[]) page.getProcessor().getPixels());
    }

    private FileInfo pageInfo(int index)
    {
        if (!contiguous) {
            return pages[index];
        }
        final FileInfo base = pages[0];
        final FileInfo fi = (FileInfo) base.clone();
        final long pageBytes = (long) base.width * base.height * Float.BYTES + base.gapBetweenImages;
        fi.nImages = 1;
        fi.longOffset = base.getOffset() + index * pageBytes;
        return fi;
    }
}
