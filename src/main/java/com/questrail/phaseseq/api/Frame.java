package com.questrail.phaseseq.api;

import java.util.Arrays;

/**
 * Frame
 * =============================================================================
 * One decoded phase map: a {@code width x height} grid of single-precision
 * samples (radians), stored row-major.
 *
 * <p>A frame owns its samples exclusively. The constructor copies the input
 * array and {@link #samples()} returns a copy, so no two components ever share
 * a mutable grid.</p>
 */
public final class Frame
{
    private final int width;
    private final int height;
    private final float[] samples;

    public Frame(int width, int height, float[] samples)
    {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive: " + width + "x" + height);
        }
        if (samples == null || samples.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples for "
                    + width + "x" + height + " frame");
        }
        this.width = width;
        this.height = height;
        this.samples = samples.clone();
    }

    public int width()
    {
        return width;
    }

    public int height()
    {
        return height;
    }

    /**
     * Returns a copy of the row-major sample grid.
     */
    public float[] samples()
    {
        return samples.clone();
    }

    public float sample(int x, int y)
    {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        return samples[y * width + x];
    }

    /**
     * Returns a copy of row {@code y}.
     */
    public float[] row(int y)
    {
        if (y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Row " + y + " outside height " + height);
        }
        return Arrays.copyOfRange(samples, y * width, (y + 1) * width);
    }

    public boolean sameShapeAs(Frame other)
    {
        return other != null && other.width == width && other.height == height;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Frame)) return false;
        Frame other = (Frame) o;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode()
    {
        int result = 31 * width + height;
        return 31 * result + Arrays.hashCode(samples);
    }

    @Override
    public String toString()
    {
        return "Frame[" + width + "x" + height + "]";
    }
}
