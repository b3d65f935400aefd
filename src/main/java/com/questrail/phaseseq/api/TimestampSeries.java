package com.questrail.phaseseq.api;

import java.util.Arrays;

/**
 * Ordered per-frame acquisition times, one single-precision value per frame.
 */
public final class TimestampSeries
{
    private final float[] values;

    public TimestampSeries(float[] values)
    {
        if (values == null) {
            throw new IllegalArgumentException("values");
        }
        this.values = values.clone();
    }

    public int size()
    {
        return values.length;
    }

    public float get(int index)
    {
        return values[index];
    }

    public float[] toArray()
    {
        return values.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        return o instanceof TimestampSeries && Arrays.equals(values, ((TimestampSeries) o).values);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString()
    {
        return "TimestampSeries" + Arrays.toString(values);
    }
}
