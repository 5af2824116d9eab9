/*
 * Copyright 2025 InfParquet.
 *
 * This file is part of InfParquet.
 *
 * InfParquet is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * InfParquet is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with InfParquet.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.infparquet.core.stats;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Statistics of a string or binary column: value lengths in bytes, the most frequent values,
 * and the occurrences of special tokens such as "error" or "fatal".
 */
public class StringStats extends BaseStats
{
    public static final int DEFAULT_HIGH_FREQ_CAPACITY = 10;
    public static final int DEFAULT_SPECIAL_CAPACITY = 20;

    private TopKTracker<String> highFreq;
    private TopKTracker<String> special;
    private long minLength = 0L;
    private long maxLength = 0L;
    private long totalLength = 0L;
    private long totalCount = 0L;

    public StringStats()
    {
        this(DEFAULT_HIGH_FREQ_CAPACITY, DEFAULT_SPECIAL_CAPACITY);
    }

    public StringStats(int highFreqCapacity, int specialCapacity)
    {
        this.highFreq = new TopKTracker<>(highFreqCapacity);
        this.special = new TopKTracker<>(specialCapacity);
    }

    /**
     * The trackers are copied.
     */
    public StringStats(long nullCount, TopKTracker<String> highFreq, TopKTracker<String> special,
                       long minLength, long maxLength, long totalLength, long totalCount)
    {
        super(nullCount);
        this.highFreq = requireNonNull(highFreq, "highFreq is null").copy();
        this.special = requireNonNull(special, "special is null").copy();
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.totalLength = totalLength;
        this.totalCount = totalCount;
    }

    @Override
    public StatsKind getKind()
    {
        return StatsKind.STRING;
    }

    /**
     * @return the most frequent values ordered by count in descending order
     */
    public List<TopKTracker.Entry<String>> getHighFreq()
    {
        return highFreq.snapshot();
    }

    public int getHighFreqCapacity()
    {
        return highFreq.getCapacity();
    }

    /**
     * @return the special tokens found in the values, ordered by count in descending order
     */
    public List<TopKTracker.Entry<String>> getSpecial()
    {
        return special.snapshot();
    }

    public int getSpecialCapacity()
    {
        return special.getCapacity();
    }

    public long getMinLength()
    {
        return minLength;
    }

    public long getMaxLength()
    {
        return maxLength;
    }

    public long getTotalLength()
    {
        return totalLength;
    }

    public long getTotalCount()
    {
        return totalCount;
    }

    public double getAvgLength()
    {
        return totalCount > 0 ? (double) totalLength / totalCount : 0.0;
    }

    @Override
    public StringStats copy()
    {
        StringStats copy = new StringStats(highFreq.getCapacity(), special.getCapacity());
        copy.hasData = hasData;
        copy.nullCount = nullCount;
        copy.assign(this);
        return copy;
    }

    @Override
    protected void assign(BaseStats other)
    {
        StringStats that = (StringStats) other;
        this.highFreq = that.highFreq.copy();
        this.special = that.special.copy();
        this.minLength = that.minLength;
        this.maxLength = that.maxLength;
        this.totalLength = that.totalLength;
        this.totalCount = that.totalCount;
    }

    @Override
    protected void mergeData(BaseStats other)
    {
        StringStats that = (StringStats) other;
        if (that.totalCount > 0)
        {
            if (this.totalCount == 0)
            {
                this.minLength = that.minLength;
                this.maxLength = that.maxLength;
            }
            else
            {
                this.minLength = Math.min(this.minLength, that.minLength);
                this.maxLength = Math.max(this.maxLength, that.maxLength);
            }
        }
        this.totalLength += that.totalLength;
        this.totalCount += that.totalCount;
        this.highFreq.merge(that.highFreq);
        this.special.merge(that.special);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!super.equals(o))
        {
            return false;
        }
        StringStats that = (StringStats) o;
        return minLength == that.minLength && maxLength == that.maxLength &&
                totalLength == that.totalLength && totalCount == that.totalCount &&
                highFreq.equals(that.highFreq) && special.equals(that.special);
    }

    @Override
    public int hashCode()
    {
        int result = super.hashCode();
        result = 31 * result + highFreq.hashCode();
        result = 31 * result + special.hashCode();
        result = 31 * result + Long.hashCode(minLength);
        result = 31 * result + Long.hashCode(maxLength);
        result = 31 * result + Long.hashCode(totalLength);
        return 31 * result + Long.hashCode(totalCount);
    }

    @Override
    public String toString()
    {
        return "StringStats{hasData=" + hasData + ", nullCount=" + nullCount +
                ", minLength=" + minLength + ", maxLength=" + maxLength +
                ", totalLength=" + totalLength + ", totalCount=" + totalCount +
                ", highFreq=" + highFreq + ", special=" + special + "}";
    }
}
