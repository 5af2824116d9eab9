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

/**
 * Statistics of a timestamp column, in seconds since the epoch.
 * The minimum and maximum are only meaningful when count is positive.
 */
public class TimestampStats extends BaseStats
{
    private long min = 0L;
    private long max = 0L;
    private long count = 0L;

    public TimestampStats()
    {
    }

    /**
     * @param nullCount the number of null values
     * @param min the minimum timestamp in seconds
     * @param max the maximum timestamp in seconds
     * @param count the number of non-null values
     */
    public TimestampStats(long nullCount, long min, long max, long count)
    {
        super(nullCount);
        this.min = min;
        this.max = max;
        this.count = count;
    }

    @Override
    public StatsKind getKind()
    {
        return StatsKind.TIMESTAMP;
    }

    public long getMin()
    {
        return min;
    }

    public long getMax()
    {
        return max;
    }

    public long getCount()
    {
        return count;
    }

    @Override
    public TimestampStats copy()
    {
        TimestampStats copy = new TimestampStats();
        copy.hasData = hasData;
        copy.nullCount = nullCount;
        copy.min = min;
        copy.max = max;
        copy.count = count;
        return copy;
    }

    @Override
    protected void assign(BaseStats other)
    {
        TimestampStats that = (TimestampStats) other;
        this.min = that.min;
        this.max = that.max;
        this.count = that.count;
    }

    @Override
    protected void mergeData(BaseStats other)
    {
        TimestampStats that = (TimestampStats) other;
        if (that.count > 0)
        {
            if (this.count == 0)
            {
                this.min = that.min;
                this.max = that.max;
            }
            else
            {
                this.min = Math.min(this.min, that.min);
                this.max = Math.max(this.max, that.max);
            }
        }
        this.count += that.count;
    }

    @Override
    public boolean equals(Object o)
    {
        if (!super.equals(o))
        {
            return false;
        }
        TimestampStats that = (TimestampStats) o;
        return min == that.min && max == that.max && count == that.count;
    }

    @Override
    public int hashCode()
    {
        int result = super.hashCode();
        result = 31 * result + Long.hashCode(min);
        result = 31 * result + Long.hashCode(max);
        return 31 * result + Long.hashCode(count);
    }

    @Override
    public String toString()
    {
        return "TimestampStats{hasData=" + hasData + ", nullCount=" + nullCount +
                ", min=" + min + ", max=" + max + ", count=" + count + "}";
    }
}
