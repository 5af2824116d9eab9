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
 * Statistics of a boolean, integer, or floating point column.
 * <p>
 * totalCount is the number of non-null values, min, max, and mean are only meaningful when it
 * is positive. The mode is exact at the leaves, except for float columns where it is the
 * midpoint of the most populated histogram bucket. Above the leaves it is only a hint.
 */
public class NumericStats extends BaseStats
{
    private double min = 0.0;
    private double max = 0.0;
    private double mean = 0.0;
    private double mode = 0.0;
    private long modeCount = 0L;
    private long totalCount = 0L;

    public NumericStats()
    {
    }

    public NumericStats(long nullCount, double min, double max, double mean,
                        double mode, long modeCount, long totalCount)
    {
        super(nullCount);
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.mode = mode;
        this.modeCount = modeCount;
        this.totalCount = totalCount;
    }

    @Override
    public StatsKind getKind()
    {
        return StatsKind.NUMERIC;
    }

    public double getMin()
    {
        return min;
    }

    public double getMax()
    {
        return max;
    }

    public double getMean()
    {
        return mean;
    }

    public double getMode()
    {
        return mode;
    }

    public long getModeCount()
    {
        return modeCount;
    }

    public long getTotalCount()
    {
        return totalCount;
    }

    @Override
    public NumericStats copy()
    {
        NumericStats copy = new NumericStats();
        copy.hasData = hasData;
        copy.nullCount = nullCount;
        copy.assign(this);
        return copy;
    }

    @Override
    protected void assign(BaseStats other)
    {
        NumericStats that = (NumericStats) other;
        this.min = that.min;
        this.max = that.max;
        this.mean = that.mean;
        this.mode = that.mode;
        this.modeCount = that.modeCount;
        this.totalCount = that.totalCount;
    }

    @Override
    protected void mergeData(BaseStats other)
    {
        NumericStats that = (NumericStats) other;
        if (that.totalCount > 0)
        {
            if (this.totalCount == 0)
            {
                this.min = that.min;
                this.max = that.max;
                this.mean = that.mean;
            }
            else
            {
                this.min = Math.min(this.min, that.min);
                this.max = Math.max(this.max, that.max);
                this.mean = (this.mean * this.totalCount + that.mean * that.totalCount) /
                        (this.totalCount + that.totalCount);
            }
        }
        if (that.modeCount > this.modeCount ||
                (that.modeCount == this.modeCount && that.mode < this.mode))
        {
            this.mode = that.mode;
            this.modeCount = that.modeCount;
        }
        this.totalCount += that.totalCount;
    }

    @Override
    public boolean equals(Object o)
    {
        if (!super.equals(o))
        {
            return false;
        }
        NumericStats that = (NumericStats) o;
        return Double.compare(min, that.min) == 0 && Double.compare(max, that.max) == 0 &&
                Double.compare(mean, that.mean) == 0 && Double.compare(mode, that.mode) == 0 &&
                modeCount == that.modeCount && totalCount == that.totalCount;
    }

    @Override
    public int hashCode()
    {
        int result = super.hashCode();
        result = 31 * result + Double.hashCode(min);
        result = 31 * result + Double.hashCode(max);
        result = 31 * result + Double.hashCode(mean);
        result = 31 * result + Double.hashCode(mode);
        result = 31 * result + Long.hashCode(modeCount);
        return 31 * result + Long.hashCode(totalCount);
    }

    @Override
    public String toString()
    {
        return "NumericStats{hasData=" + hasData + ", nullCount=" + nullCount + ", min=" + min +
                ", max=" + max + ", mean=" + mean + ", mode=" + mode + ", modeCount=" + modeCount +
                ", totalCount=" + totalCount + "}";
    }
}
