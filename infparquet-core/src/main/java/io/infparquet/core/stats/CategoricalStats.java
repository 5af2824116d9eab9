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
 * Statistics of a dictionary-encoded column.
 * <p>
 * The distinct count is exact within a chunk. Merging keeps the larger estimate, which is a
 * lower bound of the distinct count of the union.
 */
public class CategoricalStats extends BaseStats
{
    public static final int DEFAULT_TOP_CAPACITY = 20;

    private TopKTracker<String> top;
    private long distinctCountEstimate = 0L;
    private long totalCount = 0L;

    public CategoricalStats()
    {
        this(DEFAULT_TOP_CAPACITY);
    }

    public CategoricalStats(int topCapacity)
    {
        this.top = new TopKTracker<>(topCapacity);
    }

    /**
     * The tracker is copied.
     */
    public CategoricalStats(long nullCount, TopKTracker<String> top,
                            long distinctCountEstimate, long totalCount)
    {
        super(nullCount);
        this.top = requireNonNull(top, "top is null").copy();
        this.distinctCountEstimate = distinctCountEstimate;
        this.totalCount = totalCount;
    }

    @Override
    public StatsKind getKind()
    {
        return StatsKind.CATEGORICAL;
    }

    public List<TopKTracker.Entry<String>> getTop()
    {
        return top.snapshot();
    }

    public int getTopCapacity()
    {
        return top.getCapacity();
    }

    public long getDistinctCountEstimate()
    {
        return distinctCountEstimate;
    }

    public long getTotalCount()
    {
        return totalCount;
    }

    @Override
    public CategoricalStats copy()
    {
        CategoricalStats copy = new CategoricalStats(top.getCapacity());
        copy.hasData = hasData;
        copy.nullCount = nullCount;
        copy.assign(this);
        return copy;
    }

    @Override
    protected void assign(BaseStats other)
    {
        CategoricalStats that = (CategoricalStats) other;
        this.top = that.top.copy();
        this.distinctCountEstimate = that.distinctCountEstimate;
        this.totalCount = that.totalCount;
    }

    @Override
    protected void mergeData(BaseStats other)
    {
        CategoricalStats that = (CategoricalStats) other;
        this.top.merge(that.top);
        this.distinctCountEstimate = Math.max(this.distinctCountEstimate, that.distinctCountEstimate);
        this.totalCount += that.totalCount;
    }

    @Override
    public boolean equals(Object o)
    {
        if (!super.equals(o))
        {
            return false;
        }
        CategoricalStats that = (CategoricalStats) o;
        return distinctCountEstimate == that.distinctCountEstimate &&
                totalCount == that.totalCount && top.equals(that.top);
    }

    @Override
    public int hashCode()
    {
        int result = super.hashCode();
        result = 31 * result + top.hashCode();
        result = 31 * result + Long.hashCode(distinctCountEstimate);
        return 31 * result + Long.hashCode(totalCount);
    }

    @Override
    public String toString()
    {
        return "CategoricalStats{hasData=" + hasData + ", nullCount=" + nullCount +
                ", distinctCountEstimate=" + distinctCountEstimate + ", totalCount=" + totalCount +
                ", top=" + top + "}";
    }
}
