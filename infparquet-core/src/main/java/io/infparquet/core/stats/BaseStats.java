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
 * The base class of the statistics attached to column nodes and row group nodes.
 * <p>
 * A stats value without data is the identity of {@link #merge(BaseStats)}. A stats value
 * has data once a chunk has been scanned, even if every value in it was null.
 */
public abstract class BaseStats
{
    protected boolean hasData = false;
    protected long nullCount = 0L;

    protected BaseStats()
    {
    }

    protected BaseStats(long nullCount)
    {
        this.hasData = true;
        this.nullCount = nullCount;
    }

    public abstract StatsKind getKind();

    /**
     * @return a deep copy of this stats value
     */
    public abstract BaseStats copy();

    public boolean hasData()
    {
        return hasData;
    }

    public long getNullCount()
    {
        return nullCount;
    }

    /**
     * Merge other into this stats value in place. A null or empty other is ignored.
     *
     * @param other the stats to merge, must be of the same kind if it has data
     * @throws IllegalArgumentException if other has data of a different kind
     */
    public void merge(BaseStats other)
    {
        if (other == null || !other.hasData)
        {
            return;
        }
        if (other.getKind() != getKind())
        {
            throw new IllegalArgumentException("Incompatible merging of " + getKind() +
                    " and " + other.getKind() + " statistics");
        }
        if (!this.hasData)
        {
            assign(other);
        }
        else
        {
            mergeData(other);
        }
        this.hasData = true;
        this.nullCount += other.nullCount;
    }

    /**
     * Overwrite the kind-specific fields of this empty stats value with those of other.
     * The null count is handled by the caller.
     */
    protected abstract void assign(BaseStats other);

    /**
     * Combine the kind-specific fields of other, which has data of the same kind, into this
     * stats value that also has data. The null count is handled by the caller.
     */
    protected abstract void mergeData(BaseStats other);

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || o.getClass() != getClass())
        {
            return false;
        }
        BaseStats that = (BaseStats) o;
        return hasData == that.hasData && nullCount == that.nullCount;
    }

    @Override
    public int hashCode()
    {
        return 31 * Boolean.hashCode(hasData) + Long.hashCode(nullCount);
    }
}
