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
 * The merge operator of column statistics. Stats without data (or null) are the identity,
 * and merging two stats with data of different kinds is rejected.
 * <p>
 * Unlike {@link BaseStats#merge(BaseStats)}, the methods here never modify their arguments.
 */
public final class StatsMerger
{
    private StatsMerger()
    {
    }

    /**
     * @param a the left operand, may be null
     * @param b the right operand, may be null
     * @return a new stats value combining a and b, or null if both are null
     * @throws IllegalArgumentException if a and b have data of different kinds
     */
    public static BaseStats merge(BaseStats a, BaseStats b)
    {
        if (a == null || !a.hasData())
        {
            if (b != null && (b.hasData() || a == null))
            {
                return b.copy();
            }
            return a == null ? null : a.copy();
        }
        BaseStats result = a.copy();
        result.merge(b);
        return result;
    }

    /**
     * Fold the stats from left to right with {@link #merge(BaseStats, BaseStats)}.
     *
     * @param stats the stats to reduce, null elements are skipped
     * @return the reduced stats, or null if there is no non-null element
     */
    public static BaseStats reduce(Iterable<? extends BaseStats> stats)
    {
        BaseStats result = null;
        for (BaseStats s : stats)
        {
            if (s == null)
            {
                continue;
            }
            if (result == null || (!result.hasData() && s.hasData()))
            {
                result = s.copy();
            }
            else
            {
                result.merge(s);
            }
        }
        return result;
    }
}
