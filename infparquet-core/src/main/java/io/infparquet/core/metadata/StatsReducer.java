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
package io.infparquet.core.metadata;

import com.google.common.collect.ImmutableList;
import io.infparquet.core.stats.BaseStats;
import io.infparquet.core.stats.StatsKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the statistics of column nodes with {@link BaseStats#merge(BaseStats)}.
 * The inputs are never modified.
 */
public final class StatsReducer
{
    private static final Logger logger = LogManager.getLogger(StatsReducer.class);

    private StatsReducer()
    {
    }

    /**
     * Merge the statistics of the columns of a row group by kind.
     *
     * @param columns the column nodes of the row group
     * @return one merged stats value per kind present, columns without stats are skipped
     */
    public static Map<StatsKind, BaseStats> rollUp(List<ColumnNode> columns)
    {
        Map<StatsKind, BaseStats> result = new EnumMap<>(StatsKind.class);
        for (ColumnNode column : columns)
        {
            BaseStats stats = column.getStats();
            if (stats == null)
            {
                continue;
            }
            BaseStats merged = result.get(stats.getKind());
            if (merged == null)
            {
                result.put(stats.getKind(), stats.copy());
            }
            else
            {
                merged.merge(stats);
            }
        }
        return result;
    }

    /**
     * Merge the statistics of the same-named columns across the row groups, in row group order.
     * A column whose stats kind differs from that of the first stats of its name is skipped.
     *
     * @param rowGroups the row group nodes in physical order
     * @return one column node per distinct name, in order of first appearance
     */
    public static List<ColumnNode> rollAcross(List<RowGroupNode> rowGroups)
    {
        Map<String, BaseStats> merged = new LinkedHashMap<>();
        for (RowGroupNode rowGroup : rowGroups)
        {
            for (ColumnNode column : rowGroup.getColumns())
            {
                BaseStats stats = column.getStats();
                BaseStats current = merged.get(column.getName());
                if (current == null)
                {
                    merged.put(column.getName(), stats == null ? null : stats.copy());
                }
                else if (stats != null)
                {
                    if (current.getKind() != stats.getKind())
                    {
                        logger.warn("skip " + stats.getKind() + " stats of column '" + column.getName() +
                                "' in " + rowGroup.getName() + ", expected " + current.getKind());
                        continue;
                    }
                    current.merge(stats);
                }
            }
        }
        ImmutableList.Builder<ColumnNode> builder = ImmutableList.builder();
        int id = 0;
        for (Map.Entry<String, BaseStats> entry : merged.entrySet())
        {
            builder.add(new ColumnNode(id++, entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }
}
