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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A row group with the statistics of its column chunks and their roll-up, which holds one
 * merged stats value per kind of stats present among the columns.
 */
public class RowGroupNode extends MetadataNode
{
    private final long numberOfRows;
    private final long totalByteSize;
    private final List<ColumnNode> columns;
    private final Map<StatsKind, BaseStats> rollUp;

    public RowGroupNode(int id, long numberOfRows, long totalByteSize,
                        List<ColumnNode> columns, Map<StatsKind, BaseStats> rollUp)
    {
        super(id, nameOf(id));
        this.numberOfRows = numberOfRows;
        this.totalByteSize = totalByteSize;
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
        this.rollUp = copyOf(requireNonNull(rollUp, "rollUp is null"));
    }

    private static Map<StatsKind, BaseStats> copyOf(Map<StatsKind, BaseStats> stats)
    {
        EnumMap<StatsKind, BaseStats> copy = new EnumMap<>(StatsKind.class);
        for (Map.Entry<StatsKind, BaseStats> entry : stats.entrySet())
        {
            copy.put(entry.getKey(), entry.getValue().copy());
        }
        return Collections.unmodifiableMap(copy);
    }

    public static String nameOf(int rowGroupId)
    {
        return "row_group_" + rowGroupId;
    }

    @Override
    public NodeType getType()
    {
        return NodeType.ROW_GROUP;
    }

    @Override
    public List<ColumnNode> getChildren()
    {
        return columns;
    }

    public List<ColumnNode> getColumns()
    {
        return columns;
    }

    public long getNumberOfRows()
    {
        return numberOfRows;
    }

    public long getTotalByteSize()
    {
        return totalByteSize;
    }

    /**
     * @return a copy of the roll-up stats by kind, ordered by kind
     */
    public Map<StatsKind, BaseStats> getRollUp()
    {
        return copyOf(rollUp);
    }

    /**
     * @return a copy of the roll-up stats of the kind, null if no column has stats of this kind
     */
    public BaseStats getStats(StatsKind kind)
    {
        BaseStats stats = rollUp.get(kind);
        return stats == null ? null : stats.copy();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof RowGroupNode))
        {
            return false;
        }
        RowGroupNode that = (RowGroupNode) o;
        return getId() == that.getId() && numberOfRows == that.numberOfRows &&
                totalByteSize == that.totalByteSize && columns.equals(that.columns) &&
                rollUp.equals(that.rollUp);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(getId(), numberOfRows, totalByteSize, columns, rollUp);
    }

    @Override
    public String toString()
    {
        return "RowGroupNode{id=" + getId() + ", numberOfRows=" + numberOfRows +
                ", totalByteSize=" + totalByteSize + ", columns=" + columns.size() + "}";
    }
}
