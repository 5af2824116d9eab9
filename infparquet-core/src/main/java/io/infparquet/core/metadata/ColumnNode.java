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

import java.util.List;
import java.util.Objects;

/**
 * The statistics of a column, either of one chunk under a row group node, or of all the
 * same-named chunks under the file node.
 */
public class ColumnNode extends MetadataNode
{
    private final BaseStats stats;

    /**
     * @param id the position of the column
     * @param name the column name
     * @param stats the statistics, null if they were not generated, copied
     */
    public ColumnNode(int id, String name, BaseStats stats)
    {
        super(id, name);
        this.stats = stats == null ? null : stats.copy();
    }

    @Override
    public NodeType getType()
    {
        return NodeType.COLUMN;
    }

    @Override
    public List<MetadataNode> getChildren()
    {
        return ImmutableList.of();
    }

    /**
     * @return a copy of the statistics, or null
     */
    public BaseStats getStats()
    {
        return stats == null ? null : stats.copy();
    }

    public boolean hasStats()
    {
        return stats != null;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof ColumnNode))
        {
            return false;
        }
        ColumnNode that = (ColumnNode) o;
        return getId() == that.getId() && getName().equals(that.getName()) && Objects.equals(stats, that.stats);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(getId(), getName(), stats);
    }

    @Override
    public String toString()
    {
        return "ColumnNode{id=" + getId() + ", name='" + getName() + "', stats=" + stats + "}";
    }
}
