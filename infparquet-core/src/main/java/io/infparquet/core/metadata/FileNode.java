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
import io.infparquet.core.custom.CustomMetadataResult;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The root of the metadata tree of a file. Its children are the row group nodes in physical
 * order, followed by the file-level column nodes, one per distinct column name in order of
 * first appearance.
 */
public class FileNode extends MetadataNode
{
    private final List<RowGroupNode> rowGroups;
    private final List<ColumnNode> columns;
    private final List<MetadataItem> items;
    private final List<CustomMetadataResult> customResults;

    public FileNode(String filePath, List<RowGroupNode> rowGroups, List<ColumnNode> columns,
                    List<MetadataItem> items, List<CustomMetadataResult> customResults)
    {
        super(0, filePath);
        this.rowGroups = ImmutableList.copyOf(requireNonNull(rowGroups, "rowGroups is null"));
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
        this.items = ImmutableList.copyOf(requireNonNull(items, "items is null"));
        this.customResults = ImmutableList.copyOf(requireNonNull(customResults, "customResults is null"));
    }

    @Override
    public NodeType getType()
    {
        return NodeType.FILE;
    }

    @Override
    public List<MetadataNode> getChildren()
    {
        return ImmutableList.<MetadataNode>builder().addAll(rowGroups).addAll(columns).build();
    }

    public String getFilePath()
    {
        return getName();
    }

    public List<RowGroupNode> getRowGroups()
    {
        return rowGroups;
    }

    /**
     * @return the statistics of each column name across all row groups
     */
    public List<ColumnNode> getColumns()
    {
        return columns;
    }

    /**
     * @return the file-level column node of the name, or null
     */
    public ColumnNode getColumn(String name)
    {
        for (ColumnNode column : columns)
        {
            if (column.getName().equals(name))
            {
                return column;
            }
        }
        return null;
    }

    public List<MetadataItem> getItems()
    {
        return items;
    }

    /**
     * @return the item of the name, or null
     */
    public MetadataItem getItem(String name)
    {
        for (MetadataItem item : items)
        {
            if (item.getName().equals(name))
            {
                return item;
            }
        }
        return null;
    }

    public List<CustomMetadataResult> getCustomResults()
    {
        return customResults;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof FileNode))
        {
            return false;
        }
        FileNode that = (FileNode) o;
        return getName().equals(that.getName()) && rowGroups.equals(that.rowGroups) &&
                columns.equals(that.columns) && items.equals(that.items) &&
                customResults.equals(that.customResults);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(getName(), rowGroups, columns, items, customResults);
    }

    @Override
    public String toString()
    {
        return "FileNode{path='" + getName() + "', rowGroups=" + rowGroups.size() +
                ", columns=" + columns.size() + ", items=" + items + "}";
    }
}
