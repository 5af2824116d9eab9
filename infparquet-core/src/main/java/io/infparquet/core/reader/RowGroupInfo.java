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
package io.infparquet.core.reader;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Footer-level description of a row group: its size and its column names by position.
 */
public class RowGroupInfo
{
    private final long numberOfRows;
    private final long totalByteSize;
    private final List<String> columnNames;

    public RowGroupInfo(long numberOfRows, long totalByteSize, List<String> columnNames)
    {
        checkArgument(numberOfRows >= 0, "numberOfRows must be non-negative");
        checkArgument(totalByteSize >= 0, "totalByteSize must be non-negative");
        this.numberOfRows = numberOfRows;
        this.totalByteSize = totalByteSize;
        this.columnNames = ImmutableList.copyOf(requireNonNull(columnNames, "columnNames is null"));
    }

    public long getNumberOfRows()
    {
        return numberOfRows;
    }

    public long getTotalByteSize()
    {
        return totalByteSize;
    }

    public int getColumnCount()
    {
        return columnNames.size();
    }

    public String getColumnName(int columnId)
    {
        return columnNames.get(columnId);
    }

    public List<String> getColumnNames()
    {
        return columnNames;
    }
}
