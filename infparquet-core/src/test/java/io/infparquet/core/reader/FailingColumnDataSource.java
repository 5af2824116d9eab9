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

import io.infparquet.common.error.ErrorCode;
import io.infparquet.core.exception.ColumnSourceException;

/**
 * Fails to read one column chunk, by default with an I/O error, and delegates everything else.
 */
public class FailingColumnDataSource implements ColumnDataSource
{
    private final ColumnDataSource delegate;
    private final int failingRowGroup;
    private final int failingColumn;
    private final int errorCode;

    public FailingColumnDataSource(ColumnDataSource delegate, int failingRowGroup, int failingColumn)
    {
        this(delegate, failingRowGroup, failingColumn, ErrorCode.COLUMN_SOURCE_IO_ERROR);
    }

    public FailingColumnDataSource(ColumnDataSource delegate, int failingRowGroup, int failingColumn, int errorCode)
    {
        this.delegate = delegate;
        this.failingRowGroup = failingRowGroup;
        this.failingColumn = failingColumn;
        this.errorCode = errorCode;
    }

    @Override
    public String getFilePath()
    {
        return delegate.getFilePath();
    }

    @Override
    public long getFileSize()
    {
        return delegate.getFileSize();
    }

    @Override
    public int getRowGroupCount()
    {
        return delegate.getRowGroupCount();
    }

    @Override
    public RowGroupInfo getRowGroupInfo(int rowGroupId)
    {
        return delegate.getRowGroupInfo(rowGroupId);
    }

    @Override
    public ColumnChunk readColumn(int rowGroupId, int columnId) throws ColumnSourceException
    {
        if (rowGroupId == failingRowGroup && columnId == failingColumn)
        {
            throw new ColumnSourceException(errorCode, "failed to read column " + columnId +
                    " of row group " + rowGroupId);
        }
        return delegate.readColumn(rowGroupId, columnId);
    }
}
