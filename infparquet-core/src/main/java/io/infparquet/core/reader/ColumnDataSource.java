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

import io.infparquet.core.exception.ColumnSourceException;

/**
 * The decoder of the columnar file. It exposes the file structure and reads the raw
 * content of a column chunk given its row group and column coordinates.
 * <p>
 * Implementations must allow concurrent calls of {@link #readColumn(int, int)} for
 * different row groups, since the metadata generator reads row groups in parallel.
 */
public interface ColumnDataSource
{
    String getFilePath();

    long getFileSize();

    int getRowGroupCount();

    /**
     * @param rowGroupId the index of the row group, from 0 to {@link #getRowGroupCount()} - 1
     * @return the row group description
     */
    RowGroupInfo getRowGroupInfo(int rowGroupId);

    /**
     * Read the raw content of a column chunk.
     *
     * @param rowGroupId the index of the row group
     * @param columnId the position of the column in the row group
     * @return the column chunk
     * @throws ColumnSourceException if the chunk does not exist, can not be read, or is corrupt
     */
    ColumnChunk readColumn(int rowGroupId, int columnId) throws ColumnSourceException;
}
