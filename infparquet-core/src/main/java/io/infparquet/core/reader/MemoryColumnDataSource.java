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

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A column data source over column chunks that are already in memory.
 * It is used to generate metadata for data produced by a writer before it is flushed,
 * and in tests.
 */
public class MemoryColumnDataSource implements ColumnDataSource
{
    private final String filePath;
    private final long fileSize;
    private final List<RowGroupInfo> rowGroupInfos;
    private final List<List<ColumnChunk>> rowGroupChunks;

    private MemoryColumnDataSource(String filePath, long fileSize,
                                   List<RowGroupInfo> rowGroupInfos, List<List<ColumnChunk>> rowGroupChunks)
    {
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.rowGroupInfos = rowGroupInfos;
        this.rowGroupChunks = rowGroupChunks;
    }

    public static Builder newBuilder()
    {
        return new Builder();
    }

    @Override
    public String getFilePath()
    {
        return filePath;
    }

    @Override
    public long getFileSize()
    {
        return fileSize;
    }

    @Override
    public int getRowGroupCount()
    {
        return rowGroupInfos.size();
    }

    @Override
    public RowGroupInfo getRowGroupInfo(int rowGroupId)
    {
        checkArgument(rowGroupId >= 0 && rowGroupId < rowGroupInfos.size(),
                "invalid row group id: " + rowGroupId);
        return rowGroupInfos.get(rowGroupId);
    }

    @Override
    public ColumnChunk readColumn(int rowGroupId, int columnId) throws ColumnSourceException
    {
        if (rowGroupId < 0 || rowGroupId >= rowGroupChunks.size())
        {
            throw ColumnSourceException.notFound(rowGroupId, columnId);
        }
        List<ColumnChunk> chunks = rowGroupChunks.get(rowGroupId);
        if (columnId < 0 || columnId >= chunks.size())
        {
            throw ColumnSourceException.notFound(rowGroupId, columnId);
        }
        return chunks.get(columnId);
    }

    public static class Builder
    {
        private String builderPath = "memory://";
        private long builderFileSize = -1L;
        private final List<RowGroupInfo> builderRowGroups = new ArrayList<>();
        private final List<List<ColumnChunk>> builderChunks = new ArrayList<>();
        private List<String> currentNames = null;
        private List<ColumnChunk> currentChunks = null;
        private long currentRows = 0L;

        private Builder()
        {
        }

        public Builder setPath(String path)
        {
            this.builderPath = requireNonNull(path);
            return this;
        }

        /**
         * @param fileSize the file size to report, by default the sum of the chunk sizes
         */
        public Builder setFileSize(long fileSize)
        {
            checkArgument(fileSize >= 0, "fileSize must be non-negative");
            this.builderFileSize = fileSize;
            return this;
        }

        /**
         * Start a new row group, the columns added afterwards belong to it.
         */
        public Builder beginRowGroup(long numberOfRows)
        {
            finishRowGroup();
            this.currentNames = new ArrayList<>();
            this.currentChunks = new ArrayList<>();
            this.currentRows = numberOfRows;
            return this;
        }

        public Builder addColumn(String name, ColumnChunk chunk)
        {
            checkState(currentChunks != null, "beginRowGroup must be called before addColumn");
            this.currentNames.add(requireNonNull(name, "name is null"));
            this.currentChunks.add(requireNonNull(chunk, "chunk is null"));
            return this;
        }

        private void finishRowGroup()
        {
            if (currentChunks != null)
            {
                long size = 0L;
                for (ColumnChunk chunk : currentChunks)
                {
                    size += chunk.getSize();
                }
                builderRowGroups.add(new RowGroupInfo(currentRows, size, currentNames));
                builderChunks.add(currentChunks);
                currentNames = null;
                currentChunks = null;
            }
        }

        public MemoryColumnDataSource build()
        {
            finishRowGroup();
            long fileSize = builderFileSize;
            if (fileSize < 0)
            {
                fileSize = 0L;
                for (RowGroupInfo info : builderRowGroups)
                {
                    fileSize += info.getTotalByteSize();
                }
            }
            return new MemoryColumnDataSource(builderPath, fileSize,
                    new ArrayList<>(builderRowGroups), new ArrayList<>(builderChunks));
        }
    }
}
