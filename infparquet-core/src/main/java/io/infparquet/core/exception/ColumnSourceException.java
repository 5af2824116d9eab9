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
package io.infparquet.core.exception;

import io.infparquet.common.error.ErrorCode;

/**
 * Thrown by a column data source when a column chunk can not be provided.
 * The error code is one of {@link ErrorCode#COLUMN_SOURCE_NOT_FOUND},
 * {@link ErrorCode#COLUMN_SOURCE_IO_ERROR}, or {@link ErrorCode#COLUMN_SOURCE_CORRUPT_DATA}.
 */
public class ColumnSourceException extends Exception
{
    private static final long serialVersionUID = 2862016047930391785L;

    private final int errorCode;

    public ColumnSourceException(int errorCode, String message)
    {
        super(message);
        this.errorCode = errorCode;
    }

    public ColumnSourceException(int errorCode, String message, Throwable cause)
    {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode()
    {
        return errorCode;
    }

    public static ColumnSourceException notFound(int rowGroupId, int columnId)
    {
        return new ColumnSourceException(ErrorCode.COLUMN_SOURCE_NOT_FOUND,
                "column " + columnId + " in row group " + rowGroupId + " is not found");
    }
}
