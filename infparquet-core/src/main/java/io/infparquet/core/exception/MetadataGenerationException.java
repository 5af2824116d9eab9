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
 * Aborts the generation, loading, or saving of a metadata tree.
 * No partial tree is ever returned together with this exception.
 * The error code is one of the METADATA_GEN_* codes in {@link ErrorCode}.
 */
public class MetadataGenerationException
        extends InfParquetRuntimeException
{
    private static final long serialVersionUID = 6071329984127745530L;

    private final int errorCode;

    public MetadataGenerationException(int errorCode, String message)
    {
        super(message);
        this.errorCode = errorCode;
    }

    public MetadataGenerationException(int errorCode, String message, Throwable cause)
    {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode()
    {
        return errorCode;
    }

    @Override
    public String toString()
    {
        return super.toString() + " (error code " + errorCode + ")";
    }
}
