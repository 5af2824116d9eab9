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
package io.infparquet.common.error;

public class ErrorCode
{
    public static final int SUCCESS = 0;
    private static final int ERROR_BASE = 10000;

    // begin error code for metadata generation
    private static final int ERROR_BASE_METADATA_GEN = ERROR_BASE;
    public static final int METADATA_GEN_INVALID_PARAMETER = (ERROR_BASE_METADATA_GEN + 1);
    public static final int METADATA_GEN_MEMORY_ERROR = (ERROR_BASE_METADATA_GEN + 2);
    public static final int METADATA_GEN_SOURCE_ERROR = (ERROR_BASE_METADATA_GEN + 3);
    public static final int METADATA_GEN_CUSTOM_METADATA_ERROR = (ERROR_BASE_METADATA_GEN + 4);
    public static final int METADATA_GEN_SERIALIZATION_ERROR = (ERROR_BASE_METADATA_GEN + 5);
    public static final int METADATA_GEN_INTERRUPTED = (ERROR_BASE_METADATA_GEN + 6);

    // begin error code for column data source
    private static final int ERROR_BASE_COLUMN_SOURCE = ERROR_BASE + 100;
    public static final int COLUMN_SOURCE_NOT_FOUND = (ERROR_BASE_COLUMN_SOURCE + 1);
    public static final int COLUMN_SOURCE_IO_ERROR = (ERROR_BASE_COLUMN_SOURCE + 2);
    public static final int COLUMN_SOURCE_CORRUPT_DATA = (ERROR_BASE_COLUMN_SOURCE + 3);
}
