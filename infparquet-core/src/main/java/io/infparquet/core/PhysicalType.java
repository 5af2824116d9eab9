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
package io.infparquet.core;

/**
 * Physical storage types of the column chunks handed over by the column reader.
 * The statistics shape of a column is derived from its physical type.
 */
public enum PhysicalType
{
    BOOLEAN(1),
    INT32(Integer.BYTES),
    INT64(Long.BYTES),
    /**
     * Timestamps. The reader hands them over as 8-byte nanoseconds since the epoch.
     */
    INT96(Long.BYTES),
    FLOAT(Float.BYTES),
    DOUBLE(Double.BYTES),
    BYTE_ARRAY(-1),
    FIXED_LEN_BYTE_ARRAY(-1);

    private final int width;

    PhysicalType(int width)
    {
        this.width = width;
    }

    /**
     * @return the width in bytes of one value, or -1 for variable or per-column widths
     */
    public int getWidth()
    {
        return width;
    }

    public boolean isFixedWidth()
    {
        return width > 0;
    }
}
