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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A named scalar fact about a file, such as its row count or creation time.
 */
public class MetadataItem
{
    public enum Type
    {
        NUMERIC,
        /**
         * Seconds since the epoch.
         */
        TIMESTAMP
    }

    public static final String ROW_COUNT = "row_count";
    public static final String FILE_SIZE = "file_size";
    public static final String ROW_GROUP_COUNT = "row_group_count";
    public static final String COLUMN_COUNT = "column_count";
    public static final String AVG_ROWS_PER_ROW_GROUP = "avg_rows_per_row_group";
    public static final String CREATION_TIME = "creation_time";
    public static final String SCHEMA_VERSION = "schema_version";

    private final String name;
    private final Type type;
    private final double value;

    public MetadataItem(String name, Type type, double value)
    {
        this.name = requireNonNull(name, "name is null");
        this.type = requireNonNull(type, "type is null");
        this.value = value;
    }

    public static MetadataItem numeric(String name, double value)
    {
        return new MetadataItem(name, Type.NUMERIC, value);
    }

    public static MetadataItem timestamp(String name, long epochSeconds)
    {
        return new MetadataItem(name, Type.TIMESTAMP, epochSeconds);
    }

    public String getName()
    {
        return name;
    }

    public Type getType()
    {
        return type;
    }

    public double getValue()
    {
        return value;
    }

    public long getLongValue()
    {
        return (long) value;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof MetadataItem))
        {
            return false;
        }
        MetadataItem that = (MetadataItem) o;
        return name.equals(that.name) && type == that.type && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, type, value);
    }

    @Override
    public String toString()
    {
        return name + "=" + (type == Type.TIMESTAMP ? String.valueOf(getLongValue()) : String.valueOf(value));
    }
}
