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

import io.infparquet.core.PhysicalType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The raw, plain-encoded content of one column in one row group, as returned by
 * {@link ColumnDataSource#readColumn(int, int)}.
 * <p>
 * Fixed-width values are stored back to back in little-endian order. BYTE_ARRAY values
 * are stored as a 4-byte little-endian length followed by the payload. FIXED_LEN_BYTE_ARRAY
 * values are stored back to back with {@link #getTypeLength()} bytes each.
 * <p>
 * There is no validity bitmap, nulls are encoded with sentinel values.
 */
public class ColumnChunk
{
    /**
     * Type length assumed for FIXED_LEN_BYTE_ARRAY chunks that do not declare one.
     */
    public static final int DEFAULT_FIXED_LENGTH = 16;

    private final PhysicalType type;
    private final byte[] data;
    private final long valueCount;
    private final int typeLength;
    private final boolean categorical;

    public ColumnChunk(PhysicalType type, byte[] data, long valueCount)
    {
        this(type, data, valueCount, 0, false);
    }

    /**
     * @param type the physical type of the values
     * @param data the plain-encoded values, the array is not copied
     * @param valueCount the number of values, including nulls
     * @param typeLength the width of FIXED_LEN_BYTE_ARRAY values, ignored for other types
     * @param categorical true if the reader knows the column is dictionary-encoded
     */
    public ColumnChunk(PhysicalType type, byte[] data, long valueCount, int typeLength, boolean categorical)
    {
        this.type = requireNonNull(type, "type is null");
        this.data = requireNonNull(data, "data is null");
        checkArgument(valueCount >= 0, "valueCount must be non-negative");
        this.valueCount = valueCount;
        this.typeLength = typeLength;
        this.categorical = categorical;
    }

    public PhysicalType getType()
    {
        return type;
    }

    public long getValueCount()
    {
        return valueCount;
    }

    public int getSize()
    {
        return data.length;
    }

    /**
     * @return the width of a FIXED_LEN_BYTE_ARRAY value, {@link #DEFAULT_FIXED_LENGTH} if not declared
     */
    public int getTypeLength()
    {
        return typeLength > 0 ? typeLength : DEFAULT_FIXED_LENGTH;
    }

    public boolean isCategorical()
    {
        return categorical;
    }

    /**
     * @return a read-only little-endian view of the data, positioned at 0
     */
    public ByteBuffer getBuffer()
    {
        return ByteBuffer.wrap(data).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }

    public static ColumnChunk ofBooleans(boolean... values)
    {
        byte[] data = new byte[values.length];
        for (int i = 0; i < values.length; ++i)
        {
            data[i] = (byte) (values[i] ? 1 : 0);
        }
        return new ColumnChunk(PhysicalType.BOOLEAN, data, values.length);
    }

    public static ColumnChunk ofInts(int... values)
    {
        ByteBuffer buffer = allocate(values.length * Integer.BYTES);
        for (int value : values)
        {
            buffer.putInt(value);
        }
        return new ColumnChunk(PhysicalType.INT32, buffer.array(), values.length);
    }

    public static ColumnChunk ofLongs(long... values)
    {
        return new ColumnChunk(PhysicalType.INT64, encodeLongs(values), values.length);
    }

    /**
     * @param nanos timestamps in nanoseconds since the epoch
     */
    public static ColumnChunk ofTimestamps(long... nanos)
    {
        return new ColumnChunk(PhysicalType.INT96, encodeLongs(nanos), nanos.length);
    }

    public static ColumnChunk ofFloats(float... values)
    {
        ByteBuffer buffer = allocate(values.length * Float.BYTES);
        for (float value : values)
        {
            buffer.putFloat(value);
        }
        return new ColumnChunk(PhysicalType.FLOAT, buffer.array(), values.length);
    }

    public static ColumnChunk ofDoubles(double... values)
    {
        ByteBuffer buffer = allocate(values.length * Double.BYTES);
        for (double value : values)
        {
            buffer.putDouble(value);
        }
        return new ColumnChunk(PhysicalType.DOUBLE, buffer.array(), values.length);
    }

    public static ColumnChunk ofStrings(String... values)
    {
        return new ColumnChunk(PhysicalType.BYTE_ARRAY, encodeStrings(values), values.length);
    }

    /**
     * Creates a dictionary-encoded (categorical) BYTE_ARRAY chunk.
     */
    public static ColumnChunk ofCategories(String... values)
    {
        return new ColumnChunk(PhysicalType.BYTE_ARRAY, encodeStrings(values), values.length, 0, true);
    }

    /**
     * Creates a FIXED_LEN_BYTE_ARRAY chunk, every value must be typeLength bytes long.
     */
    public static ColumnChunk ofFixedLength(int typeLength, byte[]... values)
    {
        checkArgument(typeLength > 0, "typeLength must be positive");
        ByteBuffer buffer = allocate(values.length * typeLength);
        for (byte[] value : values)
        {
            checkArgument(value.length == typeLength,
                    "value length " + value.length + " does not match type length " + typeLength);
            buffer.put(value);
        }
        return new ColumnChunk(PhysicalType.FIXED_LEN_BYTE_ARRAY, buffer.array(), values.length, typeLength, false);
    }

    private static byte[] encodeLongs(long[] values)
    {
        ByteBuffer buffer = allocate(values.length * Long.BYTES);
        for (long value : values)
        {
            buffer.putLong(value);
        }
        return buffer.array();
    }

    private static byte[] encodeStrings(String[] values)
    {
        int size = 0;
        byte[][] encoded = new byte[values.length][];
        for (int i = 0; i < values.length; ++i)
        {
            encoded[i] = values[i] == null ? new byte[0] : values[i].getBytes(StandardCharsets.UTF_8);
            size += Integer.BYTES + encoded[i].length;
        }
        ByteBuffer buffer = allocate(size);
        for (byte[] value : encoded)
        {
            buffer.putInt(value.length);
            buffer.put(value);
        }
        return buffer.array();
    }

    private static ByteBuffer allocate(int size)
    {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
