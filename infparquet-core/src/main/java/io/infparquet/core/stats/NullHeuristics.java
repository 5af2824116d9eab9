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
package io.infparquet.core.stats;

import io.infparquet.core.reader.ColumnChunk;

import java.nio.ByteBuffer;

/**
 * Plain-encoded chunks carry no validity bitmap, so nulls are recognized by sentinel values.
 * A genuine value equal to a sentinel is taken as null.
 */
public final class NullHeuristics
{
    private NullHeuristics()
    {
    }

    public static boolean isNullBoolean(byte value)
    {
        return (value & 0x80) != 0;
    }

    public static boolean isNullInt(int value)
    {
        return value == Integer.MIN_VALUE;
    }

    /**
     * Applies to INT64 values and INT96 timestamps.
     */
    public static boolean isNullLong(long value)
    {
        return value == Long.MIN_VALUE;
    }

    public static boolean isNullFloat(float value)
    {
        return Float.isNaN(value);
    }

    public static boolean isNullDouble(double value)
    {
        return Double.isNaN(value);
    }

    public static boolean isNullBinary(int length)
    {
        return length == 0;
    }

    /**
     * @return true if the length bytes of buffer from offset are all zero
     */
    public static boolean isNullFixed(ByteBuffer buffer, int offset, int length)
    {
        for (int i = 0; i < length; ++i)
        {
            if (buffer.get(offset + i) != 0)
            {
                return false;
            }
        }
        return true;
    }

    /**
     * Scan the complete values in the chunk for a sentinel. An empty buffer counts as null.
     * Trailing bytes that do not form a complete value are ignored.
     *
     * @param chunk the column chunk
     * @return true if the chunk contains at least one null
     */
    public static boolean hasNull(ColumnChunk chunk)
    {
        if (chunk.getSize() == 0)
        {
            return true;
        }
        ByteBuffer buffer = chunk.getBuffer();
        int size = buffer.limit();
        switch (chunk.getType())
        {
            case BOOLEAN:
                for (int i = 0; i < size; ++i)
                {
                    if (isNullBoolean(buffer.get(i)))
                    {
                        return true;
                    }
                }
                return false;
            case INT32:
                for (int i = 0; i + Integer.BYTES <= size; i += Integer.BYTES)
                {
                    if (isNullInt(buffer.getInt(i)))
                    {
                        return true;
                    }
                }
                return false;
            case INT64:
            // timestamps share the INT64 sentinel, as in the extracted null count
            case INT96:
                for (int i = 0; i + Long.BYTES <= size; i += Long.BYTES)
                {
                    if (isNullLong(buffer.getLong(i)))
                    {
                        return true;
                    }
                }
                return false;
            case FLOAT:
                for (int i = 0; i + Float.BYTES <= size; i += Float.BYTES)
                {
                    if (isNullFloat(buffer.getFloat(i)))
                    {
                        return true;
                    }
                }
                return false;
            case DOUBLE:
                for (int i = 0; i + Double.BYTES <= size; i += Double.BYTES)
                {
                    if (isNullDouble(buffer.getDouble(i)))
                    {
                        return true;
                    }
                }
                return false;
            case BYTE_ARRAY:
            {
                long offset = 0;
                while (offset + Integer.BYTES <= size)
                {
                    int length = buffer.getInt((int) offset);
                    if (isNullBinary(length))
                    {
                        return true;
                    }
                    if (length < 0)
                    {
                        return false;
                    }
                    offset += Integer.BYTES + (long) length;
                }
                return false;
            }
            case FIXED_LEN_BYTE_ARRAY:
            {
                int typeLength = chunk.getTypeLength();
                for (int i = 0; i + typeLength <= size; i += typeLength)
                {
                    if (isNullFixed(buffer, i, typeLength))
                    {
                        return true;
                    }
                }
                return false;
            }
            default:
                return false;
        }
    }
}
