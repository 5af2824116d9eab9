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

import com.google.common.collect.ImmutableList;
import io.infparquet.core.PhysicalType;
import io.infparquet.core.reader.ColumnChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Computes the statistics of a column chunk in one pass over its plain-encoded buffer.
 * <p>
 * BOOLEAN, INT32, INT64, FLOAT, and DOUBLE chunks produce {@link NumericStats}, INT96 chunks
 * produce {@link TimestampStats}, BYTE_ARRAY and FIXED_LEN_BYTE_ARRAY chunks produce
 * {@link StringStats}, or {@link CategoricalStats} if the chunk is categorical.
 * A chunk without values, or whose buffer is too short for its values, produces stats
 * without data. The extractor is stateless and can be shared by threads.
 */
public class ColumnStatsExtractor
{
    private static final Logger logger = LogManager.getLogger(ColumnStatsExtractor.class);

    /**
     * Substrings that are counted in {@link StringStats#getSpecial()}, case-sensitive.
     */
    public static final List<String> SPECIAL_TOKENS = ImmutableList.of(
            "error", "warning", "exception", "fail", "critical",
            "bug", "crash", "fatal", "issue", "problem");

    private static final int FLOAT_BUCKET_NUM = 1000;
    private static final double FLOAT_BUCKET_WIDTH = 0.01;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final int maxHighFreqStrings;
    private final int maxSpecialStrings;
    private final int maxHighFreqCategories;

    public ColumnStatsExtractor()
    {
        this(StringStats.DEFAULT_HIGH_FREQ_CAPACITY, StringStats.DEFAULT_SPECIAL_CAPACITY,
                CategoricalStats.DEFAULT_TOP_CAPACITY);
    }

    public ColumnStatsExtractor(int maxHighFreqStrings, int maxSpecialStrings, int maxHighFreqCategories)
    {
        checkArgument(maxHighFreqStrings >= 0, "maxHighFreqStrings must be non-negative");
        checkArgument(maxSpecialStrings >= 0, "maxSpecialStrings must be non-negative");
        checkArgument(maxHighFreqCategories >= 0, "maxHighFreqCategories must be non-negative");
        this.maxHighFreqStrings = maxHighFreqStrings;
        this.maxSpecialStrings = maxSpecialStrings;
        this.maxHighFreqCategories = maxHighFreqCategories;
    }

    /**
     * @return the kind of stats produced for chunks of the type
     */
    public static StatsKind kindOf(PhysicalType type, boolean categorical)
    {
        switch (type)
        {
            case INT96:
                return StatsKind.TIMESTAMP;
            case BYTE_ARRAY:
                return categorical ? StatsKind.CATEGORICAL : StatsKind.STRING;
            case FIXED_LEN_BYTE_ARRAY:
                return StatsKind.STRING;
            default:
                return StatsKind.NUMERIC;
        }
    }

    /**
     * @return stats of the given kind without data, with the capacities of this extractor
     */
    public BaseStats emptyStats(StatsKind kind)
    {
        switch (kind)
        {
            case TIMESTAMP:
                return new TimestampStats();
            case NUMERIC:
                return new NumericStats();
            case STRING:
                return new StringStats(maxHighFreqStrings, maxSpecialStrings);
            default:
                return new CategoricalStats(maxHighFreqCategories);
        }
    }

    /**
     * Extract the statistics of the chunk. Never throws on a non-null chunk.
     *
     * @param chunk the column chunk
     * @return the statistics, without data if the chunk has no values or is malformed
     */
    public BaseStats extract(ColumnChunk chunk)
    {
        requireNonNull(chunk, "chunk is null");
        StatsKind kind = kindOf(chunk.getType(), chunk.isCategorical());
        if (chunk.getValueCount() == 0)
        {
            return emptyStats(kind);
        }
        ByteBuffer buffer = chunk.getBuffer();
        PhysicalType type = chunk.getType();
        if (type.isFixedWidth() && chunk.getValueCount() > buffer.limit() / type.getWidth())
        {
            logger.warn("buffer of " + buffer.limit() + " bytes is too short for " +
                    chunk.getValueCount() + " " + type + " values");
            return emptyStats(kind);
        }
        int n = (int) Math.min(chunk.getValueCount(), buffer.limit());
        switch (type)
        {
            case BOOLEAN:
                return extractBoolean(buffer, n);
            case INT32:
                return extractInt(buffer, n);
            case INT64:
                return extractLong(buffer, n);
            case FLOAT:
                return extractFloat(buffer, n);
            case DOUBLE:
                return extractDouble(buffer, n);
            case INT96:
                return extractTimestamp(buffer, n);
            case BYTE_ARRAY:
            {
                List<byte[]> values = decodeByteArrays(buffer, chunk.getValueCount());
                if (values == null)
                {
                    logger.warn("malformed BYTE_ARRAY buffer of " + buffer.limit() + " bytes for " +
                            chunk.getValueCount() + " values");
                    return emptyStats(kind);
                }
                return chunk.isCategorical() ? extractCategorical(values) : extractString(values);
            }
            case FIXED_LEN_BYTE_ARRAY:
            {
                List<byte[]> values = decodeFixedLength(buffer, chunk.getValueCount(), chunk.getTypeLength());
                if (values == null)
                {
                    logger.warn("buffer of " + buffer.limit() + " bytes is too short for " +
                            chunk.getValueCount() + " FIXED_LEN_BYTE_ARRAY values of length " +
                            chunk.getTypeLength());
                    return emptyStats(kind);
                }
                return extractString(values);
            }
            default:
                return emptyStats(kind);
        }
    }

    private static NumericStats numeric(long nullCount, double min, double max, double sum,
                                        long totalCount, double mode, long modeCount)
    {
        if (totalCount == 0)
        {
            return new NumericStats(nullCount, 0, 0, 0, 0, 0, 0);
        }
        return new NumericStats(nullCount, min, max, sum / totalCount, mode, modeCount, totalCount);
    }

    private static NumericStats extractBoolean(ByteBuffer buffer, int n)
    {
        long nullCount = 0, trueCount = 0, falseCount = 0;
        for (int i = 0; i < n; ++i)
        {
            byte value = buffer.get(i);
            if (NullHeuristics.isNullBoolean(value))
            {
                nullCount++;
            }
            else if (value != 0)
            {
                trueCount++;
            }
            else
            {
                falseCount++;
            }
        }
        long totalCount = trueCount + falseCount;
        double min = falseCount > 0 ? 0 : 1;
        double max = trueCount > 0 ? 1 : 0;
        if (trueCount > falseCount)
        {
            return numeric(nullCount, min, max, trueCount, totalCount, 1, trueCount);
        }
        return numeric(nullCount, min, max, trueCount, totalCount, 0, falseCount);
    }

    private static NumericStats extractInt(ByteBuffer buffer, int n)
    {
        int[] values = new int[n];
        int m = 0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY, sum = 0;
        for (int i = 0; i < n; ++i)
        {
            int value = buffer.getInt(i * Integer.BYTES);
            if (NullHeuristics.isNullInt(value))
            {
                continue;
            }
            values[m++] = value;
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        if (m == 0)
        {
            return numeric(n, 0, 0, 0, 0, 0, 0);
        }
        // the mode moves only when a running frequency exceeds the current mode count
        Map<Integer, Integer> frequencies = new HashMap<>();
        int mode = values[0];
        int modeCount = 0;
        for (int i = 0; i < m; ++i)
        {
            int frequency = frequencies.merge(values[i], 1, Integer::sum);
            if (frequency > modeCount)
            {
                mode = values[i];
                modeCount = frequency;
            }
        }
        return numeric(n - m, min, max, sum, m, mode, modeCount);
    }

    private static NumericStats extractLong(ByteBuffer buffer, int n)
    {
        long[] values = new long[n];
        int m = 0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY, sum = 0;
        for (int i = 0; i < n; ++i)
        {
            long value = buffer.getLong(i * Long.BYTES);
            if (NullHeuristics.isNullLong(value))
            {
                continue;
            }
            values[m++] = value;
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        if (m == 0)
        {
            return numeric(n, 0, 0, 0, 0, 0, 0);
        }
        long mode = values[0];
        long modeCount = 1;
        long[] sorted = Arrays.copyOf(values, m);
        Arrays.sort(sorted);
        long runCount = 1;
        for (int i = 1; i <= m; ++i)
        {
            if (i < m && sorted[i] == sorted[i - 1])
            {
                runCount++;
                continue;
            }
            if (runCount > modeCount)
            {
                mode = sorted[i - 1];
                modeCount = runCount;
            }
            runCount = 1;
        }
        return numeric(n - m, min, max, sum, m, mode, modeCount);
    }

    private static NumericStats extractFloat(ByteBuffer buffer, int n)
    {
        float[] values = new float[n];
        int m = 0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY, sum = 0;
        for (int i = 0; i < n; ++i)
        {
            float value = buffer.getFloat(i * Float.BYTES);
            if (NullHeuristics.isNullFloat(value))
            {
                continue;
            }
            values[m++] = value;
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        if (m == 0)
        {
            return numeric(n, 0, 0, 0, 0, 0, 0);
        }
        // values beyond the last bucket are not counted
        long[] buckets = new long[FLOAT_BUCKET_NUM];
        for (int i = 0; i < m; ++i)
        {
            double bucket = (values[i] - min) / FLOAT_BUCKET_WIDTH;
            if (bucket >= 0 && bucket < FLOAT_BUCKET_NUM)
            {
                buckets[(int) bucket]++;
            }
        }
        int maxBucket = 0;
        for (int i = 1; i < FLOAT_BUCKET_NUM; ++i)
        {
            if (buckets[i] > buckets[maxBucket])
            {
                maxBucket = i;
            }
        }
        double mode = min + (maxBucket + 0.5) * FLOAT_BUCKET_WIDTH;
        return numeric(n - m, min, max, sum, m, mode, buckets[maxBucket]);
    }

    private static NumericStats extractDouble(ByteBuffer buffer, int n)
    {
        double[] values = new double[n];
        int m = 0;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY, sum = 0;
        for (int i = 0; i < n; ++i)
        {
            double value = buffer.getDouble(i * Double.BYTES);
            if (NullHeuristics.isNullDouble(value))
            {
                continue;
            }
            // -0.0 and 0.0 are the same value
            values[m++] = value == 0.0 ? 0.0 : value;
            min = Math.min(min, value);
            max = Math.max(max, value);
            sum += value;
        }
        if (m == 0)
        {
            return numeric(n, 0, 0, 0, 0, 0, 0);
        }
        Map<Double, Integer> frequencies = new HashMap<>();
        double mode = values[0];
        int modeCount = 0;
        for (int i = 0; i < m; ++i)
        {
            int frequency = frequencies.merge(values[i], 1, Integer::sum);
            if (frequency > modeCount)
            {
                mode = values[i];
                modeCount = frequency;
            }
        }
        return numeric(n - m, min, max, sum, m, mode, modeCount);
    }

    private static TimestampStats extractTimestamp(ByteBuffer buffer, int n)
    {
        long nullCount = 0, count = 0;
        long min = Long.MAX_VALUE, max = Long.MIN_VALUE;
        for (int i = 0; i < n; ++i)
        {
            long nanos = buffer.getLong(i * Long.BYTES);
            if (NullHeuristics.isNullLong(nanos))
            {
                nullCount++;
                continue;
            }
            long seconds = nanos / NANOS_PER_SECOND;
            min = Math.min(min, seconds);
            max = Math.max(max, seconds);
            count++;
        }
        if (count == 0)
        {
            return new TimestampStats(nullCount, 0, 0, 0);
        }
        return new TimestampStats(nullCount, min, max, count);
    }

    private StringStats extractString(List<byte[]> values)
    {
        TopKTracker<String> highFreq = new TopKTracker<>(maxHighFreqStrings);
        TopKTracker<String> special = new TopKTracker<>(maxSpecialStrings);
        long nullCount = 0, totalCount = 0, totalLength = 0;
        long minLength = Long.MAX_VALUE, maxLength = 0;
        for (byte[] bytes : values)
        {
            if (bytes == null)
            {
                nullCount++;
                continue;
            }
            String value = new String(bytes, StandardCharsets.UTF_8);
            long length = bytes.length;
            minLength = Math.min(minLength, length);
            maxLength = Math.max(maxLength, length);
            totalLength += length;
            totalCount++;
            for (String token : SPECIAL_TOKENS)
            {
                if (value.contains(token))
                {
                    special.observe(token);
                }
            }
            highFreq.observe(value);
        }
        if (totalCount == 0)
        {
            minLength = 0;
        }
        return new StringStats(nullCount, highFreq, special, minLength, maxLength, totalLength, totalCount);
    }

    private CategoricalStats extractCategorical(List<byte[]> values)
    {
        TopKTracker<String> top = new TopKTracker<>(maxHighFreqCategories);
        Set<String> distinct = new HashSet<>();
        long nullCount = 0, totalCount = 0;
        for (byte[] bytes : values)
        {
            if (bytes == null)
            {
                nullCount++;
                continue;
            }
            String value = new String(bytes, StandardCharsets.UTF_8);
            distinct.add(value);
            top.observe(value);
            totalCount++;
        }
        return new CategoricalStats(nullCount, top, distinct.size(), totalCount);
    }

    /**
     * Split length-prefixed values, a zero-length value is returned as null.
     *
     * @return the values, or null if the buffer does not hold valueCount complete values
     */
    private static List<byte[]> decodeByteArrays(ByteBuffer buffer, long valueCount)
    {
        int size = buffer.limit();
        if (valueCount > size / Integer.BYTES)
        {
            return null;
        }
        byte[][] values = new byte[(int) valueCount][];
        long offset = 0;
        for (int i = 0; i < valueCount; ++i)
        {
            if (offset + Integer.BYTES > size)
            {
                return null;
            }
            int length = buffer.getInt((int) offset);
            offset += Integer.BYTES;
            if (length < 0 || offset + length > size)
            {
                return null;
            }
            if (!NullHeuristics.isNullBinary(length))
            {
                values[i] = decode(buffer, (int) offset, length);
            }
            offset += length;
        }
        return Arrays.asList(values);
    }

    /**
     * Split fixed-width values, an all-zero value is returned as null.
     *
     * @return the values, or null if the buffer is too short
     */
    private static List<byte[]> decodeFixedLength(ByteBuffer buffer, long valueCount, int typeLength)
    {
        if (valueCount > buffer.limit() / typeLength)
        {
            return null;
        }
        byte[][] values = new byte[(int) valueCount][];
        for (int i = 0; i < valueCount; ++i)
        {
            int offset = i * typeLength;
            if (!NullHeuristics.isNullFixed(buffer, offset, typeLength))
            {
                values[i] = decode(buffer, offset, typeLength);
            }
        }
        return Arrays.asList(values);
    }

    private static byte[] decode(ByteBuffer buffer, int offset, int length)
    {
        byte[] bytes = new byte[length];
        ByteBuffer slice = buffer.duplicate();
        slice.position(offset);
        slice.get(bytes);
        return bytes;
    }
}
