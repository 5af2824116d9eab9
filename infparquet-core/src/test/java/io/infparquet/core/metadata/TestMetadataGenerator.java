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

import io.infparquet.common.error.ErrorCode;
import io.infparquet.common.exception.InvalidArgumentException;
import io.infparquet.core.custom.CustomMetadataResult;
import io.infparquet.core.custom.NamedPredicate;
import io.infparquet.core.exception.ColumnSourceException;
import io.infparquet.core.exception.MetadataGenerationException;
import io.infparquet.core.reader.ColumnChunk;
import io.infparquet.core.reader.ColumnDataSource;
import io.infparquet.core.reader.FailingColumnDataSource;
import io.infparquet.core.reader.MemoryColumnDataSource;
import io.infparquet.core.stats.NumericStats;
import io.infparquet.core.stats.StatsKind;
import io.infparquet.core.stats.StringStats;
import io.infparquet.core.stats.TimestampStats;
import io.infparquet.core.stats.TopKTracker;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestMetadataGenerator
{
    private static final double DELTA = 1e-9;

    static MemoryColumnDataSource createSource()
    {
        return MemoryColumnDataSource.newBuilder()
                .setPath("/tmp/orders.parquet")
                .beginRowGroup(4)
                .addColumn("id", ColumnChunk.ofInts(1, 2, 3, Integer.MIN_VALUE))
                .addColumn("name", ColumnChunk.ofStrings("a", "b", "a", "critical bug"))
                .addColumn("ts", ColumnChunk.ofTimestamps(1_000_000_000_000_000_000L, 1_000_000_005_000_000_000L,
                        1_000_000_010_000_000_000L, 1_000_000_020_000_000_000L))
                .beginRowGroup(2)
                .addColumn("id", ColumnChunk.ofInts(10, 20))
                .addColumn("name", ColumnChunk.ofStrings("a", ""))
                .addColumn("ts", ColumnChunk.ofTimestamps(999_999_999_000_000_000L, 1_000_000_030_000_000_000L))
                .build();
    }

    @Test
    public void testTreeShape()
    {
        MemoryColumnDataSource source = createSource();
        FileNode file = new MetadataGenerator().generate(source, Collections.emptyList());
        assertEquals(NodeType.FILE, file.getType());
        assertEquals("/tmp/orders.parquet", file.getFilePath());
        assertEquals(2, file.getRowGroups().size());
        assertEquals(5, file.getChildren().size());
        for (int i = 0; i < 2; ++i)
        {
            RowGroupNode rowGroup = file.getRowGroups().get(i);
            assertEquals(i, rowGroup.getId());
            assertEquals("row_group_" + i, rowGroup.getName());
            assertEquals(NodeType.ROW_GROUP, rowGroup.getType());
            assertEquals(Arrays.asList("id", "name", "ts"), names(rowGroup.getColumns()));
        }
        assertEquals(Arrays.asList("id", "name", "ts"), names(file.getColumns()));
        assertEquals(4, file.getRowGroups().get(0).getNumberOfRows());
        assertEquals(source.getRowGroupInfo(1).getTotalByteSize(), file.getRowGroups().get(1).getTotalByteSize());
        assertTrue(file.getCustomResults().isEmpty());
    }

    private static List<String> names(List<ColumnNode> columns)
    {
        List<String> names = new ArrayList<>();
        for (ColumnNode column : columns)
        {
            names.add(column.getName());
        }
        return names;
    }

    @Test
    public void testRollUpHasOneStatsPerKind()
    {
        FileNode file = new MetadataGenerator().generate(createSource(), Collections.emptyList());
        RowGroupNode rowGroup = file.getRowGroups().get(0);
        assertEquals(3, rowGroup.getRollUp().size());
        assertNull(rowGroup.getStats(StatsKind.CATEGORICAL));
        assertEquals(rowGroup.getColumns().get(0).getStats(), rowGroup.getStats(StatsKind.NUMERIC));
        StringStats strings = (StringStats) rowGroup.getStats(StatsKind.STRING);
        assertEquals(4, strings.getTotalCount());
        assertEquals(2, strings.getSpecial().size());
    }

    @Test
    public void testRollUpMergesColumnsOfTheSameKind()
    {
        MemoryColumnDataSource source = MemoryColumnDataSource.newBuilder()
                .beginRowGroup(2)
                .addColumn("a", ColumnChunk.ofInts(1, 2))
                .addColumn("b", ColumnChunk.ofDoubles(-1.5, Double.NaN))
                .build();
        RowGroupNode rowGroup = new MetadataGenerator().generateRowGroup(source, 0);
        NumericStats numeric = (NumericStats) rowGroup.getStats(StatsKind.NUMERIC);
        assertEquals(1, rowGroup.getRollUp().size());
        assertEquals(-1.5, numeric.getMin(), DELTA);
        assertEquals(2, numeric.getMax(), DELTA);
        assertEquals(3, numeric.getTotalCount());
        assertEquals(1, numeric.getNullCount());
    }

    @Test
    public void testRollAcrossByColumnName()
    {
        FileNode file = new MetadataGenerator().generate(createSource(), Collections.emptyList());
        NumericStats id = (NumericStats) file.getColumn("id").getStats();
        assertEquals(1, id.getMin(), DELTA);
        assertEquals(20, id.getMax(), DELTA);
        assertEquals(36.0 / 5, id.getMean(), DELTA);
        assertEquals(5, id.getTotalCount());
        assertEquals(1, id.getNullCount());

        StringStats name = (StringStats) file.getColumn("name").getStats();
        assertEquals(5, name.getTotalCount());
        assertEquals(1, name.getNullCount());
        assertEquals("a", name.getHighFreq().get(0).getKey());
        assertEquals(3, name.getHighFreq().get(0).getCount());

        TimestampStats ts = (TimestampStats) file.getColumn("ts").getStats();
        assertEquals(999_999_999L, ts.getMin());
        assertEquals(1_000_000_030L, ts.getMax());
        assertEquals(6, ts.getCount());
    }

    @Test
    public void testGeneratedTreeCanNotBeModified()
    {
        FileNode file = new MetadataGenerator().generate(createSource(), Collections.emptyList());
        NumericStats id = (NumericStats) file.getColumn("id").getStats();
        id.merge(new NumericStats(0, -100, 100, 0, 0, 0, 1000));
        StringStats name = (StringStats) file.getColumn("name").getStats();
        name.merge(new StringStats(0, new TopKTracker<>(10), new TopKTracker<>(20), 1, 1, 1000, 1000));
        RowGroupNode rowGroup = file.getRowGroups().get(0);
        rowGroup.getStats(StatsKind.NUMERIC).merge(new NumericStats(0, -100, 100, 0, 0, 0, 1000));
        rowGroup.getRollUp().get(StatsKind.NUMERIC).merge(new NumericStats(0, -100, 100, 0, 0, 0, 1000));
        rowGroup.getColumns().get(0).getStats().merge(new NumericStats(0, -100, 100, 0, 0, 0, 1000));

        id = (NumericStats) file.getColumn("id").getStats();
        assertEquals(5, id.getTotalCount());
        assertEquals(1, id.getMin(), DELTA);
        name = (StringStats) file.getColumn("name").getStats();
        assertEquals(5, name.getTotalCount());
        assertEquals(3, name.getHighFreq().get(0).getCount());
        assertEquals(3, ((NumericStats) rowGroup.getStats(StatsKind.NUMERIC)).getTotalCount());
        assertEquals(3, ((NumericStats) rowGroup.getColumns().get(0).getStats()).getTotalCount());
    }

    @Test
    public void testStringStatsDoNotShareTrackers()
    {
        TopKTracker<String> highFreq = new TopKTracker<>(2);
        highFreq.observe("a");
        StringStats stats = new StringStats(0, highFreq, new TopKTracker<>(2), 1, 1, 1, 1);
        highFreq.observe("injected", 99);
        assertEquals(Collections.singletonList(new TopKTracker.Entry<>("a", 1L)), stats.getHighFreq());
        assertEquals(2, stats.getHighFreqCapacity());
    }

    @Test
    public void testRollAcrossSkipsMismatchedKinds()
    {
        MemoryColumnDataSource source = MemoryColumnDataSource.newBuilder()
                .beginRowGroup(2)
                .addColumn("v", ColumnChunk.ofInts(1, 2))
                .beginRowGroup(1)
                .addColumn("v", ColumnChunk.ofStrings("x"))
                .build();
        FileNode file = new MetadataGenerator().generate(source, Collections.emptyList());
        assertEquals(1, file.getColumns().size());
        NumericStats v = (NumericStats) file.getColumn("v").getStats();
        assertEquals(2, v.getTotalCount());
        assertEquals(StatsKind.STRING, file.getRowGroups().get(1).getColumns().get(0).getStats().getKind());
    }

    @Test
    public void testFileItems()
    {
        MemoryColumnDataSource source = createSource();
        long before = System.currentTimeMillis() / 1000;
        FileNode file = new MetadataGenerator().generate(source, Collections.emptyList());
        long after = System.currentTimeMillis() / 1000;
        assertEquals(6, file.getItem(MetadataItem.ROW_COUNT).getLongValue());
        assertEquals(source.getFileSize(), file.getItem(MetadataItem.FILE_SIZE).getLongValue());
        assertEquals(2, file.getItem(MetadataItem.ROW_GROUP_COUNT).getLongValue());
        assertEquals(3, file.getItem(MetadataItem.COLUMN_COUNT).getLongValue());
        assertEquals(3.0, file.getItem(MetadataItem.AVG_ROWS_PER_ROW_GROUP).getValue(), DELTA);
        assertEquals(1, file.getItem(MetadataItem.SCHEMA_VERSION).getLongValue());
        MetadataItem creationTime = file.getItem(MetadataItem.CREATION_TIME);
        assertEquals(MetadataItem.Type.TIMESTAMP, creationTime.getType());
        assertTrue(creationTime.getLongValue() >= before && creationTime.getLongValue() <= after);
    }

    @Test
    public void testEmptyFile()
    {
        MemoryColumnDataSource source = MemoryColumnDataSource.newBuilder().setPath("empty").build();
        FileNode file = new MetadataGenerator().generate(source, Collections.emptyList());
        assertTrue(file.getRowGroups().isEmpty());
        assertTrue(file.getColumns().isEmpty());
        assertEquals(0, file.getItem(MetadataItem.ROW_COUNT).getLongValue());
        assertNull(file.getItem(MetadataItem.AVG_ROWS_PER_ROW_GROUP));
    }

    @Test
    public void testCustomMetadata()
    {
        MetadataGeneratorOption option = new MetadataGeneratorOption().generateCustomMetadata(true);
        List<NamedPredicate> predicates = Arrays.asList(
                NamedPredicate.of("nulls", "SELECT has_null FROM columns"),
                NamedPredicate.of("sorted", "SELECT is_sorted FROM columns"));
        FileNode file = new MetadataGenerator(option).generate(createSource(), predicates);
        assertEquals(2, file.getCustomResults().size());
        CustomMetadataResult nulls = file.getCustomResults().get(0);
        assertEquals("nulls", nulls.getName());
        assertEquals("SELECT has_null FROM columns", nulls.getPredicateSpec());
        assertEquals("{{1,0,0}{0,1,0}}", nulls.getMatrix().toString());
        assertEquals("{{0,0,0}{0,0,0}}", file.getCustomResults().get(1).getMatrix().toString());
    }

    @Test
    public void testCustomMetadataDisabled()
    {
        FileNode file = new MetadataGenerator().generate(createSource(),
                Collections.singletonList(NamedPredicate.of("nulls", "has_null")));
        assertTrue(file.getCustomResults().isEmpty());
    }

    @Test
    public void testBaseMetadataDisabled()
    {
        MetadataGeneratorOption option = new MetadataGeneratorOption().generateBaseMetadata(false);
        FileNode file = new MetadataGenerator(option).generate(createSource(), Collections.emptyList());
        assertFalse(file.getRowGroups().get(0).getColumns().get(0).hasStats());
        assertTrue(file.getRowGroups().get(0).getRollUp().isEmpty());
        assertFalse(file.getColumn("id").hasStats());
        assertEquals(6, file.getItem(MetadataItem.ROW_COUNT).getLongValue());
    }

    @Test
    public void testParallelismDoesNotChangeResult()
    {
        MemoryColumnDataSource.Builder builder = MemoryColumnDataSource.newBuilder();
        for (int rg = 0; rg < 16; ++rg)
        {
            builder.beginRowGroup(3)
                    .addColumn("n", ColumnChunk.ofLongs(rg, rg * 2L, Long.MIN_VALUE))
                    .addColumn("s", ColumnChunk.ofStrings("k" + (rg % 3), "warning", ""));
        }
        MemoryColumnDataSource source = builder.build();
        List<NamedPredicate> predicates = Collections.singletonList(NamedPredicate.of("nulls", "has_null"));
        FileNode serial = new MetadataGenerator(new MetadataGeneratorOption().parallelism(1)
                .generateCustomMetadata(true)).generate(source, predicates);
        FileNode parallel = new MetadataGenerator(new MetadataGeneratorOption().parallelism(8)
                .generateCustomMetadata(true)).generate(source, predicates);
        assertEquals(serial.getRowGroups(), parallel.getRowGroups());
        assertEquals(serial.getColumns(), parallel.getColumns());
        assertEquals(serial.getCustomResults(), parallel.getCustomResults());
    }

    @Test
    public void testProgressListener()
    {
        List<Integer> completed = new ArrayList<>();
        new MetadataGenerator().setProgressListener((done, total) ->
        {
            assertEquals(2, total);
            completed.add(done);
        }).generate(createSource(), Collections.emptyList());
        assertEquals(Arrays.asList(1, 2), completed);
    }

    @Test
    public void testGenerateRowGroup()
    {
        MemoryColumnDataSource source = createSource();
        FileNode file = new MetadataGenerator().generate(source, Collections.emptyList());
        assertEquals(file.getRowGroups().get(1), new MetadataGenerator().generateRowGroup(source, 1));
    }

    @Test(expected = InvalidArgumentException.class)
    public void testGenerateRowGroupOutOfRange()
    {
        new MetadataGenerator().generateRowGroup(createSource(), 2);
    }

    @Test(expected = InvalidArgumentException.class)
    public void testNullSource()
    {
        new MetadataGenerator().generate(null, Collections.emptyList());
    }

    @Test
    public void testSourceFailureAbortsGeneration()
    {
        ColumnDataSource failing = new FailingColumnDataSource(createSource(), 1, 2);
        try
        {
            new MetadataGenerator(new MetadataGeneratorOption().parallelism(2)).generate(failing, Collections.emptyList());
            fail("generation should fail");
        }
        catch (MetadataGenerationException e)
        {
            assertEquals(ErrorCode.METADATA_GEN_SOURCE_ERROR, e.getErrorCode());
            assertTrue(e.getCause() instanceof ColumnSourceException);
        }
    }

    @Test
    public void testCorruptChunkKeepsSourceErrorCode()
    {
        ColumnDataSource corrupt = new FailingColumnDataSource(createSource(), 0, 1,
                ErrorCode.COLUMN_SOURCE_CORRUPT_DATA);
        try
        {
            new MetadataGenerator().generateRowGroup(corrupt, 0);
            fail("generation should fail");
        }
        catch (MetadataGenerationException e)
        {
            assertEquals(ErrorCode.METADATA_GEN_SOURCE_ERROR, e.getErrorCode());
            assertEquals(ErrorCode.COLUMN_SOURCE_CORRUPT_DATA, ((ColumnSourceException) e.getCause()).getErrorCode());
        }
    }
}
