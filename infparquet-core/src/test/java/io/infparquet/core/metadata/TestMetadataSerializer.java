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
import io.infparquet.core.custom.NamedPredicate;
import io.infparquet.core.exception.MetadataGenerationException;
import io.infparquet.core.reader.ColumnChunk;
import io.infparquet.core.reader.MemoryColumnDataSource;
import io.infparquet.core.stats.StatsKind;
import io.infparquet.core.stats.StringStats;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestMetadataSerializer
{
    private static FileNode generate()
    {
        MemoryColumnDataSource source = MemoryColumnDataSource.newBuilder()
                .setPath("/data/events.parquet")
                .beginRowGroup(3)
                .addColumn("level", ColumnChunk.ofCategories("info", "warn", "info"))
                .addColumn("message", ColumnChunk.ofStrings("connection error", "", "retry"))
                .addColumn("latency", ColumnChunk.ofDoubles(0.25, 1.0 / 3, Double.NaN))
                .beginRowGroup(1)
                .addColumn("level", ColumnChunk.ofCategories("info"))
                .addColumn("message", ColumnChunk.ofStrings("ok"))
                .addColumn("latency", ColumnChunk.ofDoubles(Double.NaN))
                .addColumn("at", ColumnChunk.ofTimestamps(1_650_000_000_000_000_000L))
                .addColumn("flags", ColumnChunk.ofInts())
                .build();
        MetadataGeneratorOption option = new MetadataGeneratorOption().generateCustomMetadata(true);
        return new MetadataGenerator(option).generate(source,
                Collections.singletonList(NamedPredicate.of("nulls", "has_null")));
    }

    @Test
    public void testJsonRoundTrip()
    {
        FileNode file = generate();
        String json = MetadataSerializer.toJson(file);
        assertTrue(json.contains("{{0,1,1}{0,0,1,0,1}}"));
        FileNode read = MetadataSerializer.fromJson(json);
        assertEquals(file, read);
        assertEquals(file.getRowGroups().get(0).getRollUp().keySet(), read.getRowGroups().get(0).getRollUp().keySet());
        StringStats message = (StringStats) read.getColumn("message").getStats();
        assertEquals(StatsKind.STRING, message.getKind());
        assertEquals(1, message.getSpecial().size());
        assertFalse(read.getColumn("flags").getStats().hasData());
    }

    @Test
    public void testSaveAndLoad() throws IOException
    {
        FileNode file = generate();
        File tmp = File.createTempFile("infparquet", ".json");
        tmp.deleteOnExit();
        MetadataSerializer.save(file, tmp.getAbsolutePath());
        assertEquals(file, MetadataSerializer.load(tmp.getAbsolutePath()));
    }

    @Test
    public void testInvalidJson()
    {
        for (String json : Arrays.asList("not json", "{}", "{\"file_path\":\"f\",\"custom_metadata\":" +
                "[{\"name\":\"n\",\"sql_query\":\"q\",\"results\":\"{{2}}\"}]}"))
        {
            try
            {
                MetadataSerializer.fromJson(json);
                fail("invalid metadata should be rejected: " + json);
            }
            catch (MetadataGenerationException e)
            {
                assertEquals(ErrorCode.METADATA_GEN_SERIALIZATION_ERROR, e.getErrorCode());
            }
        }
    }

    @Test
    public void testLoadMissingFile()
    {
        try
        {
            MetadataSerializer.load("/nonexistent/infparquet/metadata.json");
            fail("loading a missing file should fail");
        }
        catch (MetadataGenerationException e)
        {
            assertEquals(ErrorCode.METADATA_GEN_SERIALIZATION_ERROR, e.getErrorCode());
        }
    }
}
