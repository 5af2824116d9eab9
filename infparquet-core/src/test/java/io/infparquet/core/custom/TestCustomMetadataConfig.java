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
package io.infparquet.core.custom;

import io.infparquet.common.error.ErrorCode;
import io.infparquet.core.exception.MetadataGenerationException;
import io.infparquet.core.metadata.FileNode;
import io.infparquet.core.metadata.MetadataGenerator;
import io.infparquet.core.metadata.MetadataGeneratorOption;
import io.infparquet.core.reader.ColumnChunk;
import io.infparquet.core.reader.MemoryColumnDataSource;
import org.junit.Test;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestCustomMetadataConfig
{
    private static final String CONFIG = "{\"custom_metadata\": [" +
            "{\"name\": \"null_check\", \"sql_query\": \"SELECT has_null(*)\", \"description\": \"columns with nulls\"," +
            " \"target\": \"column\", \"options\": {\"cache_results\": true, \"update_frequency\": \"write\"}}," +
            "{\"sql_query\": \"SELECT 1\", \"target\": \"table\"}]}";

    @Test
    public void testParse()
    {
        List<NamedPredicate> predicates = CustomMetadataConfig.parse(CONFIG);
        assertEquals(2, predicates.size());
        NamedPredicate first = predicates.get(0);
        assertEquals("null_check", first.getName());
        assertEquals("SELECT has_null(*)", first.getQuery());
        assertEquals("columns with nulls", first.getDescription());
        assertEquals(NamedPredicate.Target.COLUMN, first.getTarget());
        assertTrue(first.isCacheResults());
        assertEquals(NamedPredicate.UpdateFrequency.WRITE, first.getUpdateFrequency());

        NamedPredicate second = predicates.get(1);
        assertEquals("Custom_1", second.getName());
        assertNull(second.getDescription());
        assertEquals(NamedPredicate.Target.FILE, second.getTarget());
        assertFalse(second.isCacheResults());
        assertEquals(NamedPredicate.UpdateFrequency.READ, second.getUpdateFrequency());
    }

    @Test
    public void testInvalidConfigurations()
    {
        for (String json : Arrays.asList("{\"custom_metadata\": [{\"name\": \"no_query\"}]}",
                "{\"other\": []}", "{not json", "{\"custom_metadata\": [42]}"))
        {
            try
            {
                CustomMetadataConfig.parse(json);
                fail("invalid configuration is accepted: " + json);
            }
            catch (MetadataGenerationException e)
            {
                assertEquals(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR, e.getErrorCode());
            }
        }
    }

    @Test
    public void testAtMostTwentyItems()
    {
        StringBuilder json = new StringBuilder("{\"custom_metadata\": [");
        for (int i = 0; i < 25; ++i)
        {
            json.append(i > 0 ? "," : "").append("{\"sql_query\": \"has_null\"}");
        }
        json.append("]}");
        List<NamedPredicate> predicates = CustomMetadataConfig.parse(json.toString());
        assertEquals(CustomMetadataEvaluator.MAX_CUSTOM_METADATA_ITEMS, predicates.size());
        assertEquals("Custom_19", predicates.get(19).getName());
    }

    @Test
    public void testLoadThroughGenerator() throws IOException
    {
        File file = File.createTempFile("custom_metadata", ".json");
        file.deleteOnExit();
        try (FileWriter writer = new FileWriter(file))
        {
            writer.write(CONFIG);
        }
        assertEquals(2, CustomMetadataConfig.load(file.getAbsolutePath()).size());

        MemoryColumnDataSource source = MemoryColumnDataSource.newBuilder()
                .beginRowGroup(1)
                .addColumn("a", ColumnChunk.ofStrings(""))
                .build();
        MetadataGeneratorOption option = new MetadataGeneratorOption()
                .generateCustomMetadata(true).customMetadataConfigPath(file.getAbsolutePath());
        FileNode tree = new MetadataGenerator(option).generate(source);
        assertEquals(2, tree.getCustomResults().size());
        assertEquals("{{1}}", tree.getCustomResults().get(0).getMatrix().toString());
        assertEquals("{{0}}", tree.getCustomResults().get(1).getMatrix().toString());
    }

    @Test
    public void testLoadMissingFile()
    {
        try
        {
            CustomMetadataConfig.load("/nonexistent/infparquet/custom_metadata.json");
            fail("loading a missing file should fail");
        }
        catch (MetadataGenerationException e)
        {
            assertEquals(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR, e.getErrorCode());
        }
    }
}
