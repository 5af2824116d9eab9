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
import io.infparquet.common.utils.ConfigFactory;
import io.infparquet.core.exception.MetadataGenerationException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestMetadataGeneratorOption
{
    @Test
    public void testDefaults()
    {
        MetadataGeneratorOption option = new MetadataGeneratorOption();
        assertTrue(option.isGenerateBaseMetadata());
        assertFalse(option.isGenerateCustomMetadata());
        assertEquals(10, option.getMaxHighFreqStrings());
        assertEquals(20, option.getMaxSpecialStrings());
        assertEquals(20, option.getMaxHighFreqCategories());
        assertEquals(0, option.getParallelism());
        assertFalse(option.getCustomMetadataConfigPath().isPresent());
    }

    @Test
    public void testFromConfig()
    {
        MetadataGeneratorOption option = MetadataGeneratorOption.fromConfig();
        assertTrue(option.isGenerateBaseMetadata());
        assertFalse(option.isGenerateCustomMetadata());
        assertEquals(10, option.getMaxHighFreqStrings());
        assertEquals(20, option.getMaxSpecialStrings());
        assertFalse(option.getCustomMetadataConfigPath().isPresent());
    }

    @Test
    public void testEffectiveParallelism()
    {
        assertEquals(3, new MetadataGeneratorOption().parallelism(3).getEffectiveParallelism());
        int effective = new MetadataGeneratorOption().getEffectiveParallelism();
        assertTrue(effective >= 1 && effective <= MetadataGeneratorOption.MAX_DEFAULT_PARALLELISM);
    }

    private static void assertInvalidProperty(String key, String value, String defaultValue)
    {
        ConfigFactory config = ConfigFactory.Instance();
        config.addProperty(key, value);
        try
        {
            MetadataGeneratorOption.fromConfig();
            fail("fromConfig should reject " + key + "=" + value);
        }
        catch (MetadataGenerationException e)
        {
            assertEquals(ErrorCode.METADATA_GEN_INVALID_PARAMETER, e.getErrorCode());
        }
        finally
        {
            config.addProperty(key, defaultValue);
        }
    }

    @Test
    public void testFromConfigRejectsInvalidProperties()
    {
        assertInvalidProperty("metadata.generator.parallelism", "-1", "0");
        assertInvalidProperty("metadata.max.high.freq.strings", "ten", "10");
        assertInvalidProperty("metadata.max.special.strings", "-5", "20");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeParallelism()
    {
        new MetadataGeneratorOption().parallelism(-1);
    }
}
