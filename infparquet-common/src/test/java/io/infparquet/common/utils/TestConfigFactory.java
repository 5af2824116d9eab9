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
package io.infparquet.common.utils;

import org.junit.Test;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class TestConfigFactory
{
    @Test
    public void testDefaultsFromClassPath()
    {
        ConfigFactory config = ConfigFactory.Instance();
        assertEquals("10", config.getProperty("metadata.max.high.freq.strings"));
        assertEquals("20", config.getProperty("metadata.max.special.strings"));
    }

    @Test
    public void testDefaultValueForBlankProperty()
    {
        ConfigFactory config = ConfigFactory.Instance();
        assertEquals("none", config.getProperty("test.config.factory.missing", "none"));
        config.addProperty("test.config.factory.blank", "  ");
        assertEquals("fallback", config.getProperty("test.config.factory.blank", "fallback"));
        assertNull(config.getProperty("test.config.factory.missing"));
    }

    @Test
    public void testUpdateCallback()
    {
        ConfigFactory config = ConfigFactory.Instance();
        AtomicReference<String> updated = new AtomicReference<>();
        config.registerUpdateCallback("test.config.factory.callback", updated::set);
        config.addProperty("test.config.factory.callback", "42");
        assertEquals("42", updated.get());
    }

    @Test
    public void testLoadProperties() throws IOException
    {
        File file = File.createTempFile("infparquet", ".properties");
        file.deleteOnExit();
        try (FileWriter writer = new FileWriter(file))
        {
            writer.write("test.config.factory.loaded=yes\n");
        }
        ConfigFactory config = ConfigFactory.Instance();
        AtomicReference<String> updated = new AtomicReference<>();
        config.registerUpdateCallback("test.config.factory.loaded", updated::set);
        config.loadProperties(file.getAbsolutePath());
        assertEquals("yes", config.getProperty("test.config.factory.loaded"));
        assertEquals("yes", updated.get());
    }
}
