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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Process-wide access to the InfParquet configuration properties.
 * <p>
 * The properties file is located in this order: the path in INFPARQUET_CONFIG,
 * $INFPARQUET_HOME/etc/infparquet.properties, and finally infparquet.properties
 * on the class path.
 */
public class ConfigFactory
{
    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static ConfigFactory instance = null;

    public static synchronized ConfigFactory Instance()
    {
        if (instance == null)
        {
            instance = new ConfigFactory();
        }
        return instance;
    }

    // Properties is thread safe, so we do not add synchronization to it.
    private final Properties prop;

    /**
     * Registered callbacks are invoked when the value of their key is
     * reloaded or updated, so that cached settings can be refreshed.
     */
    public interface UpdateCallback
    {
        void update(String value);
    }

    private final Map<String, UpdateCallback> callbacks;

    private ConfigFactory()
    {
        prop = new Properties();
        callbacks = new HashMap<>();
        String configPath = System.getenv("INFPARQUET_CONFIG");
        String home = System.getenv("INFPARQUET_HOME");
        if (home != null)
        {
            prop.setProperty("infparquet.home", home);
        }
        if (configPath == null && home != null)
        {
            if (!(home.endsWith("/") || home.endsWith("\\")))
            {
                home += "/";
            }
            configPath = home + "etc/infparquet.properties";
        }

        InputStream in = null;
        try
        {
            if (configPath == null)
            {
                in = this.getClass().getResourceAsStream("/infparquet.properties");
            }
            else
            {
                in = new FileInputStream(configPath);
            }
            if (in != null)
            {
                prop.load(in);
            }
            else
            {
                logger.warn("infparquet.properties is not found, built-in defaults are used");
            }
        }
        catch (IOException e)
        {
            logger.error("failed to load configuration from " + configPath, e);
        }
        finally
        {
            if (in != null)
            {
                try
                {
                    in.close();
                }
                catch (IOException e)
                {
                    logger.error("failed to close the configuration stream", e);
                }
            }
        }
    }

    public synchronized void registerUpdateCallback(String key, UpdateCallback callback)
    {
        this.callbacks.put(key, callback);
    }

    public synchronized void loadProperties(String propFilePath) throws IOException
    {
        try (InputStream in = new FileInputStream(propFilePath))
        {
            this.prop.load(in);
        }
        for (Map.Entry<String, UpdateCallback> entry : this.callbacks.entrySet())
        {
            String value = this.prop.getProperty(entry.getKey());
            if (value != null)
            {
                entry.getValue().update(value);
            }
        }
    }

    public synchronized void addProperty(String key, String value)
    {
        this.prop.setProperty(key, value);
        if (this.callbacks.containsKey(key))
        {
            this.callbacks.get(key).update(value);
        }
    }

    public synchronized String getProperty(String key)
    {
        return this.prop.getProperty(key);
    }

    /**
     * @param key the property key
     * @param defaultValue returned when the key is absent or blank
     * @return the trimmed property value, or defaultValue
     */
    public synchronized String getProperty(String key, String defaultValue)
    {
        String value = this.prop.getProperty(key);
        if (value == null || value.trim().isEmpty())
        {
            return defaultValue;
        }
        return value.trim();
    }
}
