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

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The options of {@link MetadataGenerator}. The constructor uses built-in defaults,
 * {@link #fromConfig()} reads them from infparquet.properties.
 */
public class MetadataGeneratorOption
{
    /**
     * The upper bound of the worker threads when parallelism is derived from the processors.
     */
    public static final int MAX_DEFAULT_PARALLELISM = 32;

    private boolean generateBaseMetadata = true;
    private boolean generateCustomMetadata = false;
    private int maxHighFreqStrings = 10;
    private int maxSpecialStrings = 20;
    private int maxHighFreqCategories = 20;
    private int parallelism = 0; // 0 means the number of available processors
    private String customMetadataConfigPath = null;

    public MetadataGeneratorOption() { }

    /**
     * @return the options configured by the metadata.* properties of {@link ConfigFactory}
     * @throws MetadataGenerationException with {@link ErrorCode#METADATA_GEN_INVALID_PARAMETER}
     * if a property is not a number or is out of range
     */
    public static MetadataGeneratorOption fromConfig()
    {
        ConfigFactory config = ConfigFactory.Instance();
        MetadataGeneratorOption option = new MetadataGeneratorOption();
        try
        {
            option.generateBaseMetadata(Boolean.parseBoolean(
                    config.getProperty("metadata.generate.base", "true")));
            option.generateCustomMetadata(Boolean.parseBoolean(
                    config.getProperty("metadata.generate.custom", "false")));
            option.maxHighFreqStrings(Integer.parseInt(
                    config.getProperty("metadata.max.high.freq.strings", "10")));
            option.maxSpecialStrings(Integer.parseInt(
                    config.getProperty("metadata.max.special.strings", "20")));
            option.maxHighFreqCategories(Integer.parseInt(
                    config.getProperty("metadata.max.high.freq.categories", "20")));
            option.parallelism(Integer.parseInt(
                    config.getProperty("metadata.generator.parallelism", "0")));
        }
        catch (IllegalArgumentException e)
        {
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_INVALID_PARAMETER,
                    "invalid metadata generator property: " + e.getMessage(), e);
        }
        option.customMetadataConfigPath(config.getProperty("metadata.custom.config.path", null));
        return option;
    }

    public MetadataGeneratorOption generateBaseMetadata(boolean generateBaseMetadata)
    {
        this.generateBaseMetadata = generateBaseMetadata;
        return this;
    }

    public boolean isGenerateBaseMetadata()
    {
        return generateBaseMetadata;
    }

    public MetadataGeneratorOption generateCustomMetadata(boolean generateCustomMetadata)
    {
        this.generateCustomMetadata = generateCustomMetadata;
        return this;
    }

    public boolean isGenerateCustomMetadata()
    {
        return generateCustomMetadata;
    }

    public MetadataGeneratorOption maxHighFreqStrings(int maxHighFreqStrings)
    {
        checkArgument(maxHighFreqStrings >= 0, "maxHighFreqStrings must be non-negative");
        this.maxHighFreqStrings = maxHighFreqStrings;
        return this;
    }

    public int getMaxHighFreqStrings()
    {
        return maxHighFreqStrings;
    }

    public MetadataGeneratorOption maxSpecialStrings(int maxSpecialStrings)
    {
        checkArgument(maxSpecialStrings >= 0, "maxSpecialStrings must be non-negative");
        this.maxSpecialStrings = maxSpecialStrings;
        return this;
    }

    public int getMaxSpecialStrings()
    {
        return maxSpecialStrings;
    }

    public MetadataGeneratorOption maxHighFreqCategories(int maxHighFreqCategories)
    {
        checkArgument(maxHighFreqCategories >= 0, "maxHighFreqCategories must be non-negative");
        this.maxHighFreqCategories = maxHighFreqCategories;
        return this;
    }

    public int getMaxHighFreqCategories()
    {
        return maxHighFreqCategories;
    }

    public MetadataGeneratorOption parallelism(int parallelism)
    {
        checkArgument(parallelism >= 0, "parallelism must be non-negative");
        this.parallelism = parallelism;
        return this;
    }

    public int getParallelism()
    {
        return parallelism;
    }

    /**
     * @return the configured parallelism, or the number of available processors capped at
     * {@link #MAX_DEFAULT_PARALLELISM} if it is 0
     */
    public int getEffectiveParallelism()
    {
        if (parallelism > 0)
        {
            return parallelism;
        }
        return Math.min(Runtime.getRuntime().availableProcessors(), MAX_DEFAULT_PARALLELISM);
    }

    public MetadataGeneratorOption customMetadataConfigPath(String customMetadataConfigPath)
    {
        this.customMetadataConfigPath = customMetadataConfigPath;
        return this;
    }

    public Optional<String> getCustomMetadataConfigPath()
    {
        return Optional.ofNullable(customMetadataConfigPath);
    }
}
