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

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.google.common.collect.ImmutableList;
import io.infparquet.common.error.ErrorCode;
import io.infparquet.core.exception.MetadataGenerationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Loads named predicates from a JSON configuration such as:
 * <pre>
 * {"custom_metadata": [
 *   {"name": "null_check", "sql_query": "SELECT has_null(*)", "description": "columns with nulls",
 *    "target": "column", "options": {"cache_results": true, "update_frequency": "write"}}
 * ]}
 * </pre>
 * Only sql_query is required. A missing name is replaced by Custom_&lt;index&gt;.
 */
public class CustomMetadataConfig
{
    private static final Logger logger = LogManager.getLogger(CustomMetadataConfig.class);

    private CustomMetadataConfig()
    {
    }

    /**
     * @param path the path of the configuration file
     * @return the predicates in the file
     * @throws MetadataGenerationException if the file can not be read or is invalid
     */
    public static List<NamedPredicate> load(String path)
    {
        requireNonNull(path, "path is null");
        String json;
        try
        {
            json = new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
        }
        catch (IOException e)
        {
            logger.error("failed to read custom metadata configuration " + path, e);
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR,
                    "failed to read custom metadata configuration " + path, e);
        }
        return parse(json);
    }

    /**
     * @param json the content of the configuration
     * @return the predicates, at most {@link CustomMetadataEvaluator#MAX_CUSTOM_METADATA_ITEMS}
     * @throws MetadataGenerationException if the configuration is invalid
     */
    public static List<NamedPredicate> parse(String json)
    {
        requireNonNull(json, "json is null");
        JSONArray items;
        try
        {
            JSONObject root = JSON.parseObject(json);
            items = root == null ? null : root.getJSONArray("custom_metadata");
        }
        catch (JSONException | ClassCastException e)
        {
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR,
                    "invalid custom metadata configuration", e);
        }
        if (items == null)
        {
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR,
                    "custom_metadata array is not found in the configuration");
        }
        int count = items.size();
        if (count > CustomMetadataEvaluator.MAX_CUSTOM_METADATA_ITEMS)
        {
            logger.warn("only the first " + CustomMetadataEvaluator.MAX_CUSTOM_METADATA_ITEMS +
                    " of " + count + " custom metadata items are loaded");
            count = CustomMetadataEvaluator.MAX_CUSTOM_METADATA_ITEMS;
        }
        ImmutableList.Builder<NamedPredicate> builder = ImmutableList.builder();
        for (int i = 0; i < count; ++i)
        {
            try
            {
                JSONObject item = items.getJSONObject(i);
                if (item == null)
                {
                    throw new MetadataGenerationException(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR,
                            "custom metadata item " + i + " is null");
                }
                builder.add(parseItem(item, i));
            }
            catch (JSONException | ClassCastException e)
            {
                throw new MetadataGenerationException(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR,
                        "custom metadata item " + i + " is malformed", e);
            }
        }
        return builder.build();
    }

    private static NamedPredicate parseItem(JSONObject item, int index)
    {
        String name = item.getString("name");
        if (name == null)
        {
            name = "Custom_" + index;
        }
        String query = item.getString("sql_query");
        if (query == null)
        {
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_CUSTOM_METADATA_ERROR,
                    "missing sql_query for custom metadata item " + name);
        }
        NamedPredicate.Builder builder = NamedPredicate.newBuilder()
                .setName(name)
                .setQuery(query)
                .setDescription(item.getString("description"))
                .setTarget(NamedPredicate.Target.from(item.getString("target")));
        JSONObject options = item.getJSONObject("options");
        if (options != null)
        {
            builder.setCacheResults(options.getBooleanValue("cache_results"))
                    .setUpdateFrequency(NamedPredicate.UpdateFrequency.from(options.getString("update_frequency")));
        }
        return builder.build();
    }
}
