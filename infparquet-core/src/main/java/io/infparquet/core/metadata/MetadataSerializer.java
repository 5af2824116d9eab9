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

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.serializer.SerializerFeature;
import io.infparquet.common.error.ErrorCode;
import io.infparquet.core.custom.CustomMetadataResult;
import io.infparquet.core.custom.ResultMatrix;
import io.infparquet.core.exception.MetadataGenerationException;
import io.infparquet.core.stats.BaseStats;
import io.infparquet.core.stats.CategoricalStats;
import io.infparquet.core.stats.NumericStats;
import io.infparquet.core.stats.StatsKind;
import io.infparquet.core.stats.StringStats;
import io.infparquet.core.stats.TimestampStats;
import io.infparquet.core.stats.TopKTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Converts a metadata tree to and from its JSON sidecar. Custom metadata matrices are
 * stored in their brace text form.
 */
public final class MetadataSerializer
{
    private static final Logger logger = LogManager.getLogger(MetadataSerializer.class);

    private MetadataSerializer()
    {
    }

    public static String toJson(FileNode file)
    {
        requireNonNull(file, "file is null");
        JSONObject root = new JSONObject(true);
        root.put("file_path", file.getFilePath());
        JSONArray items = new JSONArray();
        for (MetadataItem item : file.getItems())
        {
            JSONObject object = new JSONObject(true);
            object.put("name", item.getName());
            object.put("type", item.getType().name());
            object.put("value", item.getValue());
            items.add(object);
        }
        root.put("items", items);
        JSONArray rowGroups = new JSONArray();
        for (RowGroupNode rowGroup : file.getRowGroups())
        {
            JSONObject object = new JSONObject(true);
            object.put("id", rowGroup.getId());
            object.put("num_rows", rowGroup.getNumberOfRows());
            object.put("total_byte_size", rowGroup.getTotalByteSize());
            object.put("columns", writeColumns(rowGroup.getColumns()));
            JSONObject rollUp = new JSONObject(true);
            for (Map.Entry<StatsKind, BaseStats> entry : rowGroup.getRollUp().entrySet())
            {
                rollUp.put(entry.getKey().name(), writeStats(entry.getValue()));
            }
            object.put("roll_up", rollUp);
            rowGroups.add(object);
        }
        root.put("row_groups", rowGroups);
        root.put("columns", writeColumns(file.getColumns()));
        JSONArray custom = new JSONArray();
        for (CustomMetadataResult result : file.getCustomResults())
        {
            JSONObject object = new JSONObject(true);
            object.put("name", result.getName());
            object.put("sql_query", result.getPredicateSpec());
            object.put("results", result.getMatrix().toString());
            custom.add(object);
        }
        root.put("custom_metadata", custom);
        return JSON.toJSONString(root, SerializerFeature.PrettyFormat);
    }

    /**
     * @throws MetadataGenerationException if the JSON is not a valid metadata tree
     */
    public static FileNode fromJson(String json)
    {
        requireNonNull(json, "json is null");
        try
        {
            JSONObject root = JSON.parseObject(json);
            if (root == null)
            {
                throw new IllegalArgumentException("empty metadata");
            }
            List<MetadataItem> items = new ArrayList<>();
            for (JSONObject object : objects(root.getJSONArray("items")))
            {
                items.add(new MetadataItem(object.getString("name"),
                        MetadataItem.Type.valueOf(object.getString("type")), object.getDoubleValue("value")));
            }
            List<RowGroupNode> rowGroups = new ArrayList<>();
            for (JSONObject object : objects(root.getJSONArray("row_groups")))
            {
                Map<StatsKind, BaseStats> rollUp = new EnumMap<>(StatsKind.class);
                JSONObject rollUpObject = object.getJSONObject("roll_up");
                if (rollUpObject != null)
                {
                    for (String kind : rollUpObject.keySet())
                    {
                        rollUp.put(StatsKind.valueOf(kind), readStats(rollUpObject.getJSONObject(kind)));
                    }
                }
                rowGroups.add(new RowGroupNode(object.getIntValue("id"), object.getLongValue("num_rows"),
                        object.getLongValue("total_byte_size"), readColumns(object.getJSONArray("columns")), rollUp));
            }
            List<CustomMetadataResult> custom = new ArrayList<>();
            for (JSONObject object : objects(root.getJSONArray("custom_metadata")))
            {
                custom.add(new CustomMetadataResult(object.getString("name"), object.getString("sql_query"),
                        ResultMatrix.parse(object.getString("results"))));
            }
            return new FileNode(root.getString("file_path"), rowGroups,
                    readColumns(root.getJSONArray("columns")), items, custom);
        }
        catch (JSONException | ClassCastException | IllegalArgumentException | NullPointerException e)
        {
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_SERIALIZATION_ERROR,
                    "invalid metadata JSON", e);
        }
    }

    /**
     * Write the JSON of the tree to the file at the path, replacing its content.
     */
    public static void save(FileNode file, String path)
    {
        requireNonNull(path, "path is null");
        String json = toJson(file);
        try
        {
            Files.write(Paths.get(path), json.getBytes(StandardCharsets.UTF_8));
        }
        catch (IOException e)
        {
            logger.error("failed to save metadata to " + path, e);
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_SERIALIZATION_ERROR,
                    "failed to save metadata to " + path, e);
        }
    }

    public static FileNode load(String path)
    {
        requireNonNull(path, "path is null");
        String json;
        try
        {
            json = new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
        }
        catch (IOException e)
        {
            logger.error("failed to load metadata from " + path, e);
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_SERIALIZATION_ERROR,
                    "failed to load metadata from " + path, e);
        }
        return fromJson(json);
    }

    private static JSONArray writeColumns(List<ColumnNode> columns)
    {
        JSONArray array = new JSONArray();
        for (ColumnNode column : columns)
        {
            JSONObject object = new JSONObject(true);
            object.put("id", column.getId());
            object.put("name", column.getName());
            if (column.hasStats())
            {
                object.put("stats", writeStats(column.getStats()));
            }
            array.add(object);
        }
        return array;
    }

    private static List<ColumnNode> readColumns(JSONArray array)
    {
        List<ColumnNode> columns = new ArrayList<>();
        for (JSONObject object : objects(array))
        {
            JSONObject stats = object.getJSONObject("stats");
            columns.add(new ColumnNode(object.getIntValue("id"), object.getString("name"),
                    stats == null ? null : readStats(stats)));
        }
        return columns;
    }

    private static JSONObject writeStats(BaseStats stats)
    {
        JSONObject object = new JSONObject(true);
        object.put("kind", stats.getKind().name());
        object.put("has_data", stats.hasData());
        object.put("null_count", stats.getNullCount());
        switch (stats.getKind())
        {
            case TIMESTAMP:
            {
                TimestampStats timestamp = (TimestampStats) stats;
                object.put("min", timestamp.getMin());
                object.put("max", timestamp.getMax());
                object.put("count", timestamp.getCount());
                break;
            }
            case NUMERIC:
            {
                NumericStats numeric = (NumericStats) stats;
                object.put("min", numeric.getMin());
                object.put("max", numeric.getMax());
                object.put("mean", numeric.getMean());
                object.put("mode", numeric.getMode());
                object.put("mode_count", numeric.getModeCount());
                object.put("total_count", numeric.getTotalCount());
                break;
            }
            case STRING:
            {
                StringStats string = (StringStats) stats;
                object.put("min_length", string.getMinLength());
                object.put("max_length", string.getMaxLength());
                object.put("total_length", string.getTotalLength());
                object.put("total_count", string.getTotalCount());
                object.put("high_freq", writeTopK(string.getHighFreqCapacity(), string.getHighFreq()));
                object.put("special", writeTopK(string.getSpecialCapacity(), string.getSpecial()));
                break;
            }
            case CATEGORICAL:
            {
                CategoricalStats categorical = (CategoricalStats) stats;
                object.put("distinct_count_estimate", categorical.getDistinctCountEstimate());
                object.put("total_count", categorical.getTotalCount());
                object.put("top", writeTopK(categorical.getTopCapacity(), categorical.getTop()));
                break;
            }
        }
        return object;
    }

    private static BaseStats readStats(JSONObject object)
    {
        StatsKind kind = StatsKind.valueOf(object.getString("kind"));
        boolean hasData = object.getBooleanValue("has_data");
        long nullCount = object.getLongValue("null_count");
        switch (kind)
        {
            case TIMESTAMP:
                if (!hasData)
                {
                    return new TimestampStats();
                }
                return new TimestampStats(nullCount, object.getLongValue("min"),
                        object.getLongValue("max"), object.getLongValue("count"));
            case NUMERIC:
                if (!hasData)
                {
                    return new NumericStats();
                }
                return new NumericStats(nullCount, object.getDoubleValue("min"), object.getDoubleValue("max"),
                        object.getDoubleValue("mean"), object.getDoubleValue("mode"),
                        object.getLongValue("mode_count"), object.getLongValue("total_count"));
            case STRING:
            {
                TopKTracker<String> highFreq = readTopK(object.getJSONObject("high_freq"));
                TopKTracker<String> special = readTopK(object.getJSONObject("special"));
                if (!hasData)
                {
                    return new StringStats(highFreq.getCapacity(), special.getCapacity());
                }
                return new StringStats(nullCount, highFreq, special, object.getLongValue("min_length"),
                        object.getLongValue("max_length"), object.getLongValue("total_length"),
                        object.getLongValue("total_count"));
            }
            default:
            {
                TopKTracker<String> top = readTopK(object.getJSONObject("top"));
                if (!hasData)
                {
                    return new CategoricalStats(top.getCapacity());
                }
                return new CategoricalStats(nullCount, top, object.getLongValue("distinct_count_estimate"),
                        object.getLongValue("total_count"));
            }
        }
    }

    private static JSONObject writeTopK(int capacity, List<TopKTracker.Entry<String>> snapshot)
    {
        JSONObject object = new JSONObject(true);
        object.put("capacity", capacity);
        JSONArray entries = new JSONArray();
        for (TopKTracker.Entry<String> entry : snapshot)
        {
            JSONObject e = new JSONObject(true);
            e.put("value", entry.getKey());
            e.put("count", entry.getCount());
            entries.add(e);
        }
        object.put("entries", entries);
        return object;
    }

    private static TopKTracker<String> readTopK(JSONObject object)
    {
        TopKTracker<String> tracker = new TopKTracker<>(object.getIntValue("capacity"));
        // entries are stored in descending order, so observing them in turn rebuilds the same order
        for (JSONObject entry : objects(object.getJSONArray("entries")))
        {
            tracker.observe(entry.getString("value"), entry.getLongValue("count"));
        }
        return tracker;
    }

    private static List<JSONObject> objects(JSONArray array)
    {
        List<JSONObject> objects = new ArrayList<>();
        if (array != null)
        {
            for (int i = 0; i < array.size(); ++i)
            {
                objects.add(array.getJSONObject(i));
            }
        }
        return objects;
    }
}
