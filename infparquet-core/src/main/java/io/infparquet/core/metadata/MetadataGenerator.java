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

import com.google.common.collect.ImmutableList;
import io.infparquet.common.error.ErrorCode;
import io.infparquet.common.exception.InvalidArgumentException;
import io.infparquet.core.custom.CellPredicate;
import io.infparquet.core.custom.CustomMetadataConfig;
import io.infparquet.core.custom.CustomMetadataEvaluator;
import io.infparquet.core.custom.CustomMetadataResult;
import io.infparquet.core.custom.NamedPredicate;
import io.infparquet.core.exception.ColumnSourceException;
import io.infparquet.core.exception.MetadataGenerationException;
import io.infparquet.core.reader.ColumnChunk;
import io.infparquet.core.reader.ColumnDataSource;
import io.infparquet.core.reader.RowGroupInfo;
import io.infparquet.core.stats.BaseStats;
import io.infparquet.core.stats.ColumnStatsExtractor;
import io.infparquet.core.stats.StatsKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Builds the metadata tree of a file.
 * <p>
 * Each row group is processed by one task on a fixed thread pool: its column chunks are
 * read once, their statistics are extracted and rolled up, and the custom predicates are
 * evaluated on them. The calling thread collects the results in row group order, rolls the
 * column statistics across the row groups, and builds the tree. If a task fails, the
 * remaining tasks are cancelled and no tree is returned.
 */
public class MetadataGenerator
{
    private static final Logger logger = LogManager.getLogger(MetadataGenerator.class);

    public static final int SCHEMA_VERSION = 1;

    /**
     * Notified in the calling thread each time a row group has been processed.
     */
    public interface ProgressListener
    {
        void onProgress(int completedRowGroups, int totalRowGroups);
    }

    private final MetadataGeneratorOption option;
    private final ColumnStatsExtractor extractor;
    private final CustomMetadataEvaluator evaluator;
    private ProgressListener progressListener = null;

    public MetadataGenerator()
    {
        this(new MetadataGeneratorOption());
    }

    public MetadataGenerator(MetadataGeneratorOption option)
    {
        this(option, new CustomMetadataEvaluator());
    }

    public MetadataGenerator(MetadataGeneratorOption option, CustomMetadataEvaluator evaluator)
    {
        this.option = requireNonNull(option, "option is null");
        this.evaluator = requireNonNull(evaluator, "evaluator is null");
        this.extractor = new ColumnStatsExtractor(option.getMaxHighFreqStrings(),
                option.getMaxSpecialStrings(), option.getMaxHighFreqCategories());
    }

    public MetadataGenerator setProgressListener(ProgressListener progressListener)
    {
        this.progressListener = progressListener;
        return this;
    }

    public MetadataGeneratorOption getOption()
    {
        return option;
    }

    /**
     * Generate the metadata tree with the predicates of the custom metadata configuration
     * file in the options, if custom metadata is enabled and the file is set.
     *
     * @param source the column data source of the file
     * @return the metadata tree
     * @throws MetadataGenerationException if the configuration is invalid or the generation fails
     */
    public FileNode generate(ColumnDataSource source)
    {
        List<NamedPredicate> predicates = ImmutableList.of();
        if (option.isGenerateCustomMetadata() && option.getCustomMetadataConfigPath().isPresent())
        {
            predicates = CustomMetadataConfig.load(option.getCustomMetadataConfigPath().get());
        }
        return generate(source, predicates);
    }

    /**
     * Generate the metadata tree of the file.
     *
     * @param source the column data source of the file
     * @param predicates the custom predicates, only evaluated if custom metadata is enabled
     * @return the metadata tree
     * @throws MetadataGenerationException if a column can not be read, memory is exhausted,
     * or the calling thread is interrupted
     */
    public FileNode generate(ColumnDataSource source, List<NamedPredicate> predicates)
    {
        if (source == null || predicates == null)
        {
            throw new InvalidArgumentException("source or predicates is null");
        }
        List<NamedPredicate> evaluated = option.isGenerateCustomMetadata() ? predicates : ImmutableList.of();
        List<Optional<CellPredicate>> resolved = evaluator.resolve(evaluated);
        int rowGroupCount = source.getRowGroupCount();
        long start = System.currentTimeMillis();
        logger.info("start generating metadata of " + source.getFilePath() + " with " + rowGroupCount +
                " row groups and " + evaluated.size() + " custom predicates");

        List<RowGroupResult> results = runTasks(source, resolved, rowGroupCount);

        ImmutableList.Builder<RowGroupNode> rowGroups = ImmutableList.builder();
        List<boolean[][]> cells = new ArrayList<>(rowGroupCount);
        long rowCount = 0L;
        Set<String> columnNames = new HashSet<>();
        for (RowGroupResult result : results)
        {
            rowGroups.add(result.getNode());
            cells.add(result.getCells());
            rowCount += result.getNode().getNumberOfRows();
            for (ColumnNode column : result.getNode().getColumns())
            {
                columnNames.add(column.getName());
            }
        }
        List<RowGroupNode> rowGroupNodes = rowGroups.build();
        List<ColumnNode> columns = StatsReducer.rollAcross(rowGroupNodes);

        ImmutableList.Builder<MetadataItem> items = ImmutableList.builder();
        items.add(MetadataItem.numeric(MetadataItem.ROW_COUNT, rowCount));
        items.add(MetadataItem.numeric(MetadataItem.FILE_SIZE, source.getFileSize()));
        items.add(MetadataItem.numeric(MetadataItem.ROW_GROUP_COUNT, rowGroupCount));
        items.add(MetadataItem.numeric(MetadataItem.COLUMN_COUNT, columnNames.size()));
        if (rowGroupCount > 0)
        {
            items.add(MetadataItem.numeric(MetadataItem.AVG_ROWS_PER_ROW_GROUP, (double) rowCount / rowGroupCount));
        }
        items.add(MetadataItem.timestamp(MetadataItem.CREATION_TIME, System.currentTimeMillis() / 1000));
        items.add(MetadataItem.numeric(MetadataItem.SCHEMA_VERSION, SCHEMA_VERSION));

        List<CustomMetadataResult> customResults = CustomMetadataEvaluator.assemble(evaluated, cells);
        logger.info("finished generating metadata of " + source.getFilePath() + " in " +
                (System.currentTimeMillis() - start) + " ms");
        return new FileNode(source.getFilePath(), rowGroupNodes, columns, items.build(), customResults);
    }

    /**
     * Generate the subtree of one row group, without custom metadata.
     *
     * @param source the column data source of the file
     * @param rowGroupId the index of the row group
     * @return the row group node with its column nodes and roll-up
     * @throws InvalidArgumentException if the row group does not exist
     * @throws MetadataGenerationException if a column can not be read
     */
    public RowGroupNode generateRowGroup(ColumnDataSource source, int rowGroupId)
    {
        if (source == null)
        {
            throw new InvalidArgumentException("source is null");
        }
        if (rowGroupId < 0 || rowGroupId >= source.getRowGroupCount())
        {
            throw new InvalidArgumentException("invalid row group id " + rowGroupId +
                    ", the file has " + source.getRowGroupCount() + " row groups");
        }
        try
        {
            return processRowGroup(source, rowGroupId, ImmutableList.of(), new AtomicBoolean(false)).getNode();
        }
        catch (ColumnSourceException e)
        {
            logger.error("failed to read row group " + rowGroupId + " of " + source.getFilePath(), e);
            throw new MetadataGenerationException(ErrorCode.METADATA_GEN_SOURCE_ERROR,
                    "failed to read row group " + rowGroupId + " of " + source.getFilePath(), e);
        }
    }

    private List<RowGroupResult> runTasks(ColumnDataSource source, List<Optional<CellPredicate>> resolved,
                                          int rowGroupCount)
    {
        List<RowGroupResult> results = new ArrayList<>(rowGroupCount);
        if (rowGroupCount == 0)
        {
            return results;
        }
        int parallelism = Math.min(option.getEffectiveParallelism(), rowGroupCount);
        ExecutorService service = Executors.newFixedThreadPool(parallelism);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<CompletableFuture<RowGroupResult>> futures = new ArrayList<>(rowGroupCount);
        try
        {
            for (int i = 0; i < rowGroupCount; ++i)
            {
                int rowGroupId = i;
                CompletableFuture<RowGroupResult> future = new CompletableFuture<>();
                service.execute(() ->
                {
                    try
                    {
                        future.complete(processRowGroup(source, rowGroupId, resolved, cancelled));
                    }
                    catch (Throwable e)
                    {
                        future.completeExceptionally(e);
                    }
                });
                futures.add(future);
            }
            for (int i = 0; i < rowGroupCount; ++i)
            {
                try
                {
                    results.add(futures.get(i).get());
                }
                catch (ExecutionException e)
                {
                    cancelled.set(true);
                    for (CompletableFuture<RowGroupResult> future : futures)
                    {
                        future.cancel(true);
                    }
                    throw toGenerationException(source, i, e.getCause());
                }
                catch (InterruptedException e)
                {
                    cancelled.set(true);
                    Thread.currentThread().interrupt();
                    throw new MetadataGenerationException(ErrorCode.METADATA_GEN_INTERRUPTED,
                            "interrupted while generating metadata of " + source.getFilePath(), e);
                }
                if (progressListener != null)
                {
                    progressListener.onProgress(i + 1, rowGroupCount);
                }
            }
        }
        finally
        {
            service.shutdownNow();
        }
        return results;
    }

    private static MetadataGenerationException toGenerationException(ColumnDataSource source, int rowGroupId,
                                                                     Throwable cause)
    {
        String message = "failed to generate metadata of row group " + rowGroupId + " of " + source.getFilePath();
        logger.error(message, cause);
        if (cause instanceof MetadataGenerationException)
        {
            return (MetadataGenerationException) cause;
        }
        if (cause instanceof OutOfMemoryError)
        {
            return new MetadataGenerationException(ErrorCode.METADATA_GEN_MEMORY_ERROR, message, cause);
        }
        return new MetadataGenerationException(ErrorCode.METADATA_GEN_SOURCE_ERROR, message, cause);
    }

    private RowGroupResult processRowGroup(ColumnDataSource source, int rowGroupId,
                                           List<Optional<CellPredicate>> resolved, AtomicBoolean cancelled)
            throws ColumnSourceException
    {
        RowGroupInfo info = source.getRowGroupInfo(rowGroupId);
        int columnCount = info.getColumnCount();
        List<ColumnNode> columns = new ArrayList<>(columnCount);
        boolean[][] cells = new boolean[resolved.size()][columnCount];
        for (int col = 0; col < columnCount; ++col)
        {
            if (cancelled.get() || Thread.currentThread().isInterrupted())
            {
                throw new MetadataGenerationException(ErrorCode.METADATA_GEN_INTERRUPTED,
                        "generation of row group " + rowGroupId + " is cancelled");
            }
            ColumnChunk chunk = source.readColumn(rowGroupId, col);
            BaseStats stats = option.isGenerateBaseMetadata() ? extractor.extract(chunk) : null;
            columns.add(new ColumnNode(col, info.getColumnName(col), stats));
            boolean[] results = CustomMetadataEvaluator.test(resolved, chunk);
            for (int p = 0; p < results.length; ++p)
            {
                cells[p][col] = results[p];
            }
        }
        Map<StatsKind, BaseStats> rollUp = StatsReducer.rollUp(columns);
        logger.debug("generated metadata of row group " + rowGroupId + " with " + columnCount + " columns");
        return new RowGroupResult(new RowGroupNode(rowGroupId, info.getNumberOfRows(), info.getTotalByteSize(),
                columns, rollUp), cells);
    }

    /**
     * The output of the task of one row group.
     */
    private static class RowGroupResult
    {
        private final RowGroupNode node;
        private final boolean[][] cells;

        private RowGroupResult(RowGroupNode node, boolean[][] cells)
        {
            this.node = node;
            this.cells = cells;
        }

        public RowGroupNode getNode()
        {
            return node;
        }

        /**
         * @return the predicate results indexed by predicate then column
         */
        public boolean[][] getCells()
        {
            return cells;
        }
    }
}
