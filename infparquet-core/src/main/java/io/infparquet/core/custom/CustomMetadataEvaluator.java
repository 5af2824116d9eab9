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
import io.infparquet.common.exception.InvalidArgumentException;
import io.infparquet.core.exception.ColumnSourceException;
import io.infparquet.core.exception.MetadataGenerationException;
import io.infparquet.core.reader.ColumnChunk;
import io.infparquet.core.reader.ColumnDataSource;
import io.infparquet.core.reader.RowGroupInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates named predicates on every column chunk of a file, producing one
 * {@link ResultMatrix} per predicate. A predicate whose query matches no registered
 * implementation is false on every cell.
 */
public class CustomMetadataEvaluator
{
    private static final Logger logger = LogManager.getLogger(CustomMetadataEvaluator.class);

    public static final int MAX_CUSTOM_METADATA_ITEMS = 20;

    private final PredicateRegistry registry;

    public CustomMetadataEvaluator()
    {
        this(new PredicateRegistry());
    }

    public CustomMetadataEvaluator(PredicateRegistry registry)
    {
        this.registry = requireNonNull(registry, "registry is null");
    }

    /**
     * Look up the implementations of the predicates, in the same order.
     * A warning is logged for each predicate without implementation.
     *
     * @throws InvalidArgumentException if there are more than {@link #MAX_CUSTOM_METADATA_ITEMS} predicates
     */
    public List<Optional<CellPredicate>> resolve(List<NamedPredicate> predicates)
    {
        requireNonNull(predicates, "predicates is null");
        if (predicates.size() > MAX_CUSTOM_METADATA_ITEMS)
        {
            throw new InvalidArgumentException("at most " + MAX_CUSTOM_METADATA_ITEMS +
                    " custom metadata items are supported, got " + predicates.size());
        }
        List<Optional<CellPredicate>> resolved = new ArrayList<>(predicates.size());
        for (NamedPredicate predicate : predicates)
        {
            Optional<CellPredicate> cellPredicate = registry.lookup(predicate.getQuery());
            if (!cellPredicate.isPresent())
            {
                logger.warn("unsupported query '" + predicate.getQuery() + "' of custom metadata '" +
                        predicate.getName() + "', it evaluates to false on every column");
            }
            resolved.add(cellPredicate);
        }
        return resolved;
    }

    /**
     * @return the result of each resolved predicate on the chunk
     */
    public static boolean[] test(List<Optional<CellPredicate>> resolved, ColumnChunk chunk)
    {
        boolean[] results = new boolean[resolved.size()];
        for (int i = 0; i < results.length; ++i)
        {
            Optional<CellPredicate> predicate = resolved.get(i);
            results[i] = predicate.isPresent() && predicate.get().test(chunk);
        }
        return results;
    }

    /**
     * Build the results from the cells of every row group.
     *
     * @param predicates the predicates
     * @param cells cells.get(rg)[p][col] is the result of predicate p on column col of row group rg
     */
    public static List<CustomMetadataResult> assemble(List<NamedPredicate> predicates, List<boolean[][]> cells)
    {
        List<CustomMetadataResult> results = new ArrayList<>(predicates.size());
        for (int p = 0; p < predicates.size(); ++p)
        {
            List<boolean[]> rows = new ArrayList<>(cells.size());
            for (boolean[][] rowGroupCells : cells)
            {
                rows.add(rowGroupCells[p]);
            }
            NamedPredicate predicate = predicates.get(p);
            results.add(new CustomMetadataResult(predicate.getName(), predicate.getQuery(), new ResultMatrix(rows)));
        }
        return results;
    }

    /**
     * Evaluate the predicates on every column chunk of the source. Each chunk is read once.
     *
     * @param predicates the predicates, at most {@link #MAX_CUSTOM_METADATA_ITEMS}
     * @param source the column data source
     * @return one result per predicate, in the same order
     * @throws MetadataGenerationException if a column chunk can not be read
     */
    public List<CustomMetadataResult> evaluate(List<NamedPredicate> predicates, ColumnDataSource source)
    {
        requireNonNull(source, "source is null");
        List<Optional<CellPredicate>> resolved = resolve(predicates);
        List<boolean[][]> cells = new ArrayList<>(source.getRowGroupCount());
        for (int rg = 0; rg < source.getRowGroupCount(); ++rg)
        {
            cells.add(evaluateRowGroup(resolved, source, rg));
        }
        return assemble(predicates, cells);
    }

    /**
     * @return the cells of the row group indexed by predicate then column
     */
    public boolean[][] evaluateRowGroup(List<Optional<CellPredicate>> resolved, ColumnDataSource source, int rowGroupId)
    {
        RowGroupInfo info = source.getRowGroupInfo(rowGroupId);
        boolean[][] cells = new boolean[resolved.size()][info.getColumnCount()];
        for (int col = 0; col < info.getColumnCount(); ++col)
        {
            ColumnChunk chunk;
            try
            {
                chunk = source.readColumn(rowGroupId, col);
            }
            catch (ColumnSourceException e)
            {
                logger.error("failed to read column " + col + " of row group " + rowGroupId, e);
                throw new MetadataGenerationException(ErrorCode.METADATA_GEN_SOURCE_ERROR,
                        "failed to read column " + col + " of row group " + rowGroupId, e);
            }
            boolean[] results = test(resolved, chunk);
            for (int p = 0; p < results.length; ++p)
            {
                cells[p][col] = results[p];
            }
        }
        return cells;
    }
}
