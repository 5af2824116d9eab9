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

import io.infparquet.core.stats.NullHeuristics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Maps the query text of a predicate to its implementation. A query selects the first
 * registered predicate whose keyword it contains. Only has_null is registered by default.
 */
public class PredicateRegistry
{
    public static final String HAS_NULL = "has_null";

    private final Map<String, CellPredicate> predicates = new LinkedHashMap<>();

    public PredicateRegistry()
    {
        register(HAS_NULL, NullHeuristics::hasNull);
    }

    public void register(String keyword, CellPredicate predicate)
    {
        requireNonNull(keyword, "keyword is null");
        requireNonNull(predicate, "predicate is null");
        this.predicates.put(keyword, predicate);
    }

    /**
     * @param query the query text of a named predicate
     * @return the predicate of the first keyword contained in the query, empty if none
     */
    public Optional<CellPredicate> lookup(String query)
    {
        if (query == null)
        {
            return Optional.empty();
        }
        for (Map.Entry<String, CellPredicate> entry : predicates.entrySet())
        {
            if (query.contains(entry.getKey()))
            {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }
}
