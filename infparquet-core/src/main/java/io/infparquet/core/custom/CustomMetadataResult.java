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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The evaluated matrix of one named predicate.
 */
public class CustomMetadataResult
{
    private final String name;
    private final String predicateSpec;
    private final ResultMatrix matrix;

    public CustomMetadataResult(String name, String predicateSpec, ResultMatrix matrix)
    {
        this.name = requireNonNull(name, "name is null");
        this.predicateSpec = requireNonNull(predicateSpec, "predicateSpec is null");
        this.matrix = requireNonNull(matrix, "matrix is null");
    }

    public String getName()
    {
        return name;
    }

    /**
     * @return the query text of the predicate
     */
    public String getPredicateSpec()
    {
        return predicateSpec;
    }

    public ResultMatrix getMatrix()
    {
        return matrix;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof CustomMetadataResult))
        {
            return false;
        }
        CustomMetadataResult that = (CustomMetadataResult) o;
        return name.equals(that.name) && predicateSpec.equals(that.predicateSpec) &&
                matrix.equals(that.matrix);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, predicateSpec, matrix);
    }

    @Override
    public String toString()
    {
        return name + "=" + matrix;
    }
}
