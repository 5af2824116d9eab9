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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A node of the metadata tree. A file node owns its row group nodes and its file-level
 * column nodes, a row group node owns the column nodes of its leaves.
 * Nodes are immutable once constructed.
 */
public abstract class MetadataNode
{
    private final int id;
    private final String name;

    protected MetadataNode(int id, String name)
    {
        checkArgument(id >= 0, "id must be non-negative");
        this.id = id;
        this.name = requireNonNull(name, "name is null");
    }

    /**
     * @return the id, unique among the siblings of the same type
     */
    public int getId()
    {
        return id;
    }

    public String getName()
    {
        return name;
    }

    public abstract NodeType getType();

    /**
     * @return the children in order, empty for a leaf
     */
    public abstract List<? extends MetadataNode> getChildren();
}
