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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A user-defined boolean predicate evaluated on every column chunk of a file.
 * The query text selects the predicate implementation in {@link PredicateRegistry}.
 */
public class NamedPredicate
{
    public enum Target
    {
        FILE, ROW_GROUP, COLUMN;

        /**
         * @return the target named in lower case, FILE if the name is null or unknown
         */
        public static Target from(String name)
        {
            if (name != null)
            {
                for (Target target : values())
                {
                    if (target.name().equalsIgnoreCase(name))
                    {
                        return target;
                    }
                }
            }
            return FILE;
        }
    }

    public enum UpdateFrequency
    {
        READ, WRITE, MANUAL;

        /**
         * @return the frequency named in lower case, READ if the name is null or unknown
         */
        public static UpdateFrequency from(String name)
        {
            if (name != null)
            {
                for (UpdateFrequency frequency : values())
                {
                    if (frequency.name().equalsIgnoreCase(name))
                    {
                        return frequency;
                    }
                }
            }
            return READ;
        }
    }

    private final String name;
    private final String query;
    private final String description;
    private final Target target;
    private final boolean cacheResults;
    private final UpdateFrequency updateFrequency;

    private NamedPredicate(String name, String query, String description, Target target,
                           boolean cacheResults, UpdateFrequency updateFrequency)
    {
        this.name = name;
        this.query = query;
        this.description = description;
        this.target = target;
        this.cacheResults = cacheResults;
        this.updateFrequency = updateFrequency;
    }

    public static NamedPredicate of(String name, String query)
    {
        return newBuilder().setName(name).setQuery(query).build();
    }

    public String getName()
    {
        return name;
    }

    public String getQuery()
    {
        return query;
    }

    /**
     * @return the description, null if not given
     */
    public String getDescription()
    {
        return description;
    }

    public Target getTarget()
    {
        return target;
    }

    public boolean isCacheResults()
    {
        return cacheResults;
    }

    public UpdateFrequency getUpdateFrequency()
    {
        return updateFrequency;
    }

    @Override
    public String toString()
    {
        return "NamedPredicate{name='" + name + "', query='" + query + "', target=" + target + "}";
    }

    public static Builder newBuilder()
    {
        return new Builder();
    }

    public static class Builder
    {
        private String builderName = null;
        private String builderQuery = null;
        private String builderDescription = null;
        private Target builderTarget = Target.FILE;
        private boolean builderCacheResults = false;
        private UpdateFrequency builderUpdateFrequency = UpdateFrequency.READ;

        private Builder()
        {
        }

        public Builder setName(String name)
        {
            this.builderName = requireNonNull(name, "name is null");
            return this;
        }

        public Builder setQuery(String query)
        {
            this.builderQuery = requireNonNull(query, "query is null");
            return this;
        }

        public Builder setDescription(String description)
        {
            this.builderDescription = description;
            return this;
        }

        public Builder setTarget(Target target)
        {
            this.builderTarget = requireNonNull(target, "target is null");
            return this;
        }

        public Builder setCacheResults(boolean cacheResults)
        {
            this.builderCacheResults = cacheResults;
            return this;
        }

        public Builder setUpdateFrequency(UpdateFrequency updateFrequency)
        {
            this.builderUpdateFrequency = requireNonNull(updateFrequency, "updateFrequency is null");
            return this;
        }

        public NamedPredicate build()
        {
            checkArgument(builderName != null, "name is not set");
            checkArgument(builderQuery != null, "query is not set");
            return new NamedPredicate(builderName, builderQuery, builderDescription, builderTarget,
                    builderCacheResults, builderUpdateFrequency);
        }
    }
}
