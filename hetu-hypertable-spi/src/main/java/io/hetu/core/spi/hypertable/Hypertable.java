/*
 * Copyright (C) 2018-2021. Huawei Technologies Co., Ltd. All rights reserved.
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.hetu.core.spi.hypertable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A logical table partitioned into chunks along one or more dimensions
 */
public final class Hypertable
{
    private final int id;
    private final String name;
    private final List<Dimension> dimensions;

    @JsonCreator
    public Hypertable(
            @JsonProperty("id") int id,
            @JsonProperty("name") String name,
            @JsonProperty("dimensions") List<Dimension> dimensions)
    {
        this.id = id;
        this.name = requireNonNull(name, "name is null");
        this.dimensions = ImmutableList.copyOf(requireNonNull(dimensions, "dimensions is null"));
        checkArgument(!this.dimensions.isEmpty(), "hypertable %s has no dimensions", name);

        Set<Integer> ids = new HashSet<>();
        Set<String> columns = new HashSet<>();
        for (Dimension dimension : this.dimensions) {
            checkArgument(ids.add(dimension.getId()), "duplicate dimension id %s in hypertable %s", dimension.getId(), name);
            checkArgument(columns.add(dimension.getColumnName()), "column %s partitions hypertable %s twice", dimension.getColumnName(), name);
        }
    }

    @JsonProperty
    public int getId()
    {
        return id;
    }

    @JsonProperty
    public String getName()
    {
        return name;
    }

    @JsonProperty
    public List<Dimension> getDimensions()
    {
        return dimensions;
    }

    public int getNumberOfDimensions()
    {
        return dimensions.size();
    }

    public Optional<Dimension> getDimensionByColumn(String columnName)
    {
        return dimensions.stream()
                .filter(dimension -> dimension.getColumnName().equals(columnName))
                .findFirst();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Hypertable that = (Hypertable) o;
        return id == that.id &&
                Objects.equals(name, that.name) &&
                Objects.equals(dimensions, that.dimensions);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(id, name, dimensions);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("dimensions", dimensions)
                .toString();
    }
}
