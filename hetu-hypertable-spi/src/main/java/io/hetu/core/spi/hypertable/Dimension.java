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
import io.hetu.core.spi.hypertable.type.ScalarType;

import java.util.Objects;
import java.util.OptionalInt;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.hetu.core.spi.hypertable.DimensionType.DISCRETE;
import static io.hetu.core.spi.hypertable.DimensionType.RANGE;
import static java.util.Objects.requireNonNull;

public final class Dimension
{
    private final int id;
    private final String columnName;
    private final ScalarType columnType;
    private final DimensionType type;
    private final OptionalInt numberOfPartitions;

    @JsonCreator
    public Dimension(
            @JsonProperty("id") int id,
            @JsonProperty("columnName") String columnName,
            @JsonProperty("columnType") ScalarType columnType,
            @JsonProperty("type") DimensionType type,
            @JsonProperty("numberOfPartitions") OptionalInt numberOfPartitions)
    {
        this.id = id;
        this.columnName = requireNonNull(columnName, "columnName is null");
        this.columnType = requireNonNull(columnType, "columnType is null");
        this.type = requireNonNull(type, "type is null");
        this.numberOfPartitions = requireNonNull(numberOfPartitions, "numberOfPartitions is null");
        if (type == RANGE) {
            checkArgument(columnType.isTimeLike(), "range dimension column %s must be an integer or time type, got %s", columnName, columnType);
            checkArgument(!numberOfPartitions.isPresent(), "range dimension %s cannot have partitions", columnName);
        }
        if (type == DISCRETE) {
            checkArgument(numberOfPartitions.isPresent() && numberOfPartitions.getAsInt() > 0, "discrete dimension %s needs a positive number of partitions", columnName);
        }
    }

    public static Dimension rangeDimension(int id, String columnName, ScalarType columnType)
    {
        return new Dimension(id, columnName, columnType, RANGE, OptionalInt.empty());
    }

    public static Dimension discreteDimension(int id, String columnName, ScalarType columnType, int numberOfPartitions)
    {
        return new Dimension(id, columnName, columnType, DISCRETE, OptionalInt.of(numberOfPartitions));
    }

    @JsonProperty
    public int getId()
    {
        return id;
    }

    @JsonProperty
    public String getColumnName()
    {
        return columnName;
    }

    @JsonProperty
    public ScalarType getColumnType()
    {
        return columnType;
    }

    @JsonProperty
    public DimensionType getType()
    {
        return type;
    }

    @JsonProperty
    public OptionalInt getNumberOfPartitions()
    {
        return numberOfPartitions;
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
        Dimension that = (Dimension) o;
        return id == that.id &&
                Objects.equals(columnName, that.columnName) &&
                columnType == that.columnType &&
                type == that.type &&
                Objects.equals(numberOfPartitions, that.numberOfPartitions);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(id, columnName, columnType, type, numberOfPartitions);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", id)
                .add("columnName", columnName)
                .add("columnType", columnType)
                .add("type", type)
                .add("numberOfPartitions", numberOfPartitions)
                .toString();
    }
}
