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

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * The interval {@code [rangeStart, rangeEnd)} a chunk occupies on one dimension.
 * Values are in the dimension's internal representation. Two slices are the
 * same slice iff their ids match.
 */
public final class Slice
{
    private final long id;
    private final int dimensionId;
    private final long rangeStart;
    private final long rangeEnd;

    @JsonCreator
    public Slice(
            @JsonProperty("id") long id,
            @JsonProperty("dimensionId") int dimensionId,
            @JsonProperty("rangeStart") long rangeStart,
            @JsonProperty("rangeEnd") long rangeEnd)
    {
        checkArgument(rangeStart < rangeEnd, "slice %s is empty: [%s, %s)", id, rangeStart, rangeEnd);
        this.id = id;
        this.dimensionId = dimensionId;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    @JsonProperty
    public long getId()
    {
        return id;
    }

    @JsonProperty
    public int getDimensionId()
    {
        return dimensionId;
    }

    @JsonProperty
    public long getRangeStart()
    {
        return rangeStart;
    }

    @JsonProperty
    public long getRangeEnd()
    {
        return rangeEnd;
    }

    public boolean contains(long value)
    {
        return rangeStart <= value && value < rangeEnd;
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
        return id == ((Slice) o).id;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(id);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", id)
                .add("dimensionId", dimensionId)
                .add("rangeStart", rangeStart)
                .add("rangeEnd", rangeEnd)
                .toString();
    }
}
