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
package io.hetu.core.hypertable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.hetu.core.spi.hypertable.ComparisonStrategy;
import io.hetu.core.spi.hypertable.Dimension;
import io.hetu.core.spi.hypertable.PartitioningFunction;
import io.hetu.core.spi.hypertable.Slice;
import io.hetu.core.spi.hypertable.SliceResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.MoreObjects.toStringHelper;
import static io.hetu.core.spi.hypertable.ComparisonStrategy.EQUAL;
import static java.util.Objects.requireNonNull;

/**
 * Set of partition keys a discrete dimension can match. Unset means
 * unconstrained, an empty set means nothing can match. Once set, the keys
 * only shrink.
 */
public final class DiscreteRestriction
        extends DimensionRestriction
{
    private final PartitioningFunction partitioningFunction;
    private Optional<Set<Integer>> matchedKeys = Optional.empty();

    DiscreteRestriction(Dimension dimension, PartitioningFunction partitioningFunction)
    {
        super(dimension);
        this.partitioningFunction = requireNonNull(partitioningFunction, "partitioningFunction is null");
    }

    public Optional<Set<Integer>> getMatchedKeys()
    {
        return matchedKeys;
    }

    @Override
    public boolean fold(ComparisonStrategy strategy, PredicateValue value)
    {
        if (strategy != EQUAL) {
            return false;
        }
        // x = ALL (empty array) holds for every row
        if (!value.isOr() && value.getValues().isEmpty()) {
            return false;
        }

        Set<Integer> keys = toPartitionKeys(value.getValues());

        // equal to two different keys at once
        if (!value.isOr() && keys.size() > 1) {
            matchedKeys = Optional.of(ImmutableSet.of());
            return true;
        }

        if (matchedKeys.isPresent()) {
            matchedKeys = Optional.of(ImmutableSet.copyOf(Sets.intersection(matchedKeys.get(), keys)));
        }
        else {
            matchedKeys = Optional.of(keys);
        }
        return true;
    }

    private Set<Integer> toPartitionKeys(List<Object> values)
    {
        ImmutableSet.Builder<Integer> keys = ImmutableSet.builder();
        for (Object value : values) {
            keys.add(partitioningFunction.apply(getDimension().getId(), value));
        }
        return keys.build();
    }

    @Override
    public List<Slice> resolveSlices(SliceResolver sliceResolver)
    {
        int dimensionId = getDimension().getId();
        if (!matchedKeys.isPresent()) {
            return sliceResolver.resolveRangeSlices(dimensionId, Optional.empty(), Optional.empty());
        }

        Map<Long, Slice> slices = new LinkedHashMap<>();
        for (int key : matchedKeys.get()) {
            for (Slice slice : sliceResolver.resolveEqualSlices(dimensionId, key)) {
                slices.putIfAbsent(slice.getId(), slice);
            }
        }
        return ImmutableList.copyOf(slices.values());
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("dimension", getDimension().getColumnName())
                .add("matchedKeys", matchedKeys.orElse(null))
                .omitNullValues()
                .toString();
    }
}
