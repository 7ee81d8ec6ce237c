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

import io.hetu.core.spi.hypertable.ComparisonStrategy;
import io.hetu.core.spi.hypertable.Dimension;
import io.hetu.core.spi.hypertable.HypertableException;
import io.hetu.core.spi.hypertable.PartitioningFunction;
import io.hetu.core.spi.hypertable.Slice;
import io.hetu.core.spi.hypertable.SliceResolver;

import java.util.List;

import static io.hetu.core.spi.hypertable.HypertableErrorCode.UNKNOWN_DIMENSION_TYPE;
import static java.util.Objects.requireNonNull;

/**
 * Constraint state accumulated for one dimension while the predicates of a
 * query are folded in. The hierarchy is closed: {@link RangeRestriction} for
 * range dimensions and {@link DiscreteRestriction} for discrete ones.
 */
public abstract class DimensionRestriction
{
    private final Dimension dimension;

    DimensionRestriction(Dimension dimension)
    {
        this.dimension = requireNonNull(dimension, "dimension is null");
    }

    public static DimensionRestriction create(Dimension dimension, PartitioningFunction partitioningFunction)
    {
        switch (dimension.getType()) {
            case RANGE:
                return new RangeRestriction(dimension);
            case DISCRETE:
                return new DiscreteRestriction(dimension, partitioningFunction);
            default:
                throw new HypertableException(UNKNOWN_DIMENSION_TYPE, "Unknown dimension type: " + dimension.getType());
        }
    }

    public Dimension getDimension()
    {
        return dimension;
    }

    /**
     * Folds a predicate {@code column strategy value} into the restriction.
     *
     * @return true if the predicate was incorporated
     */
    public abstract boolean fold(ComparisonStrategy strategy, PredicateValue value);

    /**
     * Returns the slices of the dimension that can hold matching rows. An empty
     * list means no row of the hypertable can match.
     */
    public abstract List<Slice> resolveSlices(SliceResolver sliceResolver);
}
