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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.hetu.core.spi.hypertable.ChunkEnumerator;
import io.hetu.core.spi.hypertable.ChunkId;
import io.hetu.core.spi.hypertable.Dimension;
import io.hetu.core.spi.hypertable.Hypertable;
import io.hetu.core.spi.hypertable.HypertableException;
import io.hetu.core.spi.hypertable.PartitioningFunction;
import io.hetu.core.spi.hypertable.Slice;
import io.hetu.core.spi.hypertable.SliceResolver;
import io.hetu.core.spi.hypertable.relation.RowExpression;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.hetu.core.spi.hypertable.HypertableErrorCode.DIMENSION_COUNT_MISMATCH;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Restrictions on every dimension of one hypertable, built while planning a
 * single query. Not thread safe.
 */
public class RestrictionSet
{
    private static final Logger log = Logger.get(RestrictionSet.class);

    private final Hypertable hypertable;
    private final List<DimensionRestriction> restrictions;
    private final int maxInListSize;
    private int acceptedCount;

    @VisibleForTesting
    RestrictionSet(Hypertable hypertable, List<DimensionRestriction> restrictions, int maxInListSize)
    {
        this.hypertable = requireNonNull(hypertable, "hypertable is null");
        this.restrictions = ImmutableList.copyOf(requireNonNull(restrictions, "restrictions is null"));
        checkArgument(maxInListSize > 0, "maxInListSize must be positive");
        this.maxInListSize = maxInListSize;
    }

    public static RestrictionSet build(Hypertable hypertable, PartitioningFunction partitioningFunction, int maxInListSize)
    {
        requireNonNull(hypertable, "hypertable is null");
        requireNonNull(partitioningFunction, "partitioningFunction is null");
        ImmutableList.Builder<DimensionRestriction> restrictions = ImmutableList.builder();
        for (Dimension dimension : hypertable.getDimensions()) {
            restrictions.add(DimensionRestriction.create(dimension, partitioningFunction));
        }
        return new RestrictionSet(hypertable, restrictions.build(), maxInListSize);
    }

    public Hypertable getHypertable()
    {
        return hypertable;
    }

    public List<DimensionRestriction> getRestrictions()
    {
        return restrictions;
    }

    public int getAcceptedCount()
    {
        return acceptedCount;
    }

    public boolean hasRestrictions()
    {
        return acceptedCount > 0;
    }

    /**
     * Folds every usable predicate into the restriction of the dimension it
     * constrains. Predicates that cannot be used are skipped.
     */
    public void addPredicates(List<RowExpression> predicates, PlanningContext context)
    {
        requireNonNull(predicates, "predicates is null");
        PredicateClassifier classifier = new PredicateClassifier(restrictions, context, maxInListSize);
        for (RowExpression predicate : predicates) {
            if (classifier.accept(predicate)) {
                acceptedCount++;
            }
        }
    }

    /**
     * Resolves the restrictions against the stored slices and returns the
     * chunks that can hold matching rows.
     */
    public List<ChunkId> getMatchingChunks(SliceResolver sliceResolver, ChunkEnumerator chunkEnumerator)
    {
        return getMatchingChunks(hypertable, sliceResolver, chunkEnumerator);
    }

    public List<ChunkId> getMatchingChunks(Hypertable hypertable, SliceResolver sliceResolver, ChunkEnumerator chunkEnumerator)
    {
        requireNonNull(hypertable, "hypertable is null");
        requireNonNull(sliceResolver, "sliceResolver is null");
        requireNonNull(chunkEnumerator, "chunkEnumerator is null");
        if (restrictions.size() != hypertable.getNumberOfDimensions()) {
            throw new HypertableException(DIMENSION_COUNT_MISMATCH,
                    format("Hypertable %s has %s dimensions but %s restrictions", hypertable.getName(), hypertable.getNumberOfDimensions(), restrictions.size()));
        }

        ImmutableList.Builder<List<Slice>> slicesPerDimension = ImmutableList.builder();
        for (DimensionRestriction restriction : restrictions) {
            List<Slice> slices = restriction.resolveSlices(sliceResolver);
            if (slices.isEmpty()) {
                log.debug("Hypertable %s: no slice of %s matches, all chunks pruned", hypertable.getName(), restriction);
                return ImmutableList.of();
            }
            slicesPerDimension.add(slices);
        }

        List<ChunkId> chunks = chunkEnumerator.enumerateChunks(hypertable, slicesPerDimension.build());
        log.debug("Hypertable %s: %s chunks match %s", hypertable.getName(), chunks.size(), restrictions);
        return chunks;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("hypertable", hypertable.getName())
                .add("restrictions", restrictions)
                .add("acceptedCount", acceptedCount)
                .toString();
    }
}
