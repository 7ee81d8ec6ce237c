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

import io.airlift.log.Logger;
import io.hetu.core.spi.hypertable.ChunkEnumerator;
import io.hetu.core.spi.hypertable.ChunkId;
import io.hetu.core.spi.hypertable.Hypertable;
import io.hetu.core.spi.hypertable.PartitioningFunction;
import io.hetu.core.spi.hypertable.SliceResolver;
import io.hetu.core.spi.hypertable.relation.RowExpression;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for the planner. A new {@link RestrictionSet} is built for every
 * hypertable reference of a query, fed the conjuncts of its filter, and then
 * resolved to the chunks that have to be scanned.
 */
public class ChunkPruner
{
    private static final Logger log = Logger.get(ChunkPruner.class);

    private final ChunkPruningConfig config;
    private final SliceResolver sliceResolver;
    private final PartitioningFunction partitioningFunction;
    private final ChunkEnumerator chunkEnumerator;

    public ChunkPruner(ChunkPruningConfig config, SliceResolver sliceResolver, PartitioningFunction partitioningFunction, ChunkEnumerator chunkEnumerator)
    {
        this.config = requireNonNull(config, "config is null");
        this.sliceResolver = requireNonNull(sliceResolver, "sliceResolver is null");
        this.partitioningFunction = requireNonNull(partitioningFunction, "partitioningFunction is null");
        this.chunkEnumerator = requireNonNull(chunkEnumerator, "chunkEnumerator is null");
    }

    public RestrictionSet build(Hypertable hypertable)
    {
        return RestrictionSet.build(hypertable, partitioningFunction, config.getMaxInListSize());
    }

    public void addPredicates(RestrictionSet restrictionSet, List<RowExpression> predicates, PlanningContext context)
    {
        requireNonNull(restrictionSet, "restrictionSet is null");
        requireNonNull(context, "context is null");
        if (!config.isEnabled()) {
            log.debug("Query %s: chunk pruning disabled, scanning every chunk of %s", context.getQueryId(), restrictionSet.getHypertable().getName());
            return;
        }
        restrictionSet.addPredicates(predicates, context);
    }

    public boolean hasRestrictions(RestrictionSet restrictionSet)
    {
        return restrictionSet.hasRestrictions();
    }

    public List<ChunkId> getMatchingChunks(RestrictionSet restrictionSet)
    {
        return restrictionSet.getMatchingChunks(sliceResolver, chunkEnumerator);
    }
}
