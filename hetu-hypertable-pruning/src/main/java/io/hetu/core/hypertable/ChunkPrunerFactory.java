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

import io.airlift.configuration.ConfigurationFactory;
import io.hetu.core.spi.hypertable.ChunkEnumerator;
import io.hetu.core.spi.hypertable.PartitioningFunction;
import io.hetu.core.spi.hypertable.SliceResolver;

import java.util.Map;

public final class ChunkPrunerFactory
{
    private ChunkPrunerFactory() {}

    /**
     * create
     *
     * @param properties chunk pruning properties
     * @return pruner using the default hash partitioning function
     */
    public static ChunkPruner create(Map<String, String> properties, SliceResolver sliceResolver, ChunkEnumerator chunkEnumerator)
    {
        return create(properties, sliceResolver, new HashPartitioningFunction(), chunkEnumerator);
    }

    public static ChunkPruner create(Map<String, String> properties, SliceResolver sliceResolver, PartitioningFunction partitioningFunction, ChunkEnumerator chunkEnumerator)
    {
        ConfigurationFactory configurationFactory = new ConfigurationFactory(properties);
        ChunkPruningConfig config = configurationFactory.build(ChunkPruningConfig.class);
        return new ChunkPruner(config, sliceResolver, partitioningFunction, chunkEnumerator);
    }
}
