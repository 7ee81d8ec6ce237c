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

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import javax.validation.constraints.Min;

public class ChunkPruningConfig
{
    private boolean enabled = true;
    private int maxInListSize = 1000;

    public boolean isEnabled()
    {
        return enabled;
    }

    @Config("hypertable.chunk-pruning.enabled")
    @ConfigDescription("Exclude chunks that cannot match the filter of a query")
    public ChunkPruningConfig setEnabled(boolean enabled)
    {
        this.enabled = enabled;
        return this;
    }

    @Min(1)
    public int getMaxInListSize()
    {
        return maxInListSize;
    }

    @Config("hypertable.chunk-pruning.max-in-list-size")
    @ConfigDescription("ANY/ALL arrays with more elements are not used to prune chunks")
    public ChunkPruningConfig setMaxInListSize(int maxInListSize)
    {
        this.maxInListSize = maxInListSize;
        return this;
    }
}
