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

import io.hetu.core.spi.hypertable.ConstantFolder;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Per-query state handed in by the planner while pruning chunks
 */
public final class PlanningContext
{
    private final String queryId;
    private final ConstantFolder constantFolder;

    public PlanningContext(String queryId, ConstantFolder constantFolder)
    {
        this.queryId = requireNonNull(queryId, "queryId is null");
        this.constantFolder = requireNonNull(constantFolder, "constantFolder is null");
    }

    /**
     * Context whose folder only accepts expressions that are already literals
     */
    public static PlanningContext literalsOnly(String queryId)
    {
        return new PlanningContext(queryId, ConstantFolder.CONSTANTS_ONLY);
    }

    public String getQueryId()
    {
        return queryId;
    }

    public ConstantFolder getConstantFolder()
    {
        return constantFolder;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("queryId", queryId)
                .toString();
    }
}
