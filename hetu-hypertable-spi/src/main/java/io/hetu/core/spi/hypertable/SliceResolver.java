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

import java.util.List;
import java.util.Optional;

/**
 * Looks up the slices stored for a dimension. Lookups are read only and run
 * under the caller's snapshot.
 */
public interface SliceResolver
{
    /**
     * Returns every slice of the dimension overlapping the interval described by the bounds,
     * ordered by range start. An absent bound leaves that side unbounded, so two absent
     * bounds return all slices of the dimension.
     *
     * @param dimensionId dimension to scan
     * @param upper upper bound, {@code <} or {@code <=}
     * @param lower lower bound, {@code >} or {@code >=}
     * @return matching slices
     */
    List<Slice> resolveRangeSlices(int dimensionId, Optional<Bound> upper, Optional<Bound> lower);

    /**
     * Returns the slices whose range contains the partition key.
     *
     * @param dimensionId dimension to scan
     * @param partitionKey output of the dimension's partitioning function
     * @return matching slices
     */
    List<Slice> resolveEqualSlices(int dimensionId, int partitionKey);
}
