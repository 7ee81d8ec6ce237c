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

public interface ChunkEnumerator
{
    /**
     * Returns the chunks of the hypertable that have one of the given slices in every dimension.
     *
     * @param hypertable the hypertable being scanned
     * @param slicesPerDimension slice candidates, one list per dimension in declaration order
     * @return ids of the matching chunks
     */
    List<ChunkId> enumerateChunks(Hypertable hypertable, List<List<Slice>> slicesPerDimension);
}
