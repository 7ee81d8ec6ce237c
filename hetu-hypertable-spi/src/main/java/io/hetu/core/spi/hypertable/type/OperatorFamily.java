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
package io.hetu.core.spi.hypertable.type;

/**
 * Default ordering/equality operator family of a type. Comparison
 * operators are only defined between types of the same family.
 */
public enum OperatorFamily
{
    INTEGER,
    FLOAT,
    BOOLEAN,
    TEXT,
    DATETIME,
    /**
     * Types without a default ordering family, no comparison can be used for pruning
     */
    NONE;

    public boolean isComparable()
    {
        return this != NONE;
    }
}
