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
 * Column and constant types understood by chunk pruning.
 * <p>
 * Java representation of constant values:
 * SMALLINT {@link Short}, INTEGER {@link Integer}, BIGINT {@link Long},
 * DOUBLE {@link Double}, BOOLEAN {@link Boolean}, VARCHAR {@link String},
 * DATE {@link java.time.LocalDate}, TIMESTAMP {@link java.time.LocalDateTime},
 * TIMESTAMP WITH TIME ZONE {@link java.time.Instant} or {@link java.time.OffsetDateTime}.
 */
public enum ScalarType
        implements Type
{
    SMALLINT("smallint", OperatorFamily.INTEGER),
    INTEGER("integer", OperatorFamily.INTEGER),
    BIGINT("bigint", OperatorFamily.INTEGER),
    DOUBLE("double", OperatorFamily.FLOAT),
    BOOLEAN("boolean", OperatorFamily.BOOLEAN),
    VARCHAR("varchar", OperatorFamily.TEXT),
    DATE("date", OperatorFamily.DATETIME),
    TIMESTAMP("timestamp", OperatorFamily.DATETIME),
    TIMESTAMP_WITH_TIME_ZONE("timestamp with time zone", OperatorFamily.DATETIME),
    JSON("json", OperatorFamily.NONE);

    private final String displayName;
    private final OperatorFamily operatorFamily;

    ScalarType(String displayName, OperatorFamily operatorFamily)
    {
        this.displayName = displayName;
        this.operatorFamily = operatorFamily;
    }

    @Override
    public String getDisplayName()
    {
        return displayName;
    }

    public OperatorFamily getOperatorFamily()
    {
        return operatorFamily;
    }

    /**
     * Whether the type can be the source column of a range dimension
     */
    public boolean isTimeLike()
    {
        return operatorFamily == OperatorFamily.INTEGER || operatorFamily == OperatorFamily.DATETIME;
    }

    @Override
    public String toString()
    {
        return displayName;
    }
}
