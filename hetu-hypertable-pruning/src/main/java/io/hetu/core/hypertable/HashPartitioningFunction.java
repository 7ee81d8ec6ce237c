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

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import io.hetu.core.spi.hypertable.HypertableException;
import io.hetu.core.spi.hypertable.PartitioningFunction;
import io.hetu.core.spi.hypertable.type.ScalarType;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

import static io.hetu.core.spi.hypertable.HypertableErrorCode.INVALID_CONSTANT;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default partitioning function of discrete dimensions: murmur3 of the value,
 * masked to a non-negative int. Integral values hash the same whatever their
 * width, dates by epoch day and timestamps by epoch microseconds. Values of
 * any other class raise {@code INVALID_CONSTANT}.
 */
public class HashPartitioningFunction
        implements PartitioningFunction
{
    private static final HashFunction MURMUR3_32 = Hashing.murmur3_32(0);

    @Override
    public int apply(int dimensionId, Object value)
    {
        requireNonNull(value, "value is null");
        return hash(value).asInt() & Integer.MAX_VALUE;
    }

    private static HashCode hash(Object value)
    {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return MURMUR3_32.hashLong(((Number) value).longValue());
        }
        if (value instanceof Double) {
            double doubleValue = (Double) value;
            // -0.0 = 0.0
            if (doubleValue == 0.0) {
                doubleValue = 0.0;
            }
            return MURMUR3_32.hashLong(Double.doubleToLongBits(doubleValue));
        }
        if (value instanceof Boolean) {
            return MURMUR3_32.hashInt((Boolean) value ? 1 : 0);
        }
        if (value instanceof String) {
            return MURMUR3_32.hashString((String) value, UTF_8);
        }
        if (value instanceof LocalDate) {
            return MURMUR3_32.hashLong(((LocalDate) value).toEpochDay());
        }
        if (value instanceof LocalDateTime) {
            return MURMUR3_32.hashLong(TimeValues.toInternal(value, ScalarType.TIMESTAMP));
        }
        if (value instanceof Instant || value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
            return MURMUR3_32.hashLong(TimeValues.toInternal(value, ScalarType.TIMESTAMP_WITH_TIME_ZONE));
        }
        throw new HypertableException(INVALID_CONSTANT, "Cannot hash value of class " + value.getClass().getName());
    }
}
