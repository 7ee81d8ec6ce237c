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

import io.hetu.core.spi.hypertable.HypertableException;
import io.hetu.core.spi.hypertable.type.ScalarType;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

import static io.hetu.core.spi.hypertable.HypertableErrorCode.INVALID_CONSTANT;
import static java.lang.String.format;
import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.DAYS;

/**
 * Converts column values of range dimensions into the internal time
 * representation slices are stored in: integers are kept as they are,
 * dates and timestamps become microseconds since the epoch (UTC).
 */
public final class TimeValues
{
    private static final long MICROS_PER_SECOND = 1_000_000L;
    private static final long NANOS_PER_MICRO = 1_000L;

    private TimeValues() {}

    public static long toInternal(Object value, ScalarType type)
    {
        requireNonNull(value, "value is null");
        requireNonNull(type, "type is null");
        try {
            switch (type) {
                case SMALLINT:
                case INTEGER:
                case BIGINT:
                    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                        return ((Number) value).longValue();
                    }
                    break;
                case DATE:
                    if (value instanceof LocalDate) {
                        return Math.multiplyExact(((LocalDate) value).toEpochDay(), DAYS.toMicros(1));
                    }
                    break;
                case TIMESTAMP:
                    if (value instanceof LocalDateTime) {
                        return toMicros(((LocalDateTime) value).toInstant(UTC));
                    }
                    break;
                case TIMESTAMP_WITH_TIME_ZONE:
                    if (value instanceof Instant) {
                        return toMicros((Instant) value);
                    }
                    if (value instanceof OffsetDateTime) {
                        return toMicros(((OffsetDateTime) value).toInstant());
                    }
                    if (value instanceof ZonedDateTime) {
                        return toMicros(((ZonedDateTime) value).toInstant());
                    }
                    break;
                default:
                    throw new HypertableException(INVALID_CONSTANT, format("Type %s has no internal time representation", type));
            }
        }
        catch (ArithmeticException e) {
            throw new HypertableException(INVALID_CONSTANT, format("Value %s is out of range for %s", value, type), e);
        }
        throw new HypertableException(INVALID_CONSTANT, format("Value %s of class %s is not a valid %s", value, value.getClass().getName(), type));
    }

    /**
     * Whether {@link #toInternal} drops a sub-microsecond part of the value.
     * The internal value is then the microsecond just below the value.
     */
    public static boolean hasSubMicrosecondPart(Object value)
    {
        return nanosOf(value) % NANOS_PER_MICRO != 0;
    }

    private static long nanosOf(Object value)
    {
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).getNano();
        }
        if (value instanceof Instant) {
            return ((Instant) value).getNano();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).getNano();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).getNano();
        }
        return 0;
    }

    private static long toMicros(Instant instant)
    {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), MICROS_PER_SECOND), instant.getNano() / NANOS_PER_MICRO);
    }
}
