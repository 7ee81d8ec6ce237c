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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One end of the interval derived for a range dimension, e.g. {@code (<, 100)}
 */
public final class Bound
{
    private final ComparisonStrategy strategy;
    private final long value;

    public Bound(ComparisonStrategy strategy, long value)
    {
        this.strategy = requireNonNull(strategy, "strategy is null");
        checkArgument(strategy != ComparisonStrategy.EQUAL, "a bound is either upper or lower");
        this.value = value;
    }

    public static Bound upper(boolean inclusive, long value)
    {
        return new Bound(inclusive ? ComparisonStrategy.LESS_THAN_OR_EQUAL : ComparisonStrategy.LESS_THAN, value);
    }

    public static Bound lower(boolean inclusive, long value)
    {
        return new Bound(inclusive ? ComparisonStrategy.GREATER_THAN_OR_EQUAL : ComparisonStrategy.GREATER_THAN, value);
    }

    public ComparisonStrategy getStrategy()
    {
        return strategy;
    }

    public long getValue()
    {
        return value;
    }

    public boolean isInclusive()
    {
        return strategy.isInclusive();
    }

    public boolean isUpper()
    {
        return strategy.isUpperBound();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Bound that = (Bound) o;
        return value == that.value && strategy == that.strategy;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(strategy, value);
    }

    @Override
    public String toString()
    {
        return "(" + strategy.getSymbol() + ", " + value + ")";
    }
}
