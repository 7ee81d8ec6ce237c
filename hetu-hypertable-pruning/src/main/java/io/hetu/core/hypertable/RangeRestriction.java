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

import io.hetu.core.spi.hypertable.Bound;
import io.hetu.core.spi.hypertable.ComparisonStrategy;
import io.hetu.core.spi.hypertable.Dimension;
import io.hetu.core.spi.hypertable.Slice;
import io.hetu.core.spi.hypertable.SliceResolver;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;

/**
 * Interval {@code lower .. upper} on a range dimension. Bounds only ever tighten.
 */
public final class RangeRestriction
        extends DimensionRestriction
{
    private Optional<Bound> lower = Optional.empty();
    private Optional<Bound> upper = Optional.empty();

    RangeRestriction(Dimension dimension)
    {
        super(dimension);
    }

    public Optional<Bound> getLower()
    {
        return lower;
    }

    public Optional<Bound> getUpper()
    {
        return upper;
    }

    @Override
    public boolean fold(ComparisonStrategy strategy, PredicateValue value)
    {
        // several values, ANDed or ORed, do not describe a single interval
        if (value.getValues().size() != 1) {
            return false;
        }

        Object constant = value.getValues().get(0);
        long internal = TimeValues.toInternal(constant, value.getType());
        switch (strategy) {
            case LESS_THAN:
                // x < 10.5us holds for x = 10us
                if (TimeValues.hasSubMicrosecondPart(constant)) {
                    return tightenUpper(Bound.upper(true, internal));
                }
                return tightenUpper(new Bound(strategy, internal));
            case LESS_THAN_OR_EQUAL:
                return tightenUpper(new Bound(strategy, internal));
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
                return tightenLower(new Bound(strategy, internal));
            case EQUAL:
                tightenLower(Bound.lower(true, internal));
                tightenUpper(Bound.upper(true, internal));
                return true;
            default:
                return false;
        }
    }

    private boolean tightenUpper(Bound candidate)
    {
        if (upper.isPresent() && !isTighterUpper(candidate, upper.get())) {
            return false;
        }
        upper = Optional.of(candidate);
        return true;
    }

    private boolean tightenLower(Bound candidate)
    {
        if (lower.isPresent() && !isTighterLower(candidate, lower.get())) {
            return false;
        }
        lower = Optional.of(candidate);
        return true;
    }

    static boolean isTighterUpper(Bound candidate, Bound current)
    {
        if (candidate.getValue() != current.getValue()) {
            return candidate.getValue() < current.getValue();
        }
        return !candidate.isInclusive() && current.isInclusive();
    }

    static boolean isTighterLower(Bound candidate, Bound current)
    {
        if (candidate.getValue() != current.getValue()) {
            return candidate.getValue() > current.getValue();
        }
        return !candidate.isInclusive() && current.isInclusive();
    }

    @Override
    public List<Slice> resolveSlices(SliceResolver sliceResolver)
    {
        return sliceResolver.resolveRangeSlices(getDimension().getId(), upper, lower);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("dimension", getDimension().getColumnName())
                .add("lower", lower.orElse(null))
                .add("upper", upper.orElse(null))
                .omitNullValues()
                .toString();
    }
}
