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

import com.google.common.collect.ImmutableList;
import io.hetu.core.spi.hypertable.type.ScalarType;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Right-hand side of a predicate: a single constant, or the elements of an
 * ANY/ALL array together with how they combine.
 */
public final class PredicateValue
{
    public enum Combinator
    {
        AND,
        OR
    }

    private final List<Object> values;
    private final Combinator combinator;
    private final ScalarType type;

    private PredicateValue(List<Object> values, Combinator combinator, ScalarType type)
    {
        this.values = ImmutableList.copyOf(requireNonNull(values, "values is null"));
        this.combinator = requireNonNull(combinator, "combinator is null");
        this.type = requireNonNull(type, "type is null");
    }

    public static PredicateValue single(Object value, ScalarType type)
    {
        return new PredicateValue(ImmutableList.of(requireNonNull(value, "value is null")), Combinator.AND, type);
    }

    /**
     * Null elements are dropped, they never compare equal to anything.
     */
    public static PredicateValue fromArray(List<?> elements, ScalarType elementType, Combinator combinator)
    {
        ImmutableList.Builder<Object> values = ImmutableList.builder();
        for (Object element : elements) {
            if (element != null) {
                values.add(element);
            }
        }
        return new PredicateValue(values.build(), combinator, elementType);
    }

    public List<Object> getValues()
    {
        return values;
    }

    public Combinator getCombinator()
    {
        return combinator;
    }

    public ScalarType getType()
    {
        return type;
    }

    public boolean isOr()
    {
        return combinator == Combinator.OR;
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
        PredicateValue that = (PredicateValue) o;
        return Objects.equals(values, that.values) &&
                combinator == that.combinator &&
                type == that.type;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(values, combinator, type);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("values", values)
                .add("combinator", combinator)
                .add("type", type)
                .toString();
    }
}
