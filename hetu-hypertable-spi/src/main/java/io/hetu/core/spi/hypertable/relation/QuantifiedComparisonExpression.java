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
package io.hetu.core.spi.hypertable.relation;

import io.hetu.core.spi.hypertable.type.ScalarType;
import io.hetu.core.spi.hypertable.type.Type;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * {@code value operator ANY|SOME|ALL (array)}. The planner rewrites
 * {@code x IN (a, b)} to {@code x = ANY (ARRAY[a, b])}.
 */
public final class QuantifiedComparisonExpression
        extends RowExpression
{
    public enum Quantifier
    {
        ALL,
        ANY,
        SOME,
    }

    private final OperatorType operator;
    private final Quantifier quantifier;
    private final RowExpression value;
    private final RowExpression array;

    public QuantifiedComparisonExpression(OperatorType operator, Quantifier quantifier, RowExpression value, RowExpression array)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.quantifier = requireNonNull(quantifier, "quantifier is null");
        this.value = requireNonNull(value, "value is null");
        this.array = requireNonNull(array, "array is null");
    }

    public OperatorType getOperator()
    {
        return operator;
    }

    public Quantifier getQuantifier()
    {
        return quantifier;
    }

    public RowExpression getValue()
    {
        return value;
    }

    public RowExpression getArray()
    {
        return array;
    }

    @Override
    public Type getType()
    {
        return ScalarType.BOOLEAN;
    }

    @Override
    public <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitQuantifiedComparison(this, context);
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
        QuantifiedComparisonExpression that = (QuantifiedComparisonExpression) o;
        return operator == that.operator &&
                quantifier == that.quantifier &&
                Objects.equals(value, that.value) &&
                Objects.equals(array, that.array);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(operator, quantifier, value, array);
    }

    @Override
    public String toString()
    {
        return value + " " + operator.getValue() + " " + quantifier + " (" + array + ")";
    }
}
