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

public final class ComparisonExpression
        extends RowExpression
{
    private final OperatorType operator;
    private final RowExpression left;
    private final RowExpression right;

    public ComparisonExpression(OperatorType operator, RowExpression left, RowExpression right)
    {
        this.operator = requireNonNull(operator, "operator is null");
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
    }

    public OperatorType getOperator()
    {
        return operator;
    }

    public RowExpression getLeft()
    {
        return left;
    }

    public RowExpression getRight()
    {
        return right;
    }

    public ComparisonExpression flip()
    {
        return new ComparisonExpression(operator.flip(), right, left);
    }

    @Override
    public Type getType()
    {
        return ScalarType.BOOLEAN;
    }

    @Override
    public <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitComparison(this, context);
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
        ComparisonExpression that = (ComparisonExpression) o;
        return (operator == that.operator) &&
                Objects.equals(left, that.left) &&
                Objects.equals(right, that.right);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString()
    {
        return left + " " + operator.getValue() + " " + right;
    }
}
