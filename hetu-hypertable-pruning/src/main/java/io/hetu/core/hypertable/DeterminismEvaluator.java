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

import io.hetu.core.spi.hypertable.relation.CallExpression;
import io.hetu.core.spi.hypertable.relation.ComparisonExpression;
import io.hetu.core.spi.hypertable.relation.ConstantExpression;
import io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression;
import io.hetu.core.spi.hypertable.relation.RowExpression;
import io.hetu.core.spi.hypertable.relation.RowExpressionVisitor;
import io.hetu.core.spi.hypertable.relation.VariableReferenceExpression;

import static java.util.Objects.requireNonNull;

/**
 * Determines whether an expression evaluates to the same value for the same
 * row every time, which is required before it can be used to exclude chunks.
 */
public final class DeterminismEvaluator
{
    private DeterminismEvaluator() {}

    public static boolean isDeterministic(RowExpression expression)
    {
        return requireNonNull(expression, "expression is null").accept(new Visitor(), null);
    }

    private static class Visitor
            implements RowExpressionVisitor<Boolean, Void>
    {
        @Override
        public Boolean visitVariableReference(VariableReferenceExpression reference, Void context)
        {
            return true;
        }

        @Override
        public Boolean visitConstant(ConstantExpression literal, Void context)
        {
            return true;
        }

        @Override
        public Boolean visitCall(CallExpression call, Void context)
        {
            if (!call.isDeterministic()) {
                return false;
            }
            return call.getArguments().stream().allMatch(argument -> argument.accept(this, context));
        }

        @Override
        public Boolean visitComparison(ComparisonExpression comparison, Void context)
        {
            return comparison.getLeft().accept(this, context) && comparison.getRight().accept(this, context);
        }

        @Override
        public Boolean visitQuantifiedComparison(QuantifiedComparisonExpression comparison, Void context)
        {
            return comparison.getValue().accept(this, context) && comparison.getArray().accept(this, context);
        }
    }
}
