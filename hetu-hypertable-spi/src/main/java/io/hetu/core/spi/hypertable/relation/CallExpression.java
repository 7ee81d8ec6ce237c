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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import io.hetu.core.spi.hypertable.type.Type;

import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Invocation of a scalar function. The planner marks volatile functions
 * such as {@code random()} or {@code now()} as non-deterministic.
 */
public final class CallExpression
        extends RowExpression
{
    private final String functionName;
    private final boolean deterministic;
    private final Type returnType;
    private final List<RowExpression> arguments;

    public CallExpression(String functionName, boolean deterministic, Type returnType, List<RowExpression> arguments)
    {
        this.functionName = requireNonNull(functionName, "functionName is null");
        this.deterministic = deterministic;
        this.returnType = requireNonNull(returnType, "returnType is null");
        this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
    }

    public String getFunctionName()
    {
        return functionName;
    }

    public boolean isDeterministic()
    {
        return deterministic;
    }

    @Override
    public Type getType()
    {
        return returnType;
    }

    public List<RowExpression> getArguments()
    {
        return arguments;
    }

    @Override
    public <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitCall(this, context);
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
        CallExpression other = (CallExpression) o;
        return deterministic == other.deterministic &&
                Objects.equals(functionName, other.functionName) &&
                Objects.equals(arguments, other.arguments);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(functionName, deterministic, arguments);
    }

    @Override
    public String toString()
    {
        return functionName + "(" + Joiner.on(", ").join(arguments) + ")";
    }
}
