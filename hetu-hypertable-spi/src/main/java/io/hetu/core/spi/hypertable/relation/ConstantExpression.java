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

import io.hetu.core.spi.hypertable.type.ArrayType;
import io.hetu.core.spi.hypertable.type.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A literal value. Array constants carry a {@link List} value whose
 * elements may be null.
 */
public final class ConstantExpression
        extends RowExpression
{
    private final Object value;
    private final Type type;

    public ConstantExpression(Object value, Type type)
    {
        requireNonNull(type, "type is null");
        checkArgument(!type.isArray() || value == null || value instanceof List, "array constant must be a list: %s", value);
        this.value = type.isArray() && value != null ? Collections.unmodifiableList((List<?>) value) : value;
        this.type = type;
    }

    public static ConstantExpression array(ArrayType type, Object... elements)
    {
        return new ConstantExpression(Arrays.asList(elements), type);
    }

    public static ConstantExpression array(ArrayType type, List<?> elements)
    {
        return new ConstantExpression(new ArrayList<>(elements), type);
    }

    public Object getValue()
    {
        return value;
    }

    public boolean isNull()
    {
        return value == null;
    }

    @Override
    public Type getType()
    {
        return type;
    }

    @Override
    public <R, C> R accept(RowExpressionVisitor<R, C> visitor, C context)
    {
        return visitor.visitConstant(this, context);
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
        ConstantExpression that = (ConstantExpression) o;
        return Objects.equals(value, that.value) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(value, type);
    }

    @Override
    public String toString()
    {
        return String.valueOf(value);
    }
}
