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
package io.hetu.core.spi.hypertable.type;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

public final class ArrayType
        implements Type
{
    private final ScalarType elementType;

    public ArrayType(ScalarType elementType)
    {
        this.elementType = requireNonNull(elementType, "elementType is null");
    }

    public ScalarType getElementType()
    {
        return elementType;
    }

    @Override
    public String getDisplayName()
    {
        return "array(" + elementType.getDisplayName() + ")";
    }

    @Override
    public boolean isArray()
    {
        return true;
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
        ArrayType that = (ArrayType) o;
        return elementType == that.elementType;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(elementType);
    }

    @Override
    public String toString()
    {
        return getDisplayName();
    }
}
