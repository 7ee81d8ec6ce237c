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

import io.hetu.core.spi.hypertable.relation.ConstantExpression;
import io.hetu.core.spi.hypertable.relation.RowExpression;

import java.util.Optional;

/**
 * Evaluates a planning-time constant sub-expression, such as
 * {@code date '2020-01-01' + interval '1' day}, to a literal.
 */
public interface ConstantFolder
{
    ConstantFolder CONSTANTS_ONLY = expression -> {
        if (expression instanceof ConstantExpression) {
            return Optional.of((ConstantExpression) expression);
        }
        return Optional.empty();
    };

    /**
     * @return the literal value of the expression, or empty if it cannot be evaluated at planning time
     */
    Optional<ConstantExpression> fold(RowExpression expression);
}
