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

import io.hetu.core.spi.hypertable.relation.OperatorType;

import java.util.Optional;

/**
 * Strategies of a default b-tree ordering family, numbered as the index access method numbers them.
 */
public enum ComparisonStrategy
{
    LESS_THAN(1, "<"),
    LESS_THAN_OR_EQUAL(2, "<="),
    EQUAL(3, "="),
    GREATER_THAN_OR_EQUAL(4, ">="),
    GREATER_THAN(5, ">");

    private final int strategyNumber;
    private final String symbol;

    ComparisonStrategy(int strategyNumber, String symbol)
    {
        this.strategyNumber = strategyNumber;
        this.symbol = symbol;
    }

    public int getStrategyNumber()
    {
        return strategyNumber;
    }

    public String getSymbol()
    {
        return symbol;
    }

    public boolean isUpperBound()
    {
        return this == LESS_THAN || this == LESS_THAN_OR_EQUAL;
    }

    public boolean isLowerBound()
    {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL;
    }

    public boolean isInclusive()
    {
        return this == LESS_THAN_OR_EQUAL || this == EQUAL || this == GREATER_THAN_OR_EQUAL;
    }

    /**
     * Operators outside of the ordering family ({@code <>}, {@code IS DISTINCT FROM}) have no strategy.
     */
    public static Optional<ComparisonStrategy> fromOperator(OperatorType operator)
    {
        switch (operator) {
            case LESS_THAN:
                return Optional.of(LESS_THAN);
            case LESS_THAN_OR_EQUAL:
                return Optional.of(LESS_THAN_OR_EQUAL);
            case EQUAL:
                return Optional.of(EQUAL);
            case GREATER_THAN_OR_EQUAL:
                return Optional.of(GREATER_THAN_OR_EQUAL);
            case GREATER_THAN:
                return Optional.of(GREATER_THAN);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String toString()
    {
        return symbol;
    }
}
