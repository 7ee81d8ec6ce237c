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
import org.testng.annotations.Test;

import java.util.Optional;

import static io.hetu.core.spi.hypertable.ComparisonStrategy.EQUAL;
import static io.hetu.core.spi.hypertable.ComparisonStrategy.GREATER_THAN;
import static io.hetu.core.spi.hypertable.ComparisonStrategy.GREATER_THAN_OR_EQUAL;
import static io.hetu.core.spi.hypertable.ComparisonStrategy.LESS_THAN;
import static io.hetu.core.spi.hypertable.ComparisonStrategy.LESS_THAN_OR_EQUAL;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestComparisonStrategy
{
    @Test
    public void testStrategyNumbers()
    {
        assertEquals(LESS_THAN.getStrategyNumber(), 1);
        assertEquals(LESS_THAN_OR_EQUAL.getStrategyNumber(), 2);
        assertEquals(EQUAL.getStrategyNumber(), 3);
        assertEquals(GREATER_THAN_OR_EQUAL.getStrategyNumber(), 4);
        assertEquals(GREATER_THAN.getStrategyNumber(), 5);
    }

    @Test
    public void testFromOperator()
    {
        assertEquals(ComparisonStrategy.fromOperator(OperatorType.LESS_THAN), Optional.of(LESS_THAN));
        assertEquals(ComparisonStrategy.fromOperator(OperatorType.GREATER_THAN_OR_EQUAL), Optional.of(GREATER_THAN_OR_EQUAL));
        assertEquals(ComparisonStrategy.fromOperator(OperatorType.EQUAL), Optional.of(EQUAL));
        assertEquals(ComparisonStrategy.fromOperator(OperatorType.NOT_EQUAL), Optional.empty());
        assertEquals(ComparisonStrategy.fromOperator(OperatorType.IS_DISTINCT_FROM), Optional.empty());
    }

    @Test
    public void testBounds()
    {
        assertEquals(Bound.upper(true, 5), new Bound(LESS_THAN_OR_EQUAL, 5));
        assertEquals(Bound.lower(false, 5), new Bound(GREATER_THAN, 5));
        assertTrue(Bound.upper(false, 5).isUpper());
        assertFalse(Bound.lower(true, 5).isUpper());
        assertTrue(Bound.lower(true, 5).isInclusive());
        assertEquals(Bound.upper(false, 100).toString(), "(<, 100)");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEqualityIsNotBound()
    {
        new Bound(EQUAL, 5);
    }
}
