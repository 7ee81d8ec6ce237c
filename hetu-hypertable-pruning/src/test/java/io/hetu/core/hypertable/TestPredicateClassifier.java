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
import com.google.common.collect.ImmutableSet;
import io.hetu.core.spi.hypertable.Bound;
import io.hetu.core.spi.hypertable.ComparisonStrategy;
import io.hetu.core.spi.hypertable.Dimension;
import io.hetu.core.spi.hypertable.Hypertable;
import io.hetu.core.spi.hypertable.relation.CallExpression;
import io.hetu.core.spi.hypertable.relation.ComparisonExpression;
import io.hetu.core.spi.hypertable.relation.ConstantExpression;
import io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression;
import io.hetu.core.spi.hypertable.relation.VariableReferenceExpression;
import io.hetu.core.spi.hypertable.type.ArrayType;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static io.hetu.core.spi.hypertable.relation.OperatorType.EQUAL;
import static io.hetu.core.spi.hypertable.relation.OperatorType.GREATER_THAN;
import static io.hetu.core.spi.hypertable.relation.OperatorType.GREATER_THAN_OR_EQUAL;
import static io.hetu.core.spi.hypertable.relation.OperatorType.IS_DISTINCT_FROM;
import static io.hetu.core.spi.hypertable.relation.OperatorType.LESS_THAN;
import static io.hetu.core.spi.hypertable.relation.OperatorType.NOT_EQUAL;
import static io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression.Quantifier.ALL;
import static io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression.Quantifier.ANY;
import static io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression.Quantifier.SOME;
import static io.hetu.core.spi.hypertable.type.ScalarType.BIGINT;
import static io.hetu.core.spi.hypertable.type.ScalarType.BOOLEAN;
import static io.hetu.core.spi.hypertable.type.ScalarType.DATE;
import static io.hetu.core.spi.hypertable.type.ScalarType.DOUBLE;
import static io.hetu.core.spi.hypertable.type.ScalarType.INTEGER;
import static io.hetu.core.spi.hypertable.type.ScalarType.TIMESTAMP;
import static io.hetu.core.spi.hypertable.type.ScalarType.VARCHAR;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestPredicateClassifier
{
    private static final VariableReferenceExpression TIME = new VariableReferenceExpression("time", BIGINT);
    private static final VariableReferenceExpression DEVICE = new VariableReferenceExpression("device_id", INTEGER);
    private static final VariableReferenceExpression VALUE = new VariableReferenceExpression("value", DOUBLE);
    private static final ArrayType INTEGER_ARRAY = new ArrayType(INTEGER);

    private static final Hypertable HYPERTABLE = new Hypertable(1, "metrics", ImmutableList.of(
            Dimension.rangeDimension(1, "time", BIGINT),
            Dimension.discreteDimension(2, "device_id", INTEGER, 4)));

    private RangeRestriction time;
    private DiscreteRestriction device;
    private PredicateClassifier classifier;

    @BeforeMethod
    public void setUp()
    {
        classifier = classifier(PlanningContext.literalsOnly("test"), 3);
    }

    private PredicateClassifier classifier(PlanningContext context, int maxInListSize)
    {
        RestrictionSet restrictionSet = RestrictionSet.build(HYPERTABLE, (dimensionId, value) -> ((Number) value).intValue(), maxInListSize);
        time = (RangeRestriction) restrictionSet.getRestrictions().get(0);
        device = (DiscreteRestriction) restrictionSet.getRestrictions().get(1);
        return new PredicateClassifier(restrictionSet.getRestrictions(), context, maxInListSize);
    }

    @Test
    public void testColumnOnTheLeft()
    {
        assertTrue(classifier.accept(new ComparisonExpression(GREATER_THAN_OR_EQUAL, TIME, bigint(10))));
        assertEquals(time.getLower(), Optional.of(Bound.lower(true, 10)));
    }

    @Test
    public void testColumnOnTheRight()
    {
        // 10 > time
        assertTrue(classifier.accept(new ComparisonExpression(GREATER_THAN, bigint(10), TIME)));
        assertEquals(time.getUpper(), Optional.of(Bound.upper(false, 10)));
        assertEquals(time.getLower(), Optional.empty());
    }

    @Test
    public void testNonDeterministic()
    {
        PredicateClassifier folding = classifier(new PlanningContext("test", expression -> Optional.of(bigint(5))), 3);
        CallExpression random = new CallExpression("random", false, BIGINT, ImmutableList.of());
        CallExpression abs = new CallExpression("abs", true, BIGINT, ImmutableList.of(bigint(-5)));

        assertFalse(folding.accept(new ComparisonExpression(LESS_THAN, TIME, random)));
        assertEquals(time.getUpper(), Optional.empty());
        assertTrue(folding.accept(new ComparisonExpression(LESS_THAN, TIME, abs)));
        assertEquals(time.getUpper(), Optional.of(Bound.upper(false, 5)));
    }

    @Test
    public void testNotConstant()
    {
        assertFalse(classifier.accept(new ComparisonExpression(LESS_THAN, TIME, new CallExpression("abs", true, BIGINT, ImmutableList.of(bigint(-5))))));
        assertFalse(classifier.accept(new ComparisonExpression(EQUAL, TIME, new VariableReferenceExpression("other", BIGINT))));
    }

    @Test
    public void testNotComparison()
    {
        assertFalse(classifier.accept(new CallExpression("like", true, BOOLEAN, ImmutableList.of(TIME, bigint(1)))));
        assertFalse(classifier.accept(bigint(1)));
    }

    @Test
    public void testNotPartitioningColumn()
    {
        assertFalse(classifier.accept(new ComparisonExpression(LESS_THAN, VALUE, new ConstantExpression(1.5, DOUBLE))));
        assertEquals(time.getUpper(), Optional.empty());
        assertEquals(device.getMatchedKeys(), Optional.empty());
    }

    @Test
    public void testOperatorsOutsideOrderingFamily()
    {
        assertFalse(classifier.accept(new ComparisonExpression(NOT_EQUAL, DEVICE, integer(3))));
        assertFalse(classifier.accept(new ComparisonExpression(IS_DISTINCT_FROM, TIME, bigint(3))));
        assertEquals(device.getMatchedKeys(), Optional.empty());
    }

    @Test
    public void testTypeMismatch()
    {
        assertFalse(classifier.accept(new ComparisonExpression(EQUAL, TIME, new ConstantExpression("2020-01-01", VARCHAR))));
        assertFalse(classifier.accept(new ComparisonExpression(EQUAL, DEVICE, new ConstantExpression(1.0, DOUBLE))));
    }

    @Test
    public void testIntegerWidthsShareFamily()
    {
        assertTrue(classifier.accept(new ComparisonExpression(LESS_THAN, TIME, integer(100))));
        assertEquals(time.getUpper(), Optional.of(Bound.upper(false, 100)));
    }

    @Test
    public void testNullConstant()
    {
        assertFalse(classifier.accept(new ComparisonExpression(EQUAL, TIME, new ConstantExpression(null, BIGINT))));
    }

    @Test
    public void testInList()
    {
        assertTrue(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, DEVICE, ConstantExpression.array(INTEGER_ARRAY, 3, 5))));
        assertEquals(device.getMatchedKeys(), Optional.of(ImmutableSet.of(3, 5)));

        assertTrue(classifier.accept(new QuantifiedComparisonExpression(EQUAL, SOME, DEVICE, ConstantExpression.array(INTEGER_ARRAY, 5, null))));
        assertEquals(device.getMatchedKeys(), Optional.of(ImmutableSet.of(5)));
    }

    @Test
    public void testAll()
    {
        assertTrue(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ALL, DEVICE, ConstantExpression.array(INTEGER_ARRAY, 3, 5))));
        assertEquals(device.getMatchedKeys(), Optional.of(ImmutableSet.of()));
    }

    @Test
    public void testQuantifiedColumnOnTheRight()
    {
        assertFalse(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, integer(3), DEVICE)));
    }

    @Test
    public void testArrayShapeMismatch()
    {
        assertFalse(classifier.accept(new ComparisonExpression(EQUAL, DEVICE, ConstantExpression.array(INTEGER_ARRAY, 3))));
        assertFalse(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, DEVICE, integer(3))));
        assertEquals(device.getMatchedKeys(), Optional.empty());
    }

    @Test
    public void testInListTooLong()
    {
        assertFalse(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, DEVICE, ConstantExpression.array(INTEGER_ARRAY, 1, 2, 3, 4))));
        assertTrue(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, DEVICE, ConstantExpression.array(INTEGER_ARRAY, 1, 2, 3))));
    }

    @Test
    public void testMultipleValuesOnRangeDimension()
    {
        ArrayType bigintArray = new ArrayType(BIGINT);
        assertFalse(classifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, TIME, ConstantExpression.array(bigintArray, 1L, 2L))));
        assertEquals(time.getLower(), Optional.empty());
        assertEquals(time.getUpper(), Optional.empty());
    }

    @Test
    public void testResolveStrategy()
    {
        Dimension time = HYPERTABLE.getDimensions().get(0);
        Dimension device = HYPERTABLE.getDimensions().get(1);
        assertEquals(PredicateClassifier.resolveStrategy(LESS_THAN, time, INTEGER), Optional.of(ComparisonStrategy.LESS_THAN));
        assertEquals(PredicateClassifier.resolveStrategy(NOT_EQUAL, time, BIGINT), Optional.empty());
        assertEquals(PredicateClassifier.resolveStrategy(EQUAL, time, VARCHAR), Optional.empty());
        assertEquals(PredicateClassifier.resolveStrategy(EQUAL, device, INTEGER), Optional.of(ComparisonStrategy.EQUAL));
        assertEquals(PredicateClassifier.resolveStrategy(EQUAL, device, BIGINT), Optional.empty());
    }

    @Test
    public void testDiscreteDimensionNeedsColumnType()
    {
        Hypertable readings = new Hypertable(2, "readings", ImmutableList.of(Dimension.discreteDimension(3, "ts", TIMESTAMP, 4)));
        HashPartitioningFunction partitioningFunction = new HashPartitioningFunction();
        RestrictionSet restrictionSet = RestrictionSet.build(readings, partitioningFunction, 10);
        DiscreteRestriction ts = (DiscreteRestriction) restrictionSet.getRestrictions().get(0);
        PredicateClassifier readingsClassifier = new PredicateClassifier(restrictionSet.getRestrictions(), PlanningContext.literalsOnly("test"), 10);
        VariableReferenceExpression column = new VariableReferenceExpression("ts", TIMESTAMP);

        // a date hashes differently from the timestamp at midnight of that day
        assertFalse(readingsClassifier.accept(new ComparisonExpression(EQUAL, column, new ConstantExpression(LocalDate.of(2020, 1, 1), DATE))));
        assertFalse(readingsClassifier.accept(new QuantifiedComparisonExpression(EQUAL, ANY, column, ConstantExpression.array(new ArrayType(DATE), LocalDate.of(2020, 1, 1)))));
        assertEquals(ts.getMatchedKeys(), Optional.empty());

        LocalDateTime midnight = LocalDateTime.of(2020, 1, 1, 0, 0);
        assertTrue(readingsClassifier.accept(new ComparisonExpression(EQUAL, column, new ConstantExpression(midnight, TIMESTAMP))));
        assertEquals(ts.getMatchedKeys(), Optional.of(ImmutableSet.of(partitioningFunction.apply(3, midnight))));
    }

    @Test
    public void testDeclaredColumnTypeWins()
    {
        // reference typed differently from the dimension it partitions on
        VariableReferenceExpression widened = new VariableReferenceExpression("device_id", BIGINT);
        assertFalse(classifier.accept(new ComparisonExpression(EQUAL, widened, bigint(7))));
        assertEquals(device.getMatchedKeys(), Optional.empty());
        assertTrue(classifier.accept(new ComparisonExpression(EQUAL, widened, integer(7))));
        assertEquals(device.getMatchedKeys(), Optional.of(ImmutableSet.of(7)));
    }

    private static ConstantExpression bigint(long value)
    {
        return new ConstantExpression(value, BIGINT);
    }

    private static ConstantExpression integer(int value)
    {
        return new ConstantExpression(value, INTEGER);
    }
}
