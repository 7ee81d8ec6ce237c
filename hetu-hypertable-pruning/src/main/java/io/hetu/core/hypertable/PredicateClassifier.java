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

import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import io.hetu.core.spi.hypertable.ComparisonStrategy;
import io.hetu.core.spi.hypertable.Dimension;
import io.hetu.core.spi.hypertable.relation.ComparisonExpression;
import io.hetu.core.spi.hypertable.relation.ConstantExpression;
import io.hetu.core.spi.hypertable.relation.OperatorType;
import io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression;
import io.hetu.core.spi.hypertable.relation.RowExpression;
import io.hetu.core.spi.hypertable.relation.VariableReferenceExpression;
import io.hetu.core.spi.hypertable.type.ArrayType;
import io.hetu.core.spi.hypertable.type.ScalarType;
import io.hetu.core.spi.hypertable.type.Type;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static io.hetu.core.spi.hypertable.DimensionType.DISCRETE;
import static io.hetu.core.spi.hypertable.relation.QuantifiedComparisonExpression.Quantifier.ALL;
import static java.util.Objects.requireNonNull;

/**
 * Decides whether a single predicate can restrict a partitioning dimension,
 * and if so folds it into that dimension's restriction.
 */
public class PredicateClassifier
{
    private static final Logger log = Logger.get(PredicateClassifier.class);

    private final Map<String, DimensionRestriction> restrictionsByColumn;
    private final PlanningContext context;
    private final int maxInListSize;

    public PredicateClassifier(List<DimensionRestriction> restrictions, PlanningContext context, int maxInListSize)
    {
        requireNonNull(restrictions, "restrictions is null");
        ImmutableMap.Builder<String, DimensionRestriction> byColumn = ImmutableMap.builder();
        for (DimensionRestriction restriction : restrictions) {
            byColumn.put(restriction.getDimension().getColumnName(), restriction);
        }
        this.restrictionsByColumn = byColumn.build();
        this.context = requireNonNull(context, "context is null");
        checkArgument(maxInListSize > 0, "maxInListSize must be positive");
        this.maxInListSize = maxInListSize;
    }

    /**
     * @return true if the predicate was incorporated into a dimension restriction
     */
    public boolean accept(RowExpression predicate)
    {
        requireNonNull(predicate, "predicate is null");
        if (!DeterminismEvaluator.isDeterministic(predicate)) {
            return reject(predicate, "not deterministic");
        }
        if (predicate instanceof ComparisonExpression) {
            return acceptComparison((ComparisonExpression) predicate);
        }
        if (predicate instanceof QuantifiedComparisonExpression) {
            return acceptQuantifiedComparison((QuantifiedComparisonExpression) predicate);
        }
        return reject(predicate, "not a comparison");
    }

    private boolean acceptComparison(ComparisonExpression predicate)
    {
        ComparisonExpression comparison = predicate;
        if (!isPartitioningColumn(comparison.getLeft()) && isPartitioningColumn(comparison.getRight())) {
            comparison = comparison.flip();
        }
        if (!isPartitioningColumn(comparison.getLeft())) {
            return reject(predicate, "no partitioning column");
        }
        VariableReferenceExpression column = (VariableReferenceExpression) comparison.getLeft();

        Optional<ConstantExpression> constant = context.getConstantFolder().fold(comparison.getRight());
        if (!constant.isPresent()) {
            return reject(predicate, "operand is not a constant");
        }
        if (constant.get().getType().isArray()) {
            return reject(predicate, "array operand in a plain comparison");
        }
        if (constant.get().isNull()) {
            return reject(predicate, "null operand");
        }

        ScalarType constantType = (ScalarType) constant.get().getType();
        Optional<ComparisonStrategy> strategy = resolveStrategy(comparison.getOperator(), restrictionOf(column).getDimension(), constantType);
        if (!strategy.isPresent()) {
            return reject(predicate, "no ordering operator for the column and operand types");
        }
        return fold(predicate, column, strategy.get(), PredicateValue.single(constant.get().getValue(), constantType));
    }

    private boolean acceptQuantifiedComparison(QuantifiedComparisonExpression predicate)
    {
        if (!isPartitioningColumn(predicate.getValue())) {
            return reject(predicate, "no partitioning column on the left");
        }
        VariableReferenceExpression column = (VariableReferenceExpression) predicate.getValue();

        Optional<ConstantExpression> constant = context.getConstantFolder().fold(predicate.getArray());
        if (!constant.isPresent()) {
            return reject(predicate, "operand is not a constant");
        }
        Type type = constant.get().getType();
        if (!type.isArray()) {
            return reject(predicate, "scalar operand in a quantified comparison");
        }
        if (constant.get().isNull()) {
            return reject(predicate, "null array");
        }
        List<?> elements = (List<?>) constant.get().getValue();
        if (elements.size() > maxInListSize) {
            return reject(predicate, "array has more than " + maxInListSize + " elements");
        }

        ScalarType elementType = ((ArrayType) type).getElementType();
        Optional<ComparisonStrategy> strategy = resolveStrategy(predicate.getOperator(), restrictionOf(column).getDimension(), elementType);
        if (!strategy.isPresent()) {
            return reject(predicate, "no ordering operator for the column and operand types");
        }
        PredicateValue.Combinator combinator = predicate.getQuantifier() == ALL ? PredicateValue.Combinator.AND : PredicateValue.Combinator.OR;
        return fold(predicate, column, strategy.get(), PredicateValue.fromArray(elements, elementType, combinator));
    }

    private boolean fold(RowExpression predicate, VariableReferenceExpression column, ComparisonStrategy strategy, PredicateValue value)
    {
        DimensionRestriction restriction = restrictionOf(column);
        if (!restriction.fold(strategy, value)) {
            return reject(predicate, "does not tighten " + restriction);
        }
        log.debug("Query %s: folded %s into %s", context.getQueryId(), predicate, restriction);
        return true;
    }

    /**
     * Maps the operator to a strategy of the dimension column's ordering family.
     * The constant must belong to the same family as the column. Partition keys
     * of a discrete dimension are computed from the constant as it is, so there
     * the constant must have exactly the column's type.
     */
    static Optional<ComparisonStrategy> resolveStrategy(OperatorType operator, Dimension dimension, ScalarType constantType)
    {
        ScalarType columnType = dimension.getColumnType();
        if (!columnType.getOperatorFamily().isComparable() || columnType.getOperatorFamily() != constantType.getOperatorFamily()) {
            return Optional.empty();
        }
        if (dimension.getType() == DISCRETE && columnType != constantType) {
            return Optional.empty();
        }
        return ComparisonStrategy.fromOperator(operator);
    }

    private DimensionRestriction restrictionOf(VariableReferenceExpression column)
    {
        return restrictionsByColumn.get(column.getName());
    }

    private boolean isPartitioningColumn(RowExpression expression)
    {
        return expression instanceof VariableReferenceExpression &&
                restrictionsByColumn.containsKey(((VariableReferenceExpression) expression).getName());
    }

    private boolean reject(RowExpression predicate, String reason)
    {
        log.debug("Query %s: predicate %s not used for chunk pruning: %s", context.getQueryId(), predicate, reason);
        return false;
    }
}
