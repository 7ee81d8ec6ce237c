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

import com.google.common.collect.ImmutableList;
import io.airlift.json.JsonCodec;
import org.testng.annotations.Test;

import java.util.OptionalInt;

import static io.airlift.json.JsonCodec.jsonCodec;
import static io.hetu.core.spi.hypertable.DimensionType.DISCRETE;
import static io.hetu.core.spi.hypertable.DimensionType.RANGE;
import static io.hetu.core.spi.hypertable.type.ScalarType.BIGINT;
import static io.hetu.core.spi.hypertable.type.ScalarType.INTEGER;
import static io.hetu.core.spi.hypertable.type.ScalarType.TIMESTAMP;
import static io.hetu.core.spi.hypertable.type.ScalarType.VARCHAR;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestHypertable
{
    private static final JsonCodec<Hypertable> HYPERTABLE_CODEC = jsonCodec(Hypertable.class);

    private static final Hypertable CONDITIONS = new Hypertable(7, "conditions", ImmutableList.of(
            Dimension.rangeDimension(1, "time", TIMESTAMP),
            Dimension.discreteDimension(2, "location", VARCHAR, 4)));

    @Test
    public void testDimensions()
    {
        assertEquals(CONDITIONS.getNumberOfDimensions(), 2);
        assertEquals(CONDITIONS.getDimensionByColumn("location").get().getType(), DISCRETE);
        assertEquals(CONDITIONS.getDimensionByColumn("location").get().getNumberOfPartitions(), OptionalInt.of(4));
        assertEquals(CONDITIONS.getDimensionByColumn("time").get().getType(), RANGE);
        assertFalse(CONDITIONS.getDimensionByColumn("temperature").isPresent());
    }

    @Test
    public void testJson()
    {
        assertEquals(HYPERTABLE_CODEC.fromJson(HYPERTABLE_CODEC.toJson(CONDITIONS)), CONDITIONS);
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "hypertable empty has no dimensions")
    public void testNoDimensions()
    {
        new Hypertable(1, "empty", ImmutableList.of());
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "duplicate dimension id 1 in hypertable metrics")
    public void testDuplicateDimensionId()
    {
        new Hypertable(1, "metrics", ImmutableList.of(
                Dimension.rangeDimension(1, "time", BIGINT),
                Dimension.discreteDimension(1, "device_id", INTEGER, 2)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class, expectedExceptionsMessageRegExp = "column time partitions hypertable metrics twice")
    public void testDuplicateColumn()
    {
        new Hypertable(1, "metrics", ImmutableList.of(
                Dimension.rangeDimension(1, "time", BIGINT),
                Dimension.discreteDimension(2, "time", BIGINT, 2)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRangeDimensionOverText()
    {
        Dimension.rangeDimension(1, "name", VARCHAR);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDiscreteDimensionWithoutPartitions()
    {
        Dimension.discreteDimension(1, "device_id", INTEGER, 0);
    }

    @Test
    public void testSlice()
    {
        Slice slice = new Slice(3, 1, 100, 200);
        assertTrue(slice.contains(100));
        assertTrue(slice.contains(199));
        assertFalse(slice.contains(200));
        assertEquals(slice, new Slice(3, 1, 0, 1));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptySlice()
    {
        new Slice(3, 1, 100, 100);
    }
}
