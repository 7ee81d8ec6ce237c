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

import org.testng.annotations.Test;

import static io.hetu.core.spi.hypertable.HypertableErrorCode.DIMENSION_COUNT_MISMATCH;
import static io.hetu.core.spi.hypertable.HypertableErrorCode.INVALID_CONSTANT;
import static io.hetu.core.spi.hypertable.HypertableErrorCode.UNKNOWN_DIMENSION_TYPE;
import static org.testng.Assert.assertEquals;

public class TestHypertableException
{
    @Test
    public void testErrorCodes()
    {
        assertEquals(DIMENSION_COUNT_MISMATCH.getCode(), 0x7F10_0000);
        assertEquals(UNKNOWN_DIMENSION_TYPE.getCode(), 0x7F10_0001);
        assertEquals(INVALID_CONSTANT.getCode(), 0x7F10_0002);
    }

    @Test
    public void testMessage()
    {
        assertEquals(new HypertableException(DIMENSION_COUNT_MISMATCH, "2 != 3").getMessage(), "2 != 3");
        assertEquals(new HypertableException(INVALID_CONSTANT, null, new ArithmeticException("long overflow")).getMessage(), "long overflow");
        assertEquals(new HypertableException(UNKNOWN_DIMENSION_TYPE, null).getMessage(), "UNKNOWN_DIMENSION_TYPE");
    }
}
