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

/**
 * Hypertable Error Code
 *
 * @since 2021-03-02
 */
public enum HypertableErrorCode
{
    /**
     * Restriction set and hypertable disagree on the number of dimensions
     */
    DIMENSION_COUNT_MISMATCH(0),
    /**
     * Dimension of a kind chunk pruning does not know
     */
    UNKNOWN_DIMENSION_TYPE(1),
    /**
     * Constant value whose Java representation does not match its declared type
     */
    INVALID_CONSTANT(2);

    /**
     * Hypertable error code number
     */
    public static final int ERROR_CODE = 0x7F10_0000;

    private final int code;

    HypertableErrorCode(int code)
    {
        this.code = code + ERROR_CODE;
    }

    public int getCode()
    {
        return code;
    }
}
