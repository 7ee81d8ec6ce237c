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

import static java.util.Objects.requireNonNull;

/**
 * Internal error raised when chunk pruning detects a broken invariant.
 * It aborts planning of the current query and is never used for predicates
 * that simply cannot be used for pruning.
 */
public class HypertableException
        extends RuntimeException
{
    private final HypertableErrorCode errorCode;

    public HypertableException(HypertableErrorCode errorCode, String message)
    {
        this(errorCode, message, null);
    }

    public HypertableException(HypertableErrorCode errorCode, String message, Throwable cause)
    {
        super(message, cause);
        this.errorCode = requireNonNull(errorCode, "errorCode is null");
    }

    public HypertableErrorCode getErrorCode()
    {
        return errorCode;
    }

    @Override
    public String getMessage()
    {
        String message = super.getMessage();
        if (message == null && getCause() != null) {
            message = getCause().getMessage();
        }
        if (message == null) {
            message = errorCode.name();
        }
        return message;
    }
}
