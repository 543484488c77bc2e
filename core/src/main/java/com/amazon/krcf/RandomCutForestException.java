/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.krcf;

import lombok.Getter;

/**
 * The unchecked exception raised for every recoverable failure of the forest:
 * bad options, points of the wrong length, missing points in a tree, and
 * failures while writing or reading a persisted model. The {@link ErrorKind}
 * tells callers which of these happened.
 */
@Getter
public class RandomCutForestException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public RandomCutForestException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RandomCutForestException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
