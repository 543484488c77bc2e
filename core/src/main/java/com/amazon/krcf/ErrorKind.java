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

/**
 * The closed set of failure categories reported through
 * {@link RandomCutForestException}.
 */
public enum ErrorKind {
    /**
     * A configuration value, query parameter or point coordinate is outside its
     * permitted range. Point coordinates must be finite as floats.
     */
    INVALID_OPTION,
    /**
     * A point does not have the length expected by the forest.
     */
    INVALID_DIMENSION,
    /**
     * A point that was expected in a tree could not be located.
     */
    NOT_FOUND,
    /**
     * A model could not be written to its persisted form.
     */
    SERIALIZATION,
    /**
     * A persisted model could not be read back.
     */
    DESERIALIZATION
}
