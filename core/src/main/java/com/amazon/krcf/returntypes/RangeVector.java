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



package com.amazon.krcf.returntypes;

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Estimates together with an interval around each of them, as produced by
 * forecasting. For every index {@code lower[i] <= values[i] <= upper[i]}.
 */
public class RangeVector {

    public final float[] values;
    public final float[] upper;
    public final float[] lower;

    /**
     * @param dimensions the length of the three arrays, all zero
     */
    public RangeVector(int dimensions) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        values = new float[dimensions];
        upper = new float[dimensions];
        lower = new float[dimensions];
    }

    public RangeVector(float[] values, float[] upper, float[] lower) {
        checkNotNull(values, "values must not be null");
        checkNotNull(upper, "upper must not be null");
        checkNotNull(lower, "lower must not be null");
        int length = values.length;
        checkArgument(length > 0 && upper.length == length && lower.length == length,
                "values, upper and lower must have the same positive length");
        for (int i = 0; i < length; i++) {
            checkArgument(lower[i] <= values[i] && values[i] <= upper[i],
                    "value " + i + " lies outside its interval");
        }
        this.values = Arrays.copyOf(values, length);
        this.upper = Arrays.copyOf(upper, length);
        this.lower = Arrays.copyOf(lower, length);
    }

    public RangeVector copy() {
        return new RangeVector(values, upper, lower);
    }

    public int getDimensions() {
        return values.length;
    }

    @Override
    public String toString() {
        return "RangeVector(values=" + Arrays.toString(values) + ", upper=" + Arrays.toString(upper) + ", lower="
                + Arrays.toString(lower) + ")";
    }
}
