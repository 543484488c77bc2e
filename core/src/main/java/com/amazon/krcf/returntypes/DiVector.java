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
import java.util.function.DoubleUnaryOperator;

/**
 * A pair of per-coordinate quantities, one for each direction. In an anomaly
 * attribution {@code high[i]} is the part of the score explained by coordinate
 * {@code i} being larger than the sample around it, and {@code low[i]} the
 * part explained by it being smaller.
 */
public class DiVector {

    public final double[] high;
    public final double[] low;

    public DiVector(int dimensions) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        high = new double[dimensions];
        low = new double[dimensions];
    }

    public DiVector(double[] high, double[] low) {
        checkNotNull(high, "high must not be null");
        checkNotNull(low, "low must not be null");
        checkArgument(high.length > 0 && high.length == low.length,
                "high and low must have the same positive length");
        this.high = Arrays.copyOf(high, high.length);
        this.low = Arrays.copyOf(low, low.length);
    }

    public DiVector copy() {
        return new DiVector(high, low);
    }

    public int getDimensions() {
        return high.length;
    }

    /**
     * Add another vector to this one.
     *
     * @param other a vector of the same length, left unchanged
     * @return this vector
     */
    public DiVector add(DiVector other) {
        checkNotNull(other, "other must not be null");
        checkArgument(other.getDimensions() == getDimensions(), "dimensions must be the same");
        for (int i = 0; i < high.length; i++) {
            high[i] += other.high[i];
            low[i] += other.low[i];
        }
        return this;
    }

    /**
     * Apply a function to every entry in place.
     *
     * @param function the function
     * @return this vector
     */
    public DiVector map(DoubleUnaryOperator function) {
        for (int i = 0; i < high.length; i++) {
            high[i] = function.applyAsDouble(high[i]);
            low[i] = function.applyAsDouble(low[i]);
        }
        return this;
    }

    /**
     * @param factor a multiplier
     * @return a scaled copy
     */
    public DiVector scale(double factor) {
        return copy().map(x -> x * factor);
    }

    /**
     * Rescale in place so that the entries sum to {@code total}. A vector that
     * sums to zero is left as it is.
     *
     * @param total the new sum
     */
    public void scaleTo(double total) {
        double sum = getHighLowSum();
        if (sum > 0) {
            map(x -> x * total / sum);
        }
    }

    public double getHighLowSum(int i) {
        return high[i] + low[i];
    }

    public double getHighLowSum() {
        double sum = 0;
        for (int i = 0; i < high.length; i++) {
            sum += high[i] + low[i];
        }
        return sum;
    }

    @Override
    public String toString() {
        return "DiVector(high=" + Arrays.toString(high) + ", low=" + Arrays.toString(low) + ")";
    }
}
