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



package com.amazon.krcf.tree;

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkState;

import java.util.Arrays;

/**
 * An axis-aligned box given by its lowest and highest corner. The box of a
 * leaf shares the leaf point for both corners and can never change; every
 * other box owns its corners and is grown or reassigned in place as the tree
 * changes.
 */
public class BoundingBox implements IBoundingBoxView {

    private final float[] low;
    private final float[] high;
    private final boolean frozen;
    private double rangeSum;

    public BoundingBox(float[] point) {
        this(point, point, true);
    }

    /**
     * @param first  one corner
     * @param second the opposite corner
     */
    public BoundingBox(float[] first, float[] second) {
        this(new float[first.length], new float[first.length], false);
        checkArgument(first.length == second.length, "corners must have the same length");
        assign(first, first, second, second);
    }

    private BoundingBox(float[] low, float[] high, boolean frozen) {
        this.low = low;
        this.high = high;
        this.frozen = frozen;
    }

    /**
     * Set this box to the smallest box holding the two boxes given by their
     * corners.
     */
    private BoundingBox assign(float[] lowA, float[] highA, float[] lowB, float[] highB) {
        double sum = 0;
        for (int i = 0; i < low.length; i++) {
            low[i] = Math.min(lowA[i], lowB[i]);
            high[i] = Math.max(highA[i], highB[i]);
            sum += high[i] - low[i];
        }
        rangeSum = sum;
        return this;
    }

    private static float[] lowCorner(IBoundingBoxView box) {
        if (box instanceof BoundingBox) {
            return ((BoundingBox) box).low;
        }
        float[] corner = new float[box.getDimensions()];
        for (int i = 0; i < corner.length; i++) {
            corner[i] = (float) box.getMinValue(i);
        }
        return corner;
    }

    private static float[] highCorner(IBoundingBoxView box) {
        if (box instanceof BoundingBox) {
            return ((BoundingBox) box).high;
        }
        float[] corner = new float[box.getDimensions()];
        for (int i = 0; i < corner.length; i++) {
            corner[i] = (float) box.getMaxValue(i);
        }
        return corner;
    }

    private BoundingBox blank() {
        return new BoundingBox(new float[low.length], new float[low.length], false);
    }

    /**
     * @return a box with the same corners that can be changed in place
     */
    public BoundingBox copy() {
        return blank().assign(low, high, low, high);
    }

    @Override
    public BoundingBox getMergedBox(float[] point) {
        checkArgument(point.length == low.length, "point and box differ in length");
        return blank().assign(low, high, point, point);
    }

    @Override
    public BoundingBox getMergedBox(IBoundingBoxView otherBox) {
        checkArgument(otherBox.getDimensions() == low.length, "boxes differ in length");
        return blank().assign(low, high, lowCorner(otherBox), highCorner(otherBox));
    }

    /**
     * Grow this box so that it holds the point.
     *
     * @param point the point
     * @return this box
     */
    public BoundingBox extend(float[] point) {
        checkState(!frozen, "a leaf box cannot change");
        checkArgument(point.length == low.length, "point and box differ in length");
        return assign(low, high, point, point);
    }

    /**
     * Make this box the union of two others.
     *
     * @param first  a box
     * @param second another box
     * @return this box
     */
    public BoundingBox assignUnion(IBoundingBoxView first, IBoundingBoxView second) {
        checkState(!frozen, "a leaf box cannot change");
        return assign(lowCorner(first), highCorner(first), lowCorner(second), highCorner(second));
    }

    /**
     * @param point a point
     * @return the Euclidean distance from the point to the nearest point of the
     *         box, zero when the box holds the point
     */
    @Override
    public double distanceTo(float[] point) {
        checkArgument(point.length == low.length, "point and box differ in length");
        double sum = 0;
        for (int i = 0; i < low.length; i++) {
            double gap = Math.max(0.0, Math.max((double) low[i] - point[i], (double) point[i] - high[i]));
            sum += gap * gap;
        }
        return Math.sqrt(sum);
    }

    @Override
    public boolean contains(float[] point) {
        checkArgument(point.length == low.length, "point and box differ in length");
        for (int i = 0; i < low.length; i++) {
            if (point[i] < low[i] || point[i] > high[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int getDimensions() {
        return low.length;
    }

    @Override
    public double getRangeSum() {
        return rangeSum;
    }

    @Override
    public double getMinValue(int dimension) {
        return low[dimension];
    }

    @Override
    public double getMaxValue(int dimension) {
        return high[dimension];
    }

    @Override
    public double getRange(int dimension) {
        return (double) high[dimension] - low[dimension];
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BoundingBox)) {
            return false;
        }
        BoundingBox box = (BoundingBox) other;
        return Arrays.equals(low, box.low) && Arrays.equals(high, box.high);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(low) + Arrays.hashCode(high);
    }

    @Override
    public String toString() {
        return "BoundingBox(" + Arrays.toString(low) + ", " + Arrays.toString(high) + ")";
    }
}
