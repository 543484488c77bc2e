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



package com.amazon.krcf.anomalydetection;

import static com.amazon.krcf.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.krcf.tree.IBoundingBoxView;

/**
 * How much a box grows in every coordinate and direction when a point is
 * merged into it, and from that the probability that a random cut of the
 * merged box isolates the point.
 *
 * Along a leaf-to-root path the boxes only get larger, so a coordinate found
 * inside one box is inside all later ones and is skipped from then on. Call
 * {@link #forget()} before measuring boxes that do not nest.
 */
public class BoxGrowth {

    private final float[] point;
    private final boolean[] inside;
    private final double[] up;
    private final double[] down;
    private double mergedRangeSum;
    private double growthSum;

    public BoxGrowth(float[] point) {
        this.point = checkNotNull(point, "point must not be null");
        inside = new boolean[point.length];
        up = new double[point.length];
        down = new double[point.length];
    }

    /**
     * @param box a box
     * @return the probability that a random cut of the box merged with the point
     *         separates the point, 0 for a box holding the point
     */
    public double measure(IBoundingBoxView box) {
        mergedRangeSum = 0;
        growthSum = 0;
        for (int i = 0; i < point.length; i++) {
            double min = box.getMinValue(i);
            double max = box.getMaxValue(i);
            up[i] = 0;
            down[i] = 0;
            if (!inside[i]) {
                if (point[i] > max) {
                    up[i] = point[i] - max;
                } else if (point[i] < min) {
                    down[i] = min - point[i];
                } else {
                    inside[i] = true;
                }
            }
            growthSum += up[i] + down[i];
            mergedRangeSum += (max - min) + up[i] + down[i];
        }
        return getSeparationProbability();
    }

    public double getSeparationProbability() {
        return mergedRangeSum > 0 ? growthSum / mergedRangeSum : 0;
    }

    public double getMergedRangeSum() {
        return mergedRangeSum;
    }

    /**
     * @param i a coordinate
     * @return the probability of a cut isolating the point from above in that
     *         coordinate, from the last measurement
     */
    public double upProbability(int i) {
        return mergedRangeSum > 0 ? up[i] / mergedRangeSum : 0;
    }

    public double downProbability(int i) {
        return mergedRangeSum > 0 ? down[i] / mergedRangeSum : 0;
    }

    public double getUp(int i) {
        return up[i];
    }

    public double getDown(int i) {
        return down[i];
    }

    public void forget() {
        Arrays.fill(inside, false);
    }

    /**
     * @param box   a box
     * @param point a point
     * @return the probability that a random cut of the box merged with the point
     *         separates the point
     */
    public static double separationProbability(IBoundingBoxView box, float[] point) {
        return new BoxGrowth(point).measure(box);
    }
}
