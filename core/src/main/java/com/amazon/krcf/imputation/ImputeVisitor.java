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



package com.amazon.krcf.imputation;

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.krcf.MultiVisitor;
import com.amazon.krcf.anomalydetection.BoxGrowth;
import com.amazon.krcf.anomalydetection.ScoringRule;
import com.amazon.krcf.tree.INodeView;

/**
 * Fills the missing coordinates of a point from the sample of one tree. The
 * visitor branches at every cut on a missing coordinate, since the missing
 * value could lie on either side; every leaf reached proposes its own values
 * for the missing coordinates. Proposals are ranked by the anomaly score of
 * the completed point and the lowest rank wins. On a tie the branch explored
 * first, the left one, wins.
 */
public class ImputeVisitor implements MultiVisitor<float[]> {

    private final float[] point;
    private final boolean[] missing;
    private double rank = Double.MAX_VALUE;
    private double distance = Double.MAX_VALUE;

    /**
     * @param point          the point, with arbitrary values at the missing
     *                       indexes
     * @param missingIndexes the indexes to fill
     */
    public ImputeVisitor(float[] point, int[] missingIndexes) {
        checkNotNull(point, "point must not be null");
        checkNotNull(missingIndexes, "missingIndexes must not be null");
        this.point = Arrays.copyOf(point, point.length);
        this.missing = new boolean[point.length];
        for (int index : missingIndexes) {
            checkArgument(index >= 0 && index < point.length, "missing index " + index + " is outside the point");
            missing[index] = true;
        }
    }

    private ImputeVisitor(ImputeVisitor other) {
        this.point = Arrays.copyOf(other.point, other.point.length);
        this.missing = other.missing;
    }

    @Override
    public boolean shouldSplit(INodeView node) {
        return missing[node.getCutDimension()];
    }

    @Override
    public void visitLeaf(INodeView leaf, int depth) {
        float[] leafPoint = leaf.getLeafPoint();
        double gap = 0;
        for (int i = 0; i < point.length; i++) {
            if (missing[i]) {
                point[i] = leafPoint[i];
            } else {
                gap += Math.abs(point[i] - leafPoint[i]);
            }
        }
        distance = gap;
        if (gap > 0) {
            rank = ScoringRule.ANOMALY.unseen(depth, leaf.getMass());
        } else {
            rank = depth == 0 ? 0 : ScoringRule.ANOMALY.seen(depth, leaf.getMass());
        }
    }

    @Override
    public void visit(INodeView node, int depth) {
        double p = BoxGrowth.separationProbability(node.getBoundingBox(), point);
        if (p > 0) {
            rank = p * ScoringRule.ANOMALY.unseen(depth, node.getMass()) + (1 - p) * rank;
        }
    }

    @Override
    public MultiVisitor<float[]> copy() {
        return new ImputeVisitor(this);
    }

    @Override
    public void merge(MultiVisitor<float[]> other) {
        ImputeVisitor right = (ImputeVisitor) other;
        if (right.rank < rank) {
            System.arraycopy(right.point, 0, point, 0, point.length);
            rank = right.rank;
            distance = right.distance;
        }
    }

    /**
     * @return the point with its missing coordinates filled in
     */
    @Override
    public float[] getResult() {
        return Arrays.copyOf(point, point.length);
    }

    /**
     * @return the unnormalized anomaly score of the completed point
     */
    public double getRank() {
        return rank;
    }

    /**
     * @return the L1 distance between the present coordinates and the chosen leaf
     */
    public double getDistance() {
        return distance;
    }
}
