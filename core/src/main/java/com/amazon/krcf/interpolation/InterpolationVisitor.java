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



package com.amazon.krcf.interpolation;

import static com.amazon.krcf.CommonUtils.checkNotNull;

import java.util.Arrays;

import com.amazon.krcf.Visitor;
import com.amazon.krcf.anomalydetection.BoxGrowth;
import com.amazon.krcf.returntypes.DensityEstimate;
import com.amazon.krcf.returntypes.DiVector;
import com.amazon.krcf.tree.IBoundingBoxView;
import com.amazon.krcf.tree.INodeView;

/**
 * Interpolates the sample of one tree around a query point. Walking from the
 * leaf to the root, each box on the path is cut at random: in every coordinate
 * and direction the probability that the cut isolates the query is recorded,
 * weighted by the mass on the far side of the cut and by the width crossed.
 * A query equal to its leaf is interpolated against the sibling boxes, as in
 * {@link com.amazon.krcf.anomalydetection.AttributionVisitor}.
 */
public class InterpolationVisitor implements Visitor<DensityEstimate> {

    private final float[] point;
    private final double pointMass;
    private final DensityEstimate estimate;
    private final BoxGrowth growth;
    private boolean duplicate;
    private boolean settled;
    private double ownMass;
    private IBoundingBoxView siblings;

    /**
     * @param point      the query point
     * @param sampleSize the sample size of the tree
     * @param pointMass  the mass given to the query point itself
     */
    public InterpolationVisitor(float[] point, int sampleSize, double pointMass) {
        checkNotNull(point, "point must not be null");
        this.point = Arrays.copyOf(point, point.length);
        this.pointMass = pointMass;
        this.estimate = new DensityEstimate(point.length, sampleSize);
        this.growth = new BoxGrowth(this.point);
    }

    public InterpolationVisitor(float[] point, int sampleSize) {
        this(point, sampleSize, 1.0);
    }

    @Override
    public void visitLeaf(INodeView leaf, int depth) {
        IBoundingBoxView box = leaf.getBoundingBox();
        if (growth.measure(box) <= 0) {
            duplicate = true;
            ownMass = pointMass + leaf.getMass();
            double half = 0.5 / point.length;
            Arrays.fill(estimate.measure.high, half * ownMass);
            Arrays.fill(estimate.measure.low, half * ownMass);
            Arrays.fill(estimate.probMass.high, half);
            Arrays.fill(estimate.probMass.low, half);
            growth.forget();
            return;
        }
        ownMass = pointMass;
        record(box, leaf.getMass(), 0.0);
    }

    @Override
    public void visit(INodeView node, int depth) {
        if (settled) {
            return;
        }
        IBoundingBoxView box = node.getBoundingBox();
        if (duplicate) {
            IBoundingBoxView sibling = node.getSiblingBoundingBox(point);
            siblings = siblings == null ? sibling : siblings.getMergedBox(sibling);
            box = siblings;
        }
        double p = growth.measure(box);
        if (p <= 0) {
            settled = true;
            return;
        }
        record(box, node.getMass(), 1 - p);
    }

    /**
     * Blend the last measurement into the estimate, keeping {@code keep} of what
     * was there.
     */
    private void record(IBoundingBoxView box, int mass, double keep) {
        double field = mass + ownMass;
        DiVector measure = estimate.measure;
        DiVector distances = estimate.distances;
        DiVector probMass = estimate.probMass;
        for (int i = 0; i < point.length; i++) {
            double upward = growth.upProbability(i);
            double downward = growth.downProbability(i);
            double upWidth = growth.getUp(i) > 0 ? growth.getUp(i) + box.getRange(i) : 0;
            double downWidth = growth.getUp(i) <= 0 && growth.getDown(i) > 0 ? growth.getDown(i) + box.getRange(i)
                    : 0;

            probMass.high[i] = upward + keep * probMass.high[i];
            measure.high[i] = upward * field + keep * measure.high[i];
            distances.high[i] = upward * upWidth + keep * distances.high[i];

            probMass.low[i] = downward + keep * probMass.low[i];
            measure.low[i] = downward * field + keep * measure.low[i];
            distances.low[i] = downward * downWidth + keep * distances.low[i];
        }
    }

    @Override
    public DensityEstimate getResult() {
        return estimate;
    }
}
