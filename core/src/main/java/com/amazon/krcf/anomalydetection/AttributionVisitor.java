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

import com.amazon.krcf.Visitor;
import com.amazon.krcf.returntypes.DiVector;
import com.amazon.krcf.tree.IBoundingBoxView;
import com.amazon.krcf.tree.INodeView;

/**
 * Splits the score of {@link ScoreVisitor} over the coordinates of the point
 * and the direction in which the point leaves each box. The entries of the
 * result add up to the score.
 *
 * A point equal to its leaf is explained against the sample without its own
 * copies: each ancestor is replaced by the union of the sibling boxes seen so
 * far, and the total is brought back to the damped score of the duplicate.
 */
public class AttributionVisitor implements Visitor<DiVector> {

    private final float[] point;
    private final int treeMass;
    private final ScoringRule rule;
    private final BoxGrowth growth;
    private final DiVector attribution;
    private boolean duplicate;
    private boolean settled;
    private double leafScore;
    private IBoundingBoxView siblings;

    public AttributionVisitor(float[] point, int treeMass, ScoringRule rule) {
        checkNotNull(point, "point must not be null");
        this.point = Arrays.copyOf(point, point.length);
        this.treeMass = treeMass;
        this.rule = checkNotNull(rule, "rule must not be null");
        this.growth = new BoxGrowth(this.point);
        this.attribution = new DiVector(point.length);
    }

    public AttributionVisitor(float[] point, int treeMass) {
        this(point, treeMass, ScoringRule.ANOMALY);
    }

    @Override
    public void visitLeaf(INodeView leaf, int depth) {
        growth.measure(leaf.getBoundingBox());
        int mass = leaf.getMass();
        duplicate = Arrays.equals(leaf.getLeafPoint(), point);
        leafScore = duplicate ? rule.damp(mass, treeMass) * rule.seen(depth, mass) : rule.unseen(depth, mass);

        if (duplicate || growth.getMergedRangeSum() <= 0) {
            Arrays.fill(attribution.high, leafScore / (2 * point.length));
            Arrays.fill(attribution.low, leafScore / (2 * point.length));
            growth.forget();
            return;
        }
        for (int i = 0; i < point.length; i++) {
            attribution.high[i] = leafScore * growth.upProbability(i);
            attribution.low[i] = leafScore * growth.downProbability(i);
        }
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
        } else {
            double contribution = rule.unseen(depth, node.getMass());
            for (int i = 0; i < point.length; i++) {
                attribution.high[i] = growth.upProbability(i) * contribution + (1 - p) * attribution.high[i];
                attribution.low[i] = growth.downProbability(i) * contribution + (1 - p) * attribution.low[i];
            }
        }

        if (duplicate && (settled || depth == 0)) {
            attribution.scaleTo(leafScore);
        }
    }

    @Override
    public DiVector getResult() {
        return attribution.copy().map(x -> rule.normalize(x, treeMass));
    }
}
