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
import static com.amazon.krcf.CommonUtils.checkState;

import java.util.Arrays;

import com.amazon.krcf.Visitor;
import com.amazon.krcf.tree.INodeView;

/**
 * Scores a point against one tree under a {@link ScoringRule}. Once a box on
 * the path holds the point, the boxes above it hold it too and leave the score
 * unchanged, so the walk stops contributing there.
 */
public class ScoreVisitor implements Visitor<Double> {

    private final float[] point;
    private final int treeMass;
    private final ScoringRule rule;
    private final BoxGrowth growth;
    private boolean settled;
    private double score;

    public ScoreVisitor(float[] point, int treeMass, ScoringRule rule) {
        checkNotNull(point, "point must not be null");
        this.point = Arrays.copyOf(point, point.length);
        this.treeMass = treeMass;
        this.rule = checkNotNull(rule, "rule must not be null");
        this.growth = new BoxGrowth(this.point);
    }

    public static ScoreVisitor anomaly(float[] point, int treeMass) {
        return new ScoreVisitor(point, treeMass, ScoringRule.ANOMALY);
    }

    public static ScoreVisitor displacement(float[] point, int treeMass) {
        return new ScoreVisitor(point, treeMass, ScoringRule.DISPLACEMENT);
    }

    @Override
    public void visitLeaf(INodeView leaf, int depth) {
        int mass = leaf.getMass();
        if (Arrays.equals(leaf.getLeafPoint(), point)) {
            settled = true;
            score = rule.damp(mass, treeMass) * rule.seen(depth, mass);
        } else {
            score = rule.unseen(depth, mass);
        }
    }

    @Override
    public void visit(INodeView node, int depth) {
        if (settled) {
            return;
        }
        double p = growth.measure(node.getBoundingBox());
        // an internal node always spans two distinct points
        checkState(growth.getMergedRangeSum() > 0, "internal node with an empty box");
        if (p <= 0) {
            settled = true;
            return;
        }
        score = p * rule.unseen(depth, node.getMass()) + (1 - p) * score;
    }

    @Override
    public Double getResult() {
        return rule.normalize(score, treeMass);
    }
}
