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



package com.amazon.krcf.inspect;

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkNotNull;
import static com.amazon.krcf.CommonUtils.toDoubleArray;

import java.util.ArrayList;
import java.util.Optional;
import java.util.TreeSet;

import com.amazon.krcf.MultiVisitor;
import com.amazon.krcf.returntypes.Neighbor;
import com.amazon.krcf.tree.INodeView;

/**
 * Finds the leaf of a tree closest to a query point in Euclidean distance.
 *
 * The search is a branch and bound: all copies of the visitor share the best
 * distance found so far, and a subtree is explored only if its bounding box
 * lies strictly closer than that. The path of the query is always followed, so
 * its leaf, which is usually close, is among the candidates.
 */
public class NearNeighborVisitor implements MultiVisitor<Optional<Neighbor>> {

    /**
     * Shared by a visitor and all its copies.
     */
    private static class Bound {
        private double limit;
        private boolean found;

        Bound(double limit) {
            this.limit = limit;
        }

        boolean admits(double distance) {
            return found ? distance < limit : distance <= limit;
        }
    }

    private final float[] query;
    private final Bound bound;
    private Neighbor neighbor;

    /**
     * @param query    the query point
     * @param maxRange only leaves within this distance are reported
     */
    public NearNeighborVisitor(float[] query, double maxRange) {
        checkNotNull(query, "query must not be null");
        checkArgument(maxRange >= 0, "maxRange must not be negative");
        this.query = query;
        this.bound = new Bound(maxRange);
    }

    public NearNeighborVisitor(float[] query) {
        this(query, Double.POSITIVE_INFINITY);
    }

    private NearNeighborVisitor(NearNeighborVisitor other) {
        this.query = other.query;
        this.bound = other.bound;
    }

    @Override
    public boolean shouldSplit(INodeView node) {
        return bound.admits(node.getSiblingBoundingBox(query).distanceTo(query));
    }

    @Override
    public void visitLeaf(INodeView leaf, int depth) {
        float[] point = leaf.getLeafPoint();
        double sum = 0;
        for (int i = 0; i < point.length; i++) {
            double diff = (double) query[i] - point[i];
            sum += diff * diff;
        }
        double distance = Math.sqrt(sum);
        if (bound.admits(distance)) {
            bound.limit = distance;
            bound.found = true;
            neighbor = new Neighbor(toDoubleArray(point), distance,
                    new ArrayList<>(new TreeSet<>(leaf.getSequenceIndexes().keySet())));
        }
    }

    @Override
    public void visit(INodeView node, int depth) {
    }

    @Override
    public MultiVisitor<Optional<Neighbor>> copy() {
        return new NearNeighborVisitor(this);
    }

    @Override
    public void merge(MultiVisitor<Optional<Neighbor>> other) {
        Neighbor candidate = ((NearNeighborVisitor) other).neighbor;
        if (candidate != null && (neighbor == null || candidate.distance < neighbor.distance)) {
            neighbor = candidate;
        }
    }

    @Override
    public Optional<Neighbor> getResult() {
        return Optional.ofNullable(neighbor);
    }
}
