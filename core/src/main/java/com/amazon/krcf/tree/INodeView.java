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

import java.util.Map;

/**
 * The read-only view of a tree node handed to visitors.
 */
public interface INodeView {

    boolean isLeaf();

    int getMass();

    IBoundingBoxView getBoundingBox();

    /**
     * For an internal node, the bounding box of the child that the point does
     * not descend into.
     *
     * @param point the query point
     * @return the box of the sibling subtree
     */
    IBoundingBoxView getSiblingBoundingBox(float[] point);

    int getCutDimension();

    double getCutValue();

    float[] getLeafPoint();

    /**
     * @return the mass weighted sum of the points below this node, or null when
     *         point sums are not stored
     */
    float[] getPointSum();

    /**
     * @return for a leaf, the sequence indexes at which copies of the leaf point
     *         entered the tree, with their multiplicities; empty when sequence
     *         indexes are not stored
     */
    Map<Long, Integer> getSequenceIndexes();
}
