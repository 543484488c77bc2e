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

import static com.amazon.krcf.CommonUtils.checkState;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A node in a {@link RandomCutTree}. Leaf nodes hold a point and its mass
 * (number of copies); internal nodes hold a cut, the bounding box of all points
 * below them, and the total mass below them.
 */
public class Node implements INodeView {

    private final float[] leafPoint;
    private boolean pointSumEnabled;
    private float[] pointSum;
    private Node parent;
    private Node leftChild;
    private Node rightChild;
    private final Cut cut;
    private final BoundingBox boundingBox;
    private int mass;
    private HashMap<Long, Integer> sequenceIndexes;

    /**
     * Create a new internal node.
     *
     * @param leftChild   the left child
     * @param rightChild  the right child
     * @param cut         the cut separating the children
     * @param boundingBox the bounding box of all points below this node
     */
    public Node(final Node leftChild, final Node rightChild, final Cut cut, final BoundingBox boundingBox) {
        this.leftChild = leftChild;
        this.rightChild = rightChild;
        this.cut = cut;
        this.boundingBox = boundingBox;
        this.leafPoint = null;
    }

    /**
     * Create a new leaf node.
     *
     * @param leafPoint the point stored in this leaf
     */
    public Node(float[] leafPoint) {
        this.leafPoint = leafPoint;
        this.cut = null;
        this.boundingBox = new BoundingBox(leafPoint);
    }

    @Override
    public boolean isLeaf() {
        return leafPoint != null;
    }

    public Node getParent() {
        return parent;
    }

    protected void setParent(final Node parent) {
        this.parent = parent;
    }

    public Node getLeftChild() {
        return leftChild;
    }

    protected void setLeftChild(final Node leftChild) {
        checkState(!isLeaf(), "Cannot assign child to a leaf node");
        this.leftChild = leftChild;
    }

    public Node getRightChild() {
        return rightChild;
    }

    protected void setRightChild(final Node rightChild) {
        checkState(!isLeaf(), "Cannot assign child to a leaf node");
        this.rightChild = rightChild;
    }

    /**
     * Replace one of the children of this node.
     *
     * @param child       the current child
     * @param replacement its replacement
     */
    protected void replaceChild(Node child, Node replacement) {
        if (leftChild == child) {
            setLeftChild(replacement);
        } else {
            checkState(rightChild == child, "node is not a child of its parent");
            setRightChild(replacement);
        }
        replacement.setParent(this);
    }

    /**
     * @param point a point
     * @return the child the point descends into
     */
    public Node getChild(float[] point) {
        return cut.isLeft(point) ? leftChild : rightChild;
    }

    public Cut getCut() {
        return cut;
    }

    @Override
    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    @Override
    public IBoundingBoxView getSiblingBoundingBox(float[] point) {
        checkState(!isLeaf(), "a leaf has no children");
        return cut.isLeft(point) ? rightChild.getBoundingBox() : leftChild.getBoundingBox();
    }

    @Override
    public int getCutDimension() {
        checkState(!isLeaf(), "Not an internal node");
        return cut.getDimension();
    }

    @Override
    public double getCutValue() {
        checkState(!isLeaf(), "Not an internal node");
        return cut.getValue();
    }

    /**
     * @return a copy of the leaf point
     */
    @Override
    public float[] getLeafPoint() {
        checkState(isLeaf(), "Not a leaf node");
        return Arrays.copyOf(leafPoint, leafPoint.length);
    }

    /**
     * @return the point stored in this leaf, without copying
     */
    protected float[] getLeafPointReference() {
        return leafPoint;
    }

    public boolean leafPointEquals(float[] point) {
        return Arrays.equals(leafPoint, point);
    }

    @Override
    public int getMass() {
        return mass;
    }

    protected void setMass(int mass) {
        this.mass = mass;
    }

    protected void incrementMass() {
        mass++;
    }

    protected void decrementMass() {
        mass--;
    }

    @Override
    public float[] getPointSum() {
        if (!pointSumEnabled) {
            return null;
        }
        if (isLeaf()) {
            float[] sum = new float[leafPoint.length];
            for (int i = 0; i < sum.length; i++) {
                sum[i] = leafPoint[i] * mass;
            }
            return sum;
        }
        return Arrays.copyOf(pointSum, pointSum.length);
    }

    /**
     * Turn on point sums for this node. A leaf computes its sum on demand, an
     * internal node recomputes it from its children.
     */
    protected void enablePointSum() {
        pointSumEnabled = true;
        if (!isLeaf()) {
            pointSum = new float[boundingBox.getDimensions()];
            recomputePointSum();
        }
    }

    protected void recomputePointSum() {
        if (!pointSumEnabled || isLeaf()) {
            return;
        }
        float[] left = leftChild.getPointSum();
        float[] right = rightChild.getPointSum();
        for (int i = 0; i < pointSum.length; i++) {
            pointSum[i] = left[i] + right[i];
        }
    }

    protected void recomputeBoundingBox() {
        checkState(!isLeaf(), "leaf boxes are fixed");
        boundingBox.assignUnion(leftChild.getBoundingBox(), rightChild.getBoundingBox());
    }

    @Override
    public Map<Long, Integer> getSequenceIndexes() {
        return sequenceIndexes == null ? Collections.emptyMap() : Collections.unmodifiableMap(sequenceIndexes);
    }

    protected void addSequenceIndex(long sequenceIndex) {
        checkState(isLeaf(), "only leaves store sequence indexes");
        if (sequenceIndexes == null) {
            sequenceIndexes = new HashMap<>();
        }
        sequenceIndexes.merge(sequenceIndex, 1, Integer::sum);
    }

    /**
     * @param sequenceIndex a sequence index
     * @return false if the sequence index is not present in this leaf
     */
    protected boolean deleteSequenceIndex(long sequenceIndex) {
        if (sequenceIndexes == null || !sequenceIndexes.containsKey(sequenceIndex)) {
            return false;
        }
        int count = sequenceIndexes.get(sequenceIndex);
        if (count == 1) {
            sequenceIndexes.remove(sequenceIndex);
        } else {
            sequenceIndexes.put(sequenceIndex, count - 1);
        }
        return true;
    }
}
