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
import static com.amazon.krcf.CommonUtils.checkNotNull;
import static com.amazon.krcf.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import com.amazon.krcf.ErrorKind;
import com.amazon.krcf.IMultiVisitorFactory;
import com.amazon.krcf.IVisitorFactory;
import com.amazon.krcf.MultiVisitor;
import com.amazon.krcf.RandomCutForestException;
import com.amazon.krcf.Visitor;

/**
 * A Random Cut Tree is a tree data structure whose leaves represent points
 * inserted into the tree and whose interior nodes represent regions of space
 * defined by Bounding Boxes and Cuts. New nodes and leaves are added to the
 * tree by making random cuts. See {@link #addPoint} for details.
 *
 * The main use of this class is to be updated with points sampled from a
 * stream, and to define traversal methods. Users can then implement a
 * {@link Visitor} which can be submitted to a traversal method in order to
 * compute a statistic from the tree.
 *
 * All randomness is drawn from a seed that is replaced after every insertion,
 * so the shape of the tree is a function of the initial seed and of the
 * sequence of insertions and deletions.
 */
public class RandomCutTree {

    private final int dimension;
    private final boolean storeSequenceIndexesEnabled;
    private final boolean centerOfMassEnabled;
    private final Random testRandom;
    private long randomSeed;
    private Node root;

    protected RandomCutTree(Builder<?> builder) {
        checkArgument(builder.dimension > 0, "dimension must be greater than 0");
        this.dimension = builder.dimension;
        this.storeSequenceIndexesEnabled = builder.storeSequenceIndexesEnabled;
        this.centerOfMassEnabled = builder.centerOfMassEnabled;
        this.testRandom = builder.random;
        this.randomSeed = builder.randomSeed;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Return a cut chosen uniformly at random from the union of the box and the
     * point. The dimension is chosen with probability proportional to its range in
     * the union, and the value uniformly within that range.
     *
     * @param factor a uniform number in [0, 1)
     * @param point  the point being inserted
     * @param box    the box being merged with the point
     * @return a new Cut corresponding to a random cut in the merged box
     */
    protected Cut randomCut(double factor, float[] point, IBoundingBoxView box) {
        double range = 0.0;

        for (int i = 0; i < point.length; i++) {
            float minValue = (float) box.getMinValue(i);
            float maxValue = (float) box.getMaxValue(i);
            if (point[i] < minValue) {
                minValue = point[i];
            } else if (point[i] > maxValue) {
                maxValue = point[i];
            }
            range += maxValue - minValue;
        }

        checkArgument(range > 0, "the union of the box and the point is a single point");

        double breakPoint = factor * range;

        for (int i = 0; i < point.length; i++) {
            float minValue = (float) box.getMinValue(i);
            float maxValue = (float) box.getMaxValue(i);
            if (point[i] < minValue) {
                minValue = point[i];
            } else if (point[i] > maxValue) {
                maxValue = point[i];
            }
            double gap = maxValue - minValue;
            if (breakPoint <= gap && gap > 0) {
                float cutValue = (float) (minValue + breakPoint);

                // cuts must lie in [minValue, maxValue) so that both sides are non-empty
                if ((cutValue >= maxValue) && (minValue < maxValue)) {
                    cutValue = Math.nextAfter(maxValue, minValue);
                }
                return new Cut(i, cutValue);
            }
            breakPoint -= gap;
        }

        // rounding left the break point past the last range; use the last
        // dimension with a positive range
        for (int i = point.length - 1; i >= 0; i--) {
            float minValue = (float) Math.min(box.getMinValue(i), point[i]);
            float maxValue = (float) Math.max(box.getMaxValue(i), point[i]);
            if (maxValue > minValue) {
                return new Cut(i, Math.nextAfter(maxValue, minValue));
            }
        }

        throw new IllegalStateException("The break point did not lie inside the expected range");
    }

    /**
     * Add a new point to the tree.
     *
     * The path from the root to the leaf the point falls into is followed. If the
     * leaf holds an equal point, the leaf and its ancestors gain one unit of mass
     * and the existing reference is returned. Otherwise, starting with the leaf and
     * moving up, a random cut is drawn on the union of the point and the current
     * box; the highest node whose cut separates the point from the box is
     * remembered. The walk stops at the first box that already contains the point
     * or at the root. A new internal node holding the remembered cut is spliced in
     * above the remembered node, with a new leaf for the point as its other child.
     *
     * @param point         the point to add
     * @param sequenceIndex the sequence index of the point
     * @return the reference stored in the tree
     */
    public float[] addPoint(float[] point, long sequenceIndex) {
        checkNotNull(point, "point must not be null");
        checkArgument(point.length == dimension, "point has the wrong number of dimensions");

        if (root == null) {
            root = newLeaf(point, 1);
            addSequenceIndex(root, sequenceIndex);
            return point;
        }

        List<Node> pathToLeaf = getPath(point);
        Node leafNode = pathToLeaf.get(pathToLeaf.size() - 1);

        if (leafNode.leafPointEquals(point)) {
            leafNode.incrementMass();
            addSequenceIndex(leafNode, sequenceIndex);
            for (int i = pathToLeaf.size() - 2; i >= 0; i--) {
                Node node = pathToLeaf.get(i);
                node.incrementMass();
                node.recomputePointSum();
            }
            return leafNode.getLeafPointReference();
        }

        Random rng = nextRandom();
        int index = pathToLeaf.size() - 1;
        Node node = leafNode;
        BoundingBox currentBox = leafNode.getBoundingBox();
        Node savedNode = null;
        Cut savedCut = null;
        BoundingBox savedBox = null;

        while (true) {
            double factor = rng.nextDouble();
            Cut cut = randomCut(factor, point, currentBox);
            int dim = cut.getDimension();
            double value = cut.getValue();

            boolean separation = (point[dim] <= value && value < currentBox.getMinValue(dim))
                    || (point[dim] > value && value >= currentBox.getMaxValue(dim));

            if (separation) {
                savedNode = node;
                savedCut = cut;
                savedBox = currentBox;
            }
            checkState(savedNode != null, "cut failed to separate the point from its leaf");

            if (currentBox.contains(point) || index == 0) {
                break;
            }
            index--;
            node = pathToLeaf.get(index);
            currentBox = node.getBoundingBox();
        }

        Node parent = savedNode.getParent();
        Node leaf = newLeaf(point, 1);
        addSequenceIndex(leaf, sequenceIndex);
        BoundingBox mergedBox = savedBox.getMergedBox(point);
        Node mergedNode;
        if (savedCut.isLeft(point)) {
            mergedNode = new Node(leaf, savedNode, savedCut, mergedBox);
        } else {
            mergedNode = new Node(savedNode, leaf, savedCut, mergedBox);
        }
        mergedNode.setMass(savedNode.getMass() + 1);
        leaf.setParent(mergedNode);
        savedNode.setParent(mergedNode);
        if (centerOfMassEnabled) {
            mergedNode.enablePointSum();
        }

        if (parent == null) {
            root = mergedNode;
        } else {
            parent.replaceChild(savedNode, mergedNode);
            for (Node ancestor = parent; ancestor != null; ancestor = ancestor.getParent()) {
                ancestor.incrementMass();
                ancestor.getBoundingBox().extend(point);
                ancestor.recomputePointSum();
            }
        }
        return point;
    }

    /**
     * Delete one copy of the point from the tree. When the mass of its leaf drops
     * to zero, the leaf and its parent are removed and the sibling of the leaf
     * takes the place of the parent; the bounding boxes of the remaining ancestors
     * are recomputed.
     *
     * @param point         the point to delete
     * @param sequenceIndex the sequence index the point was added with
     * @return the reference stored in the tree
     * @throws RandomCutForestException of kind {@link ErrorKind#NOT_FOUND} if the
     *                                  point is not a leaf of this tree
     */
    public float[] deletePoint(float[] point, long sequenceIndex) {
        checkNotNull(point, "point must not be null");
        if (root == null) {
            throw new RandomCutForestException(ErrorKind.NOT_FOUND, "cannot delete a point from an empty tree");
        }

        List<Node> pathToLeaf = getPath(point);
        Node leafNode = pathToLeaf.get(pathToLeaf.size() - 1);
        if (!leafNode.leafPointEquals(point)) {
            throw new RandomCutForestException(ErrorKind.NOT_FOUND, "point to delete is not present in the tree");
        }
        if (storeSequenceIndexesEnabled && !leafNode.deleteSequenceIndex(sequenceIndex)) {
            throw new RandomCutForestException(ErrorKind.NOT_FOUND,
                    "sequence index " + sequenceIndex + " is not present in the tree");
        }

        leafNode.decrementMass();
        if (leafNode.getMass() > 0) {
            for (int i = pathToLeaf.size() - 2; i >= 0; i--) {
                Node node = pathToLeaf.get(i);
                node.decrementMass();
                node.recomputePointSum();
            }
            return leafNode.getLeafPointReference();
        }

        Node parent = leafNode.getParent();
        if (parent == null) {
            root = null;
            return leafNode.getLeafPointReference();
        }

        Node sibling = (parent.getLeftChild() == leafNode) ? parent.getRightChild() : parent.getLeftChild();
        Node grandParent = parent.getParent();
        if (grandParent == null) {
            root = sibling;
            sibling.setParent(null);
        } else {
            grandParent.replaceChild(parent, sibling);
            for (Node ancestor = grandParent; ancestor != null; ancestor = ancestor.getParent()) {
                ancestor.decrementMass();
                ancestor.recomputeBoundingBox();
                ancestor.recomputePointSum();
            }
        }
        return leafNode.getLeafPointReference();
    }

    /**
     * Starting from the root, traverse the canonical path to a leaf node and visit
     * the nodes along the path. The canonical path is determined by the input
     * point: at each interior node, we select the child node by comparing the
     * node's {@link Cut} to the corresponding coordinate value in the input point.
     * The method recursively traverses to the leaf node first and then invokes the
     * visitor on each node in reverse order. That is, if the path to the leaf node
     * determined by the input point is root, node1, node2, ..., nodeN, leaf; then
     * we will first invoke visitor::visitLeaf on the leaf node, and then we will
     * invoke visitor::visit on nodeN, ..., node1, and root.
     *
     * An empty tree visits nothing and returns the initial result of the visitor.
     *
     * @param point          A point which determines the traversal path from the
     *                       root to a leaf node.
     * @param visitorFactory A factory for the visitor invoked on each node of the
     *                       path.
     * @param <R>            The return type of the Visitor.
     * @return the value of {@link Visitor#getResult()}} after the traversal.
     */
    public <R> R traverse(float[] point, IVisitorFactory<R> visitorFactory) {
        checkNotNull(point, "point must not be null");
        checkNotNull(visitorFactory, "visitorFactory must not be null");
        Visitor<R> visitor = visitorFactory.newVisitor(this, point);
        if (root != null) {
            traversePathToLeafAndVisitNodes(point, visitor, root, 0);
        }
        return visitor.getResult();
    }

    private <R> void traversePathToLeafAndVisitNodes(float[] point, Visitor<R> visitor, Node node, int depthOfNode) {
        if (node.isLeaf()) {
            visitor.visitLeaf(node, depthOfNode);
        } else {
            traversePathToLeafAndVisitNodes(point, visitor, node.getChild(point), depthOfNode + 1);
            visitor.visit(node, depthOfNode);
        }
    }

    /**
     * This is a traversal method which follows the standard traversal path (defined
     * in {@link #traverse}) but at each node checks whether the visitor should
     * split. If a split is triggered, then independent copies of the visitor are
     * sent down each branch of the tree and then merged before propagating the
     * result.
     *
     * @param point          A point which determines the traversal path from the
     *                       root to a leaf node.
     * @param visitorFactory A factory for the multi-visitor.
     * @param <R>            The return type of the Visitor.
     * @return the value of {@link Visitor#getResult()}} after the traversal.
     */
    public <R> R traverseMulti(float[] point, IMultiVisitorFactory<R> visitorFactory) {
        checkNotNull(point, "point must not be null");
        checkNotNull(visitorFactory, "visitorFactory must not be null");
        MultiVisitor<R> visitor = visitorFactory.newVisitor(this, point);
        if (root != null) {
            traverseTreeMulti(point, visitor, root, 0);
        }
        return visitor.getResult();
    }

    private <R> void traverseTreeMulti(float[] point, MultiVisitor<R> visitor, Node node, int depthOfNode) {
        if (node.isLeaf()) {
            visitor.visitLeaf(node, depthOfNode);
        } else {
            if (visitor.shouldSplit(node)) {
                traverseTreeMulti(point, visitor, node.getLeftChild(), depthOfNode + 1);
                MultiVisitor<R> newVisitor = visitor.copy();
                traverseTreeMulti(point, newVisitor, node.getRightChild(), depthOfNode + 1);
                visitor.merge(newVisitor);
            } else {
                traverseTreeMulti(point, visitor, node.getChild(point), depthOfNode + 1);
            }
            visitor.visit(node, depthOfNode);
        }
    }

    /**
     * @param point a query point
     * @return the depth of the leaf reached by following the cuts, or 0 for an
     *         empty tree
     */
    public int depth(float[] point) {
        checkNotNull(point, "point must not be null");
        if (root == null) {
            return 0;
        }
        return getPath(point).size() - 1;
    }

    /**
     * @return the mean of the points in the tree, or null when point sums are not
     *         stored or the tree is empty
     */
    public float[] getCenterOfMass() {
        if (root == null || !centerOfMassEnabled) {
            return null;
        }
        float[] center = root.getPointSum();
        for (int i = 0; i < center.length; i++) {
            center[i] /= root.getMass();
        }
        return center;
    }

    private List<Node> getPath(float[] point) {
        List<Node> path = new ArrayList<>();
        Node node = root;
        while (true) {
            path.add(node);
            if (node.isLeaf()) {
                return path;
            }
            node = node.getChild(point);
        }
    }

    private Random nextRandom() {
        if (testRandom != null) {
            return testRandom;
        }
        Random rng = new Random(randomSeed);
        randomSeed = rng.nextLong();
        return rng;
    }

    private void addSequenceIndex(Node leaf, long sequenceIndex) {
        if (storeSequenceIndexesEnabled) {
            leaf.addSequenceIndex(sequenceIndex);
        }
    }

    /**
     * Create a detached leaf node with the given mass. Used when a tree is rebuilt
     * from its persisted form.
     *
     * @param point the leaf point
     * @param mass  the number of copies of the point
     * @return the leaf
     */
    public Node newLeaf(float[] point, int mass) {
        checkArgument(point.length == dimension, "point has the wrong number of dimensions");
        checkArgument(mass > 0, "mass must be positive");
        Node leaf = new Node(point);
        leaf.setMass(mass);
        if (centerOfMassEnabled) {
            leaf.enablePointSum();
        }
        return leaf;
    }

    /**
     * Record a sequence index on a detached leaf. Used when a tree is rebuilt from
     * its persisted form.
     *
     * @param leaf          a leaf created by {@link #newLeaf}
     * @param sequenceIndex the sequence index
     */
    public void addSequenceIndexToLeaf(Node leaf, long sequenceIndex) {
        checkArgument(leaf.isLeaf(), "not a leaf");
        addSequenceIndex(leaf, sequenceIndex);
    }

    /**
     * Create an internal node joining two detached subtrees. Used when a tree is
     * rebuilt from its persisted form.
     *
     * @param cut   the cut
     * @param left  the subtree left of the cut
     * @param right the subtree right of the cut
     * @return the new node
     */
    public Node newInternalNode(Cut cut, Node left, Node right) {
        checkArgument(left.getParent() == null && right.getParent() == null, "subtrees must be detached");
        BoundingBox box = left.getBoundingBox().copy().assignUnion(left.getBoundingBox(), right.getBoundingBox());
        Node node = new Node(left, right, cut, box);
        node.setMass(left.getMass() + right.getMass());
        left.setParent(node);
        right.setParent(node);
        if (centerOfMassEnabled) {
            node.enablePointSum();
        }
        return node;
    }

    public void setRoot(Node root) {
        checkState(this.root == null, "the tree is not empty");
        checkArgument(root == null || root.getParent() == null, "root must not have a parent");
        this.root = root;
    }

    public Node getRoot() {
        return root;
    }

    public int getMass() {
        return root == null ? 0 : root.getMass();
    }

    public int getDimension() {
        return dimension;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public boolean isStoreSequenceIndexesEnabled() {
        return storeSequenceIndexesEnabled;
    }

    public boolean isCenterOfMassEnabled() {
        return centerOfMassEnabled;
    }

    public String toString() {
        return String.format("RandomCutTree(dimension=%d, mass=%d, root=%s)", dimension, getMass(),
                root == null ? "empty" : (root.isLeaf() ? Arrays.toString(root.getLeafPoint()) : root.getCut()));
    }

    public static class Builder<T extends Builder<T>> {
        protected int dimension;
        protected long randomSeed = new Random().nextLong();
        protected Random random = null;
        protected boolean storeSequenceIndexesEnabled = false;
        protected boolean centerOfMassEnabled = false;

        public T dimension(int dimension) {
            this.dimension = dimension;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        /**
         * Use a fixed random number generator instead of the replayable seed. Meant
         * for tests.
         *
         * @param random the generator
         * @return this builder
         */
        public T random(Random random) {
            this.random = random;
            return (T) this;
        }

        public T storeSequenceIndexesEnabled(boolean storeSequenceIndexesEnabled) {
            this.storeSequenceIndexesEnabled = storeSequenceIndexesEnabled;
            return (T) this;
        }

        public T centerOfMassEnabled(boolean centerOfMassEnabled) {
            this.centerOfMassEnabled = centerOfMassEnabled;
            return (T) this;
        }

        public RandomCutTree build() {
            return new RandomCutTree(this);
        }
    }
}
