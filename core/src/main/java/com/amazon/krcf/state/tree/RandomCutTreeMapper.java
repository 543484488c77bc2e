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


package com.amazon.krcf.state.tree;

import static com.amazon.krcf.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.krcf.sampler.SampledPoint;
import com.amazon.krcf.sampler.StreamSampler;
import com.amazon.krcf.state.IContextualStateMapper;
import com.amazon.krcf.state.Version;
import com.amazon.krcf.tree.Cut;
import com.amazon.krcf.tree.Node;
import com.amazon.krcf.tree.RandomCutTree;

/**
 * Converts a {@link RandomCutTree} to a {@link RandomCutTreeState} and back.
 * Leaf points are not written with the tree; they are looked up in the sample
 * of the sampler paired with the tree, which is the context of both
 * conversions. Sequence indexes of the leaves are rebuilt from the sample.
 */
public class RandomCutTreeMapper
        implements IContextualStateMapper<RandomCutTree, RandomCutTreeState, StreamSampler> {

    private static final int LEAF = -1;

    @Override
    public RandomCutTreeState toState(RandomCutTree model, StreamSampler sampler) {
        List<SampledPoint> sample = sampler.getSample();
        Map<List<Float>, Integer> pointIndex = new HashMap<>();
        for (int i = 0; i < sample.size(); i++) {
            pointIndex.putIfAbsent(asKey(sample.get(i).getPoint()), i);
        }

        List<Node> nodes = new ArrayList<>();
        if (model.getRoot() != null) {
            collectPreOrder(model.getRoot(), nodes);
        }
        int size = nodes.size();
        int[] cutDimension = new int[size];
        double[] cutValue = new double[size];
        int[] mass = new int[size];
        int[] leafPointIndex = new int[size];
        for (int i = 0; i < size; i++) {
            Node node = nodes.get(i);
            mass[i] = node.getMass();
            if (node.isLeaf()) {
                Integer index = pointIndex.get(asKey(node.getLeafPoint()));
                checkArgument(index != null, "leaf point is not in the sample");
                cutDimension[i] = LEAF;
                leafPointIndex[i] = index;
            } else {
                cutDimension[i] = node.getCutDimension();
                cutValue[i] = node.getCutValue();
                leafPointIndex[i] = LEAF;
            }
        }

        RandomCutTreeState state = new RandomCutTreeState();
        state.setVersion(Version.CURRENT);
        state.setDimension(model.getDimension());
        state.setRandomSeed(model.getRandomSeed());
        state.setStoreSequenceIndexesEnabled(model.isStoreSequenceIndexesEnabled());
        state.setCenterOfMassEnabled(model.isCenterOfMassEnabled());
        state.setCutDimension(cutDimension);
        state.setCutValue(cutValue);
        state.setMass(mass);
        state.setLeafPointIndex(leafPointIndex);
        return state;
    }

    /**
     * @param state   a tree state
     * @param sampler the restored sampler paired with the tree
     * @return a tree with the saved structure
     * @throws IllegalArgumentException if the state does not describe a tree over
     *                                  the sample
     */
    @Override
    public RandomCutTree toModel(RandomCutTreeState state, StreamSampler sampler) {
        int[] cutDimension = state.getCutDimension();
        double[] cutValue = state.getCutValue();
        int[] mass = state.getMass();
        int[] leafPointIndex = state.getLeafPointIndex();
        checkArgument(cutDimension != null && cutValue != null && mass != null && leafPointIndex != null,
                "tree arrays must be present");
        int size = cutDimension.length;
        checkArgument(cutValue.length == size && mass.length == size && leafPointIndex.length == size,
                "tree arrays have different lengths");

        RandomCutTree tree = RandomCutTree.builder().dimension(state.getDimension())
                .randomSeed(state.getRandomSeed()).storeSequenceIndexesEnabled(state.isStoreSequenceIndexesEnabled())
                .centerOfMassEnabled(state.isCenterOfMassEnabled()).build();
        List<SampledPoint> sample = sampler.getSample();
        if (size == 0) {
            checkArgument(sample.isEmpty(), "empty tree with a non-empty sample");
            return tree;
        }

        int[] cursor = new int[] { 0 };
        Node root = build(tree, state, sample, cursor);
        checkArgument(cursor[0] == size, "unused nodes in tree state");
        checkArgument(root.getMass() == sample.size(), "tree mass does not match the sample");

        Map<Node, Integer> counts = new IdentityHashMap<>();
        for (SampledPoint entry : sample) {
            Node node = root;
            while (!node.isLeaf()) {
                node = node.getChild(entry.getPoint());
            }
            checkArgument(node.leafPointEquals(entry.getPoint()), "sample point is not in the tree");
            counts.merge(node, 1, Integer::sum);
            tree.addSequenceIndexToLeaf(node, entry.getSequenceIndex());
        }
        counts.forEach((leaf, count) -> checkArgument(leaf.getMass() == count, "leaf mass does not match the sample"));
        tree.setRoot(root);
        return tree;
    }

    private Node build(RandomCutTree tree, RandomCutTreeState state, List<SampledPoint> sample, int[] cursor) {
        int i = cursor[0]++;
        checkArgument(i < state.getCutDimension().length, "truncated tree state");
        int dimension = state.getCutDimension()[i];
        if (dimension == LEAF) {
            int index = state.getLeafPointIndex()[i];
            checkArgument(index >= 0 && index < sample.size(), "leaf point index out of range");
            return tree.newLeaf(sample.get(index).getPoint(), state.getMass()[i]);
        }
        checkArgument(dimension >= 0 && dimension < state.getDimension(), "cut dimension out of range");
        Node left = build(tree, state, sample, cursor);
        Node right = build(tree, state, sample, cursor);
        Node node = tree.newInternalNode(new Cut(dimension, state.getCutValue()[i]), left, right);
        checkArgument(node.getMass() == state.getMass()[i], "node mass does not match its children");
        return node;
    }

    private static void collectPreOrder(Node node, List<Node> nodes) {
        nodes.add(node);
        if (!node.isLeaf()) {
            collectPreOrder(node.getLeftChild(), nodes);
            collectPreOrder(node.getRightChild(), nodes);
        }
    }

    private static List<Float> asKey(float[] point) {
        List<Float> key = new ArrayList<>(point.length);
        for (float value : point) {
            key.add(value);
        }
        return key;
    }
}
