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



package com.amazon.krcf.executor;

import static com.amazon.krcf.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.krcf.IMultiVisitorFactory;
import com.amazon.krcf.IVisitorFactory;
import com.amazon.krcf.sampler.StreamSampler;
import com.amazon.krcf.tree.RandomCutTree;

/**
 * One member of the forest: a tree whose leaves are exactly the shingles held
 * by its sampler. The sampler decides, the tree follows.
 */
@Getter
public class SampledTree {

    private final StreamSampler sampler;
    private final RandomCutTree tree;

    public SampledTree(StreamSampler sampler, RandomCutTree tree) {
        this.sampler = checkNotNull(sampler, "sampler must not be null");
        this.tree = checkNotNull(tree, "tree must not be null");
    }

    /**
     * Offer a shingle to the sampler. When it is admitted, the shingle it evicts
     * (if any) leaves the tree first, then the new shingle is inserted and the
     * sampler keeps the reference the tree stored, which is shared with an equal
     * leaf already present.
     *
     * @param shingle       the shingle
     * @param sequenceIndex the update that offers it
     * @return true if the sample and the tree changed
     */
    public boolean update(float[] shingle, long sequenceIndex) {
        if (!sampler.acceptPoint(sequenceIndex)) {
            return false;
        }
        sampler.getEvictedPoint().ifPresent(gone -> tree.deletePoint(gone.getPoint(), gone.getSequenceIndex()));
        sampler.addPoint(tree.addPoint(shingle, sequenceIndex));
        return true;
    }

    public <R> R traverse(float[] point, IVisitorFactory<R> visitorFactory) {
        return tree.traverse(point, visitorFactory);
    }

    public <R> R traverseMulti(float[] point, IMultiVisitorFactory<R> visitorFactory) {
        return tree.traverseMulti(point, visitorFactory);
    }
}
