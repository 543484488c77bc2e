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



package com.amazon.krcf;

import com.amazon.krcf.tree.INodeView;

/**
 * Computes a value from one root-to-leaf path of a tree. The tree calls
 * {@link #visitLeaf} on the leaf the query point falls into, then
 * {@link #visit} on each ancestor up to the root, then {@link #getResult()}.
 *
 * @param <R> the result type
 */
public interface Visitor<R> {

    void visit(INodeView node, int depth);

    default void visitLeaf(INodeView leaf, int depth) {
        visit(leaf, depth);
    }

    R getResult();
}
