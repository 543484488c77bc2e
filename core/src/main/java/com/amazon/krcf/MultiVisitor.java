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
 * A visitor that may explore both children of a node. When
 * {@link #shouldSplit} holds at an internal node, the tree sends this visitor
 * down the left child and a {@link #copy()} down the right child, then folds
 * the copy back in with {@link #merge} before visiting the node itself.
 * Otherwise only the child on the path of the query point is explored.
 *
 * @param <R> the result type
 */
public interface MultiVisitor<R> extends Visitor<R> {

    boolean shouldSplit(INodeView node);

    /**
     * @return a visitor that continues from the current state of this one
     */
    MultiVisitor<R> copy();

    void merge(MultiVisitor<R> other);
}
