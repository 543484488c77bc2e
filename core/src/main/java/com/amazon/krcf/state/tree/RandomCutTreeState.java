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

import lombok.Data;

/**
 * The structure of a {@link com.amazon.krcf.tree.RandomCutTree}. Nodes are
 * listed in pre-order; a leaf has cut dimension -1 and refers to its point by
 * position in the sample of the sampler paired with the tree.
 */
@Data
public class RandomCutTreeState {
    private String version;
    private int dimension;
    private long randomSeed;
    private boolean storeSequenceIndexesEnabled;
    private boolean centerOfMassEnabled;
    private int[] cutDimension;
    private double[] cutValue;
    private int[] mass;
    private int[] leafPointIndex;
}
