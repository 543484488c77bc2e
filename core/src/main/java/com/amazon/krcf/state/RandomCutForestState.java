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


package com.amazon.krcf.state;

import java.util.List;

import lombok.Data;

import com.amazon.krcf.state.sampler.SamplerState;
import com.amazon.krcf.state.tree.RandomCutTreeState;

/**
 * A class that encapsulates the data used in a RandomCutForest such that the
 * forest can be serialized and deserialized.
 */
@Data
public class RandomCutForestState {

    private String version;

    private int dimensions;

    private int shingleSize;

    private int numberOfTrees;

    private int sampleSize;

    private int outputAfter;

    private long randomSeed;

    private double lambda;

    private boolean internalShinglingEnabled;

    private boolean storePointSumEnabled;

    private boolean storeAttributesEnabled;

    private long entriesSeen;

    /**
     * The shingler window, or the last shingled point when shingling is done by
     * the caller.
     */
    private float[] shingleWindow;

    /**
     * Number of points in the shingler window.
     */
    private int shingleWindowSize;

    private List<SamplerState> samplerStates;

    private List<RandomCutTreeState> treeStates;

    private ExecutionContext executionContext;
}
