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


package com.amazon.krcf.state.sampler;

import lombok.Data;

/**
 * A data object representing the state of a
 * {@link com.amazon.krcf.sampler.StreamSampler}.
 */
@Data
public class SamplerState {
    /**
     * a version string for extensibility
     */
    private String version;

    /**
     * The points in the sample, in heap order.
     */
    private float[][] point;

    /**
     * The weights of the points in the sample.
     */
    private float[] weight;

    /**
     * The sequence indexes of the points in the sample.
     */
    private long[] sequenceIndex;

    /**
     * The maximum number of points that the sampler can contain.
     */
    private int capacity;

    /**
     * The time-decay parameter for this sampler
     */
    private double timeDecay;

    /**
     * Last update of the time decay
     */
    private long mostRecentTimeDecayUpdate;

    /**
     * maximum sequence index seen in computeWeight
     */
    private long maxSequenceIndex;

    private double accumulatedTimeDecay;

    /**
     * the current seed of the replayable random number generator
     */
    private long randomSeed;
}
