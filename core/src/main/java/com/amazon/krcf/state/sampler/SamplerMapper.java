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

import static com.amazon.krcf.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.List;

import com.amazon.krcf.sampler.SampledPoint;
import com.amazon.krcf.sampler.StreamSampler;
import com.amazon.krcf.state.IStateMapper;
import com.amazon.krcf.state.Version;

/**
 * Converts a {@link StreamSampler} to a
 * {@link SamplerState} and back. The heap order of the sample is kept so that
 * a restored sampler evicts the same points as the original.
 */
public class SamplerMapper implements IStateMapper<StreamSampler, SamplerState> {

    @Override
    public SamplerState toState(StreamSampler model) {
        List<SampledPoint> sample = model.getSample();
        int size = sample.size();
        float[][] point = new float[size][];
        float[] weight = new float[size];
        long[] sequenceIndex = new long[size];
        for (int i = 0; i < size; i++) {
            SampledPoint entry = sample.get(i);
            point[i] = Arrays.copyOf(entry.getPoint(), entry.getPoint().length);
            weight[i] = entry.getWeight();
            sequenceIndex[i] = entry.getSequenceIndex();
        }

        SamplerState state = new SamplerState();
        state.setVersion(Version.CURRENT);
        state.setPoint(point);
        state.setWeight(weight);
        state.setSequenceIndex(sequenceIndex);
        state.setCapacity(model.getCapacity());
        state.setTimeDecay(model.getTimeDecay());
        state.setMostRecentTimeDecayUpdate(model.getMostRecentTimeDecayUpdate());
        state.setMaxSequenceIndex(model.getMaxSequenceIndex());
        state.setAccumulatedTimeDecay(model.getAccumulatedTimeDecay());
        state.setRandomSeed(model.getRandomSeed());
        return state;
    }

    /**
     * @param state a sampler state
     * @return a sampler holding the same sample with the same random state
     * @throws IllegalArgumentException if the arrays in the state disagree
     */
    @Override
    public StreamSampler toModel(SamplerState state) {
        float[][] point = state.getPoint();
        float[] weight = state.getWeight();
        long[] sequenceIndex = state.getSequenceIndex();
        checkArgument(point != null && weight != null && sequenceIndex != null, "sample arrays must be present");
        checkArgument(point.length == weight.length && point.length == sequenceIndex.length,
                "sample arrays have different lengths");
        checkArgument(point.length <= state.getCapacity(), "sample is larger than capacity");

        StreamSampler sampler = StreamSampler.builder().capacity(state.getCapacity()).timeDecay(state.getTimeDecay())
                .randomSeed(state.getRandomSeed()).decayState(state.getAccumulatedTimeDecay(),
                        state.getMostRecentTimeDecayUpdate(), state.getMaxSequenceIndex())
                .build();
        for (int i = 0; i < point.length; i++) {
            checkArgument(point[i] != null, "missing sample point");
            sampler.addSample(Arrays.copyOf(point[i], point[i].length), weight[i], sequenceIndex[i]);
        }
        return sampler;
    }
}
