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

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.krcf.ErrorKind;
import com.amazon.krcf.RandomCutForest;
import com.amazon.krcf.RandomCutForestException;
import com.amazon.krcf.executor.SampledTree;
import com.amazon.krcf.executor.ShinglingCoordinator;
import com.amazon.krcf.sampler.StreamSampler;
import com.amazon.krcf.state.sampler.SamplerMapper;
import com.amazon.krcf.state.sampler.SamplerState;
import com.amazon.krcf.state.tree.RandomCutTreeMapper;
import com.amazon.krcf.state.tree.RandomCutTreeState;
import com.amazon.krcf.tree.RandomCutTree;
import com.amazon.krcf.util.Shingler;

/**
 * A utility class for creating a {@link RandomCutForestState} instance from a
 * {@link RandomCutForest} instance and vice versa. The state holds every
 * sampler and every tree, so a restored forest gives the same results as the
 * original for the same future updates.
 */
@Getter
@Setter
public class RandomCutForestMapper implements IStateMapper<RandomCutForest, RandomCutForestState> {

    private static final Logger logger = LogManager.getLogger(RandomCutForestMapper.class);

    /**
     * A flag indicating whether the execution context should be included in the
     * {@link RandomCutForestState} object produced by the mapper.
     */
    private boolean saveExecutionContextEnabled = true;

    /**
     * Create a {@link RandomCutForestState} object representing the state of the
     * given forest.
     *
     * @param forest A Random Cut Forest whose state we want to capture.
     * @return a {@link RandomCutForestState} object representing the state of the
     *         given forest.
     */
    @Override
    public RandomCutForestState toState(RandomCutForest forest) {
        RandomCutForestState state = new RandomCutForestState();
        state.setVersion(Version.CURRENT);
        state.setDimensions(forest.getDimensions());
        state.setShingleSize(forest.getShingleSize());
        state.setNumberOfTrees(forest.getNumberOfTrees());
        state.setSampleSize(forest.getSampleSize());
        state.setOutputAfter(forest.getOutputAfter());
        state.setRandomSeed(forest.getRandomSeed());
        state.setLambda(forest.getLambda());
        state.setInternalShinglingEnabled(forest.isInternalShinglingEnabled());
        state.setStorePointSumEnabled(forest.isStorePointSumEnabled());
        state.setStoreAttributesEnabled(forest.isStoreAttributesEnabled());

        ShinglingCoordinator coordinator = forest.getUpdateCoordinator();
        state.setEntriesSeen(coordinator.getEntriesSeen());
        state.setShingleWindow(coordinator.getCurrentShingle());
        state.setShingleWindowSize(coordinator.getShingler().getSize());

        if (saveExecutionContextEnabled) {
            state.setExecutionContext(
                    new ExecutionContext(forest.isParallelExecutionEnabled(), forest.getThreadPoolSize()));
        }

        SamplerMapper samplerMapper = new SamplerMapper();
        RandomCutTreeMapper treeMapper = new RandomCutTreeMapper();
        List<SamplerState> samplerStates = new ArrayList<>();
        List<RandomCutTreeState> treeStates = new ArrayList<>();
        try {
            for (SampledTree component : forest.getComponents()) {
                samplerStates.add(samplerMapper.toState(component.getSampler()));
                treeStates.add(treeMapper.toState(component.getTree(), component.getSampler()));
            }
        } catch (IllegalArgumentException e) {
            throw new RandomCutForestException(ErrorKind.SERIALIZATION, "forest state is inconsistent", e);
        }
        state.setSamplerStates(samplerStates);
        state.setTreeStates(treeStates);
        return state;
    }

    /**
     * Create a {@link RandomCutForest} instance from a
     * {@link RandomCutForestState}.
     *
     * @param state            A Random Cut Forest state object.
     * @param executionContext An execution context used to create the executors
     *                         of the new forest. If this argument is null, the
     *                         context saved in the state object is used, and the
     *                         forest runs sequentially when there is none.
     * @return A Random Cut Forest corresponding to the state object.
     * @throws RandomCutForestException of kind {@link ErrorKind#DESERIALIZATION}
     *                                  if the version is unknown or the state is
     *                                  inconsistent.
     */
    public RandomCutForest toModel(RandomCutForestState state, ExecutionContext executionContext) {
        if (state == null) {
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION, "state must not be null");
        }
        if (!Version.V1_0.equals(state.getVersion())) {
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION,
                    "unsupported state version: " + state.getVersion());
        }
        ExecutionContext ec = executionContext != null ? executionContext : state.getExecutionContext();

        try {
            return buildForest(state, ec);
        } catch (RandomCutForestException e) {
            if (e.getKind() == ErrorKind.DESERIALIZATION) {
                throw e;
            }
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION, "invalid forest state", e);
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException
                | IndexOutOfBoundsException e) {
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION, "invalid forest state", e);
        }
    }

    /**
     * Create a {@link RandomCutForest} instance from a {@link RandomCutForestState}
     * using the execution context in the state object. See
     * {@link #toModel(RandomCutForestState, ExecutionContext)}.
     *
     * @param state A Random Cut Forest state object.
     * @return A Random Cut Forest corresponding to the state object.
     */
    @Override
    public RandomCutForest toModel(RandomCutForestState state) {
        return toModel(state, null);
    }

    private RandomCutForest buildForest(RandomCutForestState state, ExecutionContext ec) {
        List<SamplerState> samplerStates = state.getSamplerStates();
        List<RandomCutTreeState> treeStates = state.getTreeStates();
        if (samplerStates == null || treeStates == null || samplerStates.size() != state.getNumberOfTrees()
                || treeStates.size() != state.getNumberOfTrees()) {
            throw new RandomCutForestException(ErrorKind.DESERIALIZATION,
                    "the number of samplers and trees must equal the number of trees");
        }

        RandomCutForest.Builder<?> builder = RandomCutForest.builder().dimensions(state.getDimensions())
                .shingleSize(state.getShingleSize()).numberOfTrees(state.getNumberOfTrees())
                .sampleSize(state.getSampleSize()).outputAfter(state.getOutputAfter())
                .randomSeed(state.getRandomSeed()).lambda(state.getLambda())
                .internalShinglingEnabled(state.isInternalShinglingEnabled())
                .storePointSumEnabled(state.isStorePointSumEnabled())
                .storeAttributesEnabled(state.isStoreAttributesEnabled());
        if (ec != null) {
            builder.parallelExecutionEnabled(ec.isParallelExecutionEnabled());
            if (ec.getThreadPoolSize() > 0) {
                builder.threadPoolSize(ec.getThreadPoolSize());
            }
        }

        int shingledDimensions = state.getDimensions() * state.getShingleSize();
        ShinglingCoordinator coordinator;
        if (state.isInternalShinglingEnabled()) {
            Shingler shingler = new Shingler(state.getDimensions(), state.getShingleSize(), state.getShingleWindow(),
                    state.getShingleWindowSize());
            coordinator = new ShinglingCoordinator(shingler, true);
        } else {
            coordinator = new ShinglingCoordinator(new Shingler(state.getDimensions(), state.getShingleSize()),
                    false);
            coordinator.setLastShingledPoint(state.getShingleWindow());
        }
        coordinator.setEntriesSeen(state.getEntriesSeen());

        SamplerMapper samplerMapper = new SamplerMapper();
        RandomCutTreeMapper treeMapper = new RandomCutTreeMapper();
        List<SampledTree> components = new ArrayList<>(state.getNumberOfTrees());
        for (int i = 0; i < state.getNumberOfTrees(); i++) {
            SamplerState samplerState = samplerStates.get(i);
            RandomCutTreeState treeState = treeStates.get(i);
            if (!Version.V1_0.equals(samplerState.getVersion()) || !Version.V1_0.equals(treeState.getVersion())) {
                throw new RandomCutForestException(ErrorKind.DESERIALIZATION, "unsupported component version");
            }
            if (samplerState.getCapacity() != state.getSampleSize() || treeState.getDimension() != shingledDimensions) {
                throw new RandomCutForestException(ErrorKind.DESERIALIZATION,
                        "component does not match the forest configuration");
            }
            StreamSampler sampler = samplerMapper.toModel(samplerState);
            RandomCutTree tree = treeMapper.toModel(treeState, sampler);
            components.add(new SampledTree(sampler, tree));
        }

        RandomCutForest forest = new RandomCutForest(builder, coordinator, components);
        logger.info("restored forest from state version {} after {} entries", state.getVersion(),
                state.getEntriesSeen());
        return forest;
    }
}
