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

import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collector;

import lombok.Getter;

import com.amazon.krcf.IMultiVisitorFactory;
import com.amazon.krcf.IVisitorFactory;

/**
 * Runs per-tree work over every {@link SampledTree} of a forest. Subclasses
 * only decide how the work is scheduled; results always come back in tree
 * order, and every reduction below is done on that list in the calling
 * thread, so the way work is scheduled never changes a result.
 */
public abstract class ForestExecutor implements AutoCloseable {

    @Getter
    protected final List<SampledTree> components;

    protected ForestExecutor(List<SampledTree> components) {
        this.components = checkNotNull(components, "components must not be null");
    }

    /**
     * Apply a task to every component.
     *
     * @param task the per-tree work
     * @param <R>  the result type
     * @return the results, in tree order
     */
    protected abstract <R> List<R> forEachComponent(Function<SampledTree, R> task);

    /**
     * Offer a shingle to every component.
     *
     * @param shingle       the shingle
     * @param sequenceIndex the update that offers it
     * @return the number of trees whose sample changed
     */
    public int update(float[] shingle, long sequenceIndex) {
        return (int) forEachComponent(c -> c.update(shingle, sequenceIndex)).stream().filter(Boolean::booleanValue)
                .count();
    }

    public <R> List<R> traverseEach(float[] point, IVisitorFactory<R> visitorFactory) {
        return forEachComponent(c -> c.traverse(point, visitorFactory));
    }

    public <R> List<R> traverseEachMulti(float[] point, IMultiVisitorFactory<R> visitorFactory) {
        return forEachComponent(c -> c.traverseMulti(point, visitorFactory));
    }

    /**
     * Send a visitor through every tree, fold the per-tree results left to right
     * with the accumulator and finish the folded value.
     *
     * @param point          the query point
     * @param visitorFactory creates the visitor of each tree
     * @param accumulator    combines two partial results
     * @param finisher       turns the folded result into the answer
     * @param <R>            the per-tree result type
     * @param <S>            the answer type
     * @return the answer
     */
    public <R, S> S traverseForest(float[] point, IVisitorFactory<R> visitorFactory, BinaryOperator<R> accumulator,
            Function<R, S> finisher) {
        return fold(traverseEach(point, visitorFactory), accumulator, finisher);
    }

    public <R, S> S traverseForest(float[] point, IVisitorFactory<R> visitorFactory, Collector<R, ?, S> collector) {
        return traverseEach(point, visitorFactory).stream().collect(collector);
    }

    public <R, S> S traverseForestMulti(float[] point, IMultiVisitorFactory<R> visitorFactory,
            BinaryOperator<R> accumulator, Function<R, S> finisher) {
        return fold(traverseEachMulti(point, visitorFactory), accumulator, finisher);
    }

    public <R, S> S traverseForestMulti(float[] point, IMultiVisitorFactory<R> visitorFactory,
            Collector<R, ?, S> collector) {
        return traverseEachMulti(point, visitorFactory).stream().collect(collector);
    }

    private static <R, S> S fold(List<R> results, BinaryOperator<R> accumulator, Function<R, S> finisher) {
        if (results.isEmpty()) {
            throw new IllegalStateException("the forest has no trees");
        }
        R folded = results.get(0);
        for (int i = 1; i < results.size(); i++) {
            folded = accumulator.apply(folded, results.get(i));
        }
        return finisher.apply(folded);
    }

    /**
     * Release worker threads, if any.
     */
    @Override
    public void close() {
    }
}
