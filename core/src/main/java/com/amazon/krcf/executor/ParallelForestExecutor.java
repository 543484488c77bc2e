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

import static com.amazon.krcf.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs per-tree work as a parallel stream inside a private
 * {@link ForkJoinPool}. Each tree owns its random state, so the trees may be
 * updated in any order. The pool is created again if work arrives after
 * {@link #close()}.
 */
public class ParallelForestExecutor extends ForestExecutor {

    private final int threadPoolSize;
    private ForkJoinPool pool;

    public ParallelForestExecutor(List<SampledTree> components, int threadPoolSize) {
        super(components);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    protected <R> List<R> forEachComponent(Function<SampledTree, R> task) {
        return pool().submit(() -> components.parallelStream().map(task).collect(Collectors.toList())).join();
    }

    private synchronized ForkJoinPool pool() {
        if (pool == null) {
            pool = new ForkJoinPool(threadPoolSize);
        }
        return pool;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    @Override
    public synchronized void close() {
        if (pool != null) {
            pool.shutdown();
            pool = null;
        }
    }
}
