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



package com.amazon.krcf.returntypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collector;

/**
 * A sample point close to a query point.
 */
public class Neighbor {

    public final double[] point;

    /**
     * Euclidean distance to the query point.
     */
    public final double distance;

    /**
     * The updates at which the point entered a sample, ascending; empty unless
     * the forest stores attributes.
     */
    public final List<Long> sequenceIndexes;

    /**
     * The anomaly score of the point, 0 until it is scored.
     */
    public final double score;

    public Neighbor(double[] point, double distance, List<Long> sequenceIndexes) {
        this(point, distance, sequenceIndexes, 0.0);
    }

    public Neighbor(double[] point, double distance, List<Long> sequenceIndexes, double score) {
        this.point = point;
        this.distance = distance;
        this.sequenceIndexes = sequenceIndexes;
        this.score = score;
    }

    public Neighbor withScore(double newScore) {
        return new Neighbor(point, distance, sequenceIndexes, newScore);
    }

    /**
     * Collects the neighbors found by the trees. The same point found by several
     * trees becomes one neighbor whose sequence indexes are the distinct indexes
     * found by any of them. The result is sorted by distance; equal distances keep
     * the order in which the points were first found.
     *
     * @return the collector
     */
    public static Collector<Optional<Neighbor>, ?, List<Neighbor>> collector() {
        return Collector.<Optional<Neighbor>, Map<List<Float>, Neighbor>, List<Neighbor>>of(LinkedHashMap::new,
                (found, candidate) -> candidate.ifPresent(n -> found.merge(n.key(), n, Neighbor::union)),
                (left, right) -> {
                    right.values().forEach(n -> left.merge(n.key(), n, Neighbor::union));
                    return left;
                }, found -> {
                    List<Neighbor> result = new ArrayList<>();
                    found.values().forEach(n -> result.add(union(n, n)));
                    result.sort(Comparator.comparingDouble(n -> n.distance));
                    return result;
                });
    }

    /**
     * The first neighbor carrying the distinct sequence indexes of both, sorted.
     */
    private static Neighbor union(Neighbor first, Neighbor second) {
        TreeSet<Long> indexes = new TreeSet<>(first.sequenceIndexes);
        indexes.addAll(second.sequenceIndexes);
        return new Neighbor(first.point, first.distance, new ArrayList<>(indexes), first.score);
    }

    private List<Float> key() {
        List<Float> key = new ArrayList<>(point.length);
        for (double value : point) {
            key.add((float) value);
        }
        return key;
    }

    @Override
    public String toString() {
        return "Neighbor(point=" + Arrays.toString(point) + ", distance=" + distance + ", score=" + score
                + ", sequenceIndexes=" + sequenceIndexes + ")";
    }
}
