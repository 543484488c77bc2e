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

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkNotNull;

import java.util.stream.Collector;

import lombok.Getter;

/**
 * The interpolation of the sample around a query point, and the density
 * estimates derived from it.
 *
 * For each coordinate and direction, {@code probMass} is the probability that
 * a random cut isolates the query on that side, {@code measure} the mass found
 * there and {@code distances} the width of the box that was cut. Per-tree
 * estimates are summed and divided by the number of trees.
 */
public class DensityEstimate {

    /**
     * Added, times the total measure, to the denominator of the density so that
     * it stays finite.
     */
    public static final double DEFAULT_SMOOTHING = 0.001;

    public final DiVector measure;
    public final DiVector distances;
    public final DiVector probMass;

    @Getter
    private final int sampleSize;

    public DensityEstimate(int dimensions, int sampleSize) {
        this(new DiVector(dimensions), new DiVector(dimensions), new DiVector(dimensions), sampleSize);
    }

    public DensityEstimate(DiVector measure, DiVector distances, DiVector probMass, int sampleSize) {
        checkNotNull(measure, "measure must not be null");
        checkNotNull(distances, "distances must not be null");
        checkNotNull(probMass, "probMass must not be null");
        checkArgument(measure.getDimensions() == distances.getDimensions()
                && measure.getDimensions() == probMass.getDimensions(), "dimensions must be the same");
        this.measure = measure;
        this.distances = distances;
        this.probMass = probMass;
        this.sampleSize = sampleSize;
    }

    public int getDimensions() {
        return measure.getDimensions();
    }

    /**
     * Add another estimate to this one.
     *
     * @param other an estimate of the same dimensions, left unchanged
     * @return this estimate
     */
    public DensityEstimate add(DensityEstimate other) {
        measure.add(other.measure);
        distances.add(other.distances);
        probMass.add(other.probMass);
        return this;
    }

    public DensityEstimate scale(double factor) {
        return new DensityEstimate(measure.scale(factor), distances.scale(factor), probMass.scale(factor),
                sampleSize);
    }

    /**
     * @param smoothing         weight of the total measure in the denominator
     * @param manifoldDimension the dimension of the space the density lives in
     * @return the scalar density, 0 when no mass was found
     */
    public double getDensity(double smoothing, int manifoldDimension) {
        double mass = measure.getHighLowSum() / sampleSize;
        if (mass <= 0.0) {
            return 0.0;
        }
        double volume = 0;
        for (int i = 0; i < getDimensions(); i++) {
            double prob = probMass.getHighLowSum(i);
            double width = prob > 0 ? distances.getHighLowSum(i) / prob : 0;
            if (width > 0) {
                volume += Math.pow(width, manifoldDimension) * prob;
            }
        }
        return mass / (smoothing * mass + volume);
    }

    public double getDensity() {
        return getDensity(DEFAULT_SMOOTHING, getDimensions());
    }

    /**
     * @param smoothing         weight of the total measure in the denominator
     * @param manifoldDimension the dimension of the space the density lives in
     * @return the measure rescaled so that its entries sum to the density
     */
    public DiVector getDirectionalDensity(double smoothing, int manifoldDimension) {
        double total = measure.getHighLowSum();
        if (total <= 0) {
            return new DiVector(getDimensions());
        }
        return measure.scale(getDensity(smoothing, manifoldDimension) / total);
    }

    public DiVector getDirectionalDensity() {
        return getDirectionalDensity(DEFAULT_SMOOTHING, getDimensions());
    }

    /**
     * @param dimensions    the dimensions of the estimates
     * @param sampleSize    the sample size of each tree
     * @param numberOfTrees the number of estimates collected
     * @return a collector summing the estimates and dividing by the number of
     *         trees
     */
    public static Collector<DensityEstimate, DensityEstimate, DensityEstimate> collector(int dimensions,
            int sampleSize, int numberOfTrees) {
        return Collector.of(() -> new DensityEstimate(dimensions, sampleSize), DensityEstimate::add,
                DensityEstimate::add, sum -> sum.scale(1.0 / numberOfTrees));
    }
}
