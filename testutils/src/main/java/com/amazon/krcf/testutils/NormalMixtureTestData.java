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



package com.amazon.krcf.testutils;

import java.util.Random;

/**
 * Generates rows from a two-state regime-switching Gaussian source. Rows are
 * drawn around {@code baseMu} until the source switches to the anomalous
 * regime, where they are drawn around {@code anomalyMu}, and so on. Every
 * coordinate of a row uses the same mean and standard deviation.
 */
public class NormalMixtureTestData {

    private final double[] mean;
    private final double[] deviation;
    // probability of leaving regime 0 (base) and regime 1 (anomaly)
    private final double[] switchProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double toAnomalyProbability, double toBaseProbability) {
        mean = new double[] { baseMu, anomalyMu };
        deviation = new double[] { baseSigma, anomalySigma };
        switchProbability = new double[] { toAnomalyProbability, toBaseProbability };
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 4.0, 2.0, 0.01, 0.3);
    }

    /**
     * @param numberOfRows    number of rows
     * @param numberOfColumns values per row
     * @param seed            seed of the only random source used
     * @return a fresh matrix; the same seed always yields the same matrix
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        Random random = new Random(seed);
        double[][] rows = new double[numberOfRows][numberOfColumns];
        int regime = 0;
        for (double[] row : rows) {
            for (int j = 0; j < numberOfColumns; j++) {
                row[j] = mean[regime] + deviation[regime] * random.nextGaussian();
            }
            if (random.nextDouble() < switchProbability[regime]) {
                regime = 1 - regime;
            }
        }
        return rows;
    }
}
