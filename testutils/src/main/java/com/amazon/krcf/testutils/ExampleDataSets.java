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
 * Deterministic one- and two-dimensional data sets with a known shape.
 */
public class ExampleDataSets {

    private ExampleDataSets() {
    }

    /**
     * @return {@code size} one-dimensional points on a sine wave starting at
     *         zero
     */
    public static double[][] sineWave(int size, int period, double amplitude) {
        double[][] data = new double[size][1];
        double step = 2 * Math.PI / period;
        for (int i = 0; i < size; i++) {
            data[i][0] = amplitude * Math.sin(step * i);
        }
        return data;
    }

    /**
     * Points scattered along thin blades radiating from the origin. Each point
     * picks a blade at random, is drawn from a narrow Gaussian elongated along
     * the blade, and is then moved out to the blade's position at radius 0.6.
     *
     * @param numberPerBlade average number of points per blade
     * @param numberOfBlades number of blades, between 1 and 12
     * @return {@code numberPerBlade * numberOfBlades} two-dimensional points
     * @throws IllegalArgumentException for unsupported arguments
     */
    public static double[][] generateFan(int numberPerBlade, int numberOfBlades) {
        if (numberOfBlades < 1 || numberOfBlades > 12 || numberPerBlade <= 0) {
            throw new IllegalArgumentException("unsupported fan: " + numberPerBlade + " x " + numberOfBlades);
        }
        Random random = new Random(0);
        double[][] data = new double[numberPerBlade * numberOfBlades][];
        for (int i = 0; i < data.length; i++) {
            double across = 0.05 * random.nextGaussian();
            double along = 0.6 + 0.2 * random.nextGaussian();
            double angle = 2 * Math.PI * random.nextInt(numberOfBlades) / numberOfBlades;
            double sin = Math.sin(angle);
            double cos = Math.cos(angle);
            data[i] = new double[] { across * cos + along * sin, along * cos - across * sin };
        }
        return data;
    }
}
