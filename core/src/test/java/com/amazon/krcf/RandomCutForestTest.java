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


package com.amazon.krcf;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.krcf.executor.SampledTree;
import com.amazon.krcf.returntypes.DensityEstimate;
import com.amazon.krcf.returntypes.DiVector;
import com.amazon.krcf.returntypes.Neighbor;
import com.amazon.krcf.returntypes.RangeVector;
import com.amazon.krcf.sampler.SampledPoint;
import com.amazon.krcf.testutils.ExampleDataSets;
import com.amazon.krcf.testutils.NormalMixtureTestData;

public class RandomCutForestTest {

    private static final int PERIOD = 60;
    private static final double AMPLITUDE = 10.0;

    private RandomCutForest forest;

    @BeforeEach
    public void setUp() {
        forest = RandomCutForest.builder().dimensions(1).shingleSize(4).numberOfTrees(30).sampleSize(256)
                .randomSeed(42L).lambda(0.0).build();
    }

    @Test
    public void testDefaults() {
        RandomCutForest f = RandomCutForest.defaultForest(3, 0L);
        assertEquals(3, f.getDimensions());
        assertEquals(RandomCutForest.DEFAULT_SHINGLE_SIZE, f.getShingleSize());
        assertEquals(RandomCutForest.DEFAULT_NUMBER_OF_TREES, f.getNumberOfTrees());
        assertEquals(RandomCutForest.DEFAULT_SAMPLE_SIZE, f.getSampleSize());
        assertEquals(64, f.getOutputAfter());
        assertEquals(RandomCutForest.DEFAULT_LAMBDA, f.getLambda());
        assertEquals(0L, f.getRandomSeed());
        assertTrue(f.isInternalShinglingEnabled());
        assertFalse(f.isParallelExecutionEnabled());
        assertTrue(f.getThreadPoolSize() >= 1);
        assertEquals(RandomCutForest.DEFAULT_NUMBER_OF_TREES, f.getComponents().size());
        assertEquals(0L, f.getEntriesSeen());
    }

    @Test
    public void testInvalidOptions() {
        assertInvalidOption(RandomCutForest.builder().dimensions(0));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).shingleSize(0));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).numberOfTrees(0));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).sampleSize(0));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).outputAfter(-1));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).lambda(-0.1));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).lambda(Double.POSITIVE_INFINITY));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).lambda(Double.NaN));
        assertInvalidOption(RandomCutForest.builder().dimensions(2).parallelExecutionEnabled(true).threadPoolSize(0));
    }

    @Test
    public void testThreadPoolSizeIgnoredWhenSequential() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).threadPoolSize(0).build();
        assertFalse(f.isParallelExecutionEnabled());
    }

    private static void assertInvalidOption(RandomCutForest.Builder<?> builder) {
        RandomCutForestException e = assertThrows(RandomCutForestException.class, builder::build);
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }

    @Test
    public void testUpdateWithWrongDimension() {
        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> forest.update(new double[] { 1.0, 2.0 }));
        assertEquals(ErrorKind.INVALID_DIMENSION, e.getKind());
        assertEquals(0L, forest.getEntriesSeen());

        e = assertThrows(RandomCutForestException.class, () -> forest.getAnomalyScore(new double[0]));
        assertEquals(ErrorKind.INVALID_DIMENSION, e.getKind());
        assertThrows(NullPointerException.class, () -> forest.update(null));
    }

    @Test
    public void testExternalShinglingExpectsFullShingles() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).shingleSize(3).internalShinglingEnabled(false)
                .numberOfTrees(5).sampleSize(16).outputAfter(4).randomSeed(1L).build();
        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> f.update(new double[] { 1.0, 2.0 }));
        assertEquals(ErrorKind.INVALID_DIMENSION, e.getKind());

        for (int i = 0; i < 5; i++) {
            assertFalse(f.isOutputReady());
            f.update(new double[] { i, i, i, i, i, i });
        }
        assertTrue(f.isOutputReady());
        assertEquals(5L, f.getEntriesSeen());
        assertArrayEquals(new double[] { 1, 2, 3, 4, 5, 6 }, f.getShingledPoint(new double[] { 1, 2, 3, 4, 5, 6 }));
    }

    @Test
    public void testOutputReadyAccountsForShingleWarmUp() {
        RandomCutForest f = RandomCutForest.builder().dimensions(1).shingleSize(4).numberOfTrees(5).sampleSize(32)
                .outputAfter(10).randomSeed(3L).build();
        for (int i = 0; i < 13; i++) {
            f.update(new double[] { i });
            assertFalse(f.isOutputReady());
        }
        f.update(new double[] { 13 });
        assertTrue(f.isOutputReady());
        assertEquals(14L, f.getEntriesSeen());
    }

    @Test
    public void testFarPointScoresHighOnceReady() {
        RandomCutForest f = RandomCutForest.builder().dimensions(10).shingleSize(2).outputAfter(1).numberOfTrees(20)
                .sampleSize(64).randomSeed(31L).build();
        double[] far = new double[10];
        Arrays.fill(far, 1e9);
        NormalMixtureTestData generator = new NormalMixtureTestData();
        int readyQueries = 0;
        for (double[] point : generator.generateTestData(200, 10, 32L)) {
            if (f.isOutputReady()) {
                assertThat(f.getAnomalyScore(far), greaterThanOrEqualTo(1.5));
                readyQueries++;
            } else {
                assertEquals(0.0, f.getAnomalyScore(far));
            }
            f.update(point);
        }
        assertEquals(197, readyQueries);
    }

    @Test
    public void testNonFinitePointsChangeNothing() {
        for (double[] point : ExampleDataSets.sineWave(50, PERIOD, AMPLITUDE)) {
            forest.update(point);
        }
        float[] shingle = forest.getUpdateCoordinator().getCurrentShingle();
        double score = forest.getAnomalyScore(new double[] { 3.0 });
        int[] masses = forest.getComponents().stream().mapToInt(c -> c.getTree().getMass()).toArray();

        for (double value : new double[] { Double.NaN, 1e39, Double.NEGATIVE_INFINITY }) {
            RandomCutForestException e = assertThrows(RandomCutForestException.class,
                    () -> forest.update(new double[] { value }));
            assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
            assertThat(e.getMessage(), containsString("finite"));
        }

        assertEquals(50L, forest.getEntriesSeen());
        assertArrayEquals(shingle, forest.getUpdateCoordinator().getCurrentShingle());
        assertArrayEquals(masses, forest.getComponents().stream().mapToInt(c -> c.getTree().getMass()).toArray());
        for (SampledTree component : forest.getComponents()) {
            assertEquals(component.getSampler().size(), component.getTree().getMass());
        }
        assertEquals(score, forest.getAnomalyScore(new double[] { 3.0 }));
    }

    @Test
    public void testResultsBeforeOutputReady() {
        forest.update(new double[] { 1.0 });
        double[] point = { 2.0 };
        assertEquals(0.0, forest.getAnomalyScore(point));
        assertEquals(0.0, forest.getDisplacementScore(point));
        DiVector attribution = forest.getAnomalyAttribution(point);
        assertEquals(4, attribution.getDimensions());
        assertEquals(0.0, attribution.getHighLowSum());
        assertTrue(forest.getNearNeighborList(point, 50).isEmpty());

        RangeVector forecast = forest.extrapolate(3);
        assertEquals(3, forecast.values.length);
        assertArrayEquals(new float[3], forecast.values);

        double[] shingled = { 1.0, 2.0, 3.0, 4.0 };
        double[] imputed = forest.imputeMissingValues(shingled, new int[] { 3 });
        assertArrayEquals(shingled, imputed);
        assertNotSame(shingled, imputed);
    }

    @Test
    public void testAnomalyScoreSeparatesSpike() {
        double[][] data = ExampleDataSets.sineWave(2000, PERIOD, AMPLITUDE);
        double[] recent = new double[50];
        for (int i = 0; i < data.length; i++) {
            if (i >= data.length - recent.length) {
                recent[i - (data.length - recent.length)] = forest.getAnomalyScore(data[i]);
            }
            forest.update(data[i]);
        }
        Arrays.sort(recent);
        double median = (recent[24] + recent[25]) / 2;
        double spike = forest.getAnomalyScore(new double[] { 100.0 });
        assertThat(spike, greaterThan(3 * median));
    }

    @Test
    public void testAttributionSumsToScore() {
        NormalMixtureTestData generator = new NormalMixtureTestData();
        RandomCutForest f = RandomCutForest.builder().dimensions(3).numberOfTrees(20).sampleSize(64).randomSeed(5L)
                .build();
        for (double[] point : generator.generateTestData(500, 3, 11L)) {
            f.update(point);
        }
        for (double[] query : generator.generateTestData(20, 3, 12L)) {
            DiVector attribution = f.getAnomalyAttribution(query);
            assertEquals(f.getAnomalyScore(query), attribution.getHighLowSum(), 1e-6);
        }
        double[] outlier = { 50.0, -50.0, 0.0 };
        DiVector attribution = f.getAnomalyAttribution(outlier);
        assertEquals(f.getAnomalyScore(outlier), attribution.getHighLowSum(), 1e-6);
        assertThat(attribution.high[0], greaterThan(attribution.low[0]));
        assertThat(attribution.low[1], greaterThan(attribution.high[1]));
    }

    @Test
    public void testSequentialAndParallelAgree() {
        RandomCutForest.Builder<?> builder = RandomCutForest.builder().dimensions(4).numberOfTrees(16).sampleSize(64)
                .randomSeed(123L);
        RandomCutForest sequential = builder.parallelExecutionEnabled(false).build();
        RandomCutForest parallel = builder.parallelExecutionEnabled(true).threadPoolSize(4).build();

        NormalMixtureTestData generator = new NormalMixtureTestData();
        for (double[] point : generator.generateTestData(1000, 4, 99L)) {
            assertEquals(sequential.getAnomalyScore(point), parallel.getAnomalyScore(point), 1e-10);
            DiVector a = sequential.getAnomalyAttribution(point);
            DiVector b = parallel.getAnomalyAttribution(point);
            assertArrayEquals(a.high, b.high, 1e-10);
            assertArrayEquals(a.low, b.low, 1e-10);
            sequential.update(point);
            parallel.update(point);
        }
        parallel.close();
    }

    @Test
    public void testSameSeedSameResults() {
        RandomCutForest other = RandomCutForest.builder().dimensions(1).shingleSize(4).numberOfTrees(30)
                .sampleSize(256).randomSeed(42L).lambda(0.0).build();
        for (double[] point : ExampleDataSets.sineWave(400, PERIOD, AMPLITUDE)) {
            forest.update(point);
            other.update(point);
        }
        double[] query = { 3.0 };
        assertEquals(forest.getAnomalyScore(query), other.getAnomalyScore(query));
    }

    @Test
    public void testTreeMassBoundedBySampleSize() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).numberOfTrees(10).sampleSize(32).lambda(0.01)
                .randomSeed(17L).build();
        NormalMixtureTestData generator = new NormalMixtureTestData();
        for (double[] point : generator.generateTestData(300, 2, 4L)) {
            f.update(point);
        }
        for (SampledTree component : f.getComponents()) {
            assertThat(component.getTree().getMass(), lessThanOrEqualTo(32));
            assertEquals(component.getSampler().size(), component.getTree().getMass());
        }
        assertTrue(f.samplersFull());
    }

    @Test
    public void testGetShingledPointHasNoSideEffects() {
        for (int i = 0; i < 5; i++) {
            forest.update(new double[] { i });
        }
        double[] shingled = forest.getShingledPoint(new double[] { 9.0 });
        assertArrayEquals(new double[] { 2.0, 3.0, 4.0, 9.0 }, shingled);
        assertArrayEquals(shingled, forest.getShingledPoint(new double[] { 9.0 }));
        assertEquals(5L, forest.getEntriesSeen());
        assertArrayEquals(new float[] { 1.0f, 2.0f, 3.0f, 4.0f }, forest.getUpdateCoordinator().getCurrentShingle());
    }

    @Test
    public void testCopyContinuesIdentically() {
        double[][] data = ExampleDataSets.sineWave(800, PERIOD, AMPLITUDE);
        for (int i = 0; i < 500; i++) {
            forest.update(data[i]);
        }
        RandomCutForest copy = forest.copy();
        assertNotSame(forest, copy);
        assertEquals(forest.getEntriesSeen(), copy.getEntriesSeen());
        for (int i = 500; i < data.length; i++) {
            assertEquals(forest.getAnomalyScore(data[i]), copy.getAnomalyScore(data[i]), 1e-10);
            forest.update(data[i]);
            copy.update(data[i]);
        }
        copy.update(new double[] { 50.0 });
        assertEquals(forest.getEntriesSeen() + 1, copy.getEntriesSeen());
    }

    @Test
    public void testSetLambda() {
        forest.setLambda(0.001);
        assertEquals(0.001, forest.getLambda());
        for (SampledTree component : forest.getComponents()) {
            assertEquals(0.001, component.getSampler().getTimeDecay());
        }
        RandomCutForestException e = assertThrows(RandomCutForestException.class, () -> forest.setLambda(-1.0));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }

    @Test
    public void testSimpleDensity() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).numberOfTrees(10).sampleSize(32).randomSeed(8L)
                .build();
        assertEquals(0.0, f.getDensity(new double[] { 0.0, 0.0 }));
        NormalMixtureTestData generator = new NormalMixtureTestData(0.0, 1.0, 0.0, 1.0, 0.0, 1.0);
        for (double[] point : generator.generateTestData(200, 2, 21L)) {
            f.update(point);
        }
        DensityEstimate near = f.getSimpleDensity(new double[] { 0.0, 0.0 });
        double far = f.getDensity(new double[] { 40.0, 40.0 });
        assertThat(near.getDensity(), greaterThan(far));
        assertThat(far, greaterThan(0.0));
        assertEquals(2, f.getDirectionalDensity(new double[] { 0.0, 0.0 }).getDimensions());
        assertEquals(2, f.getDensityInterpolant(new double[] { 0.0, 0.0 }).getDimensions());
    }

    @Test
    public void testDisplacementScore() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).numberOfTrees(20).sampleSize(64).randomSeed(13L)
                .build();
        NormalMixtureTestData generator = new NormalMixtureTestData(0.0, 1.0, 0.0, 1.0, 0.0, 1.0);
        for (double[] point : generator.generateTestData(300, 2, 14L)) {
            f.update(point);
        }
        assertTrue(f.isOutputReady());
        double inlier = f.getDisplacementScore(new double[] { 0.0, 0.0 });
        double outlier = f.getDisplacementScore(new double[] { 30.0, -30.0 });
        assertThat(outlier, greaterThan(inlier));
        for (double[] query : generator.generateTestData(20, 2, 15L)) {
            assertThat(f.getDisplacementScore(query), allOf(greaterThanOrEqualTo(0.0), lessThanOrEqualTo(1.0)));
        }
        assertThat(outlier, lessThanOrEqualTo(1.0));
        assertThat(inlier, greaterThanOrEqualTo(0.0));
    }

    @Test
    public void testToStringShowsConfiguration() {
        forest.update(new double[] { 1.0 });
        String text = forest.toString();
        assertThat(text, containsString("dimensions=1"));
        assertThat(text, containsString("shingleSize=4"));
        assertThat(text, containsString("numberOfTrees=30"));
        assertThat(text, containsString("sampleSize=256"));
        assertThat(text, containsString("randomSeed=42"));
        assertThat(text, containsString("entriesSeen=1"));
    }

    @Test
    public void testClosestNeighborMatchesBruteForce() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).numberOfTrees(10).sampleSize(64).randomSeed(16L)
                .build();
        NormalMixtureTestData generator = new NormalMixtureTestData();
        for (double[] point : generator.generateTestData(500, 2, 17L)) {
            f.update(point);
        }
        for (double[] query : generator.generateTestData(30, 2, 18L)) {
            float[] shingled = f.getUpdateCoordinator().shingledPoint(query);
            double best = Double.MAX_VALUE;
            for (SampledTree component : f.getComponents()) {
                for (SampledPoint sampled : component.getSampler().getSample()) {
                    float[] point = sampled.getPoint();
                    double sum = 0;
                    for (int i = 0; i < point.length; i++) {
                        double diff = (double) shingled[i] - point[i];
                        sum += diff * diff;
                    }
                    best = Math.min(best, Math.sqrt(sum));
                }
            }
            List<Neighbor> neighbors = f.getNearNeighborList(query, 0);
            assertFalse(neighbors.isEmpty());
            assertEquals(best, neighbors.get(0).distance, 1e-9);
        }
    }

    @Test
    public void testNearNeighbors() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).numberOfTrees(20).sampleSize(64).randomSeed(9L)
                .storeAttributesEnabled(true).build();
        double[][] data = ExampleDataSets.generateFan(50, 3);
        for (double[] point : data) {
            f.update(point);
        }
        double[] query = data[data.length - 1];
        List<Neighbor> neighbors = f.getNearNeighborList(query, 100);
        assertFalse(neighbors.isEmpty());
        for (int i = 1; i < neighbors.size(); i++) {
            assertThat(neighbors.get(i - 1).distance, lessThanOrEqualTo(neighbors.get(i).distance));
        }
        Neighbor closest = neighbors.get(0);
        assertEquals(0.0, closest.distance, 1e-6);
        assertFalse(closest.sequenceIndexes.isEmpty());
        assertThat(closest.score, greaterThan(0.0));

        assertThat(f.getNearNeighborList(query, 0).size(), lessThanOrEqualTo(neighbors.size()));

        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> f.getNearNeighborList(query, 101));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }

    @Test
    public void testImputeMissingValues() {
        RandomCutForest f = RandomCutForest.builder().dimensions(2).numberOfTrees(20).sampleSize(64).randomSeed(10L)
                .build();
        for (int i = 0; i < 300; i++) {
            double x = (i % 50) / 5.0;
            f.update(new double[] { x, 2 * x });
        }
        double[] point = { 4.0, Double.NaN };
        double[] imputed = f.imputeMissingValues(point, new int[] { 1 });
        assertEquals(4.0, imputed[0]);
        assertTrue(imputed[1] >= 0.0 && imputed[1] <= 20.0);
        assertTrue(Double.isNaN(point[1]));

        assertArrayEquals(new double[] { 1.0, 2.0 }, f.imputeMissingValues(new double[] { 1.0, 2.0 }, new int[0]));

        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> f.imputeMissingValues(new double[] { 1.0, 2.0 }, new int[] { 2 }));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
        e = assertThrows(RandomCutForestException.class,
                () -> f.imputeMissingValues(new double[] { 1.0 }, new int[] { 0 }));
        assertEquals(ErrorKind.INVALID_DIMENSION, e.getKind());
    }

    @Test
    public void testExtrapolate() {
        RandomCutForest f = RandomCutForest.builder().dimensions(1).shingleSize(8).numberOfTrees(30).sampleSize(128)
                .randomSeed(11L).build();
        for (double[] point : ExampleDataSets.sineWave(1000, PERIOD, AMPLITUDE)) {
            f.update(point);
        }
        RangeVector forecast = f.extrapolate(10);
        assertEquals(10, forecast.values.length);
        for (int i = 0; i < 10; i++) {
            assertThat((double) forecast.lower[i], lessThanOrEqualTo((double) forecast.values[i]));
            assertThat((double) forecast.values[i], lessThanOrEqualTo((double) forecast.upper[i]));
            assertThat(Math.abs((double) forecast.values[i]), lessThanOrEqualTo(AMPLITUDE + 1e-3));
        }
        long entries = f.getEntriesSeen();
        f.extrapolate(3);
        assertEquals(entries, f.getEntriesSeen());

        RandomCutForestException e = assertThrows(RandomCutForestException.class, () -> f.extrapolate(0));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
    }

    @Test
    public void testTraverseForestRejectsNullArguments() {
        double[] point = { 1.0 };
        assertThrows(NullPointerException.class, () -> forest.traverseForest(point, null, Double::sum, x -> x));
        assertThrows(NullPointerException.class,
                () -> forest.traverseForest(point, TestUtils.DUMMY_VISITOR_FACTORY, null, x -> x));
        assertThrows(NullPointerException.class,
                () -> forest.traverseForestMulti(point, TestUtils.DUMMY_MULTI_VISITOR_FACTORY, null));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 5, 10 })
    public void testQuantile(int length) {
        double[] sorted = new double[length];
        for (int i = 0; i < length; i++) {
            sorted[i] = i;
        }
        assertEquals(0.0, RandomCutForest.quantile(sorted, 0.0));
        assertEquals(length - 1, RandomCutForest.quantile(sorted, 1.0));
        assertEquals((length - 1) / 2.0, RandomCutForest.quantile(sorted, 0.5), 1e-12);
    }

    @Test
    public void testNearestRank() {
        assertEquals(0, RandomCutForest.nearestRank(10, 0.0));
        assertEquals(0, RandomCutForest.nearestRank(10, 0.1));
        assertEquals(4, RandomCutForest.nearestRank(10, 0.5));
        assertEquals(9, RandomCutForest.nearestRank(10, 1.0));
        assertEquals(0, RandomCutForest.nearestRank(1, 0.5));
    }
}
