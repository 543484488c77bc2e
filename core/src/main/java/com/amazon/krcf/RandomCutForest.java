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

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkNotNull;
import static com.amazon.krcf.CommonUtils.checkOption;
import static com.amazon.krcf.CommonUtils.toDoubleArray;
import static com.amazon.krcf.CommonUtils.toFloatArray;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.krcf.anomalydetection.AttributionVisitor;
import com.amazon.krcf.anomalydetection.ScoreVisitor;
import com.amazon.krcf.executor.ForestExecutor;
import com.amazon.krcf.executor.ParallelForestExecutor;
import com.amazon.krcf.executor.SampledTree;
import com.amazon.krcf.executor.SequentialForestExecutor;
import com.amazon.krcf.executor.ShinglingCoordinator;
import com.amazon.krcf.imputation.ImputeVisitor;
import com.amazon.krcf.inspect.NearNeighborVisitor;
import com.amazon.krcf.interpolation.InterpolationVisitor;
import com.amazon.krcf.returntypes.DensityEstimate;
import com.amazon.krcf.returntypes.DiVector;
import com.amazon.krcf.returntypes.Neighbor;
import com.amazon.krcf.returntypes.RangeVector;
import com.amazon.krcf.sampler.StreamSampler;
import com.amazon.krcf.state.RandomCutForestMapper;
import com.amazon.krcf.tree.RandomCutTree;
import com.amazon.krcf.util.Shingler;

/**
 * The RandomCutForest class is the interface to the algorithms in this package,
 * and includes methods for anomaly detection, anomaly detection with
 * attribution, density estimation, near neighbors, imputation and
 * extrapolation. A Random Cut Forest is a collection of Random Cut Trees and
 * stream samplers. When an update call is made to a Random Cut Forest, the
 * point is shingled and each sampler is independently updated with the shingle;
 * if the sampler accepts it, the corresponding Random Cut Tree is also updated.
 * Similarly, when an algorithm method is called, the Random Cut Forest proxies
 * to the trees which implement the actual scoring logic, and combines the
 * partial results into a final result.
 *
 * Updates are exclusive; queries may run concurrently with each other.
 */
public class RandomCutForest implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(RandomCutForest.class);

    /**
     * Default sample size. This is the number of points retained by the stream
     * sampler.
     */
    public static final int DEFAULT_SAMPLE_SIZE = 256;

    /**
     * Default fraction used to compute the amount of points required by stream
     * samplers before results are returned.
     */
    public static final double DEFAULT_OUTPUT_AFTER_FRACTION = 0.25;

    /**
     * Default number of trees to use in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 50;

    public static final int DEFAULT_SHINGLE_SIZE = 1;

    public static final double DEFAULT_LAMBDA = 0.0;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    public static final boolean DEFAULT_INTERNAL_SHINGLING_ENABLED = true;

    public static final boolean DEFAULT_STORE_POINT_SUM_ENABLED = false;

    public static final boolean DEFAULT_STORE_ATTRIBUTES_ENABLED = false;

    /**
     * Percentiles of the per-tree predictions reported as the bounds of an
     * extrapolation.
     */
    public static final double EXTRAPOLATION_LOWER_QUANTILE = 0.1;

    public static final double EXTRAPOLATION_UPPER_QUANTILE = 0.9;

    /**
     * Number of dimensions of the raw input points.
     */
    protected final int dimensions;

    protected final int shingleSize;

    protected final int numberOfTrees;

    protected final int sampleSize;

    protected final int outputAfter;

    protected final long randomSeed;

    protected final boolean parallelExecutionEnabled;

    protected final int threadPoolSize;

    protected final boolean internalShinglingEnabled;

    protected final boolean storePointSumEnabled;

    protected final boolean storeAttributesEnabled;

    protected volatile double lambda;

    protected final ShinglingCoordinator updateCoordinator;

    protected final List<SampledTree> components;

    protected final ForestExecutor executor;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public RandomCutForest(Builder<?> builder) {
        this(builder, false);
        Random rng = new Random(randomSeed);
        List<SampledTree> newComponents = new ArrayList<>(numberOfTrees);
        int shingledDimensions = dimensions * shingleSize;
        for (int i = 0; i < numberOfTrees; i++) {
            long treeSeed = rng.nextLong();
            long samplerSeed = rng.nextLong();
            RandomCutTree tree = RandomCutTree.builder().dimension(shingledDimensions).randomSeed(treeSeed)
                    .storeSequenceIndexesEnabled(storeAttributesEnabled).centerOfMassEnabled(storePointSumEnabled)
                    .build();
            StreamSampler sampler = StreamSampler.builder().capacity(sampleSize).timeDecay(lambda)
                    .randomSeed(samplerSeed).build();
            newComponents.add(new SampledTree(sampler, tree));
        }
        this.components.addAll(newComponents);
        logger.debug("created forest with dimensions={}, shingleSize={}, numberOfTrees={}, sampleSize={}",
                dimensions, shingleSize, numberOfTrees, sampleSize);
    }

    /**
     * Create a forest around existing components. Used when a forest is restored
     * from its persisted state.
     *
     * @param builder           the configuration
     * @param updateCoordinator the coordinator holding the shingle and the update
     *                          count
     * @param components        the sampled trees, in tree order
     */
    public RandomCutForest(Builder<?> builder, ShinglingCoordinator updateCoordinator,
            List<SampledTree> components) {
        this(builder, updateCoordinator, components, false);
        checkArgument(components.size() == numberOfTrees, "the number of components must equal numberOfTrees");
        logger.debug("restored forest with dimensions={}, shingleSize={}, numberOfTrees={}, entriesSeen={}",
                dimensions, shingleSize, numberOfTrees, updateCoordinator.getEntriesSeen());
    }

    private RandomCutForest(Builder<?> builder, boolean notUsed) {
        this(builder, new ShinglingCoordinator(new Shingler(validDimensions(builder), validShingleSize(builder)),
                builder.internalShinglingEnabled), new ArrayList<>(), notUsed);
    }

    private RandomCutForest(Builder<?> builder, ShinglingCoordinator updateCoordinator,
            List<SampledTree> components, boolean notUsed) {
        checkNotNull(updateCoordinator, "updateCoordinator must not be null");
        checkNotNull(components, "components must not be null");
        validate(builder);

        dimensions = builder.dimensions;
        shingleSize = builder.shingleSize;
        numberOfTrees = builder.numberOfTrees;
        sampleSize = builder.sampleSize;
        outputAfter = builder.outputAfter.orElse((int) (sampleSize * DEFAULT_OUTPUT_AFTER_FRACTION));
        randomSeed = builder.randomSeed.orElseGet(() -> new Random().nextLong());
        lambda = builder.lambda;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize
                .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        internalShinglingEnabled = builder.internalShinglingEnabled;
        storePointSumEnabled = builder.storePointSumEnabled;
        storeAttributesEnabled = builder.storeAttributesEnabled;

        checkArgument(updateCoordinator.getShingler().getDimensions() == dimensions
                && updateCoordinator.getShingler().getShingleSize() == shingleSize, "shingler does not match");
        checkArgument(updateCoordinator.isInternalShinglingEnabled() == internalShinglingEnabled,
                "shingling mode does not match");

        this.updateCoordinator = updateCoordinator;
        this.components = components;

        executor = parallelExecutionEnabled ? new ParallelForestExecutor(components, threadPoolSize)
                : new SequentialForestExecutor(components);
    }

    private static int validDimensions(Builder<?> builder) {
        checkOption(builder.dimensions > 0, "dimensions must be greater than 0");
        return builder.dimensions;
    }

    private static int validShingleSize(Builder<?> builder) {
        checkOption(builder.shingleSize > 0, "shingleSize must be greater than 0");
        return builder.shingleSize;
    }

    private static void validate(Builder<?> builder) {
        validDimensions(builder);
        validShingleSize(builder);
        checkOption(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkOption(builder.sampleSize > 0, "sampleSize must be greater than 0");
        builder.outputAfter.ifPresent(n -> checkOption(n >= 0, "outputAfter must be greater than or equal to 0"));
        checkOption(builder.lambda >= 0 && Double.isFinite(builder.lambda),
                "lambda must be finite and greater than or equal to 0");
        builder.threadPoolSize.ifPresent(n -> checkOption(n > 0 || !builder.parallelExecutionEnabled,
                "threadPoolSize must be greater than 0. To disable thread pool, set parallel execution to 'false'."));
    }

    /**
     * @return a new RandomCutForest builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Create a new RandomCutForest with optional arguments set to default values.
     *
     * @param dimensions The number of dimension in the input data.
     * @param randomSeed The random seed to use to create the forest random number
     *                   generator
     * @return a new RandomCutForest with optional arguments set to default values.
     */
    public static RandomCutForest defaultForest(int dimensions, long randomSeed) {
        return builder().dimensions(dimensions).randomSeed(randomSeed).build();
    }

    public static RandomCutForest defaultForest(int dimensions) {
        return builder().dimensions(dimensions).build();
    }

    /**
     * @return the number of trees in the forest.
     */
    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    /**
     * @return the sample size used by stream samplers in this forest.
     */
    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * @return the number of points in a shingle.
     */
    public int getShingleSize() {
        return shingleSize;
    }

    /**
     * @return the number of full-shingle updates required before results are
     *         returned.
     */
    public int getOutputAfter() {
        return outputAfter;
    }

    /**
     * @return the number of dimensions of the raw input points.
     */
    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return the number of dimensions of the points stored in the trees.
     */
    public int getShingledDimensions() {
        return dimensions * shingleSize;
    }

    /**
     * @return the decay factor used by stream samplers in this forest.
     */
    public double getLambda() {
        return lambda;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public boolean isInternalShinglingEnabled() {
        return internalShinglingEnabled;
    }

    public boolean isStorePointSumEnabled() {
        return storePointSumEnabled;
    }

    public boolean isStoreAttributesEnabled() {
        return storeAttributesEnabled;
    }

    public ShinglingCoordinator getUpdateCoordinator() {
        return updateCoordinator;
    }

    public List<SampledTree> getComponents() {
        return components;
    }

    /**
     * @return the number of calls to {@link #update} so far.
     */
    public long getEntriesSeen() {
        return updateCoordinator.getEntriesSeen();
    }

    /**
     * Update the forest with the given point. The point is shingled and the
     * shingle, once the window is full, is submitted to each sampler in the
     * forest. If the sampler accepts the shingle, the shingle is submitted to the
     * update method in the corresponding Random Cut Tree. Points of the wrong
     * length, or with a coordinate that is not a finite float, are rejected before
     * any state changes.
     *
     * @param point The point used to update the forest.
     */
    public void update(double[] point) {
        checkNotNull(point, "point must not be null");
        lock.writeLock().lock();
        try {
            updateCoordinator.checkInput(point);
            boolean wasReady = isOutputReady();
            long sequenceIndex = updateCoordinator.getEntriesSeen();
            try {
                float[] shingle = updateCoordinator.prepare(point);
                if (shingle != null) {
                    executor.update(shingle, sequenceIndex);
                }
                updateCoordinator.complete(shingle);
            } catch (RandomCutForestException e) {
                logger.error("update failed after {} entries: {}", sequenceIndex, e.getMessage());
                throw e;
            }
            if (!wasReady && isOutputReady()) {
                logger.info("output is ready after {} entries", updateCoordinator.getEntriesSeen());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Changes the time decay of every sampler on the fly.
     *
     * @param lambda new value of the decay factor
     */
    public void setLambda(double lambda) {
        checkOption(lambda >= 0 && Double.isFinite(lambda), "lambda must be finite and greater than or equal to 0");
        lock.writeLock().lock();
        try {
            this.lambda = lambda;
            components.forEach(c -> c.getSampler().setTimeDecay(lambda));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Visit each of the trees in the forest and combine the individual results into
     * an aggregate result. The point is shingled the same way as for scoring. The
     * results from all the trees are combined, in tree order, using the
     * accumulator and then transformed using the finisher before being returned.
     *
     * @param point          The point that defines the traversal path.
     * @param visitorFactory A factory method which is invoked for each tree to
     *                       construct a visitor.
     * @param accumulator    A function that combines the results from individual
     *                       trees into an aggregate result.
     * @param finisher       A function called on the aggregate result in order to
     *                       produce the final result.
     * @param <R>            The visitor result type.
     * @param <S>            The final type.
     * @return The aggregated and finalized result.
     */
    public <R, S> S traverseForest(double[] point, IVisitorFactory<R> visitorFactory, BinaryOperator<R> accumulator,
            Function<R, S> finisher) {
        checkNotNull(visitorFactory, "visitorFactory must not be null");
        checkNotNull(accumulator, "accumulator must not be null");
        checkNotNull(finisher, "finisher must not be null");
        return withReadLock(() -> executor.traverseForest(updateCoordinator.shingledPoint(point),
                visitorFactory, accumulator, finisher));
    }

    public <R, S> S traverseForest(double[] point, IVisitorFactory<R> visitorFactory, Collector<R, ?, S> collector) {
        checkNotNull(visitorFactory, "visitorFactory must not be null");
        checkNotNull(collector, "collector must not be null");
        return withReadLock(() -> executor.traverseForest(updateCoordinator.shingledPoint(point),
                visitorFactory, collector));
    }

    public <R, S> S traverseForestMulti(double[] point, IMultiVisitorFactory<R> visitorFactory,
            BinaryOperator<R> accumulator, Function<R, S> finisher) {
        checkNotNull(visitorFactory, "visitorFactory must not be null");
        checkNotNull(accumulator, "accumulator must not be null");
        checkNotNull(finisher, "finisher must not be null");
        return withReadLock(() -> executor.traverseForestMulti(updateCoordinator.shingledPoint(point),
                visitorFactory, accumulator, finisher));
    }

    public <R, S> S traverseForestMulti(double[] point, IMultiVisitorFactory<R> visitorFactory,
            Collector<R, ?, S> collector) {
        checkNotNull(visitorFactory, "visitorFactory must not be null");
        checkNotNull(collector, "collector must not be null");
        return withReadLock(() -> executor.traverseForestMulti(updateCoordinator.shingledPoint(point),
                visitorFactory, collector));
    }

    /**
     * Compute an anomaly score for the given point. The point being scored is
     * compared with the points in the sample to compute a measure of how anomalous
     * it is. Scores are greater than 0, with higher scores corresponding to being
     * more anomalous. A threshold of 1.0 is commonly used to distinguish anomalous
     * points from non-anomalous ones.
     * <p>
     * See {@link ScoreVisitor} and
     * {@link com.amazon.krcf.anomalydetection.ScoringRule#ANOMALY} for more
     * details about the anomaly score algorithm.
     *
     * @param point The point being scored.
     * @return an anomaly score for the given point, or 0 before output is ready.
     */
    public double getAnomalyScore(double[] point) {
        return withReadLock(() -> {
            float[] shingledPoint = updateCoordinator.shingledPoint(point);
            if (!isOutputReady()) {
                return 0.0;
            }
            return scoreShingledPoint(shingledPoint);
        });
    }

    private double scoreShingledPoint(float[] shingledPoint) {
        return executor.traverseForest(shingledPoint,
                (tree, x) -> ScoreVisitor.anomaly(x, tree.getMass()), Double::sum, sum -> sum / numberOfTrees);
    }

    /**
     * Compute the expected fraction of the sample that would be displaced by
     * inserting the point, averaged over the trees.
     * <p>
     * See {@link com.amazon.krcf.anomalydetection.ScoringRule#DISPLACEMENT}.
     *
     * @param point The point being scored.
     * @return the displacement score, or 0 before output is ready.
     */
    public double getDisplacementScore(double[] point) {
        return withReadLock(() -> {
            float[] shingledPoint = updateCoordinator.shingledPoint(point);
            if (!isOutputReady()) {
                return 0.0;
            }
            return executor.traverseForest(shingledPoint,
                    (tree, x) -> ScoreVisitor.displacement(x, tree.getMass()), Double::sum,
                    sum -> sum / numberOfTrees);
        });
    }

    /**
     * Compute an anomaly score attribution DiVector for the given point. The
     * result contains an anomaly score in both the positive and negative
     * directions for each dimension of the shingled point, and its high-low sum
     * equals {@link #getAnomalyScore(double[])} up to floating point summation.
     * <p>
     * See {@link AttributionVisitor} for more details.
     *
     * @param point The point being scored.
     * @return the attribution, or zeros before output is ready.
     */
    public DiVector getAnomalyAttribution(double[] point) {
        return withReadLock(() -> {
            float[] shingledPoint = updateCoordinator.shingledPoint(point);
            if (!isOutputReady()) {
                return new DiVector(shingledPoint.length);
            }
            return executor.traverseForest(shingledPoint,
                    (tree, x) -> new AttributionVisitor(x, tree.getMass()), DiVector::add,
                    x -> x.scale(1.0 / numberOfTrees));
        });
    }

    /**
     * Compute a density estimate at the given point.
     * <p>
     * See {@link InterpolationVisitor} and {@link DensityEstimate} for more
     * details about the density computation.
     *
     * @param point The point where the density estimate is made.
     * @return A density estimate, all zero until every sampler is full.
     */
    public DensityEstimate getSimpleDensity(double[] point) {
        return withReadLock(() -> {
            float[] shingledPoint = updateCoordinator.shingledPoint(point);
            // density estimation needs a full sample
            if (!samplersFull()) {
                return new DensityEstimate(shingledPoint.length, sampleSize);
            }
            Collector<DensityEstimate, ?, DensityEstimate> collector = DensityEstimate.collector(shingledPoint.length,
                    sampleSize, numberOfTrees);
            return executor.traverseForest(shingledPoint, (tree, x) -> new InterpolationVisitor(x, sampleSize),
                    collector);
        });
    }

    /**
     * @param point the query point
     * @return the scalar density estimate at the point
     */
    public double getDensity(double[] point) {
        return getSimpleDensity(point).getDensity();
    }

    /**
     * @param point the query point
     * @return the density estimate split by direction and dimension
     */
    public DiVector getDirectionalDensity(double[] point) {
        return getSimpleDensity(point).getDirectionalDensity();
    }

    /**
     * @param point the query point
     * @return the interpolation the density estimates are derived from; the same
     *         value as {@link #getSimpleDensity(double[])}
     */
    public DensityEstimate getDensityInterpolant(double[] point) {
        return getSimpleDensity(point);
    }

    /**
     * For each tree in the forest, find the sample point closest to the query,
     * with its distance to the query. Points found by several trees are merged. Only neighbors whose distance is at most the
     * given percentile of the per-tree distances are kept. Each returned neighbor
     * carries the anomaly score of the neighbor point in this forest and, when
     * attributes are stored, the sequence indexes at which it entered the sample.
     *
     * @param point      A point whose neighbors we want to find.
     * @param percentile the percentile of the per-tree distances, between 0 and
     *                   100, used as a distance threshold
     * @return a list of Neighbors, ordered from closest to furthest.
     */
    public List<Neighbor> getNearNeighborList(double[] point, int percentile) {
        checkOption(percentile >= 0 && percentile <= 100, "percentile must be between 0 and 100");
        return withReadLock(() -> {
            float[] shingledPoint = updateCoordinator.shingledPoint(point);
            if (!isOutputReady()) {
                return Collections.<Neighbor>emptyList();
            }
            List<Optional<Neighbor>> perTree = executor.traverseEachMulti(shingledPoint,
                    (tree, x) -> new NearNeighborVisitor(x));
            double[] distances = perTree.stream().filter(Optional::isPresent).mapToDouble(n -> n.get().distance)
                    .sorted().toArray();
            if (distances.length == 0) {
                return Collections.<Neighbor>emptyList();
            }
            double threshold = distances[nearestRank(distances.length, percentile / 100.0)];
            List<Neighbor> neighbors = perTree.stream().filter(n -> n.isPresent() && n.get().distance <= threshold)
                    .collect(Neighbor.collector());
            return neighbors.stream().map(n -> n.withScore(scoreShingledPoint(toFloatArray(n.point))))
                    .collect(Collectors.toList());
        });
    }

    /**
     * Given a shingled point with missing values, return a new point with the
     * missing values imputed. Each tree produces an imputed point and the median
     * over the trees is returned for each missing coordinate.
     *
     * @param point          A point in the space of the trees, of length
     *                       {@code dimensions * shingleSize}.
     * @param missingIndexes The indexes of the missing values.
     * @return A point with the missing values imputed.
     */
    public double[] imputeMissingValues(double[] point, int[] missingIndexes) {
        checkNotNull(point, "point must not be null");
        checkNotNull(missingIndexes, "missingIndexes must not be null");
        CommonUtils.checkDimension(point, getShingledDimensions());
        boolean[] missing = new boolean[point.length];
        for (int index : missingIndexes) {
            checkOption(index >= 0 && index < point.length, "missing index out of range");
            missing[index] = true;
        }
        CommonUtils.checkFinite(point, missing);
        return withReadLock(() -> {
            if (missingIndexes.length == 0 || !isOutputReady()) {
                return Arrays.copyOf(point, point.length);
            }
            RangeVector imputed = impute(toFloatArray(point), missingIndexes);
            double[] result = Arrays.copyOf(point, point.length);
            for (int index : missingIndexes) {
                result[index] = imputed.values[index];
            }
            return result;
        });
    }

    /**
     * Predict the next values of the stream. Starting from the current shingle,
     * the shingle is shifted by one point and the newest point is imputed by the
     * trees; the median of the per-tree predictions is fed back as the newest
     * point, and the 10th and 90th percentiles are reported as bounds.
     *
     * @param lookAhead the number of future points to predict
     * @return a RangeVector of length {@code lookAhead * dimensions}, all zero
     *         before output is ready
     */
    public RangeVector extrapolate(int lookAhead) {
        checkOption(lookAhead > 0, "lookAhead must be greater than 0");
        return withReadLock(() -> {
            RangeVector result = new RangeVector(lookAhead * dimensions);
            if (!isOutputReady()) {
                return result;
            }
            float[] shingle = updateCoordinator.getCurrentShingle();
            int length = shingle.length;
            int[] missingIndexes = new int[dimensions];
            for (int i = 0; i < dimensions; i++) {
                missingIndexes[i] = length - dimensions + i;
            }
            for (int step = 0; step < lookAhead; step++) {
                float[] query = new float[length];
                System.arraycopy(shingle, dimensions, query, 0, length - dimensions);
                RangeVector imputed = impute(query, missingIndexes);
                for (int i = 0; i < dimensions; i++) {
                    int index = length - dimensions + i;
                    result.values[step * dimensions + i] = imputed.values[index];
                    result.upper[step * dimensions + i] = imputed.upper[index];
                    result.lower[step * dimensions + i] = imputed.lower[index];
                    query[index] = imputed.values[index];
                }
                shingle = query;
            }
            return result;
        });
    }

    /**
     * Impute the missing coordinates of a shingled point in every tree, and
     * summarize the per-tree values of each coordinate by their median and outer
     * quantiles.
     */
    private RangeVector impute(float[] query, int[] missingIndexes) {
        List<float[]> perTree = executor.traverseEachMulti(query,
                (tree, x) -> new ImputeVisitor(x, missingIndexes));
        float[] values = Arrays.copyOf(query, query.length);
        float[] upper = Arrays.copyOf(query, query.length);
        float[] lower = Arrays.copyOf(query, query.length);
        double[] column = new double[perTree.size()];
        for (int index : missingIndexes) {
            for (int j = 0; j < perTree.size(); j++) {
                column[j] = perTree.get(j)[index];
            }
            Arrays.sort(column);
            values[index] = (float) quantile(column, 0.5);
            upper[index] = (float) quantile(column, EXTRAPOLATION_UPPER_QUANTILE);
            lower[index] = (float) quantile(column, EXTRAPOLATION_LOWER_QUANTILE);
        }
        return new RangeVector(values, upper, lower);
    }

    /**
     * Linear interpolation between the order statistics of a sorted array.
     */
    static double quantile(double[] sorted, double q) {
        double position = q * (sorted.length - 1);
        int low = (int) Math.floor(position);
        int high = Math.min(low + 1, sorted.length - 1);
        double fraction = position - low;
        return sorted[low] + fraction * (sorted[high] - sorted[low]);
    }

    /**
     * Index of the nearest-rank percentile in a sorted array of the given length.
     */
    static int nearestRank(int length, double fraction) {
        int rank = (int) Math.ceil(fraction * length);
        return Math.min(Math.max(rank, 1), length) - 1;
    }

    /**
     * Return the shingle the forest would score for this point, without changing
     * any state.
     *
     * @param point a raw input point
     * @return the shingled point, of length {@code dimensions * shingleSize}
     */
    public double[] getShingledPoint(double[] point) {
        return withReadLock(() -> toDoubleArray(updateCoordinator.shingledPoint(point)));
    }

    /**
     * Output is ready once more than {@code outputAfter} updates have carried a
     * full shingle. The condition never reverts.
     *
     * @return true if queries return results computed from the trees.
     */
    public boolean isOutputReady() {
        long warmUp = internalShinglingEnabled ? shingleSize - 1 : 0;
        return updateCoordinator.getEntriesSeen() > outputAfter + warmUp;
    }

    /**
     * @return true if all samplers in the forest are full.
     */
    public boolean samplersFull() {
        return withReadLock(() -> components.stream().allMatch(c -> c.getSampler().isFull()));
    }

    /**
     * Create an independent copy of this forest. The copy continues exactly like
     * this forest when given the same updates.
     *
     * @return the copy
     */
    public RandomCutForest copy() {
        return withReadLock(() -> {
            RandomCutForestMapper mapper = new RandomCutForestMapper();
            return mapper.toModel(mapper.toState(this));
        });
    }

    /**
     * Shut down the worker pools of a parallel forest. A closed forest can still
     * be used; the pools are created again on demand.
     */
    @Override
    public void close() {
        executor.close();
    }

    @Override
    public String toString() {
        return "RandomCutForest(dimensions=" + dimensions + ", shingleSize=" + shingleSize + ", numberOfTrees="
                + numberOfTrees + ", sampleSize=" + sampleSize + ", outputAfter=" + outputAfter + ", lambda=" + lambda
                + ", randomSeed=" + randomSeed + ", internalShinglingEnabled=" + internalShinglingEnabled
                + ", parallelExecutionEnabled=" + parallelExecutionEnabled + ", threadPoolSize=" + threadPoolSize
                + ", storePointSumEnabled=" + storePointSumEnabled + ", storeAttributesEnabled="
                + storeAttributesEnabled + ", entriesSeen=" + getEntriesSeen() + ")";
    }

    private <T> T withReadLock(Supplier<T> supplier) {
        lock.readLock().lock();
        try {
            return supplier.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional primitive fields when it doesn't make
        // sense to use a constant default.

        private int dimensions;
        private int shingleSize = DEFAULT_SHINGLE_SIZE;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private Optional<Integer> outputAfter = Optional.empty();
        private Optional<Long> randomSeed = Optional.empty();
        private double lambda = DEFAULT_LAMBDA;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private boolean internalShinglingEnabled = DEFAULT_INTERNAL_SHINGLING_ENABLED;
        private boolean storePointSumEnabled = DEFAULT_STORE_POINT_SUM_ENABLED;
        private boolean storeAttributesEnabled = DEFAULT_STORE_ATTRIBUTES_ENABLED;

        public T dimensions(int dimensions) {
            this.dimensions = dimensions;
            return (T) this;
        }

        public T shingleSize(int shingleSize) {
            this.shingleSize = shingleSize;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T outputAfter(int outputAfter) {
            this.outputAfter = Optional.of(outputAfter);
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public T lambda(double lambda) {
            this.lambda = lambda;
            return (T) this;
        }

        public T timeDecay(double timeDecay) {
            return lambda(timeDecay);
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T internalShinglingEnabled(boolean internalShinglingEnabled) {
            this.internalShinglingEnabled = internalShinglingEnabled;
            return (T) this;
        }

        public T storePointSumEnabled(boolean storePointSumEnabled) {
            this.storePointSumEnabled = storePointSumEnabled;
            return (T) this;
        }

        public T storeAttributesEnabled(boolean storeAttributesEnabled) {
            this.storeAttributesEnabled = storeAttributesEnabled;
            return (T) this;
        }

        public RandomCutForest build() {
            return new RandomCutForest(this);
        }
    }
}
