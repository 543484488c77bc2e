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



package com.amazon.krcf.sampler;

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Random;

import lombok.Getter;

/**
 * A fixed size, time-decayed reservoir of shingles for one tree.
 * <p>
 * A shingle offered at sequence index {@code t} draws {@code u} uniformly from
 * (0, 1) and gets the key
 * </p>
 *
 * <pre>
 * key(t) = log(-log(u)) - lambda * t
 * </pre>
 * <p>
 * where {@code lambda * t} is accumulated piecewise when the decay changes
 * (see {@link #setTimeDecay}). The sample keeps the {@code capacity} smallest
 * keys: a new shingle is admitted when the sample is not full, or when its key
 * is smaller than the largest key held, which is then evicted. With
 * {@code lambda = 0} this is a uniform sample of the stream.
 * </p>
 * <p>
 * Admission takes two calls so that the paired tree can be kept in step:
 * {@link #acceptPoint} decides and evicts, then {@link #addPoint} stores the
 * reference the tree actually kept. Random draws come from a seed that is
 * replaced on every draw, so the seed is all the random state there is.
 * </p>
 */
public class StreamSampler {

    public static final int DEFAULT_CAPACITY = 256;

    @Getter
    private final int capacity;

    /**
     * Max-heap on the key; the head is the next entry to go.
     */
    private final PriorityQueue<SampledPoint> heap;

    @Getter
    private double timeDecay;

    /**
     * Decay accrued under earlier values of {@code timeDecay}.
     */
    @Getter
    private double accumulatedTimeDecay;

    /**
     * The sequence index at which {@code timeDecay} last changed.
     */
    @Getter
    private long mostRecentTimeDecayUpdate;

    @Getter
    private long maxSequenceIndex;

    @Getter
    private long randomSeed;

    private final Random fixedRandom;

    private boolean pending;
    private long pendingSequenceIndex;
    private float pendingWeight;
    private SampledPoint evicted;

    private StreamSampler(Builder builder) {
        checkArgument(builder.capacity > 0, "capacity must be greater than 0");
        checkArgument(builder.timeDecay >= 0, "timeDecay must be greater than or equal to 0");
        capacity = builder.capacity;
        timeDecay = builder.timeDecay;
        accumulatedTimeDecay = builder.accumulatedTimeDecay;
        mostRecentTimeDecayUpdate = builder.mostRecentTimeDecayUpdate;
        maxSequenceIndex = builder.maxSequenceIndex;
        randomSeed = builder.randomSeed;
        fixedRandom = builder.random;
        heap = new PriorityQueue<>(Comparator.comparingDouble(SampledPoint::getWeight).reversed());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Offer a shingle and store it if it is admitted.
     *
     * @param point         the shingle
     * @param sequenceIndex the update that offers it
     * @return true if the shingle entered the sample
     */
    public boolean update(float[] point, long sequenceIndex) {
        if (!acceptPoint(sequenceIndex)) {
            return false;
        }
        addPoint(point);
        return true;
    }

    /**
     * First half of an admission. Draws the key of the offered shingle and, if
     * it is admitted into a full sample, removes the entry with the largest key;
     * that entry is then available from {@link #getEvictedPoint()}.
     *
     * @param sequenceIndex the update that offers the shingle
     * @return true if {@link #addPoint} must be called next
     */
    public boolean acceptPoint(long sequenceIndex) {
        checkState(sequenceIndex >= mostRecentTimeDecayUpdate, "sequence index precedes the last change of decay");
        evicted = null;
        float weight = computeWeight(sequenceIndex);
        boolean admitted = heap.size() < capacity || weight < heap.peek().getWeight();
        if (admitted) {
            if (isFull()) {
                evicted = heap.poll();
            }
            pending = true;
            pendingSequenceIndex = sequenceIndex;
            pendingWeight = weight;
        }
        return admitted;
    }

    /**
     * Second half of an admission.
     *
     * @param point the reference to keep for the admitted shingle
     * @throws IllegalStateException unless the last {@link #acceptPoint} call
     *                               admitted a shingle that is not stored yet
     */
    public void addPoint(float[] point) {
        checkState(pending, "addPoint must follow a successful acceptPoint");
        heap.add(new SampledPoint(point, pendingWeight, pendingSequenceIndex));
        pending = false;
    }

    /**
     * Put back an entry of a saved sample. Entries must be given in the order of
     * {@link #getSample()} to get the same heap back.
     *
     * @param point         the shingle
     * @param weight        its key
     * @param sequenceIndex its sequence index
     */
    public void addSample(float[] point, float weight, long sequenceIndex) {
        checkState(heap.size() < capacity, "sampler is full");
        heap.add(new SampledPoint(point, weight, sequenceIndex));
    }

    /**
     * @return the entry removed by the last {@link #acceptPoint} call, if any
     */
    public Optional<SampledPoint> getEvictedPoint() {
        return Optional.ofNullable(evicted);
    }

    /**
     * @return a copy of the sample in heap order
     */
    public List<SampledPoint> getSample() {
        return new ArrayList<>(heap);
    }

    public int size() {
        return heap.size();
    }

    public boolean isFull() {
        return heap.size() >= capacity;
    }

    /**
     * Change the decay from the latest sequence index on. Decay accrued so far is
     * folded into {@code accumulatedTimeDecay}, so keys already drawn stay
     * comparable with new ones.
     *
     * @param newTimeDecay the new decay, at least 0
     */
    public void setTimeDecay(double newTimeDecay) {
        checkArgument(newTimeDecay >= 0, "timeDecay must be greater than or equal to 0");
        accumulatedTimeDecay += timeDecay * (maxSequenceIndex - mostRecentTimeDecayUpdate);
        mostRecentTimeDecayUpdate = maxSequenceIndex;
        timeDecay = newTimeDecay;
    }

    float computeWeight(long sequenceIndex) {
        maxSequenceIndex = Math.max(maxSequenceIndex, sequenceIndex);
        double u = nextUniform();
        while (u == 0.0) {
            u = nextUniform();
        }
        double decay = accumulatedTimeDecay + timeDecay * (sequenceIndex - mostRecentTimeDecayUpdate);
        return (float) (Math.log(-Math.log(u)) - decay);
    }

    private double nextUniform() {
        if (fixedRandom != null) {
            return fixedRandom.nextDouble();
        }
        Random draw = new Random(randomSeed);
        randomSeed = draw.nextLong();
        return draw.nextDouble();
    }

    public static class Builder {
        private int capacity = DEFAULT_CAPACITY;
        private double timeDecay;
        private double accumulatedTimeDecay;
        private long mostRecentTimeDecayUpdate;
        private long maxSequenceIndex;
        private long randomSeed = new Random().nextLong();
        private Random random;

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder timeDecay(double timeDecay) {
            this.timeDecay = timeDecay;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        /**
         * Draw from the given generator instead of the replaced seed. Meant for
         * tests; a sampler built this way cannot be saved faithfully.
         *
         * @param random the generator
         * @return this builder
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        /**
         * Restore the decay bookkeeping of a saved sampler.
         *
         * @param accumulatedTimeDecay      decay accrued before the last change
         * @param mostRecentTimeDecayUpdate sequence index of the last change
         * @param maxSequenceIndex          largest sequence index drawn so far
         * @return this builder
         */
        public Builder decayState(double accumulatedTimeDecay, long mostRecentTimeDecayUpdate,
                long maxSequenceIndex) {
            this.accumulatedTimeDecay = accumulatedTimeDecay;
            this.mostRecentTimeDecayUpdate = mostRecentTimeDecayUpdate;
            this.maxSequenceIndex = maxSequenceIndex;
            return this;
        }

        public StreamSampler build() {
            return new StreamSampler(this);
        }
    }
}
