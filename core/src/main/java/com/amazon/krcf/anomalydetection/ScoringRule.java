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



package com.amazon.krcf.anomalydetection;

/**
 * The four functions that turn a root-to-leaf path into a score. A path is
 * scored from the leaf up: the leaf contributes {@link #seen} when it equals
 * the query (scaled by {@link #damp}) and {@link #unseen} otherwise; every
 * ancestor mixes in {@link #unseen} with the probability that a random cut of
 * its box isolates the query. The result is put on the common scale of the
 * forest by {@link #normalize}.
 */
public enum ScoringRule {

    /**
     * Points that are isolated close to the root score high.
     */
    ANOMALY {
        @Override
        public double seen(int depth, int mass) {
            return 1.0 / (depth + log2(mass + 1.0));
        }

        @Override
        public double unseen(int depth, int mass) {
            return 1.0 / (depth + 1);
        }

        @Override
        public double damp(int leafMass, int treeMass) {
            return 1.0 - leafMass / (2.0 * treeMass);
        }

        @Override
        public double normalize(double score, int treeMass) {
            return score * log2(treeMass + 1.0);
        }
    },

    /**
     * The expected share of the sample that inserting the point would move.
     */
    DISPLACEMENT {
        @Override
        public double seen(int depth, int mass) {
            return 1.0 / (mass + 1);
        }

        @Override
        public double unseen(int depth, int mass) {
            return mass;
        }

        @Override
        public double damp(int leafMass, int treeMass) {
            return 1.0;
        }

        @Override
        public double normalize(double score, int treeMass) {
            return score / (1.0 + treeMass);
        }
    };

    public abstract double seen(int depth, int mass);

    public abstract double unseen(int depth, int mass);

    public abstract double damp(int leafMass, int treeMass);

    /**
     * Must be linear in {@code score}, so that an attribution normalized entry by
     * entry still sums to the normalized score.
     *
     * @param score    the raw score of one tree
     * @param treeMass the mass of that tree
     * @return the score on the scale shared by all trees
     */
    public abstract double normalize(double score, int treeMass);

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
