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

import static com.amazon.krcf.CommonUtils.checkDimension;
import static com.amazon.krcf.CommonUtils.checkFinite;
import static com.amazon.krcf.CommonUtils.checkNotNull;
import static com.amazon.krcf.CommonUtils.checkState;
import static com.amazon.krcf.CommonUtils.toFloatArray;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.krcf.util.Shingler;

/**
 * Turns raw input points into the shingles stored in the trees and counts
 * updates. With internal shingling the coordinator owns a {@link Shingler} and
 * passes a shingle on only once the window is full; otherwise input points
 * must already be shingled and are passed on as they are.
 *
 * An update is {@link #prepare} followed by {@link #complete}. A point that
 * fails validation is rejected by {@code prepare} before anything changes.
 */
public class ShinglingCoordinator {

    @Getter
    private final Shingler shingler;

    @Getter
    private final boolean internalShinglingEnabled;

    @Getter
    private final int inputDimensions;

    /**
     * Read by queries without holding the update lock.
     */
    private volatile long entriesSeen;

    /**
     * The most recent shingle when points arrive already shingled.
     */
    private float[] lastShingledPoint;

    public ShinglingCoordinator(Shingler shingler, boolean internalShinglingEnabled) {
        this.shingler = checkNotNull(shingler, "shingler must not be null");
        this.internalShinglingEnabled = internalShinglingEnabled;
        this.inputDimensions = internalShinglingEnabled ? shingler.getDimensions() : shingler.getShingledPointSize();
        this.lastShingledPoint = new float[shingler.getShingledPointSize()];
    }

    /**
     * Validate a point and advance the shingle window.
     *
     * @param point the raw input point
     * @return the shingle to offer to the trees, or null while the window fills
     */
    public float[] prepare(double[] point) {
        if (!internalShinglingEnabled) {
            checkInput(point);
            return toFloatArray(point);
        }
        return shingler.advance(point).orElse(null);
    }

    /**
     * Count the update whose point went through {@link #prepare}.
     *
     * @param shingle what {@code prepare} returned
     */
    public void complete(float[] shingle) {
        if (!internalShinglingEnabled) {
            checkState(shingle != null, "external shingles are always complete");
            lastShingledPoint = Arrays.copyOf(shingle, shingle.length);
        }
        entriesSeen++;
    }

    /**
     * Validate a raw input point without changing any state.
     *
     * @param point the point
     */
    public void checkInput(double[] point) {
        checkDimension(point, inputDimensions);
        checkFinite(point);
    }

    /**
     * @param point a raw input point
     * @return the shingle used to query the trees; the window is not modified
     */
    public float[] shingledPoint(double[] point) {
        if (!internalShinglingEnabled) {
            checkInput(point);
            return toFloatArray(point);
        }
        return shingler.shingledPoint(point);
    }

    /**
     * @return a copy of the most recent shingle: the shingler window with internal
     *         shingling, otherwise the last point passed through
     */
    public float[] getCurrentShingle() {
        if (internalShinglingEnabled) {
            return shingler.getShingle();
        }
        return Arrays.copyOf(lastShingledPoint, lastShingledPoint.length);
    }

    /**
     * Restore the last point passed through when shingling is external.
     *
     * @param point the shingled point
     */
    public void setLastShingledPoint(float[] point) {
        checkDimension(point, shingler.getShingledPointSize());
        lastShingledPoint = Arrays.copyOf(point, point.length);
    }

    public long getEntriesSeen() {
        return entriesSeen;
    }

    public void setEntriesSeen(long entriesSeen) {
        this.entriesSeen = entriesSeen;
    }
}
