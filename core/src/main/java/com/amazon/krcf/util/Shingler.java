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

package com.amazon.krcf.util;

import static com.amazon.krcf.CommonUtils.checkArgument;
import static com.amazon.krcf.CommonUtils.checkDimension;
import static com.amazon.krcf.CommonUtils.checkFinite;
import static com.amazon.krcf.CommonUtils.toFloatArray;

import java.util.Arrays;
import java.util.Optional;

/**
 * Keeps a sliding window over the most recent input points and turns each new
 * point into a shingle: the concatenation of the last {@code shingleSize}
 * points, oldest first.
 */
public class Shingler {

    /**
     * Number of dimensions of each point in the shingle.
     */
    private final int dimensions;

    /**
     * Number of points in the shingle.
     */
    private final int shingleSize;

    /**
     * The current window, oldest point first. Slots not yet filled are zero.
     */
    private final float[] window;

    /**
     * Number of points in the window, capped at {@code shingleSize}.
     */
    private int size;

    public Shingler(int dimensions, int shingleSize) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        checkArgument(shingleSize > 0, "shingleSize must be greater than 0");
        this.dimensions = dimensions;
        this.shingleSize = shingleSize;
        this.window = new float[dimensions * shingleSize];
        this.size = 0;
    }

    /**
     * Restore a shingler from a saved window.
     *
     * @param dimensions  number of dimensions of each point
     * @param shingleSize number of points in the shingle
     * @param window      the saved window, oldest point first
     * @param size        number of points the window holds
     */
    public Shingler(int dimensions, int shingleSize, float[] window, int size) {
        this(dimensions, shingleSize);
        checkArgument(window != null && window.length == dimensions * shingleSize, "incorrect window length");
        checkArgument(size >= 0 && size <= shingleSize, "incorrect window size");
        System.arraycopy(window, 0, this.window, 0, window.length);
        this.size = size;
    }

    /**
     * Slide the window by one point. An invalid point leaves the window as it
     * was.
     *
     * @param point the new point
     * @return the new shingle once the window is full, otherwise empty
     */
    public Optional<float[]> advance(double[] point) {
        checkDimension(point, dimensions);
        checkFinite(point);
        float[] newPoint = toFloatArray(point);
        System.arraycopy(window, dimensions, window, 0, window.length - dimensions);
        System.arraycopy(newPoint, 0, window, window.length - dimensions, dimensions);
        if (size < shingleSize) {
            size++;
        }
        return isFull() ? Optional.of(Arrays.copyOf(window, window.length)) : Optional.empty();
    }

    /**
     * Return the shingle that {@link #advance} would produce for this point,
     * without changing the window.
     *
     * @param point the new point
     * @return the previewed shingle
     */
    public float[] shingledPoint(double[] point) {
        checkDimension(point, dimensions);
        checkFinite(point);
        float[] newPoint = toFloatArray(point);
        float[] result = new float[window.length];
        System.arraycopy(window, dimensions, result, 0, window.length - dimensions);
        System.arraycopy(newPoint, 0, result, window.length - dimensions, dimensions);
        return result;
    }

    /**
     * @return a copy of the current window
     */
    public float[] getShingle() {
        return Arrays.copyOf(window, window.length);
    }

    /**
     * @return true once {@code shingleSize} points have been seen
     */
    public boolean isFull() {
        return size == shingleSize;
    }

    public int getSize() {
        return size;
    }

    public int getDimensions() {
        return dimensions;
    }

    public int getShingleSize() {
        return shingleSize;
    }

    public int getShingledPointSize() {
        return dimensions * shingleSize;
    }
}
