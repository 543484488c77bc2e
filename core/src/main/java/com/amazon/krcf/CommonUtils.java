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

/**
 * Precondition checks and point conversions shared across the engine.
 */
public class CommonUtils {

    private CommonUtils() {
    }

    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * @param object  a reference
     * @param message the message of the exception
     * @param <T>     the type of the reference
     * @return the reference
     * @throws NullPointerException if the reference is null
     */
    public static <T> T checkNotNull(T object, String message) {
        if (object == null) {
            throw new NullPointerException(message);
        }
        return object;
    }

    /**
     * Fails with {@link ErrorKind#INVALID_OPTION} unless the condition holds.
     *
     * @param condition the condition
     * @param message   the message of the exception
     */
    public static void checkOption(boolean condition, String message) {
        if (!condition) {
            throw new RandomCutForestException(ErrorKind.INVALID_OPTION, message);
        }
    }

    /**
     * Fails with {@link ErrorKind#INVALID_DIMENSION} unless the point has the
     * expected length.
     *
     * @param point    the point
     * @param expected the length it must have
     */
    public static void checkDimension(double[] point, int expected) {
        checkNotNull(point, "point must not be null");
        checkLength(point.length, expected);
    }

    public static void checkDimension(float[] point, int expected) {
        checkNotNull(point, "point must not be null");
        checkLength(point.length, expected);
    }

    private static void checkLength(int actual, int expected) {
        if (actual != expected) {
            throw new RandomCutForestException(ErrorKind.INVALID_DIMENSION,
                    "point has length " + actual + ", expected " + expected);
        }
    }

    /**
     * Fails with {@link ErrorKind#INVALID_OPTION} if a coordinate is NaN or
     * infinite once stored as a float, which includes finite doubles beyond the
     * float range. Coordinates flagged in {@code skip} are not checked.
     *
     * @param point the point
     * @param skip  coordinates to leave unchecked, or null to check all
     */
    public static void checkFinite(double[] point, boolean[] skip) {
        for (int i = 0; i < point.length; i++) {
            if ((skip == null || !skip[i]) && !Float.isFinite((float) point[i])) {
                throw new RandomCutForestException(ErrorKind.INVALID_OPTION,
                        "point values must be finite floats, found " + point[i] + " at index " + i);
            }
        }
    }

    public static void checkFinite(double[] point) {
        checkFinite(point, null);
    }

    /**
     * @param point a point
     * @return the point as floats, with negative zero stored as zero so that
     *         equal points compare equal in the trees
     */
    public static float[] toFloatArray(double[] point) {
        checkNotNull(point, "point must not be null");
        float[] result = new float[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = (float) point[i] + 0.0f;
        }
        return result;
    }

    public static double[] toDoubleArray(float[] point) {
        checkNotNull(point, "point must not be null");
        double[] result = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = point[i];
        }
        return result;
    }
}
