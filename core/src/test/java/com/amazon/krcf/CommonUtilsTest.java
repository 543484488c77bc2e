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
import static com.amazon.krcf.CommonUtils.checkDimension;
import static com.amazon.krcf.CommonUtils.checkFinite;
import static com.amazon.krcf.CommonUtils.checkNotNull;
import static com.amazon.krcf.CommonUtils.checkOption;
import static com.amazon.krcf.CommonUtils.checkState;
import static com.amazon.krcf.CommonUtils.toDoubleArray;
import static com.amazon.krcf.CommonUtils.toFloatArray;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertDoesNotThrow(() -> checkArgument(true, "unused"));
        IllegalArgumentException iae = assertThrows(IllegalArgumentException.class,
                () -> checkArgument(false, "bad argument"));
        assertEquals("bad argument", iae.getMessage());

        assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
        assertThrows(NullPointerException.class, () -> checkNotNull(null, "null"));
        String value = "value";
        assertSame(value, checkNotNull(value, "unused"));
    }

    @Test
    public void testCheckOptionAndDimension() {
        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> checkOption(false, "bad option"));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
        assertEquals("bad option", e.getMessage());

        assertDoesNotThrow(() -> checkDimension(new double[3], 3));
        e = assertThrows(RandomCutForestException.class, () -> checkDimension(new float[2], 3));
        assertEquals(ErrorKind.INVALID_DIMENSION, e.getKind());
        assertThrows(NullPointerException.class, () -> checkDimension((double[]) null, 3));
    }

    @Test
    public void testCheckFinite() {
        assertDoesNotThrow(() -> checkFinite(new double[] { 1.0, -3.4e38, Float.MAX_VALUE }));

        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> checkFinite(new double[] { 0.0, Double.NaN }));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
        assertEquals("point values must be finite floats, found NaN at index 1", e.getMessage());

        // finite as a double but infinite once stored as a float
        e = assertThrows(RandomCutForestException.class, () -> checkFinite(new double[] { 1e39 }));
        assertEquals(ErrorKind.INVALID_OPTION, e.getKind());
        assertThrows(RandomCutForestException.class,
                () -> checkFinite(new double[] { Double.NEGATIVE_INFINITY, 0.0 }));

        assertDoesNotThrow(() -> checkFinite(new double[] { Double.NaN, 2.0 }, new boolean[] { true, false }));
        assertThrows(RandomCutForestException.class,
                () -> checkFinite(new double[] { Double.NaN, 2.0 }, new boolean[] { false, true }));
    }

    @Test
    public void testArrayConversions() {
        float[] converted = toFloatArray(new double[] { -0.0, 1.5, -2.25 });
        assertArrayEquals(new float[] { 0.0f, 1.5f, -2.25f }, converted);
        assertEquals(0, Float.floatToIntBits(converted[0]));
        assertArrayEquals(new double[] { 1.5, -2.25 }, toDoubleArray(new float[] { 1.5f, -2.25f }));
        assertThrows(NullPointerException.class, () -> toFloatArray(null));
    }
}
