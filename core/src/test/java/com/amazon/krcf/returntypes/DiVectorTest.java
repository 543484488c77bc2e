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


package com.amazon.krcf.returntypes;

import static com.amazon.krcf.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DiVectorTest {

    private DiVector vector;

    @BeforeEach
    public void setUp() {
        vector = new DiVector(new double[] { 1.0, 2.0, 3.0 }, new double[] { 0.5, 0.0, 1.5 });
    }

    @Test
    public void testNew() {
        DiVector empty = new DiVector(3);
        assertEquals(3, empty.getDimensions());
        assertArrayEquals(new double[3], empty.high);
        assertArrayEquals(new double[3], empty.low);

        assertThrows(IllegalArgumentException.class, () -> new DiVector(0));
        assertThrows(IllegalArgumentException.class, () -> new DiVector(new double[2], new double[3]));
        assertThrows(NullPointerException.class, () -> new DiVector(null, new double[3]));
    }

    @Test
    public void testCopy() {
        DiVector copy = vector.copy();
        assertArrayEquals(vector.high, copy.high);
        assertArrayEquals(vector.low, copy.low);
        assertNotSame(vector.high, copy.high);
    }

    @Test
    public void testAdd() {
        DiVector right = new DiVector(new double[] { 1.0, 1.0, 1.0 }, new double[] { 2.0, 2.0, 2.0 });
        DiVector result = vector.add(right);
        assertSame(vector, result);
        assertArrayEquals(new double[] { 2.0, 3.0, 4.0 }, result.high);
        assertArrayEquals(new double[] { 2.5, 2.0, 3.5 }, result.low);
        assertArrayEquals(new double[] { 1.0, 1.0, 1.0 }, right.high);

        assertThrows(IllegalArgumentException.class, () -> vector.add(new DiVector(2)));
    }

    @Test
    public void testSums() {
        assertEquals(1.5, vector.getHighLowSum(0));
        assertEquals(8.0, vector.getHighLowSum());
    }

    @Test
    public void testScale() {
        DiVector scaled = vector.scale(2.0);
        assertArrayEquals(new double[] { 2.0, 4.0, 6.0 }, scaled.high);
        assertArrayEquals(new double[] { 1.0, 0.0, 3.0 }, scaled.low);
        assertEquals(8.0, vector.getHighLowSum());
    }

    @Test
    public void testScaleTo() {
        vector.scaleTo(4.0);
        assertThat(vector.getHighLowSum(), closeTo(4.0, EPSILON));
        assertThat(vector.high[2], closeTo(1.5, EPSILON));

        DiVector zero = new DiVector(2);
        zero.scaleTo(1.0);
        assertEquals(0.0, zero.getHighLowSum());
    }

    @Test
    public void testMap() {
        assertSame(vector, vector.map(x -> 2 * x + 1));
        assertArrayEquals(new double[] { 3.0, 5.0, 7.0 }, vector.high);
        assertArrayEquals(new double[] { 2.0, 1.0, 4.0 }, vector.low);
    }
}
