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


package com.amazon.krcf.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.krcf.ErrorKind;
import com.amazon.krcf.RandomCutForest;
import com.amazon.krcf.RandomCutForestException;
import com.amazon.krcf.returntypes.DiVector;
import com.amazon.krcf.state.ExecutionContext;
import com.amazon.krcf.testutils.ExampleDataSets;
import com.amazon.krcf.testutils.NormalMixtureTestData;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class RandomCutForestSerDeTest {

    private RandomCutForestSerDe serializer;

    @BeforeEach
    public void setUp() {
        serializer = new RandomCutForestSerDe();
    }

    private static Stream<RandomCutForest> forestProvider() {
        RandomCutForest sequential = RandomCutForest.builder().dimensions(4).numberOfTrees(10).sampleSize(64)
                .randomSeed(31L).build();
        RandomCutForest decayed = RandomCutForest.builder().dimensions(4).numberOfTrees(10).sampleSize(64)
                .lambda(0.01).storeAttributesEnabled(true).randomSeed(32L).build();
        RandomCutForest shingled = RandomCutForest.builder().dimensions(2).shingleSize(2).numberOfTrees(10)
                .sampleSize(64).randomSeed(33L).build();
        return Stream.of(sequential, decayed, shingled);
    }

    @ParameterizedTest
    @MethodSource("forestProvider")
    public void testRoundTrip(RandomCutForest forest) {
        int dimensions = forest.getDimensions();
        NormalMixtureTestData testData = new NormalMixtureTestData();
        for (double[] point : testData.generateTestData(400, dimensions, 34L)) {
            forest.update(point);
        }

        String json = serializer.toJson(forest);
        RandomCutForest forest2 = serializer.fromJson(json);

        assertEquals(forest.getDimensions(), forest2.getDimensions());
        assertEquals(forest.getShingleSize(), forest2.getShingleSize());
        assertEquals(forest.getNumberOfTrees(), forest2.getNumberOfTrees());
        assertEquals(forest.getSampleSize(), forest2.getSampleSize());
        assertEquals(forest.getLambda(), forest2.getLambda());
        assertEquals(forest.getEntriesSeen(), forest2.getEntriesSeen());

        for (double[] point : testData.generateTestData(200, dimensions, 35L)) {
            assertEquals(forest.getAnomalyScore(point), forest2.getAnomalyScore(point), 1e-10);
            DiVector a = forest.getAnomalyAttribution(point);
            DiVector b = forest2.getAnomalyAttribution(point);
            assertArrayEquals(a.high, b.high, 1e-10);
            assertArrayEquals(a.low, b.low, 1e-10);
            forest.update(point);
            forest2.update(point);
        }
        assertEquals(serializer.toJson(forest), serializer.toJson(forest2));
    }

    @Test
    public void testJsonCarriesVersionAndConfiguration() {
        RandomCutForest forest = RandomCutForest.builder().dimensions(1).shingleSize(3).numberOfTrees(5)
                .sampleSize(16).randomSeed(36L).build();
        for (double[] point : ExampleDataSets.sineWave(50, 10, 1.0)) {
            forest.update(point);
        }
        JsonObject json = JsonParser.parseString(serializer.toJson(forest)).getAsJsonObject();
        assertEquals("1.0", json.get("version").getAsString());
        assertEquals(1, json.get("dimensions").getAsInt());
        assertEquals(3, json.get("shingleSize").getAsInt());
        assertEquals(50L, json.get("entriesSeen").getAsLong());
        assertEquals(5, json.getAsJsonArray("treeStates").size());
        assertEquals(5, json.getAsJsonArray("samplerStates").size());
    }

    @Test
    public void testExecutionContextOverride() {
        RandomCutForest forest = RandomCutForest.builder().dimensions(2).numberOfTrees(4).sampleSize(8)
                .randomSeed(37L).build();
        String json = serializer.toJson(forest);

        RandomCutForest parallel = serializer.fromJson(json, new ExecutionContext(true, 2));
        assertTrue(parallel.isParallelExecutionEnabled());
        assertEquals(2, parallel.getThreadPoolSize());
        parallel.close();

        assertFalse(serializer.fromJson(json).isParallelExecutionEnabled());
    }

    @ParameterizedTest
    @ValueSource(strings = { "{not json", "[1, 2, 3]", "{\"dimensions\": \"many\"}", "" })
    public void testMalformedJson(String json) {
        RandomCutForestException e = assertThrows(RandomCutForestException.class, () -> serializer.fromJson(json));
        assertEquals(ErrorKind.DESERIALIZATION, e.getKind());
    }

    @Test
    public void testNullJson() {
        RandomCutForestException e = assertThrows(RandomCutForestException.class, () -> serializer.fromJson(null));
        assertEquals(ErrorKind.DESERIALIZATION, e.getKind());
    }

    @Test
    public void testMissingOrUnknownVersion() {
        RandomCutForest forest = RandomCutForest.builder().dimensions(2).numberOfTrees(3).sampleSize(8)
                .randomSeed(38L).build();
        JsonObject json = JsonParser.parseString(serializer.toJson(forest)).getAsJsonObject();

        json.remove("version");
        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> serializer.fromJson(json.toString()));
        assertEquals(ErrorKind.DESERIALIZATION, e.getKind());

        json.addProperty("version", "2.0");
        e = assertThrows(RandomCutForestException.class, () -> serializer.fromJson(json.toString()));
        assertEquals(ErrorKind.DESERIALIZATION, e.getKind());
    }

    @Test
    public void testTruncatedTreeState() {
        RandomCutForest forest = RandomCutForest.builder().dimensions(2).numberOfTrees(3).sampleSize(8)
                .randomSeed(39L).build();
        for (double[] point : new NormalMixtureTestData().generateTestData(20, 2, 40L)) {
            forest.update(point);
        }
        JsonObject json = JsonParser.parseString(serializer.toJson(forest)).getAsJsonObject();
        json.getAsJsonArray("treeStates").get(0).getAsJsonObject().getAsJsonArray("mass").remove(0);

        RandomCutForestException e = assertThrows(RandomCutForestException.class,
                () -> serializer.fromJson(json.toString()));
        assertEquals(ErrorKind.DESERIALIZATION, e.getKind());
    }
}
