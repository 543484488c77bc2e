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



package com.amazon.krcf.interpolation;

import static com.amazon.krcf.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.amazon.krcf.returntypes.DensityEstimate;
import com.amazon.krcf.tree.BoundingBox;
import com.amazon.krcf.tree.INodeView;
import com.amazon.krcf.tree.RandomCutTree;

public class InterpolationVisitorTest {

    private static INodeView leaf(float[] point, int mass) {
        INodeView leaf = mock(INodeView.class);
        when(leaf.getLeafPoint()).thenReturn(point);
        when(leaf.getBoundingBox()).thenReturn(new BoundingBox(point));
        when(leaf.getMass()).thenReturn(mass);
        return leaf;
    }

    @Test
    public void testResultBeforeAnyVisit() {
        float[] point = { 1.0f, 2.0f };
        DensityEstimate output = new InterpolationVisitor(point, 9).getResult();
        assertEquals(2, output.getDimensions());
        assertEquals(9, output.getSampleSize());
        assertEquals(0.0, output.measure.getHighLowSum());
        assertEquals(0.0, output.probMass.getHighLowSum());
    }

    @Test
    public void testDuplicateLeaf() {
        float[] point = { 1.0f, 2.0f };
        InterpolationVisitor visitor = new InterpolationVisitor(point, 16);
        visitor.visitLeaf(leaf(point.clone(), 3), 5);

        DensityEstimate result = visitor.getResult();
        for (int i = 0; i < point.length; i++) {
            // the leaf mass plus the query point, spread evenly
            assertThat(result.measure.high[i], closeTo(1.0, EPSILON));
            assertThat(result.measure.low[i], closeTo(1.0, EPSILON));
            assertThat(result.probMass.high[i], closeTo(0.25, EPSILON));
            assertThat(result.probMass.low[i], closeTo(0.25, EPSILON));
            assertEquals(0.0, result.distances.high[i]);
            assertEquals(0.0, result.distances.low[i]);
        }
    }

    @Test
    public void testPointMass() {
        float[] point = { 1.0f, 2.0f };
        InterpolationVisitor visitor = new InterpolationVisitor(point, 16, 0.0);
        visitor.visitLeaf(leaf(point.clone(), 3), 5);
        assertThat(visitor.getResult().measure.getHighLowSum(), closeTo(3.0, EPSILON));
    }

    @Test
    public void testDistinctLeaf() {
        float[] point = { 0.0f, 0.0f };
        InterpolationVisitor visitor = new InterpolationVisitor(point, 16);
        visitor.visitLeaf(leaf(new float[] { 1.0f, -3.0f }, 2), 5);

        DensityEstimate result = visitor.getResult();
        assertThat(result.probMass.low[0], closeTo(0.25, EPSILON));
        assertThat(result.probMass.high[1], closeTo(0.75, EPSILON));
        assertThat(result.measure.low[0], closeTo(0.75, EPSILON));
        assertThat(result.measure.high[1], closeTo(2.25, EPSILON));
        assertThat(result.distances.low[0], closeTo(0.25, EPSILON));
        assertThat(result.distances.high[1], closeTo(2.25, EPSILON));
        assertEquals(0.0, result.probMass.high[0]);
        assertEquals(0.0, result.probMass.low[1]);
    }

    @Test
    public void testStopsAtBoxHoldingThePoint() {
        float[] point = { 0.0f, 0.0f };
        InterpolationVisitor visitor = new InterpolationVisitor(point, 16);
        visitor.visitLeaf(leaf(new float[] { 1.0f, 1.0f }, 1), 2);
        double before = visitor.getResult().probMass.getHighLowSum();

        INodeView node = mock(INodeView.class);
        when(node.getBoundingBox())
                .thenReturn(new BoundingBox(new float[] { -1.0f, -1.0f }, new float[] { 1.0f, 1.0f }));
        visitor.visit(node, 1);
        INodeView root = mock(INodeView.class);
        visitor.visit(root, 0);
        verifyNoInteractions(root);
        assertThat(visitor.getResult().probMass.getHighLowSum(), closeTo(before, EPSILON));
    }

    @Test
    public void testProbabilityMassSumsToOneOnTree() {
        RandomCutTree tree = RandomCutTree.builder().dimension(2).randomSeed(23L).build();
        Random random = new Random(29);
        List<float[]> points = new ArrayList<>();
        for (int i = 0; i < 128; i++) {
            float[] point = new float[] { (float) random.nextGaussian(), (float) random.nextGaussian() };
            points.add(point);
            tree.addPoint(point, i);
        }
        float[] query = { 3.0f, 0.5f };
        DensityEstimate estimate = tree.traverse(query, (t, x) -> new InterpolationVisitor(x, 128));
        assertThat(estimate.probMass.getHighLowSum(), closeTo(1.0, 1e-6));
        assertThat(estimate.probMass.high[0], greaterThan(estimate.probMass.low[0]));
        assertThat(estimate.getDensity(), greaterThan(0.0));

        // a sampled point is interpolated against the rest of the sample
        float[] central = points.get(0);
        for (float[] point : points) {
            if (point[0] * point[0] + point[1] * point[1] < central[0] * central[0] + central[1] * central[1]) {
                central = point;
            }
        }
        DensityEstimate atSample = tree.traverse(central.clone(), (t, x) -> new InterpolationVisitor(x, 128));
        assertThat(atSample.probMass.getHighLowSum(), closeTo(1.0, 1e-6));
        assertThat(atSample.distances.getHighLowSum(), greaterThan(0.0));
        assertThat(atSample.getDensity(), greaterThan(estimate.getDensity()));
    }
}
