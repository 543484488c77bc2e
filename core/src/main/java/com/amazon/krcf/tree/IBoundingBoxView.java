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


package com.amazon.krcf.tree;

/**
 * A read-only view of an axis-aligned bounding box.
 */
public interface IBoundingBoxView {

    double getRangeSum();

    int getDimensions();

    double getRange(int dimension);

    double getMinValue(int dimension);

    double getMaxValue(int dimension);

    /**
     * @param point a point with the same number of dimensions as the box
     * @return true if the point lies inside the box (boundary included)
     */
    boolean contains(float[] point);

    /**
     * @param point a point with the same number of dimensions as the box
     * @return the Euclidean distance from the point to the box
     */
    double distanceTo(float[] point);

    /**
     * Returns a new box that is the union of this box and the point. This box is
     * not modified.
     *
     * @param point the point to merge
     * @return the merged box
     */
    IBoundingBoxView getMergedBox(float[] point);

    /**
     * Returns a new box that is the union of this box and the other box. Neither
     * box is modified.
     *
     * @param otherBox the box to merge
     * @return the merged box
     */
    IBoundingBoxView getMergedBox(IBoundingBoxView otherBox);
}
