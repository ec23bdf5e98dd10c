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

package com.amazon.datacleaner.statistics;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class DensityClusteringTest {

    @Test
    public void testIsolatedPointIsNoise() {
        double[][] points = new double[][] { { 0, 0 }, { 0.5, 0 }, { 0, 0.5 }, { 5, 5 } };
        assertArrayEquals(new boolean[] { false, false, false, true }, new DensityClustering(1, 2).noise(points));
    }

    @Test
    public void testMinSamplesCountsThePointItself() {
        double[][] points = new double[][] { { 0 }, { 0.5 }, { 10 } };
        assertArrayEquals(new boolean[] { false, false, true }, new DensityClustering(1, 2).noise(points));
        assertArrayEquals(new boolean[] { true, true, true }, new DensityClustering(1, 3).noise(points));
        assertArrayEquals(new boolean[] { false, false, false }, new DensityClustering(1, 1).noise(points));
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new DensityClustering(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new DensityClustering(Double.NaN, 2));
        assertThrows(IllegalArgumentException.class, () -> new DensityClustering(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new DensityClustering(1, 2).noise(new double[0][]));
    }
}
