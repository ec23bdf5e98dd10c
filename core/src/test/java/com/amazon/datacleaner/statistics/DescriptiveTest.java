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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DescriptiveTest {

    private static final double EPSILON = 1e-10;

    private final double[] data = new double[] { 0, 0, 0, 100, -1, 1, -1, 1, -6, 6 };

    @Test
    public void testQuantileInterpolatesLinearly() {
        assertThat(Descriptive.quantile(data, 0.25), closeTo(-0.75, EPSILON));
        assertThat(Descriptive.quantile(data, 0.75), closeTo(1, EPSILON));
        assertThat(Descriptive.quantile(data, 0), closeTo(-6, EPSILON));
        assertThat(Descriptive.quantile(data, 1), closeTo(100, EPSILON));
        assertTrue(Double.isNaN(Descriptive.quantile(new double[0], 0.5)));
    }

    @Test
    public void testMoments() {
        double[] values = new double[] { 2, 4, 4, 4, 5, 5, 7, 9 };
        assertThat(Descriptive.mean(values), closeTo(5, EPSILON));
        assertThat(Descriptive.populationVariance(values), closeTo(4, EPSILON));
        assertThat(Descriptive.std(values), closeTo(Math.sqrt(32.0 / 7), EPSILON));
        assertTrue(Double.isNaN(Descriptive.std(new double[] { 1 })));
    }

    @Test
    public void testMedianAndMad() {
        double[] values = new double[] { 1, 1, 2, 2, 4, 6, 9 };
        assertThat(Descriptive.median(values), closeTo(2, EPSILON));
        assertThat(Descriptive.mad(values), closeTo(1, EPSILON));
    }

    @Test
    public void testIsConstant() {
        assertTrue(Descriptive.isConstant(new double[] { 3, 3, 3 }));
        assertFalse(Descriptive.isConstant(new double[] { 3, 3, 4 }));
        assertEquals(0, Descriptive.populationVariance(new double[] { 3, 3, 3 }), EPSILON);
    }
}
