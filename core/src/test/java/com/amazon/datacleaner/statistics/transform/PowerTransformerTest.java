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

package com.amazon.datacleaner.statistics.transform;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.datacleaner.config.TransformMethod;

public class PowerTransformerTest {

    private static final double EPSILON = 1e-9;

    @ParameterizedTest
    @ValueSource(doubles = { 0, 0.5, 2 })
    public void testBoxCoxInverse(double lambda) {
        BoxCoxTransform transform = new BoxCoxTransform();
        for (double x : new double[] { 0.1, 1, 2.5, 40 }) {
            assertThat(transform.invert(transform.apply(x, lambda), lambda), closeTo(x, EPSILON));
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0, 0.5, 2 })
    public void testYeoJohnsonInverse(double lambda) {
        YeoJohnsonTransform transform = new YeoJohnsonTransform();
        for (double x : new double[] { -30, -1.5, 0, 0.3, 12 }) {
            assertThat(transform.invert(transform.apply(x, lambda), lambda), closeTo(x, 1e-8));
        }
    }

    @Test
    public void testBoxCoxKnownValues() {
        BoxCoxTransform transform = new BoxCoxTransform();
        assertThat(transform.apply(Math.E, 0), closeTo(1, EPSILON));
        assertThat(transform.apply(4, 0.5), closeTo(2, EPSILON));
    }

    @Test
    public void testFitShiftsBoxCoxData() {
        double[] data = new double[] { -3, -1, 0, 2, 5, 9, 20 };
        PowerTransformer transformer = PowerTransformer.fit(TransformMethod.BOX_COX, data);
        assertEquals(4, transformer.getShift(), EPSILON);
        for (double x : data) {
            assertThat(transformer.inverse(transformer.transform(x)), closeTo(x, 1e-8));
        }
    }

    @Test
    public void testFittedLambdaReducesSkewness() {
        Random random = new Random(3);
        double[] data = new double[300];
        for (int i = 0; i < data.length; i++) {
            data[i] = Math.exp(random.nextGaussian());
        }
        PowerTransformer transformer = PowerTransformer.fit(TransformMethod.BOX_COX, data);
        // the log transform is the exact answer for lognormal data
        assertThat(transformer.getLambda(), closeTo(0, 0.2));
        BoxCoxTransform transform = new BoxCoxTransform();
        assertThat(transform.logLikelihood(data, transformer.getLambda()),
                greaterThan(transform.logLikelihood(data, 1)));
    }

    @Test
    public void testConstantDataKeepsIdentity() {
        assertEquals(1, new YeoJohnsonTransform().fitLambda(new double[] { 2, 2, 2 }), EPSILON);
    }

    @Test
    public void testNoTransform() {
        assertThrows(IllegalArgumentException.class, () -> new PowerTransformer(TransformMethod.NONE, 1, 0));
    }
}
