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

package com.amazon.datacleaner.detection.gaussian;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.frame.Column;

public class IqrDetectorTest {

    private static final double EPSILON = 1e-10;

    private final Column column = Column.numeric("x", 0, 0, 0, 100, -1, 1, -1, 1, -6, 6);

    @Test
    public void testBounds() {
        IqrDetector detector = IqrDetector.fromData(GaussianConfig.builder().threshold(2).build(), column);
        assertThat(detector.getQ25(), closeTo(-0.75, EPSILON));
        assertThat(detector.getQ75(), closeTo(1, EPSILON));
        assertThat(detector.getLower(), closeTo(-4.25, EPSILON));
        assertThat(detector.getUpper(), closeTo(4.5, EPSILON));
        assertThat(detector.getIndex(), contains(3, 8, 9));
    }

    @Test
    public void testDefaultThreshold() {
        IqrDetector detector = IqrDetector.fromData(GaussianConfig.defaults(), column);
        assertEquals(IqrDetector.DEFAULT_THRESHOLD, detector.getThreshold());
    }

    @Test
    public void testOneSided() {
        IqrDetector detector = IqrDetector.fromData(GaussianConfig.builder().threshold(2).sided(Sided.RIGHT).build(),
                column);
        assertEquals(Double.NEGATIVE_INFINITY, detector.getLower());
        assertThat(detector.getIndex(), contains(3, 9));
    }

    @Test
    public void testReplay() {
        IqrDetector source = IqrDetector.fromData(GaussianConfig.builder().threshold(2).build(), column);
        IqrDetector replayed = IqrDetector.fromDetector(source, Column.numeric("y", 4, 5, -5));
        assertThat(replayed.getUpper(), closeTo(4.5, EPSILON));
        assertThat(replayed.getIndex(), contains(1, 2));
    }

    @Test
    public void testInvalidThreshold() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> IqrDetector.fromData(GaussianConfig.builder().threshold(-1).build(), column));
        assertEquals("Threshold must be >= 0", e.getMessage());
        e = assertThrows(IllegalArgumentException.class,
                () -> IqrDetector.fromData(GaussianConfig.builder().pValue(0).build(), column));
        assertEquals("pvalue must be positive", e.getMessage());
    }
}
