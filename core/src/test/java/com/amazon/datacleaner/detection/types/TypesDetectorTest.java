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

package com.amazon.datacleaner.detection.types;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.frame.Column;

public class TypesDetectorTest {

    private final Column mixed = Column.of("v", null, 1, "a", 2.5, 3);

    @Test
    public void testInferredType() {
        TypesDetector detector = TypesDetector.fromData(TypesConfig.builder().build(), mixed);
        assertEquals(Integer.class, detector.getPtype());
        assertThat(detector.getIndex(), contains(2, 3));
    }

    @Test
    public void testGivenType() {
        TypesDetector detector = TypesDetector.fromData(TypesConfig.builder().ptype(String.class).build(), mixed);
        assertThat(detector.getIndex(), contains(1, 3, 4));

        TypesDetector replayed = TypesDetector.fromDetector(detector, Column.of("v", "b", 4));
        assertThat(replayed.getIndex(), contains(1));
    }

    @Test
    public void testColumnWithoutValues() {
        TypesDetector detector = TypesDetector.fromData(TypesConfig.builder().build(), Column.of("v", null, null));
        assertNull(detector.getPtype());
        assertThat(detector.getIndex(), empty());
    }
}
