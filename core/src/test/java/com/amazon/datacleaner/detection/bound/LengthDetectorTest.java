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

package com.amazon.datacleaner.detection.bound;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.frame.Column;

public class LengthDetectorTest {

    private final Column column = Column.of("zip", "75001", "7500", "750011", null, 12345);

    @Test
    public void testFixedLength() {
        LengthDetector detector = LengthDetector.fromData(LengthConfig.builder().value(5).build(), column);
        assertTrue(detector.isFixedValue());
        assertThat(detector.getIndex(), contains(1, 2));
    }

    @Test
    public void testRange() {
        LengthDetector detector = LengthDetector.fromData(LengthConfig.builder().lower(5).upper(6).build(), column);
        assertThat(detector.getIndex(), contains(1));
    }

    @Test
    public void testInvalidArguments() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> LengthDetector.fromData(LengthConfig.builder().build(), column));
        assertEquals("At least one argument must be provided", e.getMessage());
        e = assertThrows(IllegalArgumentException.class,
                () -> LengthDetector.fromData(LengthConfig.builder().value(5).lower(1).build(), column));
        assertEquals("Incompatible arguments: value and upper or lower", e.getMessage());
        assertThrows(IllegalArgumentException.class,
                () -> LengthDetector.fromData(LengthConfig.builder().lower(6).upper(5).build(), column));
    }
}
