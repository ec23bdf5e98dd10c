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

package com.amazon.datacleaner.detection.frequency;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.frame.Column;

public class EnumDetectorTest {

    private final Column data = Column.of("size", "S", "M", "XL", null, "L");

    @Test
    public void testAuthorizedValues() {
        EnumDetector detector = EnumDetector.fromData(EnumConfig.builder().values(Arrays.asList("S", "M", "L")).build(),
                data);
        assertThat(detector.getIndex(), contains(2));
    }

    @Test
    public void testForbiddenValues() {
        EnumDetector detector = EnumDetector
                .fromData(EnumConfig.builder().values(Arrays.asList("XL", "XXL")).forbidden(true).build(), data);
        assertThat(detector.getIndex(), contains(2));

        EnumDetector replayed = EnumDetector.fromDetector(detector, Column.of("size", "XXL", "S"));
        assertThat(replayed.getIndex(), contains(0));
    }

    @Test
    public void testNumbersMatchAcrossTypes() {
        EnumDetector detector = EnumDetector.fromData(EnumConfig.builder().values(Arrays.asList(1, 2)).build(),
                Column.of("x", 1.0, 2, 3.0));
        assertThat(detector.getIndex(), contains(2));
    }

    @Test
    public void testEmptyValues() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EnumDetector.fromData(EnumConfig.builder().values(Collections.emptyList()).build(), data));
        assertEquals("The list of authorized values is empty", e.getMessage());
    }
}
