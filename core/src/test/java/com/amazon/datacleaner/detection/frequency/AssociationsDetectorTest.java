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
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.detection.IncompatibleDataException;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

public class AssociationsDetectorTest {

    private final Table cities = Table.of(
            Column.of("city", "Paris", "Paris", "Paris", "Lyon", "Lyon", "Paris", null),
            Column.of("country", "FR", "FR", "FR", "FR", "FR", "DE", "DE"));

    @Test
    public void testCount() {
        AssociationsDetector detector = AssociationsDetector.fromData(AssociationsConfig.builder().count(1).build(),
                cities);
        assertThat(detector.getValidAssociations(),
                containsInAnyOrder(Arrays.asList("Paris", "FR"), Arrays.asList("Lyon", "FR")));
        assertThat(detector.getIndex(), contains(5));
    }

    @Test
    public void testFreq() {
        AssociationsDetector detector = AssociationsDetector.fromData(AssociationsConfig.builder().freq(0.4).build(),
                cities);
        assertThat(detector.getIndex(), contains(3, 4, 5));
    }

    @Test
    public void testReplay() {
        AssociationsDetector source = AssociationsDetector.fromData(AssociationsConfig.builder().count(1).build(),
                cities);
        Table other = Table.of(Column.of("city", "Lyon", "Lyon"), Column.of("country", "FR", "DE"));
        assertThat(AssociationsDetector.fromDetector(source, other).getIndex(), contains(1));
    }

    @Test
    public void testParameters() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AssociationsDetector.fromData(AssociationsConfig.builder().build(), cities));
        assertEquals("Either freq or count must be provided", e.getMessage());
        e = assertThrows(IllegalArgumentException.class,
                () -> AssociationsDetector.fromData(AssociationsConfig.builder().count(1).freq(0.1).build(), cities));
        assertEquals("Either freq or count must be provided", e.getMessage());
        e = assertThrows(IllegalArgumentException.class,
                () -> AssociationsDetector.fromData(AssociationsConfig.builder().freq(1.0).build(), cities));
        assertEquals("freq must be between 0 and 1 exclusive", e.getMessage());
    }

    @Test
    public void testColumnTypes() {
        Table mixed = Table.of(Column.of("city", "Paris"), Column.numeric("population", 2.1));
        assertThrows(IncompatibleDataException.class,
                () -> AssociationsDetector.fromData(AssociationsConfig.builder().count(1).build(), mixed));
    }
}
