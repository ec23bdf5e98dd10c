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

package com.amazon.datacleaner.detection.generic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.config.Keep;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

public class DuplicatedDetectorTest {

    private final Column values = Column.of("v", 1, 2, 1.0, null, null, 2, 3);

    private final Table people = Table.of(Column.of("name", "a", "b", "a", "a"), Column.numeric("age", 1, 2, 1, 3));

    @Test
    public void testColumnKeepFirst() {
        DuplicatedDetector detector = DuplicatedDetector.fromData(DuplicatedConfig.builder().build(), values);
        assertEquals(Keep.FIRST, detector.getKeep());
        assertThat(detector.getIndex(), contains(2, 5));
    }

    @Test
    public void testColumnKeepLastAndNone() {
        assertThat(DuplicatedDetector.fromData(DuplicatedConfig.builder().keep(Keep.LAST).build(), values).getIndex(),
                contains(0, 1));
        assertThat(DuplicatedDetector.fromData(DuplicatedConfig.builder().keep(Keep.NONE).build(), values).getIndex(),
                contains(0, 1, 2, 5));
    }

    @Test
    public void testRows() {
        DuplicatedRowsDetector detector = DuplicatedRowsDetector.fromData(DuplicatedConfig.builder().build(), people);
        assertEquals(Arrays.asList("name", "age"), detector.getSubset());
        assertThat(detector.getIndex(), contains(2));
    }

    @Test
    public void testRowsOnSubset() {
        DuplicatedConfig.DuplicatedConfigBuilder builder = DuplicatedConfig.builder()
                .subset(Collections.singletonList("name"));
        assertThat(DuplicatedRowsDetector.fromData(builder.build(), people).getIndex(), contains(2, 3));
        assertThat(DuplicatedRowsDetector.fromData(builder.keep(Keep.LAST).build(), people).getIndex(),
                contains(0, 2));
        assertThat(DuplicatedRowsDetector.fromData(builder.keep(Keep.NONE).build(), people).getIndex(),
                contains(0, 2, 3));
    }

    @Test
    public void testInvalidSubset() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DuplicatedRowsDetector
                .fromData(DuplicatedConfig.builder().subset(Arrays.asList("name", "city")).build(), people));
        assertEquals("unknown column in subset: city", e.getMessage());

        e = assertThrows(IllegalArgumentException.class, () -> DuplicatedRowsDetector
                .fromData(DuplicatedConfig.builder().subset(Collections.emptyList()).build(), people));
        assertEquals("subset must not be empty", e.getMessage());
    }
}
