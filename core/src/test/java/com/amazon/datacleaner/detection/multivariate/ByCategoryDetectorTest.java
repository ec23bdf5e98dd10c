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

package com.amazon.datacleaner.detection.multivariate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.IncompatibleDataException;
import com.amazon.datacleaner.detection.gaussian.GaussianConfig;
import com.amazon.datacleaner.detection.gaussian.IqrDetector;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

public class ByCategoryDetectorTest {

    private final Table heights = Table.of(
            Column.numeric("height", 0, 0, 0, 0, -1, 1, -1, 1, -2, 2, 5, 6, 6, 6, 6, 5, 7, 5, 7, 4, 8),
            Column.of("group", "I", "I", "I", "I", "I", "I", "I", "I", "I", "I", "I", "II", "II", "II", "II", "II",
                    "II", "II", "II", "II", "II"));

    @Test
    public void testIqrPerCategory() {
        ByCategoryDetector detector = ByCategoryDetector
                .fromData(ByCategoryConfig.builder().method(DetectorKind.IQR).build(), heights);
        assertEquals(DetectorKind.IQR, detector.getMethod());
        assertThat(detector.getDetectors().keySet(), contains("I", "II"));
        IqrDetector first = (IqrDetector) detector.getDetectors().get("I");
        assertThat(first.getLower(), closeTo(-2.75, 1e-10));
        assertThat(first.getUpper(), closeTo(3.25, 1e-10));
        IqrDetector second = (IqrDetector) detector.getDetectors().get("II");
        assertThat(second.getLower(), closeTo(3, 1e-10));
        assertThat(second.getUpper(), closeTo(9, 1e-10));
        assertThat(detector.getIndex(), contains(10));
    }

    @Test
    public void testIndexIsUnionOfGroupIndexes() {
        Column height = heights.getColumn("height");
        Column group = heights.getColumn("group");
        Map<Object, List<Integer>> positions = new LinkedHashMap<>();
        for (int i = 0; i < group.size(); i++) {
            positions.computeIfAbsent(group.get(i), k -> new ArrayList<>()).add(i);
        }
        Set<Object> expected = new HashSet<>();
        for (List<Integer> rows : positions.values()) {
            expected.addAll(IqrDetector.fromData(GaussianConfig.defaults(), height.select(rows)).getIndex());
        }

        ByCategoryDetector detector = ByCategoryDetector
                .fromData(ByCategoryConfig.builder().method(DetectorKind.IQR).build(), heights);
        assertEquals(expected, detector.getIndex());
    }

    @Test
    public void testMethodConfigIsForwarded() {
        GaussianConfig config = GaussianConfig.builder().threshold(3).build();
        ByCategoryDetector detector = ByCategoryDetector
                .fromData(ByCategoryConfig.builder().method(DetectorKind.IQR).methodConfig(config).build(), heights);
        assertEquals(config, detector.getMethodConfig());
        assertThat(((IqrDetector) detector.getDetectors().get("I")).getThreshold(), closeTo(3, 1e-10));
    }

    @Test
    public void testInvalidInput() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ByCategoryDetector
                .fromData(ByCategoryConfig.builder().method(DetectorKind.EMAIL).build(), heights));
        assertEquals("email is not a numerical column method", e.getMessage());

        Table twoCategories = Table.of(Column.of("a", "x"), Column.of("b", "y"));
        IncompatibleDataException incompatible = assertThrows(IncompatibleDataException.class,
                () -> ByCategoryDetector.fromData(ByCategoryConfig.builder().method(DetectorKind.IQR).build(),
                        twoCategories));
        assertEquals("Table must contain one numerical column and one categorical column", incompatible.getMessage());
    }
}
