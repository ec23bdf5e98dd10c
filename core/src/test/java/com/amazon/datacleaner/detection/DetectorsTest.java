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

package com.amazon.datacleaner.detection;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.frequency.CountsConfig;
import com.amazon.datacleaner.detection.frequency.CountsDetector;
import com.amazon.datacleaner.detection.frequency.FreqConfig;
import com.amazon.datacleaner.detection.gaussian.ZScoreDetector;
import com.amazon.datacleaner.detection.generic.DuplicatedRowsDetector;
import com.amazon.datacleaner.detection.multivariate.ByCategoryDetector;
import com.amazon.datacleaner.detection.text.EmailDetector;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

public class DetectorsTest {

    private final Column numbers = Column.numeric("x", 1, 2, 3, Double.NaN, 2, 3, 100, 2, 1);

    private final Column words = Column.of("v", "a b", null, " a", "a@b.io", "a b");

    private final Table heights = Table.of(
            Column.numeric("height", 0, 0, 0, 0, -1, 1, -1, 1, -2, 2, 5, 6, 6, 6, 6, 5, 7, 5, 7, 4, 8),
            Column.of("group", "I", "I", "I", "I", "I", "I", "I", "I", "I", "I", "I", "II", "II", "II", "II", "II",
                    "II", "II", "II", "II", "II"));

    @Test
    public void testDefaultConfigs() {
        assertThat(Detectors.fromData(DetectorKind.ZSCORE, null, numbers), instanceOf(ZScoreDetector.class));
        assertThat(Detectors.fromData(DetectorKind.EMAIL, null, words), instanceOf(EmailDetector.class));
        IDetector<Column> counts = Detectors.fromData(DetectorKind.COUNTS, null, words);
        assertThat(counts, instanceOf(CountsDetector.class));
        assertEquals(1, ((CountsDetector) counts).getN());
    }

    @Test
    public void testConfigOfAnotherKind() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Detectors.fromData(DetectorKind.COUNTS, FreqConfig.builder().build(), words));
        assertEquals("counts expects a CountsConfig, found FreqConfig", e.getMessage());

        e = assertThrows(IllegalArgumentException.class,
                () -> Detectors.fromData(DetectorKind.EMAIL, CountsConfig.builder().build(), words));
        assertEquals("email takes no parameter", e.getMessage());
    }

    @Test
    public void testFrameShapeGuards() {
        IncompatibleDataException e = assertThrows(IncompatibleDataException.class,
                () -> Detectors.fromData(DetectorKind.OUTLIERS, null, numbers));
        assertEquals("outliers applies to tables, not to a single column", e.getMessage());

        e = assertThrows(IncompatibleDataException.class,
                () -> Detectors.fromData(DetectorKind.EMAIL, null, Table.of(words)));
        assertEquals("email applies to a single column, not to a table", e.getMessage());

        e = assertThrows(IncompatibleDataException.class,
                () -> Detectors.fromData(DetectorKind.IQR, null, Table.of(numbers, numbers.rename("y"))));
        assertEquals(AbstractNumericCategoricalTableDetector.INCOMPATIBLE_MESSAGE, e.getMessage());

        assertThrows(IncompatibleDataException.class, () -> Detectors.fromData(DetectorKind.ZSCORE, null, words));
        assertThrows(IncompatibleDataException.class, () -> Detectors.fromData(DetectorKind.EMAIL, null, numbers));
    }

    @Test
    public void testNumericMethodOnCategorizedTable() {
        IDetector<Table> detector = Detectors.fromData(DetectorKind.IQR, null, heights);
        assertThat(detector, instanceOf(ByCategoryDetector.class));
        assertThat(detector.getIndex(), contains(10));
    }

    @Test
    public void testFromDetector() {
        IDetector<Column> source = Detectors.fromData(DetectorKind.COUNTS, null, words);
        IDetector<Column> replayed = Detectors.fromDetector(source, Column.of("v", "a b", "zzz"));
        assertEquals(DetectorKind.COUNTS, replayed.getKind());
        assertThat(replayed.getIndex(), contains(1));

        IDetector<Table> rows = Detectors.fromData(DetectorKind.DUPLICATED, null, heights);
        assertThat(Detectors.fromDetector(rows, heights), instanceOf(DuplicatedRowsDetector.class));
    }

    @Test
    public void testDetectorsWithoutClone() {
        IDetector<Table> outliers = Detectors.fromData(DetectorKind.OUTLIERS, null,
                Table.of(numbers, numbers.rename("y")));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Detectors.fromDetector(outliers, Table.of(numbers, numbers.rename("y"))));
        assertEquals(Detectors.NO_CLONE_MESSAGE, e.getMessage());

        IDetector<Table> byCategory = Detectors.fromData(DetectorKind.IQR, null, heights);
        e = assertThrows(IllegalArgumentException.class, () -> Detectors.fromDetector(byCategory, heights));
        assertEquals(Detectors.NO_CLONE_MESSAGE, e.getMessage());
    }

    @ParameterizedTest
    @EnumSource(value = DetectorKind.class, names = { "BOUNDED", "QUANTILES", "IQR", "ZSCORE", "MODZSCORE", "COUNTS",
            "FREQ", "DUPLICATED", "TYPES" })
    public void testMissingNumbersAreNeverFlagged(DetectorKind kind) {
        assertFalse(Detectors.fromData(kind, null, numbers).isError().get(3));
    }

    @ParameterizedTest
    @EnumSource(value = DetectorKind.class, names = { "EMAIL", "URL", "SPACES", "KEY_COLLISION", "COUNTS", "FREQ",
            "DUPLICATED", "TYPES" })
    public void testMissingTextIsNeverFlagged(DetectorKind kind) {
        assertFalse(Detectors.fromData(kind, null, words).isError().get(1));
    }
}
