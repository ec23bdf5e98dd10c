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

package com.amazon.datacleaner.frame;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

public class TableTest {

    private final Table table = Table.of(Column.numeric("x", 1, 2, Double.NaN), Column.of("c", "a", null, "b"));

    @Test
    public void testShape() {
        assertEquals(3, table.size());
        assertEquals(2, table.getColumnCount());
        assertThat(table.getColumnNames(), contains("x", "c"));
        assertEquals(1, table.countColumns(DataType.NUMERIC));
        assertEquals(1, table.countColumns(DataType.OBJECT));
    }

    @Test
    public void testRows() {
        assertEquals(Arrays.asList(1.0, "a"), table.getRow(0));
        assertFalse(table.isMissing(0));
        assertTrue(table.isMissing(1));
        assertTrue(table.isMissing(2));
        assertThat(table.dropMissing().getIndex(), contains(0));
    }

    @Test
    public void testSelect() {
        Table selected = table.select(Collections.singletonList("c"));
        assertThat(selected.getColumnNames(), contains("c"));
        assertThrows(IllegalArgumentException.class, () -> table.getColumn("missing"));
    }

    @Test
    public void testColumnsMustAgree() {
        assertThrows(IllegalArgumentException.class, () -> Table.of(Column.numeric("x", 1), Column.numeric("y", 1, 2)));
        assertThrows(IllegalArgumentException.class, () -> Table.of(Column.numeric("x", 1), Column.numeric("x", 2)));
        assertThrows(IllegalArgumentException.class, () -> new Table(Collections.emptyList()));
    }
}
