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

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.datacleaner.returntypes.ErrorMask;

/**
 * An immutable, ordered collection of named columns sharing one row index. A
 * row is missing when any of its cells is missing.
 */
public class Table implements IFrame<Table> {

    private final Map<String, Column> columns;

    private final List<Object> index;

    /**
     * @param columns at least one column; all columns must have the same row keys
     *                in the same order and distinct names
     */
    public Table(List<Column> columns) {
        checkNotNull(columns, "columns must not be null");
        checkArgument(!columns.isEmpty(), "a table needs at least one column");
        this.columns = new LinkedHashMap<>();
        this.index = columns.get(0).getIndex();
        for (Column column : columns) {
            checkArgument(column.getIndex().equals(index),
                    "column " + column.getName() + " does not share the table index");
            checkArgument(this.columns.put(column.getName(), column) == null,
                    "duplicate column name " + column.getName());
        }
    }

    public static Table of(Column... columns) {
        return new Table(Arrays.asList(columns));
    }

    @Override
    public List<Object> getIndex() {
        return index;
    }

    @Override
    public int size() {
        return index.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(new ArrayList<>(columns.values()));
    }

    /**
     * @param name a column name
     * @return the column
     * @throws IllegalArgumentException if there is no such column
     */
    public Column getColumn(String name) {
        Column column = columns.get(name);
        checkArgument(column != null, "unknown column " + name);
        return column;
    }

    /**
     * @param type a data type
     * @return the number of columns of that type
     */
    public int countColumns(DataType type) {
        int count = 0;
        for (Column column : columns.values()) {
            if (column.getDtype() == type) {
                count++;
            }
        }
        return count;
    }

    /**
     * @param type a data type
     * @return the columns of that type, in table order
     */
    public List<Column> getColumns(DataType type) {
        List<Column> result = new ArrayList<>();
        for (Column column : columns.values()) {
            if (column.getDtype() == type) {
                result.add(column);
            }
        }
        return result;
    }

    /**
     * @param position a row position
     * @return the cells of that row, in column order
     */
    public List<Object> getRow(int position) {
        List<Object> row = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            row.add(column.get(position));
        }
        return row;
    }

    @Override
    public boolean isMissing(int position) {
        for (Column column : columns.values()) {
            if (column.isMissing(position)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param names the names of the columns to keep, in the wanted order
     * @return a table with these columns only
     */
    public Table select(List<String> names) {
        List<Column> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(getColumn(name));
        }
        return new Table(selected);
    }

    /**
     * @return a copy without the rows holding a missing value
     */
    public Table dropMissing() {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            if (!isMissing(i)) {
                kept.add(i);
            }
        }
        return selectRows(kept);
    }

    @Override
    public Table filter(ErrorMask mask) {
        checkArgument(mask.size() == size(), "mask and table sizes differ");
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            if (mask.get(i)) {
                kept.add(i);
            }
        }
        return selectRows(kept);
    }

    /**
     * @param rowPositions positions of the rows to keep
     * @return a table with these rows, keys preserved
     */
    public Table selectRows(List<Integer> rowPositions) {
        List<Column> selected = new ArrayList<>(columns.size());
        for (Column column : columns.values()) {
            selected.add(column.select(rowPositions));
        }
        return new Table(selected);
    }

    @Override
    public String toString() {
        return "Table" + columns.values();
    }
}
