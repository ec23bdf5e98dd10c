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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.datacleaner.CommonUtils;
import com.amazon.datacleaner.returntypes.ErrorMask;

/**
 * An immutable named column of values. Each value is associated with a unique
 * row key; the keys need not be sorted nor contiguous. Missing values are
 * {@code null} or NaN.
 */
@Getter
public class Column implements IFrame<Column> {

    private final String name;

    private final DataType dtype;

    private final List<Object> index;

    private final List<Object> values;

    @Getter(AccessLevel.NONE)
    private final Map<Object, Integer> positions;

    /**
     * Creates a column with the default row keys {@code 0..n-1} and an inferred
     * type.
     *
     * @param name   the column name
     * @param values the values, missing ones as null or NaN
     */
    public Column(String name, List<?> values) {
        this(name, values, defaultIndex(values.size()), null);
    }

    public Column(String name, List<?> values, List<?> index) {
        this(name, values, index, null);
    }

    /**
     * @param name   the column name
     * @param values the values, missing ones as null or NaN
     * @param index  the row keys, unique and not null
     * @param dtype  the type of the column, or null to infer it from the values
     */
    public Column(String name, List<?> values, List<?> index, DataType dtype) {
        checkNotNull(name, "name must not be null");
        checkNotNull(values, "values must not be null");
        checkNotNull(index, "index must not be null");
        checkArgument(values.size() == index.size(),
                String.format("index has %d keys but column has %d values", index.size(), values.size()));
        this.name = name;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.index = Collections.unmodifiableList(new ArrayList<>(index));
        this.positions = new HashMap<>();
        for (int i = 0; i < index.size(); i++) {
            Object key = index.get(i);
            checkNotNull(key, "row keys must not be null");
            checkArgument(positions.put(key, i) == null, "duplicate row key " + key);
        }
        if (dtype == null) {
            this.dtype = DataType.infer(values);
        } else {
            for (Object value : values) {
                checkArgument(CommonUtils.isMissing(value) || dtype.accepts(value),
                        String.format("value %s does not fit a %s column", value, dtype));
            }
            this.dtype = dtype;
        }
    }

    /**
     * @param name   the column name
     * @param values the values, missing ones as null or NaN
     * @return a column with default row keys
     */
    public static Column of(String name, Object... values) {
        return new Column(name, Arrays.asList(values));
    }

    /**
     * @param name   the column name
     * @param values numeric values, missing ones as NaN
     * @return a numeric column with default row keys
     */
    public static Column numeric(String name, double... values) {
        List<Object> list = new ArrayList<>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return new Column(name, list, defaultIndex(values.length), DataType.NUMERIC);
    }

    public static List<Object> defaultIndex(int size) {
        List<Object> keys = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            keys.add(i);
        }
        return keys;
    }

    @Override
    public int size() {
        return values.size();
    }

    /**
     * @param position a row position
     * @return the value at that position
     */
    public Object get(int position) {
        return values.get(position);
    }

    /**
     * @param key a row key
     * @return the value stored under that key
     * @throws IllegalArgumentException if the key is not in the index
     */
    public Object getByKey(Object key) {
        Integer position = positions.get(key);
        checkArgument(position != null, "unknown row key " + key);
        return values.get(position);
    }

    /**
     * @param key a row key
     * @return true if the key belongs to this column
     */
    public boolean containsKey(Object key) {
        return positions.containsKey(key);
    }

    /**
     * @param position a row position
     * @return the numeric value at that position
     */
    public double getDouble(int position) {
        Object value = values.get(position);
        return CommonUtils.isMissing(value) ? Double.NaN : ((Number) value).doubleValue();
    }

    @Override
    public boolean isMissing(int position) {
        return CommonUtils.isMissing(values.get(position));
    }

    /**
     * @return the number of non-missing values
     */
    public int count() {
        int count = 0;
        for (int i = 0; i < size(); i++) {
            if (!isMissing(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return the non-missing values of a numeric column, in row order
     */
    public double[] toDoubleArray() {
        checkArgument(dtype == DataType.NUMERIC, "column " + name + " is not numeric");
        double[] result = new double[count()];
        int j = 0;
        for (int i = 0; i < size(); i++) {
            if (!isMissing(i)) {
                result[j++] = getDouble(i);
            }
        }
        return result;
    }

    /**
     * @return a copy without the missing values
     */
    public Column dropMissing() {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            if (!isMissing(i)) {
                kept.add(i);
            }
        }
        return select(kept);
    }

    @Override
    public Column filter(ErrorMask mask) {
        checkArgument(mask.size() == size(), "mask and column sizes differ");
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            if (mask.get(i)) {
                kept.add(i);
            }
        }
        return select(kept);
    }

    /**
     * @param rowPositions positions of the rows to keep, in the wanted order
     * @return a column with these rows, keeping their keys and the column type
     */
    public Column select(List<Integer> rowPositions) {
        List<Object> newValues = new ArrayList<>(rowPositions.size());
        List<Object> newIndex = new ArrayList<>(rowPositions.size());
        for (int position : rowPositions) {
            newValues.add(values.get(position));
            newIndex.add(index.get(position));
        }
        return new Column(name, newValues, newIndex, dtype);
    }

    /**
     * @param newName the name of the copy
     * @return the same values and keys under another name
     */
    public Column rename(String newName) {
        return new Column(newName, values, index, dtype);
    }

    @Override
    public String toString() {
        return "Column(" + name + ", " + dtype + ", " + values + ")";
    }
}
