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

package com.amazon.datacleaner.returntypes;

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A boolean per row of a column or table, aligned with its row index. The
 * mask returned by {@code isError()} is true on the flagged rows; the mask
 * returned by {@code notError()} is its complement.
 */
public class ErrorMask {

    /**
     * the row keys, in frame order
     */
    public final List<Object> index;

    /**
     * one flag per row key
     */
    public final boolean[] values;

    public ErrorMask(List<Object> index, boolean[] values) {
        checkNotNull(index, "index must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(index.size() == values.length, "index and values must have the same length");
        this.index = Collections.unmodifiableList(new ArrayList<>(index));
        this.values = Arrays.copyOf(values, values.length);
    }

    public int size() {
        return values.length;
    }

    /**
     * @param position a row position
     * @return the flag at that position
     */
    public boolean get(int position) {
        return values[position];
    }

    /**
     * @return the number of true entries
     */
    public int count() {
        int count = 0;
        for (boolean value : values) {
            if (value) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return a mask with every flag inverted
     */
    public ErrorMask negate() {
        boolean[] negated = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            negated[i] = !values[i];
        }
        return new ErrorMask(index, negated);
    }

    public List<Boolean> toList() {
        List<Boolean> list = new ArrayList<>(values.length);
        for (boolean value : values) {
            list.add(value);
        }
        return list;
    }

    @Override
    public String toString() {
        return "ErrorMask" + toList();
    }
}
