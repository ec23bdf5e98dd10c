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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.datacleaner.CommonUtils;
import com.amazon.datacleaner.frame.Column;

/**
 * Value counting shared by the frequency detectors.
 */
final class ValueKeys {

    private ValueKeys() {
    }

    static Object key(Object value) {
        return CommonUtils.valueKey(value);
    }

    /**
     * @param column a column
     * @return the number of occurrences of each non-missing value, in order of
     *         first appearance
     */
    static Map<Object, Integer> counts(Column column) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object value : column.getValues()) {
            if (!CommonUtils.isMissing(value)) {
                counts.merge(key(value), 1, Integer::sum);
            }
        }
        return counts;
    }

    static List<Object> keys(List<?> values) {
        List<Object> keys = new ArrayList<>(values.size());
        for (Object value : values) {
            keys.add(key(value));
        }
        return keys;
    }
}
