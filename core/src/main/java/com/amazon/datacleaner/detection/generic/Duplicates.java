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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.amazon.datacleaner.config.Keep;

/**
 * Marks repeated keys the way {@link Keep} asks for.
 */
final class Duplicates {

    private Duplicates() {
    }

    /**
     * @param keys one comparison key per row
     * @param keep which occurrence stays unmarked
     * @return true at the positions holding a duplicate
     */
    static boolean[] mark(List<Object> keys, Keep keep) {
        Map<Object, Integer> counts = new HashMap<>();
        for (Object key : keys) {
            counts.merge(key, 1, Integer::sum);
        }
        boolean[] duplicated = new boolean[keys.size()];
        Map<Object, Integer> seen = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            Object key = keys.get(i);
            int occurrence = seen.merge(key, 1, Integer::sum);
            int total = counts.get(key);
            switch (keep) {
            case FIRST:
                duplicated[i] = occurrence > 1;
                break;
            case LAST:
                duplicated[i] = occurrence < total;
                break;
            default:
                duplicated[i] = total > 1;
            }
        }
        return duplicated;
    }
}
