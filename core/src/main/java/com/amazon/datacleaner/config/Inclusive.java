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

package com.amazon.datacleaner.config;

import com.amazon.datacleaner.CommonUtils;

/**
 * Which bounds of an interval are themselves valid values. A value equal to an
 * inclusive bound is valid; a value equal to an exclusive bound is flagged.
 */
public enum Inclusive {

    /**
     * both bounds are valid values
     */
    BOTH,
    /**
     * neither bound is a valid value
     */
    NEITHER,
    /**
     * only the lower bound is a valid value
     */
    LEFT,
    /**
     * only the upper bound is a valid value
     */
    RIGHT;

    public boolean isLowerInclusive() {
        return this == BOTH || this == LEFT;
    }

    public boolean isUpperInclusive() {
        return this == BOTH || this == RIGHT;
    }

    /**
     * @param value a value to test
     * @param lower the lower bound, possibly -infinity
     * @param upper the upper bound, possibly +infinity
     * @return true if the value lies outside the interval
     */
    public boolean isOutside(double value, double lower, double upper) {
        boolean below = isLowerInclusive() ? value < lower : value <= lower;
        boolean above = isUpperInclusive() ? value > upper : value >= upper;
        return below || above;
    }

    /**
     * Same test for comparable values; a null bound is unbounded.
     */
    public <T extends Comparable<? super T>> boolean isOutside(T value, T lower, T upper) {
        if (lower != null) {
            int cmp = value.compareTo(lower);
            if (isLowerInclusive() ? cmp < 0 : cmp <= 0) {
                return true;
            }
        }
        if (upper != null) {
            int cmp = value.compareTo(upper);
            return isUpperInclusive() ? cmp > 0 : cmp >= 0;
        }
        return false;
    }

    public static Inclusive fromName(String name) {
        return CommonUtils.parseEnum(Inclusive.class, name);
    }
}
