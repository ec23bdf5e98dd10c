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

import static com.amazon.datacleaner.CommonUtils.isMissing;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;

/**
 * The kind of values held by a column. Detectors use it to check that they
 * apply to the data they receive.
 */
public enum DataType {

    /**
     * every non-missing value is a {@link Number}
     */
    NUMERIC,
    /**
     * strings, categories or mixed values
     */
    OBJECT,
    /**
     * every non-missing value is a {@link LocalDate} or a {@link LocalDateTime}
     */
    DATETIME;

    /**
     * Infers the type of a sequence of values. Missing values are ignored; a
     * column with only missing values is numeric, since NaN is a number.
     *
     * @param values the values of a column
     * @return the narrowest type accepting all values
     */
    public static DataType infer(Collection<?> values) {
        boolean numeric = true;
        boolean dates = true;
        boolean any = false;
        for (Object value : values) {
            if (isMissing(value)) {
                continue;
            }
            any = true;
            numeric &= value instanceof Number;
            dates &= isDate(value);
        }
        if (numeric || !any) {
            return NUMERIC;
        }
        return dates ? DATETIME : OBJECT;
    }

    /**
     * @param value a non-missing value
     * @return true if the value fits into a column of this type
     */
    public boolean accepts(Object value) {
        switch (this) {
        case NUMERIC:
            return value instanceof Number;
        case DATETIME:
            return isDate(value);
        default:
            return true;
        }
    }

    static boolean isDate(Object value) {
        return value instanceof LocalDate || value instanceof LocalDateTime;
    }
}
