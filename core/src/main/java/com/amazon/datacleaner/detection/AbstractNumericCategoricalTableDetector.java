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

import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.DataType;
import com.amazon.datacleaner.frame.Table;

/**
 * Base of the detectors bound to a table with exactly one numeric column and
 * one categorical column.
 */
public abstract class AbstractNumericCategoricalTableDetector extends AbstractTableDetector {

    public static final String INCOMPATIBLE_MESSAGE = "Table must contain one numerical column"
            + " and one categorical column";

    protected AbstractNumericCategoricalTableDetector(Table data) {
        super(data);
        if (!isNumericCategorical(data)) {
            throw new IncompatibleDataException(INCOMPATIBLE_MESSAGE);
        }
    }

    public static boolean isNumericCategorical(Table table) {
        return table.getColumnCount() == 2 && table.countColumns(DataType.NUMERIC) == 1
                && table.countColumns(DataType.OBJECT) == 1;
    }

    protected Column getNumericColumn() {
        return data.getColumns(DataType.NUMERIC).get(0);
    }

    protected Column getCategoryColumn() {
        return data.getColumns(DataType.OBJECT).get(0);
    }
}
