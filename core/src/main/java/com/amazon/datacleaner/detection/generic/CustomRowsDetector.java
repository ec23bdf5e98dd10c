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

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractTableDetector;
import com.amazon.datacleaner.frame.Table;

/**
 * Flags the complete rows for which a user function returns true. The
 * function receives the cells of the row in column order.
 */
public class CustomRowsDetector extends AbstractTableDetector {

    private final Function<Object, ?> errorFunction;

    private CustomRowsDetector(Table data, Function<Object, ?> errorFunction) {
        super(data);
        this.errorFunction = checkNotNull(errorFunction, "error function must be defined");
    }

    public static CustomRowsDetector fromData(CustomConfig config, Table data) {
        return new CustomRowsDetector(data, config.getErrorFunction());
    }

    public static CustomRowsDetector fromDetector(CustomRowsDetector source, Table data) {
        return new CustomRowsDetector(data, source.errorFunction);
    }

    @Override
    protected Collection<Object> computeIndex() {
        List<Object> index = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            if (!data.isMissing(i) && CustomDetector.asBoolean(errorFunction.apply(data.getRow(i)))) {
                index.add(data.getIndex().get(i));
            }
        }
        return index;
    }

    public Function<Object, ?> getErrorFunction() {
        return errorFunction;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.CUSTOM;
    }
}
