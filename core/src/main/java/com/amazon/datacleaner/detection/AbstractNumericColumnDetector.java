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

/**
 * Base of the detectors that apply to numeric columns only.
 */
public abstract class AbstractNumericColumnDetector extends AbstractColumnDetector {

    protected AbstractNumericColumnDetector(Column data) {
        super(data);
        if (data.getDtype() != DataType.NUMERIC) {
            throw new IncompatibleDataException("This detector applies to numerical columns.");
        }
    }

    protected abstract boolean isErrorNumber(double value);

    @Override
    protected boolean isErrorValue(Object value) {
        return isErrorNumber(((Number) value).doubleValue());
    }
}
