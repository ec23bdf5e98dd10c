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
 * Base of the detectors that apply to date columns.
 */
public abstract class AbstractDateTimeColumnDetector extends AbstractColumnDetector {

    protected AbstractDateTimeColumnDetector(Column data) {
        super(data);
        if (data.getDtype() != DataType.DATETIME && data.count() > 0) {
            throw new IncompatibleDataException("This detector applies to datetime columns.");
        }
    }
}
