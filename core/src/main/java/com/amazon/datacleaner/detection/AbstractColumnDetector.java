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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.amazon.datacleaner.frame.Column;

/**
 * A detector that judges every value of a column on its own.
 */
public abstract class AbstractColumnDetector extends AbstractDetector<Column> {

    protected AbstractColumnDetector(Column data) {
        super(data);
    }

    /**
     * @param value a non-missing value of the column
     * @return true if the value is an error
     */
    protected abstract boolean isErrorValue(Object value);

    @Override
    protected Collection<Object> computeIndex() {
        List<Object> keys = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            if (!data.isMissing(i) && isErrorValue(data.get(i))) {
                keys.add(data.getIndex().get(i));
            }
        }
        return keys;
    }
}
