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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * A detector that learns the set of valid values on the data it is fitted on
 * and flags the values outside of it. A clone reuses the learned set.
 */
public abstract class AbstractValidSetDetector extends AbstractColumnDetector {

    private final Set<Object> validValues;

    protected AbstractValidSetDetector(Column data, Set<Object> validValues) {
        super(data);
        this.validValues = Collections.unmodifiableSet(new LinkedHashSet<>(validValues));
    }

    /**
     * @return the values seen often enough on the fitted data, numbers as
     *         doubles
     */
    public Set<Object> getValidValues() {
        return validValues;
    }

    @Override
    protected boolean isErrorValue(Object value) {
        return !validValues.contains(ValueKeys.key(value));
    }
}
