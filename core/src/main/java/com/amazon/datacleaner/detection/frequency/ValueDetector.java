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

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.Objects;

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values different from an expected value, or equal to a forbidden
 * one.
 */
@Getter
public class ValueDetector extends AbstractColumnDetector {

    private final Object value;

    private final boolean checkType;

    private final boolean forbidden;

    private ValueDetector(Column data, Object value, boolean checkType, boolean forbidden) {
        super(data);
        checkArgument(value != null, "The authorized value is not defined");
        this.value = value;
        this.checkType = checkType;
        this.forbidden = forbidden;
    }

    public static ValueDetector fromData(ValueConfig config, Column data) {
        return new ValueDetector(data, config.getValue(), config.isCheckType(), config.isForbidden());
    }

    public static ValueDetector fromDetector(ValueDetector source, Column data) {
        return new ValueDetector(data, source.value, source.checkType, source.forbidden);
    }

    private boolean matches(Object cell) {
        if (checkType) {
            return cell.getClass() == value.getClass() && Objects.equals(cell, value);
        }
        return Objects.equals(ValueKeys.key(cell), ValueKeys.key(value));
    }

    @Override
    protected boolean isErrorValue(Object cell) {
        return matches(cell) == forbidden;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.VALUE;
    }
}
