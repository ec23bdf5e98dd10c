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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values that are not in a list of authorized values, or that are
 * in a list of forbidden values.
 */
public class EnumDetector extends AbstractColumnDetector {

    @Getter
    private final List<Object> values;

    @Getter
    private final boolean forbidden;

    private final Set<Object> keys;

    private EnumDetector(Column data, List<?> values, boolean forbidden) {
        super(data);
        checkArgument(values != null && !values.isEmpty(), "The list of authorized values is empty");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.forbidden = forbidden;
        this.keys = new HashSet<>(ValueKeys.keys(values));
    }

    public static EnumDetector fromData(EnumConfig config, Column data) {
        return new EnumDetector(data, config.getValues(), config.isForbidden());
    }

    public static EnumDetector fromDetector(EnumDetector source, Column data) {
        return new EnumDetector(data, source.values, source.forbidden);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        return keys.contains(ValueKeys.key(value)) == forbidden;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ENUM;
    }
}
