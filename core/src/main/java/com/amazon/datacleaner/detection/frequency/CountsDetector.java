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

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags rare values: a value is valid when it occurs more than {@code n} times.
 */
public class CountsDetector extends AbstractValidSetDetector {

    private final int n;

    private CountsDetector(Column data, int n, Set<Object> validValues) {
        super(data, validValues);
        this.n = n;
    }

    public static CountsDetector fromData(CountsConfig config, Column data) {
        int n = config.getN();
        checkArgument(n > 0, "n must be a >0 integer");
        Set<Object> valid = new LinkedHashSet<>();
        for (Map.Entry<Object, Integer> entry : ValueKeys.counts(data).entrySet()) {
            if (entry.getValue() > n) {
                valid.add(entry.getKey());
            }
        }
        return new CountsDetector(data, n, valid);
    }

    public static CountsDetector fromDetector(CountsDetector source, Column data) {
        return new CountsDetector(data, source.n, source.getValidValues());
    }

    public int getN() {
        return n;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.COUNTS;
    }
}
