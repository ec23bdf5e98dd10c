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
 * Flags rare values: a value is valid when its frequency among the
 * non-missing values is above {@code freq}.
 */
public class FreqDetector extends AbstractValidSetDetector {

    private final double freq;

    private FreqDetector(Column data, double freq, Set<Object> validValues) {
        super(data, validValues);
        checkArgument(freq > 0 && freq < 1, "freq must be in the range ]0;1[");
        this.freq = freq;
    }

    public static FreqDetector fromData(FreqConfig config, Column data) {
        double freq = config.getFreq();
        Map<Object, Integer> counts = ValueKeys.counts(data);
        double total = data.count();
        Set<Object> valid = new LinkedHashSet<>();
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() / total > freq) {
                valid.add(entry.getKey());
            }
        }
        return new FreqDetector(data, freq, valid);
    }

    public static FreqDetector fromDetector(FreqDetector source, Column data) {
        return new FreqDetector(data, source.freq, source.getValidValues());
    }

    public double getFreq() {
        return freq;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.FREQ;
    }
}
