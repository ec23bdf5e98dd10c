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

package com.amazon.datacleaner.detection.bound;

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values whose string representation is too short, too long, or
 * does not have an exact length. Applies to columns of any type.
 */
@Getter
public class LengthDetector extends AbstractColumnDetector {

    private final Integer lower;

    private final Integer upper;

    private final Integer value;

    private final Inclusive inclusive;

    private LengthDetector(Column data, Integer lower, Integer upper, Integer value, Inclusive inclusive) {
        super(data);
        checkArgument(lower != null || upper != null || value != null, "At least one argument must be provided");
        checkArgument(value == null || (lower == null && upper == null),
                "Incompatible arguments: value and upper or lower");
        checkArgument(lower == null || upper == null || lower < upper, "Lower bound is >= upper bound");
        this.lower = lower;
        this.upper = upper;
        this.value = value;
        this.inclusive = checkNotNull(inclusive, "inclusive must not be null");
    }

    public static LengthDetector fromData(LengthConfig config, Column data) {
        return new LengthDetector(data, config.getLower(), config.getUpper(), config.getValue(),
                config.getInclusive());
    }

    public static LengthDetector fromDetector(LengthDetector source, Column data) {
        return new LengthDetector(data, source.lower, source.upper, source.value, source.inclusive);
    }

    /**
     * @return true when an exact length is required
     */
    public boolean isFixedValue() {
        return value != null;
    }

    @Override
    protected boolean isErrorValue(Object cell) {
        int length = String.valueOf(cell).length();
        if (value != null) {
            return length != value;
        }
        return inclusive.isOutside(Integer.valueOf(length), lower, upper);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.LENGTH;
    }
}
