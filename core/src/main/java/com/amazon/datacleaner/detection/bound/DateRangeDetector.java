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

import java.time.LocalDate;
import java.time.LocalDateTime;

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.detection.AbstractDateTimeColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the dates of a datetime column lying outside a range. Dates without a
 * time of day are compared at midnight.
 */
@Getter
public class DateRangeDetector extends AbstractDateTimeColumnDetector {

    private final LocalDateTime lower;

    private final LocalDateTime upper;

    private final Inclusive inclusive;

    private DateRangeDetector(Column data, LocalDateTime lower, LocalDateTime upper, Inclusive inclusive) {
        super(data);
        checkArgument(lower != null || upper != null, "Neither lower nor upper specified");
        checkArgument(lower == null || upper == null || lower.isBefore(upper), "Lower bound is >= upper bound");
        this.lower = lower;
        this.upper = upper;
        this.inclusive = checkNotNull(inclusive, "inclusive must not be null");
    }

    public static DateRangeDetector fromData(DateRangeConfig config, Column data) {
        return new DateRangeDetector(data, config.getLower(), config.getUpper(), config.getInclusive());
    }

    public static DateRangeDetector fromDetector(DateRangeDetector source, Column data) {
        return new DateRangeDetector(data, source.lower, source.upper, source.inclusive);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        LocalDateTime date = value instanceof LocalDate ? ((LocalDate) value).atStartOfDay() : (LocalDateTime) value;
        return inclusive.isOutside(date, lower, upper);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.DATE_RANGE;
    }
}
