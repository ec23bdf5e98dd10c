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

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Getter;

import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.detection.DetectorConfig;

/**
 * Parameters of the date range detector; a null bound is open.
 */
@Getter
@Builder
public class DateRangeConfig implements DetectorConfig {

    private final LocalDateTime lower;

    private final LocalDateTime upper;

    @Builder.Default
    private final Inclusive inclusive = Inclusive.BOTH;
}
