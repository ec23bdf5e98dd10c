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

import lombok.Builder;
import lombok.Getter;

import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.detection.DetectorConfig;

/**
 * Parameters of the quantiles detector: the quantile fractions whose values
 * become the bounds.
 */
@Getter
@Builder
public class QuantilesConfig implements DetectorConfig {

    @Builder.Default
    private final double lowerq = 0;

    @Builder.Default
    private final double upperq = 1;

    @Builder.Default
    private final Inclusive inclusive = Inclusive.BOTH;
}
