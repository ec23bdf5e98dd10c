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

package com.amazon.datacleaner.detection.types;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;

import com.amazon.datacleaner.config.CastTarget;
import com.amazon.datacleaner.detection.DetectorConfig;

/**
 * Parameters of the castable detector.
 */
@Getter
@Builder
public class CastableConfig implements DetectorConfig {

    private final CastTarget target;

    /**
     * separator between groups of digits, removed before parsing
     */
    private final String thousands;

    /**
     * decimal separator, replaced with a dot before parsing
     */
    private final String decimal;

    /**
     * accepted spellings of booleans; null accepts "True" and "False"
     */
    private final Map<String, Boolean> boolValues;

    /**
     * date patterns tried in order; null uses a list of common layouts
     */
    private final List<String> dateFormats;
}
