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

package com.amazon.datacleaner.detection.text;

import java.util.regex.Pattern;

import lombok.Builder;
import lombok.Getter;

import com.amazon.datacleaner.config.PatternMode;
import com.amazon.datacleaner.detection.DetectorConfig;

/**
 * Parameters of the pattern detector. The regular expression is given either
 * as a string, compiled with {@code caseSensitive} and {@code flags}, or as a
 * compiled {@link Pattern} used as is.
 */
@Getter
@Builder
public class PatternConfig implements DetectorConfig {

    private final String pattern;

    private final Pattern compiled;

    @Builder.Default
    private final PatternMode mode = PatternMode.MATCH;

    @Builder.Default
    private final boolean caseSensitive = true;

    /**
     * {@link Pattern} flags added to the string pattern
     */
    @Builder.Default
    private final int flags = 0;
}
