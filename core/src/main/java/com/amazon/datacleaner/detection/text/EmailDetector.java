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

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.PatternMode;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values that are not email addresses.
 */
public class EmailDetector extends PatternDetector {

    public static final Pattern EMAIL_PATTERN = Pattern
            .compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b");

    private EmailDetector(Column data) {
        super(data, PatternConfig.builder().compiled(EMAIL_PATTERN).mode(PatternMode.FULLMATCH).build());
    }

    private EmailDetector(Column data, EmailDetector source) {
        super(data, source);
    }

    public static EmailDetector fromData(Column data) {
        return new EmailDetector(data);
    }

    public static EmailDetector fromDetector(EmailDetector source, Column data) {
        return new EmailDetector(data, source);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.EMAIL;
    }
}
