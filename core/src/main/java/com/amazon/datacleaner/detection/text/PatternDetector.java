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

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.PatternMode;
import com.amazon.datacleaner.detection.AbstractObjectColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values of a text column that do not match a regular expression.
 * Non-string values are matched through their string representation.
 */
public class PatternDetector extends AbstractObjectColumnDetector {

    private final Pattern regex;

    private final PatternMode mode;

    private final boolean caseSensitive;

    private final int flags;

    protected PatternDetector(Column data, PatternConfig config) {
        super(data);
        checkNotNull(config, "config must not be null");
        this.mode = checkNotNull(config.getMode(), "mode must not be null");
        this.caseSensitive = config.isCaseSensitive();
        this.flags = config.getFlags();
        if (config.getCompiled() != null) {
            if (!caseSensitive || flags != 0) {
                warn("case and flag are ignored with a compiled regex");
            }
            this.regex = config.getCompiled();
        } else {
            checkArgument(config.getPattern() != null && !config.getPattern().isEmpty(), "The pattern is empty");
            this.regex = Pattern.compile(config.getPattern(), caseSensitive ? flags : flags | Pattern.CASE_INSENSITIVE);
        }
    }

    protected PatternDetector(Column data, PatternDetector source) {
        super(data);
        this.regex = source.regex;
        this.mode = source.mode;
        this.caseSensitive = source.caseSensitive;
        this.flags = source.flags;
    }

    public static PatternDetector fromData(PatternConfig config, Column data) {
        return new PatternDetector(data, config);
    }

    public static PatternDetector fromDetector(PatternDetector source, Column data) {
        return new PatternDetector(data, source);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        Matcher matcher = regex.matcher(value.toString());
        switch (mode) {
        case MATCH:
            return !matcher.lookingAt();
        case FULLMATCH:
            return !matcher.matches();
        default:
            return !matcher.find();
        }
    }

    /**
     * @return the compiled regular expression, flags included
     */
    public Pattern getPattern() {
        return regex;
    }

    public PatternMode getMode() {
        return mode;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public int getFlags() {
        return flags;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.PATTERN;
    }
}
