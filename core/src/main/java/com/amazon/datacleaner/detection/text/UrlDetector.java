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
 * Flags the values that are not well formed URLs: a domain name, localhost or
 * a dotted IPv4 address, an optional port and an optional path.
 */
public class UrlDetector extends PatternDetector {

    private static final String PROTOCOL = "^(?:http|ftp)s?://";

    private static final String OPTIONAL_PROTOCOL = "(^(?:http|ftp)s?://)?";

    private static final String HOST_PORT_PATH = "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+"
            + "(?:[A-Z]{2,6}\\.?|[A-Z0-9-]{2,}\\.?)|" // domain
            + "localhost|" //
            + "\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})" // ip
            + "(?::\\d+)?" // port
            + "(?:/?|[/?]\\S+)$";

    private final boolean checkProtocol;

    private UrlDetector(Column data, boolean checkProtocol) {
        super(data, PatternConfig.builder().compiled(urlPattern(checkProtocol)).mode(PatternMode.FULLMATCH).build());
        this.checkProtocol = checkProtocol;
    }

    private UrlDetector(Column data, UrlDetector source) {
        super(data, source);
        this.checkProtocol = source.checkProtocol;
    }

    public static UrlDetector fromData(UrlConfig config, Column data) {
        return new UrlDetector(data, config.isCheckProtocol());
    }

    public static UrlDetector fromDetector(UrlDetector source, Column data) {
        return new UrlDetector(data, source);
    }

    static Pattern urlPattern(boolean checkProtocol) {
        return Pattern.compile((checkProtocol ? PROTOCOL : OPTIONAL_PROTOCOL) + HOST_PORT_PATH,
                Pattern.CASE_INSENSITIVE);
    }

    public boolean isCheckProtocol() {
        return checkProtocol;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.URL;
    }
}
