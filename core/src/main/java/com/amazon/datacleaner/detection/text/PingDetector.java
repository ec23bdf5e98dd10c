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

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractObjectColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values that cannot be fetched as URLs. Requests are sent
 * sequentially, the first time the flagged rows are asked for.
 */
public class PingDetector extends AbstractObjectColumnDetector {

    private final UrlProbe probe;

    private PingDetector(Column data, UrlProbe probe) {
        super(data);
        this.probe = checkNotNull(probe, "probe must not be null");
    }

    public static PingDetector fromData(PingConfig config, Column data) {
        return new PingDetector(data, config.getProbe());
    }

    public static PingDetector fromDetector(PingDetector source, Column data) {
        return new PingDetector(data, source.probe);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        return !probe.isReachable(value.toString());
    }

    public UrlProbe getProbe() {
        return probe;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.PING;
    }
}
