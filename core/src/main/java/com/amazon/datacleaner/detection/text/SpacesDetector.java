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
import com.amazon.datacleaner.config.Side;
import com.amazon.datacleaner.detection.AbstractObjectColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values starting or ending with a space.
 */
public class SpacesDetector extends AbstractObjectColumnDetector {

    private final Side side;

    private SpacesDetector(Column data, Side side) {
        super(data);
        this.side = checkNotNull(side, "Parameter side must be leading or trailing or both");
    }

    public static SpacesDetector fromData(SpacesConfig config, Column data) {
        return new SpacesDetector(data, config.getSide());
    }

    public static SpacesDetector fromDetector(SpacesDetector source, Column data) {
        return new SpacesDetector(data, source.side);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        String text = value.toString();
        boolean leading = text.startsWith(" ");
        boolean trailing = text.endsWith(" ");
        switch (side) {
        case LEADING:
            return leading;
        case TRAILING:
            return trailing;
        default:
            return leading || trailing;
        }
    }

    public Side getSide() {
        return side;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.SPACES;
    }
}
