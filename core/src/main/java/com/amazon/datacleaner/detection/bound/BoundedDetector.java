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

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values of a numeric column lying outside fixed bounds.
 */
public class BoundedDetector extends AbstractBoundDetector {

    private BoundedDetector(Column data, double lower, double upper, Inclusive inclusive) {
        super(data, inclusive, Sided.BOTH);
        checkArgument(!Double.isNaN(lower), "Lower bound must be a number");
        checkArgument(!Double.isNaN(upper), "Upper bound must be a number");
        if (Double.isInfinite(lower) && Double.isInfinite(upper)) {
            warn("Neither lower nor upper specified");
        }
        checkArgument(lower < upper, "Lower bound is >= upper bound");
        this.lower = lower;
        this.upper = upper;
    }

    public static BoundedDetector fromData(BoundedConfig config, Column data) {
        return new BoundedDetector(data, config.getLower(), config.getUpper(), config.getInclusive());
    }

    public static BoundedDetector fromDetector(BoundedDetector source, Column data) {
        return new BoundedDetector(data, source.lower, source.upper, source.inclusive);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.BOUNDED;
    }
}
