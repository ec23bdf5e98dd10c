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

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.statistics.Descriptive;

/**
 * Flags the values of a numeric column lying outside the interval between two
 * of its quantiles. The quantile values are computed once, on the data the
 * detector is fitted on.
 */
@Getter
public class QuantilesDetector extends AbstractBoundDetector {

    private final double lowerq;

    private final double upperq;

    private QuantilesDetector(Column data, double lowerq, double upperq, Inclusive inclusive) {
        super(data, inclusive, Sided.BOTH);
        checkArgument(lowerq >= 0 && lowerq <= 1, "lowerq must be a number in [0, 1]");
        checkArgument(upperq >= 0 && upperq <= 1, "upperq must be a number in [0, 1]");
        if (lowerq == 0 && upperq == 1) {
            warn("Neither lower or upper quantile specified");
        }
        checkArgument(lowerq < upperq, "Lower quantile is >= upper quantile");
        this.lowerq = lowerq;
        this.upperq = upperq;
    }

    public static QuantilesDetector fromData(QuantilesConfig config, Column data) {
        QuantilesDetector detector = new QuantilesDetector(data, config.getLowerq(), config.getUpperq(),
                config.getInclusive());
        double[] values = data.toDoubleArray();
        detector.lower = Descriptive.quantile(values, detector.lowerq);
        detector.upper = Descriptive.quantile(values, detector.upperq);
        return detector;
    }

    public static QuantilesDetector fromDetector(QuantilesDetector source, Column data) {
        QuantilesDetector detector = new QuantilesDetector(data, source.lowerq, source.upperq, source.inclusive);
        detector.lower = source.lower;
        detector.upper = source.upper;
        return detector;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.QUANTILES;
    }
}
