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

package com.amazon.datacleaner.detection.gaussian;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.statistics.Descriptive;

/**
 * Interquartile range outliers: values outside
 * {@code [Q25 - k * IQR, Q75 + k * IQR]} are flagged.
 */
public class IqrDetector extends AbstractGaussianDetector {

    public static final double DEFAULT_THRESHOLD = 1.5;

    private final double q25;

    private final double q75;

    private IqrDetector(Column data, GaussianConfig config) {
        super(data, config, DEFAULT_THRESHOLD);
        this.q25 = Descriptive.quantile(fitValues, 0.25);
        this.q75 = Descriptive.quantile(fitValues, 0.75);
        updateBounds();
    }

    private IqrDetector(Column data, IqrDetector source) {
        super(data, source);
        this.q25 = source.q25;
        this.q75 = source.q75;
        updateBounds();
    }

    public static IqrDetector fromData(GaussianConfig config, Column data) {
        return new IqrDetector(data, config);
    }

    public static IqrDetector fromDetector(IqrDetector source, Column data) {
        return new IqrDetector(data, source);
    }

    private void updateBounds() {
        double iqr = getIqr();
        setBounds(q25 - fit.getThreshold() * iqr, q75 + fit.getThreshold() * iqr);
    }

    /**
     * @return the first quartile, in the transformed space if a transform applies
     */
    public double getQ25() {
        return q25;
    }

    public double getQ75() {
        return q75;
    }

    public double getIqr() {
        return q75 - q25;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.IQR;
    }
}
