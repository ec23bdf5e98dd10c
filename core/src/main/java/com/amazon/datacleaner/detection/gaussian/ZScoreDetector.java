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
 * Z-score outliers: values more than {@code k} sample standard deviations away
 * from the mean are flagged.
 */
public class ZScoreDetector extends AbstractGaussianDetector {

    public static final double DEFAULT_THRESHOLD = 1.96;

    private final double mean;

    private final double std;

    private ZScoreDetector(Column data, GaussianConfig config) {
        super(data, config, DEFAULT_THRESHOLD);
        this.mean = Descriptive.mean(fitValues);
        this.std = Descriptive.std(fitValues);
        setBounds(mean - fit.getThreshold() * std, mean + fit.getThreshold() * std);
    }

    private ZScoreDetector(Column data, ZScoreDetector source) {
        super(data, source);
        this.mean = source.mean;
        this.std = source.std;
        setBounds(mean - fit.getThreshold() * std, mean + fit.getThreshold() * std);
    }

    public static ZScoreDetector fromData(GaussianConfig config, Column data) {
        return new ZScoreDetector(data, config);
    }

    public static ZScoreDetector fromDetector(ZScoreDetector source, Column data) {
        return new ZScoreDetector(data, source);
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ZSCORE;
    }
}
