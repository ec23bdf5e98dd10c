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
 * Modified z-score outliers, a robust variant of the z-score built on the
 * median and the median absolute deviation (MAD).
 */
public class ModZScoreDetector extends AbstractGaussianDetector {

    public static final double DEFAULT_THRESHOLD = 3.5;

    /**
     * MAD to standard deviation ratio of a normal distribution
     */
    public static final double MAD_SCALE = 0.6475;

    private final double median;

    private final double mad;

    private ModZScoreDetector(Column data, GaussianConfig config) {
        super(data, config, DEFAULT_THRESHOLD);
        this.median = Descriptive.median(fitValues);
        this.mad = Descriptive.mad(fitValues);
        updateBounds();
    }

    private ModZScoreDetector(Column data, ModZScoreDetector source) {
        super(data, source);
        this.median = source.median;
        this.mad = source.mad;
        updateBounds();
    }

    public static ModZScoreDetector fromData(GaussianConfig config, Column data) {
        return new ModZScoreDetector(data, config);
    }

    public static ModZScoreDetector fromDetector(ModZScoreDetector source, Column data) {
        return new ModZScoreDetector(data, source);
    }

    private void updateBounds() {
        double width = fit.getThreshold() / MAD_SCALE * mad;
        setBounds(median - width, median + width);
    }

    public double getMedian() {
        return median;
    }

    public double getMad() {
        return mad;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.MODZSCORE;
    }
}
