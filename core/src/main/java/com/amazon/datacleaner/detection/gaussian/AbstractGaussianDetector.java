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

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import lombok.extern.slf4j.Slf4j;

import com.amazon.datacleaner.config.NormalTest;
import com.amazon.datacleaner.config.TransformMethod;
import com.amazon.datacleaner.detection.NonNormalDataException;
import com.amazon.datacleaner.detection.bound.AbstractBoundDetector;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.statistics.NormalityTest;
import com.amazon.datacleaner.statistics.transform.PowerTransformer;

/**
 * Base of the outlier detectors that assume a normal distribution. The data
 * is tested for normality; when it is not normal and a power transform is
 * requested, the statistics are computed on the transformed data and the
 * resulting bounds are mapped back to the original space. Bounds without an
 * antecedent become infinite.
 */
@Slf4j
public abstract class AbstractGaussianDetector extends AbstractBoundDetector {

    /**
     * normality is only tested above this number of values
     */
    public static final int MIN_NORMALITY_TEST_SIZE = NormalityTest.MIN_SAMPLE_SIZE;

    protected final GaussianFit fit;

    /**
     * the values the statistics are computed on, transformed if needed; null on
     * a clone
     */
    protected final double[] fitValues;

    protected AbstractGaussianDetector(Column data, GaussianConfig config, double defaultThreshold) {
        super(data, config.getInclusive(), config.getSided());
        checkNotNull(config.getNormalTest(), "normaltest must not be null");
        checkNotNull(config.getTransform(), "transform must not be null");
        double threshold = config.getThreshold().orElse(defaultThreshold);
        checkArgument(!Double.isNaN(threshold), "Threshold must be a number");
        checkArgument(threshold >= 0, "Threshold must be >= 0");
        checkArgument(!Double.isNaN(config.getPValue()), "pvalue must be a number");
        checkArgument(config.getPValue() > 0, "pvalue must be positive");

        double[] values = data.toDoubleArray();
        boolean normal = false;
        String message;
        if (values.length > MIN_NORMALITY_TEST_SIZE) {
            double observed = NormalityTest.pValue(values);
            log.debug("normality test p-value {}", observed);
            normal = observed > config.getPValue();
            message = normal ? "Column distribution has been tested as normal with p=" + config.getPValue()
                    : "Column distribution is not normal/gaussian";
        } else {
            message = "Not enough rows to test normality. Must be > " + MIN_NORMALITY_TEST_SIZE;
        }

        double lambda = Double.NaN;
        double shift = 0;
        PowerTransformer transformer = null;
        if (config.getTransform() != TransformMethod.NONE) {
            transformer = PowerTransformer.fit(config.getTransform(), values);
            lambda = transformer.getLambda();
            shift = transformer.getShift();
            log.debug("{} lambda {} shift {}", config.getTransform(), lambda, shift);
        }
        this.fit = new GaussianFit(threshold, config.getInclusive(), config.getSided(), config.getNormalTest(),
                config.getPValue(), config.getTransform(), normal, lambda, shift, message);
        this.fitValues = fit.isTransformApplied() ? transformer.transform(values) : values;
        applyNormalTest();
    }

    protected AbstractGaussianDetector(Column data, AbstractGaussianDetector source) {
        super(data, source.fit.getInclusive(), source.fit.getSided());
        this.fit = source.fit;
        this.fitValues = null;
        applyNormalTest();
    }

    private void applyNormalTest() {
        if (fit.isNormal()) {
            return;
        }
        if (fit.getNormalTest() == NormalTest.WARN) {
            warn(fit.getMessage());
        } else if (fit.getNormalTest() == NormalTest.ERROR) {
            throw new NonNormalDataException(fit.getMessage());
        }
    }

    /**
     * Sets the bounds from values computed in the space of the statistics.
     *
     * @param lowerBound the lower bound, possibly in the transformed space
     * @param upperBound the upper bound, possibly in the transformed space
     */
    protected void setBounds(double lowerBound, double upperBound) {
        if (fit.isTransformApplied()) {
            PowerTransformer transformer = fit.getTransformer();
            double inverseLower = transformer.inverse(lowerBound);
            double inverseUpper = transformer.inverse(upperBound);
            this.lower = Double.isNaN(inverseLower) ? Double.NEGATIVE_INFINITY : inverseLower;
            this.upper = Double.isNaN(inverseUpper) ? Double.POSITIVE_INFINITY : inverseUpper;
        } else {
            this.lower = lowerBound;
            this.upper = upperBound;
        }
    }

    public GaussianFit getFit() {
        return fit;
    }

    public double getThreshold() {
        return fit.getThreshold();
    }

    public boolean isNormal() {
        return fit.isNormal();
    }

    public TransformMethod getTransform() {
        return fit.getTransform();
    }

    /**
     * @return the fitted lambda, NaN when no transform was requested
     */
    public double getLambda() {
        return fit.getLambda();
    }

    public String getMessage() {
        return fit.getMessage();
    }
}
