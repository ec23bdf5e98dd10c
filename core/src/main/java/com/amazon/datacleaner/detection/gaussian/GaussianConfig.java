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

import java.util.Optional;

import lombok.Getter;

import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.config.NormalTest;
import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.config.TransformMethod;
import com.amazon.datacleaner.detection.DetectorConfig;

/**
 * Parameters shared by the iqr, zscore and modzscore detectors. The default
 * threshold depends on the detector, so it stays empty unless given.
 */
@Getter
public class GaussianConfig implements DetectorConfig {

    public static final Inclusive DEFAULT_INCLUSIVE = Inclusive.BOTH;

    public static final Sided DEFAULT_SIDED = Sided.BOTH;

    public static final NormalTest DEFAULT_NORMAL_TEST = NormalTest.IGNORE;

    public static final double DEFAULT_P_VALUE = 1e-3;

    public static final TransformMethod DEFAULT_TRANSFORM = TransformMethod.NONE;

    private final Optional<Double> threshold;

    private final Inclusive inclusive;

    private final Sided sided;

    private final NormalTest normalTest;

    private final double pValue;

    private final TransformMethod transform;

    protected GaussianConfig(Builder<?> builder) {
        this.threshold = builder.threshold;
        this.inclusive = builder.inclusive;
        this.sided = builder.sided;
        this.normalTest = builder.normalTest;
        this.pValue = builder.pValue;
        this.transform = builder.transform;
    }

    /**
     * @return a new builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * @return a configuration with every default
     */
    public static GaussianConfig defaults() {
        return builder().build();
    }

    public static class Builder<T extends Builder<T>> {

        // no constant default for the threshold, each detector has its own
        private Optional<Double> threshold = Optional.empty();
        private Inclusive inclusive = DEFAULT_INCLUSIVE;
        private Sided sided = DEFAULT_SIDED;
        private NormalTest normalTest = DEFAULT_NORMAL_TEST;
        private double pValue = DEFAULT_P_VALUE;
        private TransformMethod transform = DEFAULT_TRANSFORM;

        public T threshold(double threshold) {
            this.threshold = Optional.of(threshold);
            return (T) this;
        }

        public T inclusive(Inclusive inclusive) {
            this.inclusive = inclusive;
            return (T) this;
        }

        public T sided(Sided sided) {
            this.sided = sided;
            return (T) this;
        }

        public T normalTest(NormalTest normalTest) {
            this.normalTest = normalTest;
            return (T) this;
        }

        public T pValue(double pValue) {
            this.pValue = pValue;
            return (T) this;
        }

        public T transform(TransformMethod transform) {
            this.transform = transform;
            return (T) this;
        }

        public GaussianConfig build() {
            return new GaussianConfig(this);
        }
    }
}
