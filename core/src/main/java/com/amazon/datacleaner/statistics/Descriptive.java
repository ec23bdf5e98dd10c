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

package com.amazon.datacleaner.statistics;

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Summary statistics over arrays without missing values. Quantiles use linear
 * interpolation between order statistics and the standard deviation is the
 * sample one (n - 1 degrees of freedom). Empty input yields NaN.
 */
public class Descriptive {

    private Descriptive() {
    }

    /**
     * @param data     the sample
     * @param fraction a quantile fraction in [0, 1]
     * @return the interpolated quantile
     */
    public static double quantile(double[] data, double fraction) {
        checkArgument(fraction >= 0 && fraction <= 1, "quantile fraction must be in [0, 1]");
        if (data.length == 0) {
            return Double.NaN;
        }
        if (fraction == 0) {
            return Arrays.stream(data).min().getAsDouble();
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(data, 100 * fraction);
    }

    public static double median(double[] data) {
        return quantile(data, 0.5);
    }

    public static double mean(double[] data) {
        return new Mean().evaluate(data);
    }

    /**
     * @param data the sample
     * @return the sample standard deviation, NaN below two values
     */
    public static double std(double[] data) {
        if (data.length < 2) {
            return Double.NaN;
        }
        return new StandardDeviation(true).evaluate(data);
    }

    /**
     * @param data the sample
     * @return the median of the absolute deviations from the median
     */
    public static double mad(double[] data) {
        double median = median(data);
        double[] deviations = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            deviations[i] = Math.abs(data[i] - median);
        }
        return median(deviations);
    }

    /**
     * @param data the sample
     * @return the biased (divide by n) variance
     */
    public static double populationVariance(double[] data) {
        double mean = mean(data);
        double sum = 0;
        for (double value : data) {
            sum += (value - mean) * (value - mean);
        }
        return sum / data.length;
    }

    /**
     * @param data the sample
     * @return true if all values are equal
     */
    public static boolean isConstant(double[] data) {
        for (double value : data) {
            if (value != data[0]) {
                return false;
            }
        }
        return true;
    }
}
