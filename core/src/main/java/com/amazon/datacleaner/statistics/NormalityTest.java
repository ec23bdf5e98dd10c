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

import org.apache.commons.math3.distribution.ChiSquaredDistribution;

/**
 * D'Agostino and Pearson omnibus test of normality. The statistic combines a
 * skewness test and a kurtosis test, each mapped to an approximately standard
 * normal variable; their squared sum follows a chi-squared distribution with
 * two degrees of freedom under the normal hypothesis.
 */
public class NormalityTest {

    /**
     * smallest sample accepted by the skewness test
     */
    public static final int MIN_SAMPLE_SIZE = 8;

    private static final ChiSquaredDistribution CHI_SQUARED_2 = new ChiSquaredDistribution(2);

    private NormalityTest() {
    }

    /**
     * @param data a sample of at least {@link #MIN_SAMPLE_SIZE} values
     * @return the p-value of the test, NaN for a constant sample
     */
    public static double pValue(double[] data) {
        checkArgument(data.length >= MIN_SAMPLE_SIZE,
                "normality test needs at least " + MIN_SAMPLE_SIZE + " values");
        double statistic = square(skewnessZ(data)) + square(kurtosisZ(data));
        if (Double.isNaN(statistic)) {
            return Double.NaN;
        }
        return 1 - CHI_SQUARED_2.cumulativeProbability(statistic);
    }

    static double skewnessZ(double[] data) {
        double n = data.length;
        double[] moments = centralMoments(data);
        double skew = moments[1] / Math.pow(moments[0], 1.5);
        double y = skew * Math.sqrt(((n + 1) * (n + 3)) / (6.0 * (n - 2)));
        double beta2 = 3.0 * (n * n + 27 * n - 70) * (n + 1) * (n + 3) / ((n - 2) * (n + 5) * (n + 7) * (n + 9));
        double w2 = -1 + Math.sqrt(2 * (beta2 - 1));
        double delta = 1 / Math.sqrt(0.5 * Math.log(w2));
        double alpha = Math.sqrt(2.0 / (w2 - 1));
        if (y == 0) {
            y = 1;
        }
        return delta * Math.log(y / alpha + Math.sqrt((y / alpha) * (y / alpha) + 1));
    }

    static double kurtosisZ(double[] data) {
        double n = data.length;
        double[] moments = centralMoments(data);
        double b2 = moments[2] / (moments[0] * moments[0]);
        double expected = 3.0 * (n - 1) / (n + 1);
        double variance = 24.0 * n * (n - 2) * (n - 3) / ((n + 1) * (n + 1) * (n + 3) * (n + 5));
        double x = (b2 - expected) / Math.sqrt(variance);
        double sqrtBeta1 = 6.0 * (n * n - 5 * n + 2) / ((n + 7) * (n + 9))
                * Math.sqrt((6.0 * (n + 3) * (n + 5)) / (n * (n - 2) * (n - 3)));
        double a = 6.0 + 8.0 / sqrtBeta1 * (2.0 / sqrtBeta1 + Math.sqrt(1 + 4.0 / (sqrtBeta1 * sqrtBeta1)));
        double term1 = 1 - 2 / (9.0 * a);
        double denominator = 1 + x * Math.sqrt(2 / (a - 4.0));
        if (denominator == 0) {
            return Double.NaN;
        }
        double term2 = Math.signum(denominator) * Math.cbrt((1 - 2.0 / a) / Math.abs(denominator));
        return (term1 - term2) / Math.sqrt(2 / (9.0 * a));
    }

    /**
     * @return the biased second, third and fourth central moments
     */
    private static double[] centralMoments(double[] data) {
        double mean = Descriptive.mean(data);
        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        for (double value : data) {
            double d = value - mean;
            m2 += d * d;
            m3 += d * d * d;
            m4 += d * d * d * d;
        }
        int n = data.length;
        return new double[] { m2 / n, m3 / n, m4 / n };
    }

    private static double square(double x) {
        return x * x;
    }
}
