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

package com.amazon.datacleaner.statistics.transform;

import com.amazon.datacleaner.statistics.Descriptive;

/**
 * Box-Cox transform, defined for positive values only.
 */
public class BoxCoxTransform implements IPowerTransform {

    @Override
    public double apply(double x, double lambda) {
        if (lambda == 0) {
            return Math.log(x);
        }
        return (Math.pow(x, lambda) - 1) / lambda;
    }

    @Override
    public double invert(double y, double lambda) {
        if (lambda == 0) {
            return Math.exp(y);
        }
        return Math.pow(y * lambda + 1, 1 / lambda);
    }

    @Override
    public double logLikelihood(double[] data, double lambda) {
        double sumLog = 0;
        for (double x : data) {
            sumLog += Math.log(x);
        }
        double variance = Descriptive.populationVariance(apply(data, lambda));
        return (lambda - 1) * sumLog - data.length / 2.0 * Math.log(variance);
    }
}
