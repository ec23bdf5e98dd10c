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
 * Yeo-Johnson transform, an extension of Box-Cox to signed values.
 */
public class YeoJohnsonTransform implements IPowerTransform {

    @Override
    public double apply(double x, double lambda) {
        if (x >= 0) {
            return lambda == 0 ? Math.log1p(x) : (Math.pow(x + 1, lambda) - 1) / lambda;
        }
        return lambda == 2 ? -Math.log1p(-x) : -(Math.pow(1 - x, 2 - lambda) - 1) / (2 - lambda);
    }

    @Override
    public double invert(double y, double lambda) {
        if (y >= 0) {
            return lambda == 0 ? Math.exp(y) - 1 : Math.pow(y * lambda + 1, 1 / lambda) - 1;
        }
        return lambda == 2 ? 1 - Math.exp(-y) : 1 - Math.pow(-(2 - lambda) * y + 1, 1 / (2 - lambda));
    }

    @Override
    public double logLikelihood(double[] data, double lambda) {
        double sum = 0;
        for (double x : data) {
            sum += Math.signum(x) * Math.log1p(Math.abs(x));
        }
        double variance = Descriptive.populationVariance(apply(data, lambda));
        return (lambda - 1) * sum - data.length / 2.0 * Math.log(variance);
    }
}
