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

import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

import com.amazon.datacleaner.statistics.Descriptive;

/**
 * A one parameter family of power transforms. The parameter (lambda) is
 * chosen by maximizing the profile log-likelihood of the transformed data
 * under a normal model.
 */
public interface IPowerTransform {

    double LAMBDA_MIN = -10;

    double LAMBDA_MAX = 10;

    int MAX_EVALUATIONS = 1000;

    /**
     * @param x      a value in the domain of the transform
     * @param lambda the shape parameter
     * @return the transformed value
     */
    double apply(double x, double lambda);

    /**
     * @param y      a transformed value
     * @param lambda the shape parameter
     * @return the original value, NaN when y is not in the image of the
     *         transform
     */
    double invert(double y, double lambda);

    /**
     * @param data   a sample in the domain of the transform
     * @param lambda the shape parameter
     * @return the log-likelihood, up to a constant
     */
    double logLikelihood(double[] data, double lambda);

    default double[] apply(double[] data, double lambda) {
        double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = apply(data[i], lambda);
        }
        return result;
    }

    /**
     * @param data a sample in the domain of the transform
     * @return the maximum likelihood lambda; 1 (the identity up to a shift) when
     *         the sample has less than two distinct values
     */
    default double fitLambda(double[] data) {
        if (data.length < 2 || Descriptive.isConstant(data)) {
            return 1;
        }
        BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-14);
        UnivariatePointValuePair optimum = optimizer.optimize(new MaxEval(MAX_EVALUATIONS),
                new UnivariateObjectiveFunction(lambda -> logLikelihood(data, lambda)), GoalType.MAXIMIZE,
                new SearchInterval(LAMBDA_MIN, LAMBDA_MAX));
        return optimum.getPoint();
    }
}
