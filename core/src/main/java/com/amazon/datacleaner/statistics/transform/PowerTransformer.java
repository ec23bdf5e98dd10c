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

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.datacleaner.config.TransformMethod;

/**
 * A power transform with a fitted lambda and, for Box-Cox, the shift that
 * makes the fitted data positive (its minimum is moved to 1).
 */
@Getter
public class PowerTransformer {

    private final TransformMethod method;

    private final double lambda;

    private final double shift;

    public PowerTransformer(TransformMethod method, double lambda, double shift) {
        checkArgument(method != TransformMethod.NONE, "no transform to apply");
        this.method = method;
        this.lambda = lambda;
        this.shift = shift;
    }

    /**
     * Fits lambda on a sample.
     *
     * @param method the transform family
     * @param data   the sample, without missing values
     * @return the fitted transformer
     */
    public static PowerTransformer fit(TransformMethod method, double[] data) {
        double shift = 0;
        if (method == TransformMethod.BOX_COX && data.length > 0) {
            shift = 1 - Arrays.stream(data).min().getAsDouble();
        }
        IPowerTransform transform = family(method);
        double[] shifted = shift(data, shift);
        return new PowerTransformer(method, transform.fitLambda(shifted), shift);
    }

    public double transform(double x) {
        return family(method).apply(x + shift, lambda);
    }

    public double[] transform(double[] data) {
        return family(method).apply(shift(data, shift), lambda);
    }

    /**
     * @param y a transformed value
     * @return the value in the original space, NaN if y has no antecedent
     */
    public double inverse(double y) {
        return family(method).invert(y, lambda) - shift;
    }

    static IPowerTransform family(TransformMethod method) {
        switch (method) {
        case BOX_COX:
            return new BoxCoxTransform();
        case YEO_JOHNSON:
            return new YeoJohnsonTransform();
        default:
            throw new IllegalArgumentException("no power transform for " + method);
        }
    }

    private static double[] shift(double[] data, double shift) {
        if (shift == 0) {
            return data;
        }
        double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            result[i] = data[i] + shift;
        }
        return result;
    }
}
