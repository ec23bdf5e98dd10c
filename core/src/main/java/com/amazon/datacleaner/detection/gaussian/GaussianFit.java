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

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.config.NormalTest;
import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.config.TransformMethod;
import com.amazon.datacleaner.statistics.transform.PowerTransformer;

/**
 * The fitted parameters shared by the gaussian detectors. A clone reuses this
 * object as is.
 */
@Getter
@ToString
@AllArgsConstructor
public class GaussianFit {

    private final double threshold;

    private final Inclusive inclusive;

    private final Sided sided;

    private final NormalTest normalTest;

    /**
     * the significance level of the normality test
     */
    private final double pValue;

    private final TransformMethod transform;

    /**
     * the result of the normality test on the fitted data
     */
    private final boolean normal;

    /**
     * the fitted transform parameter, NaN without transform
     */
    private final double lambda;

    /**
     * the Box-Cox shift, 1 - min of the fitted data
     */
    private final double shift;

    /**
     * a description of the normality test outcome
     */
    private final String message;

    /**
     * @return true when statistics are computed in the transformed space
     */
    public boolean isTransformApplied() {
        return transform != TransformMethod.NONE && !normal;
    }

    public PowerTransformer getTransformer() {
        return new PowerTransformer(transform, lambda, shift);
    }
}
