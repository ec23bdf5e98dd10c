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

package com.amazon.datacleaner.config;

import com.amazon.datacleaner.CommonUtils;

/**
 * Power transforms used by the gaussian detectors to bring a skewed
 * distribution closer to a normal one. The statistics are computed on the
 * transformed data and the bounds are mapped back with the inverse transform.
 */
public enum TransformMethod {

    /**
     * statistics are computed on the raw data
     */
    NONE,
    /**
     * Box-Cox, applied after shifting the data so that its minimum is 1
     */
    BOX_COX,
    /**
     * Yeo-Johnson, which accepts signed data
     */
    YEO_JOHNSON;

    public static TransformMethod fromName(String name) {
        return CommonUtils.parseEnum(TransformMethod.class, name);
    }
}
