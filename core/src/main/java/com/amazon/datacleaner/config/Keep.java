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
 * Which occurrence of a duplicated value is considered valid.
 */
public enum Keep {

    /**
     * the first occurrence is valid, later ones are flagged
     */
    FIRST,
    /**
     * the last occurrence is valid, earlier ones are flagged
     */
    LAST,
    /**
     * every occurrence of a duplicated value is flagged
     */
    NONE;

    public static Keep fromName(String name) {
        return CommonUtils.parseEnum(Keep.class, name);
    }
}
