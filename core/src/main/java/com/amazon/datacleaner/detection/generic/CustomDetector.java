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

package com.amazon.datacleaner.detection.generic;

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.function.Function;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values for which a user function returns true.
 */
public class CustomDetector extends AbstractColumnDetector {

    public static final String NOT_BOOLEAN_MESSAGE = "error function must return a boolean";

    private final Function<Object, ?> errorFunction;

    private CustomDetector(Column data, Function<Object, ?> errorFunction) {
        super(data);
        this.errorFunction = checkNotNull(errorFunction, "error function must be defined");
    }

    public static CustomDetector fromData(CustomConfig config, Column data) {
        return new CustomDetector(data, config.getErrorFunction());
    }

    public static CustomDetector fromDetector(CustomDetector source, Column data) {
        return new CustomDetector(data, source.errorFunction);
    }

    static boolean asBoolean(Object result) {
        if (!(result instanceof Boolean)) {
            throw new IllegalStateException(NOT_BOOLEAN_MESSAGE);
        }
        return (Boolean) result;
    }

    @Override
    protected boolean isErrorValue(Object value) {
        return asBoolean(errorFunction.apply(value));
    }

    public Function<Object, ?> getErrorFunction() {
        return errorFunction;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.CUSTOM;
    }
}
