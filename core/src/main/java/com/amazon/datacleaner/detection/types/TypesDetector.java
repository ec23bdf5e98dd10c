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

package com.amazon.datacleaner.detection.types;

import lombok.extern.slf4j.Slf4j;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the values whose class differs from the expected one. This applies to
 * any column, mixed object columns being the typical target.
 */
@Slf4j
public class TypesDetector extends AbstractColumnDetector {

    private final Class<?> ptype;

    private TypesDetector(Column data, Class<?> ptype) {
        super(data);
        this.ptype = ptype;
    }

    public static TypesDetector fromData(TypesConfig config, Column data) {
        Class<?> ptype = config.getPtype();
        if (ptype == null) {
            for (int i = 0; i < data.size() && ptype == null; i++) {
                if (!data.isMissing(i)) {
                    ptype = data.get(i).getClass();
                }
            }
            log.debug("expected type inferred as {}", ptype);
        }
        return new TypesDetector(data, ptype);
    }

    public static TypesDetector fromDetector(TypesDetector source, Column data) {
        return new TypesDetector(data, source.ptype);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        return ptype != null && value.getClass() != ptype;
    }

    /**
     * @return the expected class, null when the fitted column had no value
     */
    public Class<?> getPtype() {
        return ptype;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.TYPES;
    }
}
