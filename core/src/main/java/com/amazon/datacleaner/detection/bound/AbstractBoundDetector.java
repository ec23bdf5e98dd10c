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

package com.amazon.datacleaner.detection.bound;

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import com.amazon.datacleaner.config.Inclusive;
import com.amazon.datacleaner.config.Sided;
import com.amazon.datacleaner.detection.AbstractNumericColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * A numeric detector flagging values outside an interval. The bounds may be
 * infinite. With {@link Sided#LEFT} only the lower bound is checked, with
 * {@link Sided#RIGHT} only the upper one.
 */
public abstract class AbstractBoundDetector extends AbstractNumericColumnDetector {

    protected final Inclusive inclusive;

    protected final Sided sided;

    protected double lower;

    protected double upper;

    protected AbstractBoundDetector(Column data, Inclusive inclusive, Sided sided) {
        super(data);
        this.inclusive = checkNotNull(inclusive, "inclusive must not be null");
        this.sided = checkNotNull(sided, "sided must not be null");
    }

    /**
     * @return the lower bound in effect, -infinity when only the upper side is
     *         checked
     */
    public double getLower() {
        return sided == Sided.RIGHT ? Double.NEGATIVE_INFINITY : lower;
    }

    /**
     * @return the upper bound in effect, +infinity when only the lower side is
     *         checked
     */
    public double getUpper() {
        return sided == Sided.LEFT ? Double.POSITIVE_INFINITY : upper;
    }

    public Inclusive getInclusive() {
        return inclusive;
    }

    public Sided getSided() {
        return sided;
    }

    @Override
    protected boolean isErrorNumber(double value) {
        return inclusive.isOutside(value, getLower(), getUpper());
    }
}
