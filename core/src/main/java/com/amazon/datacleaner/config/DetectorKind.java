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

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * The closed set of detection methods. Each method has a canonical name and
 * possibly aliases, which are the names accepted by {@link #fromName(String)}.
 */
public enum DetectorKind {

    BOUNDED(true, "bounded"),
    QUANTILES(true, "quantiles"),
    IQR(true, "iqr"),
    ZSCORE(true, "zscore"),
    MODZSCORE(true, "modzscore"),
    LENGTH(false, "length"),
    DATE_RANGE(false, "date_range"),
    ENUM(false, "enum"),
    VALUE(false, "value"),
    COUNTS(false, "counts"),
    FREQ(false, "freq"),
    ASSOCIATIONS(false, "associations"),
    PATTERN(false, "pattern"),
    EMAIL(false, "email"),
    URL(false, "url"),
    PING(false, "ping"),
    SPACES(false, "spaces"),
    KEY_COLLISION(false, "keycollision", "alternatives"),
    OUTLIERS(false, "outliers", "ndoutliers"),
    BY_CATEGORY(false, "by_category"),
    TYPES(false, "types"),
    CASTABLE(false, "castable"),
    DUPLICATED(false, "duplicated"),
    CUSTOM(false, "custom");

    private final boolean numericColumnKind;

    private final List<String> names;

    DetectorKind(boolean numericColumnKind, String... names) {
        this.numericColumnKind = numericColumnKind;
        this.names = Collections.unmodifiableList(Arrays.asList(names));
    }

    /**
     * @return the canonical name
     */
    public String getName() {
        return names.get(0);
    }

    public List<String> getNames() {
        return names;
    }

    /**
     * One dimensional numeric methods. Applied to a table holding numeric
     * columns and one categorical column they run once per category.
     *
     * @return true for the numeric column methods
     */
    public boolean isNumericColumnKind() {
        return numericColumnKind;
    }

    /**
     * @param name a canonical name or an alias, case insensitive
     * @return the matching kind
     * @throws IllegalArgumentException for an unknown name
     */
    public static DetectorKind fromName(String name) {
        checkNotNull(name, "A detection method must be provided");
        String lower = name.toLowerCase(Locale.ROOT);
        for (DetectorKind kind : values()) {
            if (kind.names.contains(lower)) {
                return kind;
            }
        }
        StringJoiner candidates = new StringJoiner(", ");
        for (DetectorKind kind : values()) {
            kind.names.forEach(candidates::add);
        }
        throw new IllegalArgumentException(
                name + " is not a valid detection method. Possible candidates are: " + candidates);
    }

    @Override
    public String toString() {
        return getName();
    }
}
