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

package com.amazon.datacleaner.detection.multivariate;

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractNumericCategoricalTableDetector;
import com.amazon.datacleaner.detection.DetectorConfig;
import com.amazon.datacleaner.detection.Detectors;
import com.amazon.datacleaner.detection.IDetector;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

/**
 * Runs a numeric column method separately within each category of a
 * numeric/categorical table and flags the union of what the per-category
 * detectors flag. Rows with a missing value take no part.
 */
public class ByCategoryDetector extends AbstractNumericCategoricalTableDetector {

    private final DetectorKind method;

    private final DetectorConfig methodConfig;

    private final Map<Object, IDetector<Column>> detectors;

    private ByCategoryDetector(Table data, DetectorKind method, DetectorConfig methodConfig) {
        super(data);
        checkNotNull(method, "method must not be null");
        checkArgument(method.isNumericColumnKind(), method + " is not a numerical column method");
        this.method = method;
        this.methodConfig = methodConfig;

        Table complete = data.dropMissing();
        Column numeric = complete.getColumn(getNumericColumn().getName());
        Column categories = complete.getColumn(getCategoryColumn().getName());
        Map<Object, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < categories.size(); i++) {
            groups.computeIfAbsent(categories.get(i), k -> new ArrayList<>()).add(i);
        }
        Map<Object, IDetector<Column>> fitted = new LinkedHashMap<>();
        for (Map.Entry<Object, List<Integer>> group : groups.entrySet()) {
            fitted.put(group.getKey(), Detectors.fromData(method, methodConfig, numeric.select(group.getValue())));
        }
        this.detectors = Collections.unmodifiableMap(fitted);
    }

    public static ByCategoryDetector fromData(ByCategoryConfig config, Table data) {
        return new ByCategoryDetector(data, config.getMethod(), config.getMethodConfig());
    }

    @Override
    protected Collection<Object> computeIndex() {
        List<Object> keys = new ArrayList<>();
        for (IDetector<Column> detector : detectors.values()) {
            keys.addAll(detector.getIndex());
        }
        return keys;
    }

    public DetectorKind getMethod() {
        return method;
    }

    public DetectorConfig getMethodConfig() {
        return methodConfig;
    }

    /**
     * @return the detector fitted on each category, in order of first appearance
     */
    public Map<Object, IDetector<Column>> getDetectors() {
        return detectors;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.BY_CATEGORY;
    }
}
