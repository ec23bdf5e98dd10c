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

package com.amazon.datacleaner.detection.frequency;

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.AbstractTwoCategoricalTableDetector;
import com.amazon.datacleaner.frame.Table;

/**
 * Flags rare combinations of two categorical columns. A pair of values is
 * valid when it occurs more than {@code count} times, or when its share of
 * the complete rows is above {@code freq}.
 */
public class AssociationsDetector extends AbstractTwoCategoricalTableDetector {

    @Getter
    private final Integer count;

    @Getter
    private final Double freq;

    private final Set<List<Object>> validAssociations;

    private AssociationsDetector(Table data, Integer count, Double freq, Set<List<Object>> validAssociations) {
        super(data);
        checkArgument((count == null) != (freq == null), "Either freq or count must be provided");
        checkArgument(freq == null || (freq > 0 && freq < 1), "freq must be between 0 and 1 exclusive");
        this.count = count;
        this.freq = freq;
        Set<List<Object>> valid = validAssociations == null ? computeValidAssociations() : validAssociations;
        this.validAssociations = Collections.unmodifiableSet(new LinkedHashSet<>(valid));
    }

    public static AssociationsDetector fromData(AssociationsConfig config, Table data) {
        return new AssociationsDetector(data, config.getCount(), config.getFreq(), null);
    }

    public static AssociationsDetector fromDetector(AssociationsDetector source, Table data) {
        return new AssociationsDetector(data, source.count, source.freq, source.validAssociations);
    }

    private Set<List<Object>> computeValidAssociations() {
        Map<List<Object>, Integer> counts = new LinkedHashMap<>();
        int total = 0;
        for (int i = 0; i < data.size(); i++) {
            if (!data.isMissing(i)) {
                counts.merge(data.getRow(i), 1, Integer::sum);
                total++;
            }
        }
        Set<List<Object>> valid = new LinkedHashSet<>();
        for (Map.Entry<List<Object>, Integer> entry : counts.entrySet()) {
            boolean frequent = freq == null ? entry.getValue() > count : (double) entry.getValue() / total > freq;
            if (frequent) {
                valid.add(entry.getKey());
            }
        }
        return valid;
    }

    /**
     * @return the valid pairs of values, as two element lists
     */
    public Set<List<Object>> getValidAssociations() {
        return validAssociations;
    }

    @Override
    protected Collection<Object> computeIndex() {
        List<Object> keys = new ArrayList<>();
        for (int i = 0; i < data.size(); i++) {
            if (!data.isMissing(i) && !validAssociations.contains(data.getRow(i))) {
                keys.add(data.getIndex().get(i));
            }
        }
        return keys;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.ASSOCIATIONS;
    }
}
