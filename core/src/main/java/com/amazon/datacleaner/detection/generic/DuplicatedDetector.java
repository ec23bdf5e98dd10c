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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.amazon.datacleaner.CommonUtils;
import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Keep;
import com.amazon.datacleaner.detection.AbstractDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags the repeated values of a column.
 */
public class DuplicatedDetector extends AbstractDetector<Column> {

    private final Keep keep;

    private DuplicatedDetector(Column data, Keep keep) {
        super(data);
        this.keep = checkNotNull(keep, "keep must be first, last or none");
    }

    public static DuplicatedDetector fromData(DuplicatedConfig config, Column data) {
        return new DuplicatedDetector(data, config.getKeep());
    }

    public static DuplicatedDetector fromDetector(DuplicatedDetector source, Column data) {
        return new DuplicatedDetector(data, source.keep);
    }

    @Override
    protected Collection<Object> computeIndex() {
        List<Object> keys = new ArrayList<>(data.size());
        for (Object value : data.getValues()) {
            keys.add(CommonUtils.isMissing(value) ? null : CommonUtils.valueKey(value));
        }
        boolean[] duplicated = Duplicates.mark(keys, keep);
        List<Object> index = new ArrayList<>();
        for (int i = 0; i < duplicated.length; i++) {
            if (duplicated[i]) {
                index.add(data.getIndex().get(i));
            }
        }
        return index;
    }

    public Keep getKeep() {
        return keep;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.DUPLICATED;
    }
}
