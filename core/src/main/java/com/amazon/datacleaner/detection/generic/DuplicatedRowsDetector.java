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

import static com.amazon.datacleaner.CommonUtils.checkArgument;
import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.amazon.datacleaner.CommonUtils;
import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.Keep;
import com.amazon.datacleaner.detection.AbstractTableDetector;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

/**
 * Flags the rows repeating an earlier (or later) row over a subset of columns.
 */
public class DuplicatedRowsDetector extends AbstractTableDetector {

    private final List<String> subset;

    private final Keep keep;

    private DuplicatedRowsDetector(Table data, List<String> subset, Keep keep) {
        super(data);
        this.keep = checkNotNull(keep, "keep must be first, last or none");
        if (subset == null) {
            this.subset = data.getColumnNames();
        } else {
            checkArgument(!subset.isEmpty(), "subset must not be empty");
            for (String name : subset) {
                checkArgument(data.getColumnNames().contains(name), "unknown column in subset: " + name);
            }
            this.subset = Collections.unmodifiableList(new ArrayList<>(subset));
        }
    }

    public static DuplicatedRowsDetector fromData(DuplicatedConfig config, Table data) {
        return new DuplicatedRowsDetector(data, config.getSubset(), config.getKeep());
    }

    public static DuplicatedRowsDetector fromDetector(DuplicatedRowsDetector source, Table data) {
        return new DuplicatedRowsDetector(data, source.subset, source.keep);
    }

    @Override
    protected Collection<Object> computeIndex() {
        List<Column> columns = new ArrayList<>();
        for (String name : subset) {
            columns.add(data.getColumn(name));
        }
        List<Object> keys = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            List<Object> row = new ArrayList<>(columns.size());
            for (Column column : columns) {
                Object value = column.get(i);
                row.add(CommonUtils.isMissing(value) ? null : CommonUtils.valueKey(value));
            }
            keys.add(row);
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

    public List<String> getSubset() {
        return subset;
    }

    public Keep getKeep() {
        return keep;
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.DUPLICATED;
    }
}
