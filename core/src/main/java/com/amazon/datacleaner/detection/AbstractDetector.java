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

package com.amazon.datacleaner.detection;

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import com.amazon.datacleaner.frame.IFrame;
import com.amazon.datacleaner.returntypes.ErrorMask;

/**
 * Shared behaviour of all detectors. Subclasses only compute the raw set of
 * flagged keys; this class orders it along the data index, drops the keys of
 * missing rows and caches the result.
 *
 * @param <F> the type of data the detector is bound to
 */
@Slf4j
public abstract class AbstractDetector<F extends IFrame<F>> implements IDetector<F> {

    protected final F data;

    private final List<String> warnings = new ArrayList<>();

    private Set<Object> index;

    protected AbstractDetector(F data) {
        this.data = checkNotNull(data, "data must not be null");
    }

    /**
     * @return the keys of the rows to flag, in any order; keys of rows holding
     *         missing values are removed afterwards
     */
    protected abstract Collection<Object> computeIndex();

    @Override
    public F getData() {
        return data;
    }

    @Override
    public Set<Object> getIndex() {
        if (index == null) {
            Set<Object> raw = new HashSet<>(computeIndex());
            Set<Object> ordered = new LinkedHashSet<>();
            List<Object> keys = data.getIndex();
            for (int i = 0; i < keys.size(); i++) {
                if (raw.contains(keys.get(i)) && !data.isMissing(i)) {
                    ordered.add(keys.get(i));
                }
            }
            index = Collections.unmodifiableSet(ordered);
            log.debug("{} flagged {} of {} rows", getKind(), index.size(), data.size());
        }
        return index;
    }

    @Override
    public ErrorMask isError() {
        Set<Object> flagged = getIndex();
        List<Object> keys = data.getIndex();
        boolean[] values = new boolean[keys.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = flagged.contains(keys.get(i));
        }
        return new ErrorMask(keys, values);
    }

    @Override
    public ErrorMask notError() {
        return isError().negate();
    }

    @Override
    public int getNErrors() {
        return getIndex().size();
    }

    @Override
    public boolean hasErrors() {
        return !getIndex().isEmpty();
    }

    @Override
    public F getDetected() {
        return data.filter(isError());
    }

    @Override
    public F getValid() {
        return data.filter(notError());
    }

    @Override
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Records a warning and logs it.
     *
     * @param message the warning
     */
    protected void warn(String message) {
        log.warn("{}: {}", getKind(), message);
        warnings.add(message);
    }

    @Override
    public String toString() {
        return String.format("Detector%n- Method: %s%n- Detected errors: %d among %d samples", getKind(),
                getNErrors(), data.size());
    }
}
