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

import java.util.List;
import java.util.Set;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.frame.IFrame;
import com.amazon.datacleaner.returntypes.ErrorMask;

/**
 * A detector is bound to one column or table and answers which of its rows
 * look wrong. Missing values are never flagged.
 *
 * @param <F> the type of data the detector is bound to
 */
public interface IDetector<F extends IFrame<F>> {

    /**
     * @return the detection method of this detector
     */
    DetectorKind getKind();

    /**
     * @return the column or table the detector is bound to
     */
    F getData();

    /**
     * The flagged row keys, in the order of the data index. Computed on first
     * access, then cached.
     *
     * @return the keys of the rows detected as errors
     */
    Set<Object> getIndex();

    /**
     * @return a mask over the data rows, true where a row is flagged
     */
    ErrorMask isError();

    /**
     * @return the complement of {@link #isError()}
     */
    ErrorMask notError();

    int getNErrors();

    boolean hasErrors();

    /**
     * @return the flagged rows of the data
     */
    F getDetected();

    /**
     * @return the rows of the data that are not flagged
     */
    F getValid();

    /**
     * @return the warnings raised while building the detector
     */
    List<String> getWarnings();
}
