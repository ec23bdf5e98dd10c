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

package com.amazon.datacleaner.frame;

import java.util.List;

import com.amazon.datacleaner.returntypes.ErrorMask;

/**
 * The tabular objects a detector can be bound to: a single {@link Column} or a
 * {@link Table} of columns sharing one row index.
 *
 * @param <F> the concrete frame type, so that filtering returns the same type
 */
public interface IFrame<F extends IFrame<F>> {

    /**
     * @return the ordered row keys, unique within the frame
     */
    List<Object> getIndex();

    /**
     * @return the number of rows
     */
    int size();

    /**
     * @param position a row position, not a row key
     * @return true if the row at the given position holds a missing value (for
     *         a table, in any column)
     */
    boolean isMissing(int position);

    /**
     * @param mask a mask over the rows of this frame
     * @return a frame holding the rows where the mask is true, in the same order
     */
    F filter(ErrorMask mask);
}
