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

package com.amazon.datacleaner.examples.datasets;

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import java.util.Random;

import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

/**
 * Small datasets used by the examples.
 */
public class ExampleDataSets {

    /**
     * Third and fourth Anscombe quartet sets. Each has one point far from the
     * others.
     */
    public static Table anscombe(int set) {
        checkArgument(set == 3 || set == 4, "only sets 3 and 4 are available");
        if (set == 3) {
            return Table.of(Column.numeric("x", 10, 8, 13, 9, 11, 14, 6, 4, 12, 7, 5),
                    Column.numeric("y", 7.46, 6.77, 12.74, 7.11, 7.81, 8.84, 6.08, 5.39, 8.15, 6.42, 5.73));
        }
        return Table.of(Column.numeric("x", 8, 8, 8, 8, 8, 8, 8, 19, 8, 8, 8),
                Column.numeric("y", 6.58, 5.76, 7.71, 8.84, 8.47, 7.04, 5.25, 12.50, 5.56, 7.91, 6.89));
    }

    /**
     * Lognormal sample with a given seed.
     */
    public static double[] lognormal(int size, double sigma, long seed) {
        Random random = new Random(seed);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = Math.exp(sigma * random.nextGaussian());
        }
        return values;
    }

    /**
     * Heights in two groups of very different scale, with one value that is
     * only abnormal within its own group.
     */
    public static Table heightsByGroup() {
        return Table.of(
                Column.numeric("height", 0, 0, 0, 0, -1, 1, -1, 1, -2, 2, 5, 6, 6, 6, 6, 5, 7, 5, 7, 4, 8),
                Column.of("group", "I", "I", "I", "I", "I", "I", "I", "I", "I", "I", "I", "II", "II", "II", "II", "II",
                        "II", "II", "II", "II", "II"));
    }

    public static Column names() {
        return Column.of("name", "Linus Torvalds", "linus.torvalds", "Torvalds, Linus", "Linus Torvalds",
                "Bill Gates");
    }
}
