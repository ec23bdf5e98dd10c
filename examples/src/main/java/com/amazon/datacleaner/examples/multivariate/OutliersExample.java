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

package com.amazon.datacleaner.examples.multivariate;

import com.amazon.datacleaner.detection.multivariate.OutliersConfig;
import com.amazon.datacleaner.detection.multivariate.OutliersDetector;
import com.amazon.datacleaner.examples.Example;
import com.amazon.datacleaner.examples.datasets.ExampleDataSets;
import com.amazon.datacleaner.frame.Table;

public class OutliersExample implements Example {

    public static void main(String[] args) throws Exception {
        new OutliersExample().run();
    }

    @Override
    public String command() {
        return "outliers";
    }

    @Override
    public String description() {
        return "flags the point lying away from the others in two sets of the Anscombe quartet";
    }

    @Override
    public void run() throws Exception {
        for (int set : new int[] { 3, 4 }) {
            Table data = ExampleDataSets.anscombe(set);
            OutliersDetector detector = OutliersDetector.fromData(OutliersConfig.builder().build(), data);
            System.out.printf("Anscombe %d: eps %.3f, flagged rows %s%n", set, detector.getEps(), detector.getIndex());
        }
    }
}
