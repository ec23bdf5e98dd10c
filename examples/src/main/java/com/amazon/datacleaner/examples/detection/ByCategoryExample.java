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

package com.amazon.datacleaner.examples.detection;

import java.util.Map;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.detection.IDetector;
import com.amazon.datacleaner.detection.bound.AbstractBoundDetector;
import com.amazon.datacleaner.detection.multivariate.ByCategoryConfig;
import com.amazon.datacleaner.detection.multivariate.ByCategoryDetector;
import com.amazon.datacleaner.examples.Example;
import com.amazon.datacleaner.examples.datasets.ExampleDataSets;
import com.amazon.datacleaner.frame.Column;
import com.amazon.datacleaner.frame.Table;

public class ByCategoryExample implements Example {

    public static void main(String[] args) throws Exception {
        new ByCategoryExample().run();
    }

    @Override
    public String command() {
        return "by_category";
    }

    @Override
    public String description() {
        return "runs an interquartile range detector within each group of a numeric column";
    }

    @Override
    public void run() throws Exception {
        Table heights = ExampleDataSets.heightsByGroup();
        ByCategoryDetector detector = ByCategoryDetector
                .fromData(ByCategoryConfig.builder().method(DetectorKind.IQR).build(), heights);
        for (Map.Entry<Object, IDetector<Column>> entry : detector.getDetectors().entrySet()) {
            AbstractBoundDetector bounds = (AbstractBoundDetector) entry.getValue();
            System.out.printf("group %s: valid range [%.2f, %.2f]%n", entry.getKey(), bounds.getLower(),
                    bounds.getUpper());
        }
        System.out.println("flagged rows: " + detector.getIndex());
    }
}
