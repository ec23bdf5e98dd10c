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

import com.amazon.datacleaner.config.TransformMethod;
import com.amazon.datacleaner.detection.gaussian.GaussianConfig;
import com.amazon.datacleaner.detection.gaussian.ZScoreDetector;
import com.amazon.datacleaner.examples.Example;
import com.amazon.datacleaner.examples.datasets.ExampleDataSets;
import com.amazon.datacleaner.frame.Column;

/**
 * Fits a z-score detector on reference data and replays its bounds on new data.
 */
public class ReplayExample implements Example {

    public static void main(String[] args) throws Exception {
        new ReplayExample().run();
    }

    @Override
    public String command() {
        return "replay";
    }

    @Override
    public String description() {
        return "fits a z-score detector on skewed reference data with a Box-Cox transform and applies it to new data";
    }

    @Override
    public void run() throws Exception {
        Column reference = Column.numeric("duration", ExampleDataSets.lognormal(500, 0.5, 42));
        ZScoreDetector fitted = ZScoreDetector.fromData(
                GaussianConfig.builder().threshold(3).transform(TransformMethod.BOX_COX).build(), reference);
        System.out.printf("lambda %.4f, valid range [%.4f, %.4f]%n", fitted.getLambda(), fitted.getLower(),
                fitted.getUpper());
        System.out.println("flagged in reference data: " + fitted.getIndex());

        Column incoming = Column.numeric("duration", 0.9, 1.2, 25.0, 0.05, 2.3);
        ZScoreDetector replayed = ZScoreDetector.fromDetector(fitted, incoming);
        System.out.println("flagged in incoming data: " + replayed.getIndex());
        System.out.println(replayed.getDetected());
    }
}
