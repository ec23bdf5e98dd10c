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

package com.amazon.datacleaner.examples.text;

import com.amazon.datacleaner.detection.text.KeyCollisionConfig;
import com.amazon.datacleaner.detection.text.KeyCollisionDetector;
import com.amazon.datacleaner.examples.Example;
import com.amazon.datacleaner.examples.datasets.ExampleDataSets;
import com.amazon.datacleaner.frame.Column;

public class KeyCollisionExample implements Example {

    public static void main(String[] args) throws Exception {
        new KeyCollisionExample().run();
    }

    @Override
    public String command() {
        return "keycollision";
    }

    @Override
    public String description() {
        return "groups alternative spellings of names by fingerprint and flags the less frequent ones";
    }

    @Override
    public void run() throws Exception {
        KeyCollisionDetector detector = KeyCollisionDetector.fromData(KeyCollisionConfig.builder().build(),
                ExampleDataSets.names());
        System.out.println("canonical spellings: " + detector.getKeyMap().asMap());
        System.out.println("alternative spellings: " + detector.getDetected());

        Column incoming = Column.of("name", "torvalds LinuS", "Bill Gates", "Steve Jobs");
        System.out.println("flagged in new data: " + KeyCollisionDetector.fromDetector(detector, incoming).getIndex());
    }
}
