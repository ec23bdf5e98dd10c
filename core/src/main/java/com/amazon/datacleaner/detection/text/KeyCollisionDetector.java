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

package com.amazon.datacleaner.detection.text;

import static com.amazon.datacleaner.CommonUtils.checkArgument;

import lombok.Getter;

import com.amazon.datacleaner.config.DetectorKind;
import com.amazon.datacleaner.config.KeyMethod;
import com.amazon.datacleaner.detection.AbstractObjectColumnDetector;
import com.amazon.datacleaner.frame.Column;

/**
 * Flags alternative spellings of a value. Values sharing a key are
 * considered the same; every spelling other than the most frequent one is
 * flagged. A clone applies the key map learned on the fitted data; values
 * whose key was never seen are not flagged.
 */
@Getter
public class KeyCollisionDetector extends AbstractObjectColumnDetector {

    private final KeyMethod keys;

    private final FingerprintKeyMap keyMap;

    private KeyCollisionDetector(Column data, KeyMethod keys, FingerprintKeyMap keyMap) {
        super(data);
        checkArgument(keys == KeyMethod.FINGERPRINT, "Not a valid method. Only fingerprint method is implemented");
        this.keys = keys;
        this.keyMap = keyMap == null ? FingerprintKeyMap.fit(data) : keyMap;
    }

    public static KeyCollisionDetector fromData(KeyCollisionConfig config, Column data) {
        return new KeyCollisionDetector(data, config.getKeys(), null);
    }

    public static KeyCollisionDetector fromDetector(KeyCollisionDetector source, Column data) {
        return new KeyCollisionDetector(data, source.keys, source.keyMap);
    }

    @Override
    protected boolean isErrorValue(Object value) {
        String text = value.toString();
        String canonical = keyMap.getCanonical(FingerprintKeyMap.fingerprint(text));
        return canonical != null && !canonical.equals(text);
    }

    @Override
    public DetectorKind getKind() {
        return DetectorKind.KEY_COLLISION;
    }
}
