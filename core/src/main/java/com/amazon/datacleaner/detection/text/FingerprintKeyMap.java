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

import static com.amazon.datacleaner.CommonUtils.checkNotNull;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

import com.amazon.datacleaner.CommonUtils;
import com.amazon.datacleaner.frame.Column;

/**
 * Groups the values of a column by fingerprint and elects, for each
 * fingerprint, the most frequent original value as the canonical spelling.
 * Ties go to the value seen first.
 */
public class FingerprintKeyMap {

    private static final Pattern PREFIX = Pattern.compile("^.{2}:");

    private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");

    private static final Pattern NON_LETTER = Pattern.compile("[^a-zA-Z]");

    private static final Pattern SPACES = Pattern.compile(" +");

    private final Map<String, String> canonicalValues;

    private final Map<String, Integer> canonicalCounts;

    public FingerprintKeyMap(Map<String, String> canonicalValues, Map<String, Integer> canonicalCounts) {
        checkNotNull(canonicalValues, "canonicalValues must not be null");
        checkNotNull(canonicalCounts, "canonicalCounts must not be null");
        this.canonicalValues = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalValues));
        this.canonicalCounts = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalCounts));
    }

    /**
     * Builds the fingerprint of a string: a two character prefix followed by a
     * colon is dropped, the rest is lowercased, folded to ascii, stripped of
     * non-letters, and its unique tokens are sorted.
     *
     * @param value a string
     * @return its fingerprint
     */
    public static String fingerprint(String value) {
        String text = PREFIX.matcher(value).replaceFirst(" ").trim().toLowerCase(Locale.ROOT);
        text = NON_ASCII.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
        text = SPACES.matcher(NON_LETTER.matcher(text).replaceAll(" ")).replaceAll(" ").trim();
        if (text.isEmpty()) {
            return text;
        }
        return String.join(" ", new TreeSet<>(Arrays.asList(text.split(" "))));
    }

    /**
     * @param column a column of strings; other values are used through their
     *               string representation, missing values are skipped
     * @return the key map of the column
     */
    public static FingerprintKeyMap fit(Column column) {
        Map<String, Map<String, Integer>> groups = new LinkedHashMap<>();
        for (Object value : column.getValues()) {
            if (CommonUtils.isMissing(value)) {
                continue;
            }
            String text = value.toString();
            groups.computeIfAbsent(fingerprint(text), k -> new LinkedHashMap<>()).merge(text, 1, Integer::sum);
        }
        Map<String, String> canonicalValues = new LinkedHashMap<>();
        Map<String, Integer> canonicalCounts = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Integer>> group : groups.entrySet()) {
            String best = null;
            int bestCount = 0;
            for (Map.Entry<String, Integer> spelling : group.getValue().entrySet()) {
                if (spelling.getValue() > bestCount) {
                    best = spelling.getKey();
                    bestCount = spelling.getValue();
                }
            }
            canonicalValues.put(group.getKey(), best);
            canonicalCounts.put(group.getKey(), bestCount);
        }
        return new FingerprintKeyMap(canonicalValues, canonicalCounts);
    }

    /**
     * @param key a fingerprint
     * @return the canonical spelling, or null for an unknown fingerprint
     */
    public String getCanonical(String key) {
        return canonicalValues.get(key);
    }

    /**
     * @return fingerprint to canonical spelling, in order of first appearance
     */
    public Map<String, String> asMap() {
        return canonicalValues;
    }

    /**
     * @return fingerprint to the number of occurrences of its canonical spelling
     */
    public Map<String, Integer> getCounts() {
        return canonicalCounts;
    }

    public int size() {
        return canonicalValues.size();
    }
}
