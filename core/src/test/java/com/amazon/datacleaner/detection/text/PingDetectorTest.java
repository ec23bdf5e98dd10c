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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.datacleaner.frame.Column;

@ExtendWith(MockitoExtension.class)
public class PingDetectorTest {

    @Mock
    private UrlProbe probe;

    private final Column urls = Column.of("url", "google.com", "https://www.google.com/", "https://127.0.0.1:80",
            "dummy", null);

    @Test
    public void testUnreachableUrls() {
        when(probe.isReachable(anyString()))
                .thenAnswer(invocation -> "https://www.google.com/".equals(invocation.getArgument(0)));

        PingDetector detector = PingDetector.fromData(PingConfig.builder().probe(probe).build(), urls);
        verify(probe, never()).isReachable(anyString());

        assertThat(detector.getIndex(), contains(0, 2, 3));
        assertThat(detector.getIndex(), contains(0, 2, 3));
        verify(probe, times(4)).isReachable(anyString());
    }

    @Test
    public void testReplayKeepsProbe() {
        when(probe.isReachable(anyString())).thenReturn(true);
        PingDetector source = PingDetector.fromData(PingConfig.builder().probe(probe).build(), urls);
        PingDetector replayed = PingDetector.fromDetector(source, Column.of("url", "http://a.org", ""));
        assertSame(probe, replayed.getProbe());
        assertThat(replayed.getIndex(), empty());
    }
}
