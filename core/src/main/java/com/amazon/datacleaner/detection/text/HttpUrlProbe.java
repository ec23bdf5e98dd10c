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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

/**
 * Sends one GET request per URL with the JDK HTTP client. Malformed URLs,
 * unsupported schemes, connection failures and timeouts all mean
 * unreachable; there is no retry.
 */
@Slf4j
public class HttpUrlProbe implements UrlProbe {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;

    private final Duration timeout;

    public HttpUrlProbe() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpUrlProbe(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean isReachable(String url) {
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET().build();
            client.send(request, HttpResponse.BodyHandlers.discarding());
            return true;
        } catch (IllegalArgumentException | IOException e) {
            log.debug("{} is not reachable: {}", url, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("interrupted while fetching {}", url);
            return false;
        }
    }
}
