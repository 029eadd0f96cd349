/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package com.linecorp.cookiesession.server.session;

import static com.linecorp.cookiesession.server.session.HostBasedCookieOptionsPolicy.isLoopback;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.server.CookieOptions;

class HostBasedCookieOptionsPolicyTest {

    private static final CookieOptions BASE = CookieOptions.builder()
                                                          .httpOnly(true)
                                                          .sameSite("Strict")
                                                          .maxAge(Duration.ofHours(8))
                                                          .domain("ignored.example")
                                                          .path("/ignored")
                                                          .build();

    private final CookieOptionsPolicy policy = CookieOptionsPolicy.ofHost("example.com", BASE);

    @ParameterizedTest
    @ValueSource(strings = {
            "localhost", "localhost:8080", "LOCALHOST:8080", "127.0.0.1", "127.0.0.1:36462", "127.1.2.3",
            "[::1]", "[::1]:8080", "::1"
    })
    void loopbackHosts(String authority) {
        assertThat(isLoopback(authority)).isTrue();

        final CookieOptions options = policy.apply(newContext(authority));
        assertThat(options.secure()).isFalse();
        assertThat(options.domain()).isNull();
        assertThat(options.path()).isEqualTo("/");
        assertThat(options.httpOnly()).isTrue();
        assertThat(options.sameSite()).isEqualTo("Strict");
        assertThat(options.maxAge()).isEqualTo(Duration.ofHours(8));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "app.example.com", "app.example.com:443", "example.com", "localhost.example.com", "10.0.0.1",
            "[2001:db8::1]:8443", "128.0.0.1"
    })
    void remoteHosts(String authority) {
        assertThat(isLoopback(authority)).isFalse();

        final CookieOptions options = policy.apply(newContext(authority));
        assertThat(options.secure()).isTrue();
        assertThat(options.domain()).isEqualTo("example.com");
        assertThat(options.path()).isEqualTo("/");
        assertThat(options.httpOnly()).isTrue();
        assertThat(options.sameSite()).isEqualTo("Strict");
    }

    @Test
    void missingOrInvalidAuthority() {
        assertThat(isLoopback(null)).isFalse();
        assertThat(isLoopback("")).isFalse();
        assertThat(isLoopback("[::1")).isFalse();
    }

    @Test
    void withoutTrustedDomain() {
        final CookieOptionsPolicy policy = CookieOptionsPolicy.ofHost(null, BASE);
        final CookieOptions options = policy.apply(newContext("app.example.com"));
        assertThat(options.secure()).isTrue();
        assertThat(options.domain()).isNull();
    }

    private static ServiceRequestContext newContext(String authority) {
        return ServiceRequestContext.of(HttpRequest.of(RequestHeaders.builder(HttpMethod.GET, "/")
                                                                     .authority(authority)
                                                                     .build()));
    }
}
