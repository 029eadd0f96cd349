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
package com.linecorp.cookiesession.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import com.linecorp.armeria.common.Cookie;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.RequestHeadersBuilder;
import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.codec.CookieValueEncoder;
import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;
import com.linecorp.cookiesession.common.CookieIntegrityException;
import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.MalformedCookieException;

class SecureCookieManagerTest {

    private static final int ITERATIONS = 1000;

    private final SecureCookieManager manager = SecureCookieManager.of("secret", ITERATIONS);

    @Test
    void setAndGet() {
        final ServiceRequestContext ctx = newContext();
        final CookieOptions options = CookieOptions.builder()
                                                   .path("/")
                                                   .httpOnly(true)
                                                   .maxAge(Duration.ofHours(1))
                                                   .build();
        final Cookie emitted = manager.set(ctx, "sess", options, ImmutableMap.of("uid", 42));

        final List<String> setCookies = ctx.additionalResponseHeaders().getAll(HttpHeaderNames.SET_COOKIE);
        assertThat(setCookies).hasSize(1);
        final Cookie cookie = Cookie.fromSetCookieHeader(setCookies.get(0));
        assertThat(cookie).isNotNull();
        assertThat(cookie.name()).isEqualTo("sess");
        assertThat(cookie.value()).isEqualTo(emitted.value())
                                  .doesNotContain("uid")
                                  .doesNotContain("42");
        assertThat(cookie.path()).isEqualTo("/");
        assertThat(cookie.isHttpOnly()).isTrue();
        assertThat(cookie.maxAge()).isEqualTo(3600);

        final ServiceRequestContext nextCtx = newContext(cookie);
        @SuppressWarnings("unchecked")
        final Map<String, Object> value = manager.get(nextCtx, "sess", Map.class);
        assertThat(value).containsExactly(Map.entry("uid", 42));
    }

    @Test
    void getCookieReturnsPlaintextValue() {
        final Cookie emitted = manager.newCookie("session", null, ImmutableMap.of("uid", 42));
        final Cookie decrypted = manager.getCookie(headers(emitted), "session");
        assertThat(decrypted.name()).isEqualTo("session");
        assertThat(decrypted.value()).isEqualTo("{\"uid\":42}");
    }

    @Test
    void stringEncoder() {
        final SecureCookieManager manager = stringManager();
        final Cookie cookie = manager.newCookie("flash", CookieOptions.of(), "Saved!");
        assertThat(manager.get(headers(cookie), "flash", String.class)).isEqualTo("Saved!");
    }

    @Test
    void missingCookie() {
        assertThatThrownBy(() -> manager.get(newContext(), "session", Map.class))
                .isInstanceOf(CookieNotFoundException.class);
        final Cookie other = manager.newCookie("other", null, ImmutableMap.of("uid", 42));
        assertThatThrownBy(() -> manager.get(newContext(other), "session", Map.class))
                .isInstanceOf(CookieNotFoundException.class);
    }

    @Test
    void emptyCookie() {
        assertThatThrownBy(() -> manager.get(newContext(Cookie.of("session", "")), "session", Map.class))
                .isInstanceOf(CookieNotFoundException.class);
    }

    @Test
    void tamperedCookie() {
        final Cookie cookie = manager.newCookie("session", null, ImmutableMap.of("uid", 42));
        final String value = cookie.value();
        final int index = value.indexOf('.') + 1;
        final char replacement = value.charAt(index) == 'A' ? 'B' : 'A';
        final Cookie tampered = Cookie.of("session", value.substring(0, index) + replacement +
                                                     value.substring(index + 1));
        assertThatThrownBy(() -> manager.get(newContext(tampered), "session", Map.class))
                .isInstanceOf(CookieIntegrityException.class);
        assertThatThrownBy(() -> manager.get(newContext(Cookie.of("session", "a.b")), "session", Map.class))
                .isInstanceOf(MalformedCookieException.class);
    }

    @Test
    void undecodablePayload() {
        final Cookie cookie = stringManager().newCookie("session", null, "not json");
        assertThatThrownBy(() -> manager.get(newContext(cookie), "session", Map.class))
                .isInstanceOf(CookieDecodeException.class);
    }

    @Test
    void nothingIsWrittenWhenEncodingFails() {
        final ServiceRequestContext ctx = newContext();
        assertThatThrownBy(() -> manager.set(ctx, "session", null, new Object()))
                .isInstanceOf(CookieEncodeException.class);
        assertThat(ctx.additionalResponseHeaders().contains(HttpHeaderNames.SET_COOKIE)).isFalse();
    }

    @Test
    void oversizedCookieIsStillWritten() {
        final ServiceRequestContext ctx = newContext();
        final String large = Strings.repeat("x", SecureCookieManager.MAX_COOKIE_LENGTH);
        manager.set(ctx, "session", null, ImmutableMap.of("data", large));
        final String header = ctx.additionalResponseHeaders().get(HttpHeaderNames.SET_COOKIE);
        assertThat(header).isNotNull();
        assertThat(header.length()).isGreaterThan(SecureCookieManager.MAX_COOKIE_LENGTH);
    }

    @Test
    void delete() {
        final ServiceRequestContext ctx = newContext();
        final CookieOptions options = CookieOptions.builder()
                                                   .domain("example.com")
                                                   .path("/")
                                                   .secure(true)
                                                   .httpOnly(true)
                                                   .maxAge(Duration.ofHours(1))
                                                   .sameSite("Strict")
                                                   .build();
        final Cookie deleted = manager.delete(ctx, "session", options);
        assertThat(deleted.value()).isEmpty();
        assertThat(deleted.maxAge()).isEqualTo(-1);
        assertThat(deleted.domain()).isEqualTo("example.com");
        assertThat(deleted.path()).isEqualTo("/");
        assertThat(deleted.isSecure()).isTrue();
        assertThat(deleted.isHttpOnly()).isTrue();
        assertThat(deleted.sameSite()).isEqualTo("Strict");

        final String header = ctx.additionalResponseHeaders().get(HttpHeaderNames.SET_COOKIE);
        assertThat(header).isNotNull()
                          .startsWith("session=;")
                          .contains("Max-Age=-1")
                          .contains("SameSite=Strict")
                          .doesNotContain("Partitioned");
    }

    @Test
    void deletePartitionedCookie() {
        final ServiceRequestContext ctx = newContext();
        final CookieOptions options = CookieOptions.builder()
                                                   .secure(true)
                                                   .sameSite("None")
                                                   .partitioned(true)
                                                   .build();
        final Cookie deleted = manager.delete(ctx, "session", options);
        assertThat(deleted.sameSite()).isEqualTo("None");

        final String header = ctx.additionalResponseHeaders().get(HttpHeaderNames.SET_COOKIE);
        assertThat(header).isNotNull()
                          .contains("Max-Age=-1")
                          .contains("SameSite=None")
                          .endsWith("; Partitioned");
    }

    @Test
    void deleteWithoutOptions() {
        final ServiceRequestContext ctx = newContext();
        final Cookie deleted = manager.delete(ctx, "session", null);
        assertThat(deleted.value()).isEmpty();
        assertThat(deleted.maxAge()).isEqualTo(-1);
        assertThat(deleted.domain()).isNull();
    }

    private static SecureCookieManager stringManager() {
        return new SecureCookieManager(CookieEncryptor.of("secret", ITERATIONS), CookieValueEncoder.ofString());
    }

    private static RequestHeaders headers(Cookie... cookies) {
        final RequestHeadersBuilder builder =
                RequestHeaders.builder(HttpMethod.GET, "/");
        for (Cookie cookie : cookies) {
            builder.cookie(cookie);
        }
        return builder.build();
    }

    private static ServiceRequestContext newContext(Cookie... cookies) {
        return ServiceRequestContext.of(HttpRequest.of(headers(cookies)));
    }
}
