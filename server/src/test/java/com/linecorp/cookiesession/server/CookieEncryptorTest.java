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

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.linecorp.armeria.common.Cookie;

import com.linecorp.cookiesession.common.CookieIntegrityException;
import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.MalformedCookieException;

class CookieEncryptorTest {

    private static final int ITERATIONS = 1000;

    private final CookieEncryptor encryptor = CookieEncryptor.of("secret", ITERATIONS);

    @Test
    void encryptKeepsAttributes() {
        final Cookie template = Cookie.secureBuilder("session", "hello")
                                      .domain("example.com")
                                      .path("/")
                                      .maxAge(60)
                                      .build();
        final Cookie encrypted = encryptor.encrypt(template);
        assertThat(encrypted.name()).isEqualTo("session");
        assertThat(encrypted.value()).isNotEqualTo("hello");
        assertThat(encrypted.domain()).isEqualTo("example.com");
        assertThat(encrypted.path()).isEqualTo("/");
        assertThat(encrypted.maxAge()).isEqualTo(60);
        assertThat(encrypted.isSecure()).isTrue();
        assertThat(encrypted.isHttpOnly()).isTrue();

        assertThat(new String(encryptor.decrypt(encrypted), StandardCharsets.UTF_8)).isEqualTo("hello");
    }

    @Test
    void encryptPayload() {
        final Cookie encrypted = encryptor.encrypt(Cookie.of("session", ""), new byte[] { 1, 2, 3 });
        assertThat(encryptor.decrypt(encrypted)).containsExactly(1, 2, 3);
    }

    @Test
    void emptyValueIsNotFound() {
        assertThatThrownBy(() -> encryptor.decrypt(Cookie.of("session", "")))
                .isInstanceOf(CookieNotFoundException.class);
    }

    @Test
    void garbageValueIsMalformed() {
        assertThatThrownBy(() -> encryptor.decrypt(Cookie.of("session", "garbage")))
                .isInstanceOf(MalformedCookieException.class);
    }

    @Test
    void otherSecretIsRejected() {
        final Cookie encrypted = encryptor.encrypt(Cookie.of("session", "hello"));
        assertThatThrownBy(() -> CookieEncryptor.of("other", ITERATIONS).decrypt(encrypted))
                .isInstanceOf(CookieIntegrityException.class);
    }
}
