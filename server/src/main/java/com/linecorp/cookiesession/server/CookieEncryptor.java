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

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;

import com.linecorp.armeria.common.Cookie;

import com.linecorp.cookiesession.common.CookieIntegrityException;
import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.MalformedCookieException;
import com.linecorp.cookiesession.crypto.AuthenticatedEncryptor;

/**
 * Replaces the value of a {@link Cookie} with an encrypted and signed envelope, and recovers the
 * payload from such a {@link Cookie}. The other attributes of the {@link Cookie} are kept as they are.
 */
public final class CookieEncryptor {

    /**
     * Returns a new {@link CookieEncryptor} whose keys are derived from the specified {@code secret}.
     */
    public static CookieEncryptor of(String secret, int iterations) {
        return new CookieEncryptor(AuthenticatedEncryptor.of(secret, iterations));
    }

    private final AuthenticatedEncryptor encryptor;

    /**
     * Creates a new instance which delegates to the specified {@link AuthenticatedEncryptor}.
     */
    public CookieEncryptor(AuthenticatedEncryptor encryptor) {
        this.encryptor = requireNonNull(encryptor, "encryptor");
    }

    /**
     * Returns a copy of the specified {@link Cookie} whose value is its current value encrypted.
     */
    public Cookie encrypt(Cookie cookie) {
        requireNonNull(cookie, "cookie");
        return encrypt(cookie, cookie.value().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns a copy of the specified {@code template} whose value is the encrypted {@code payload}.
     */
    public Cookie encrypt(Cookie template, byte[] payload) {
        requireNonNull(template, "template");
        requireNonNull(payload, "payload");
        return template.toBuilder()
                       .value(encryptor.encryptAndSign(payload))
                       .build();
    }

    /**
     * Verifies and decrypts the value of the specified {@link Cookie}.
     *
     * @throws CookieNotFoundException if the {@link Cookie} has an empty value
     * @throws MalformedCookieException if the value is not a well-formed envelope
     * @throws CookieIntegrityException if the value was not produced with the same secret
     */
    public byte[] decrypt(Cookie cookie) {
        requireNonNull(cookie, "cookie");
        final String value = cookie.value();
        if (value.isEmpty()) {
            throw new CookieNotFoundException("empty cookie: " + cookie.name());
        }
        return encryptor.decryptAndVerify(value);
    }
}
