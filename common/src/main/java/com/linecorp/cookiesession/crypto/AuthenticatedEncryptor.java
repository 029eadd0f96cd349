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
package com.linecorp.cookiesession.crypto;

import com.linecorp.cookiesession.common.CookieIntegrityException;
import com.linecorp.cookiesession.common.KeyDerivationException;
import com.linecorp.cookiesession.common.MalformedCookieException;

/**
 * Encrypts an opaque payload into a signed envelope string and reverses it.
 * An envelope that was not produced with the same keys never decrypts.
 */
public interface AuthenticatedEncryptor {

    /**
     * Returns a new {@link AuthenticatedEncryptor} whose encryption and signing keys are derived from
     * the specified {@code secret}. The derivation is expensive, but its result is shared by every
     * encryptor created with the same {@code secret} and {@code iterations}.
     *
     * @throws KeyDerivationException if the {@code secret} is empty or {@code iterations} is not positive
     */
    static AuthenticatedEncryptor of(String secret, int iterations) {
        return new DefaultAuthenticatedEncryptor(KeyGenerator.of(secret, iterations));
    }

    /**
     * Encrypts the specified {@code plaintext} with a fresh initialization vector and signs the result.
     *
     * @return the envelope, a compact JWS whose payload is the compact JWE of the {@code plaintext}
     */
    String encryptAndSign(byte[] plaintext);

    /**
     * Verifies the signature of the specified {@code envelope} and decrypts it.
     *
     * @throws MalformedCookieException if the {@code envelope} is not well-formed
     * @throws CookieIntegrityException if the signature does not match
     */
    byte[] decryptAndVerify(String envelope);
}
