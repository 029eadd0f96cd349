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

import static java.util.Objects.requireNonNull;

import java.text.ParseException;

import com.google.common.annotations.VisibleForTesting;
import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEDecrypter;
import com.nimbusds.jose.JWEEncrypter;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSObject;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.DirectDecrypter;
import com.nimbusds.jose.crypto.DirectEncrypter;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.util.Base64URL;

import com.linecorp.cookiesession.common.CookieEncryptionException;
import com.linecorp.cookiesession.common.CookieIntegrityException;
import com.linecorp.cookiesession.common.MalformedCookieException;

/**
 * An {@link AuthenticatedEncryptor} which encrypts into a compact JWE ({@code alg=dir}, {@code enc=A256GCM})
 * and signs the compact JWE as the payload of a compact JWS ({@code HS512}) under a separate key
 * (encrypt-then-MAC).
 *
 * <p>The envelope is the compact JWS serialization. Its signature is always verified before the nested JWE
 * is parsed or decrypted.
 */
final class DefaultAuthenticatedEncryptor implements AuthenticatedEncryptor {

    @VisibleForTesting
    static final String ENCRYPTION_KEY_LABEL = "encrypted cookie";
    @VisibleForTesting
    static final String SIGNING_KEY_LABEL = "signed encrypted cookie";

    static final int ENCRYPTION_KEY_LENGTH = 32;
    static final int SIGNING_KEY_LENGTH = 64;

    private static final JWEHeader jweHeader = new JWEHeader(JWEAlgorithm.DIR, EncryptionMethod.A256GCM);
    private static final JWSHeader jwsHeader = new JWSHeader(JWSAlgorithm.HS512);

    private final JWEEncrypter encrypter;
    private final JWEDecrypter decrypter;
    private final JWSSigner signer;
    private final JWSVerifier verifier;

    DefaultAuthenticatedEncryptor(KeyGenerator keyGenerator) {
        this(requireNonNull(keyGenerator, "keyGenerator")
                     .cacheGenerate(ENCRYPTION_KEY_LABEL, ENCRYPTION_KEY_LENGTH),
             keyGenerator.cacheGenerate(SIGNING_KEY_LABEL, SIGNING_KEY_LENGTH));
    }

    @VisibleForTesting
    DefaultAuthenticatedEncryptor(byte[] encryptionKey, byte[] signingKey) {
        requireNonNull(encryptionKey, "encryptionKey");
        requireNonNull(signingKey, "signingKey");
        if (encryptionKey.length != ENCRYPTION_KEY_LENGTH) {
            throw new IllegalArgumentException("encryptionKey.length: " + encryptionKey.length +
                                               " (expected: " + ENCRYPTION_KEY_LENGTH + ')');
        }
        if (signingKey.length != SIGNING_KEY_LENGTH) {
            throw new IllegalArgumentException("signingKey.length: " + signingKey.length +
                                               " (expected: " + SIGNING_KEY_LENGTH + ')');
        }
        try {
            encrypter = new DirectEncrypter(encryptionKey);
            decrypter = new DirectDecrypter(encryptionKey);
            signer = new MACSigner(signingKey);
            verifier = new MACVerifier(signingKey);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to initialize " +
                                            DefaultAuthenticatedEncryptor.class.getSimpleName(), e);
        }
    }

    @Override
    public String encryptAndSign(byte[] plaintext) {
        requireNonNull(plaintext, "plaintext");
        final JWEObject jwe = new JWEObject(jweHeader, new Payload(plaintext));
        try {
            jwe.encrypt(encrypter);
        } catch (JOSEException e) {
            throw new CookieEncryptionException("Failed to encrypt with " + jweHeader.getEncryptionMethod(), e);
        }

        final JWSObject jws = new JWSObject(jwsHeader, new Payload(jwe.serialize()));
        try {
            jws.sign(signer);
        } catch (JOSEException e) {
            throw new CookieEncryptionException("Failed to sign with " + jwsHeader.getAlgorithm(), e);
        }
        return jws.serialize();
    }

    @Override
    public byte[] decryptAndVerify(String envelope) {
        requireNonNull(envelope, "envelope");
        final JWSObject jws;
        try {
            jws = JWSObject.parse(envelope);
        } catch (ParseException e) {
            throw new MalformedCookieException("invalid signed envelope", e);
        }

        // Only the canonical encoding is accepted for the signature.
        final Base64URL signature = jws.getSignature();
        if (!Base64URL.encode(signature.decode()).toString().equals(signature.toString())) {
            throw new MalformedCookieException("invalid signature segment");
        }
        if (!jwsHeader.getAlgorithm().equals(jws.getHeader().getAlgorithm())) {
            throw new CookieIntegrityException("unexpected signature algorithm: " +
                                               jws.getHeader().getAlgorithm());
        }
        try {
            if (!jws.verify(verifier)) {
                throw new CookieIntegrityException("signature mismatch");
            }
        } catch (JOSEException e) {
            throw new CookieIntegrityException("Failed to verify the signature", e);
        }

        final JWEObject jwe;
        try {
            jwe = JWEObject.parse(jws.getPayload().toString());
        } catch (ParseException e) {
            throw new MalformedCookieException("invalid encrypted payload", e);
        }
        try {
            jwe.decrypt(decrypter);
        } catch (JOSEException e) {
            throw new CookieIntegrityException("Failed to decrypt the payload", e);
        }
        return jwe.getPayload().toBytes();
    }

    @Override
    public String toString() {
        return "DefaultAuthenticatedEncryptor{jwe=" + jweHeader.getAlgorithm() + '+' +
               jweHeader.getEncryptionMethod() + ", jws=" + jwsHeader.getAlgorithm() + '}';
    }
}
