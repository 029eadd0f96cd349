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

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import com.linecorp.cookiesession.common.KeyDerivationException;

/**
 * Derives purpose-specific keys from a single master secret with PBKDF2-HMAC-SHA256.
 * The purpose label is used as the salt, so the same secret, label, iteration count and length always
 * produce the same key while different labels produce unrelated keys.
 *
 * <p>Derivation is deliberately slow. Use {@link #cacheGenerate(String, int)} on hot paths; it computes
 * each key at most once per process.
 */
public final class KeyGenerator {

    private static final Logger logger = LoggerFactory.getLogger(KeyGenerator.class);

    private static final ConcurrentMap<CacheKey, byte[]> cache = new ConcurrentHashMap<>();

    /**
     * Returns a new {@link KeyGenerator} for the specified UTF-8 {@code secret}.
     *
     * @throws KeyDerivationException if the {@code secret} is empty or {@code iterations} is not positive
     */
    public static KeyGenerator of(String secret, int iterations) {
        requireNonNull(secret, "secret");
        return new KeyGenerator(secret.getBytes(StandardCharsets.UTF_8), iterations);
    }

    /**
     * Returns a new {@link KeyGenerator} for the specified {@code secret}.
     *
     * @throws KeyDerivationException if the {@code secret} is empty or {@code iterations} is not positive
     */
    public static KeyGenerator of(byte[] secret, int iterations) {
        requireNonNull(secret, "secret");
        return new KeyGenerator(secret.clone(), iterations);
    }

    private final byte[] secret;
    private final int iterations;
    private final HashCode secretFingerprint;

    private KeyGenerator(byte[] secret, int iterations) {
        if (secret.length == 0) {
            throw new KeyDerivationException("secret must not be empty");
        }
        if (iterations <= 0) {
            throw new KeyDerivationException("iterations: " + iterations + " (expected: > 0)");
        }
        this.secret = secret;
        this.iterations = iterations;
        secretFingerprint = Hashing.sha256().hashBytes(secret);
    }

    /**
     * Returns the number of PBKDF2 iterations.
     */
    public int iterations() {
        return iterations;
    }

    /**
     * Derives a new key of {@code length} bytes for the specified purpose {@code label}.
     */
    public byte[] generate(String label, int length) {
        validate(label, length);
        return derive(label, length);
    }

    /**
     * Derives a key of {@code length} bytes for the specified purpose {@code label}, or returns the one
     * derived earlier by any {@link KeyGenerator} with the same secret and iteration count.
     * Concurrent callers asking for the same key wait for a single derivation.
     */
    public byte[] cacheGenerate(String label, int length) {
        validate(label, length);
        final CacheKey key = new CacheKey(secretFingerprint, iterations, label, length);
        return cache.computeIfAbsent(key, unused -> derive(label, length)).clone();
    }

    private byte[] derive(String label, int length) {
        final Stopwatch stopwatch = Stopwatch.createStarted();
        final PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(secret, label.getBytes(StandardCharsets.UTF_8), iterations);
        final KeyParameter parameter = (KeyParameter) generator.generateDerivedMacParameters(length * 8);
        logger.debug("Derived a {}-byte key for '{}' with {} iterations in {} ms",
                     length, label, iterations, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return parameter.getKey();
    }

    private static void validate(String label, int length) {
        requireNonNull(label, "label");
        if (label.isEmpty()) {
            throw new KeyDerivationException("label must not be empty");
        }
        if (length <= 0) {
            throw new KeyDerivationException("length: " + length + " (expected: > 0)");
        }
    }

    @VisibleForTesting
    static int cacheSize() {
        return cache.size();
    }

    @Override
    public String toString() {
        return "KeyGenerator{iterations=" + iterations + '}';
    }

    private static final class CacheKey {

        private final HashCode secretFingerprint;
        private final int iterations;
        private final String label;
        private final int length;

        CacheKey(HashCode secretFingerprint, int iterations, String label, int length) {
            this.secretFingerprint = secretFingerprint;
            this.iterations = iterations;
            this.label = label;
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CacheKey)) {
                return false;
            }
            final CacheKey that = (CacheKey) o;
            return iterations == that.iterations &&
                   length == that.length &&
                   secretFingerprint.equals(that.secretFingerprint) &&
                   label.equals(that.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(secretFingerprint, iterations, label, length);
        }
    }
}
