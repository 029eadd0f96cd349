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

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import com.linecorp.armeria.common.Cookie;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.codec.CookieValueEncoder;
import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;
import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.InvalidCookieException;

/**
 * Reads and writes cookies whose values are encoded with a {@link CookieValueEncoder} and protected
 * with a {@link CookieEncryptor}.
 */
public final class SecureCookieManager {

    private static final Logger logger = LoggerFactory.getLogger(SecureCookieManager.class);

    /**
     * The largest {@code Set-Cookie} header most browsers accept.
     */
    @VisibleForTesting
    static final int MAX_COOKIE_LENGTH = 4096;

    /**
     * Returns a new {@link SecureCookieManager} which encodes values as JSON.
     */
    public static SecureCookieManager of(String secret, int iterations) {
        return new SecureCookieManager(CookieEncryptor.of(secret, iterations), CookieValueEncoder.ofJson());
    }

    private final CookieEncryptor encryptor;
    private final CookieValueEncoder encoder;

    /**
     * Creates a new instance.
     */
    public SecureCookieManager(CookieEncryptor encryptor, CookieValueEncoder encoder) {
        this.encryptor = requireNonNull(encryptor, "encryptor");
        this.encoder = requireNonNull(encoder, "encoder");
    }

    /**
     * Encodes and encrypts the specified {@code value} and adds the resulting cookie to the response of
     * the specified {@link ServiceRequestContext}. Nothing is added if encoding or encryption fails.
     *
     * @return the emitted {@link Cookie}
     * @throws CookieEncodeException if the {@code value} cannot be encoded
     */
    public Cookie set(ServiceRequestContext ctx, String name, @Nullable CookieOptions options, Object value) {
        requireNonNull(ctx, "ctx");
        final CookieOptions opts = options != null ? options : CookieOptions.of();
        final Cookie cookie = newCookie(name, opts, value);
        final String header = opts.toSetCookieHeader(cookie);
        if (header.length() > MAX_COOKIE_LENGTH) {
            logger.warn("The cookie '{}' is {} bytes long, which exceeds the limit of {} bytes. " +
                        "Browsers may discard it.", name, header.length(), MAX_COOKIE_LENGTH);
        }
        ctx.addAdditionalResponseHeader(HttpHeaderNames.SET_COOKIE, header);
        return cookie;
    }

    /**
     * Returns a new {@link Cookie} whose value is the specified {@code value} encoded and encrypted.
     */
    public Cookie newCookie(String name, @Nullable CookieOptions options, Object value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        final CookieOptions opts = options != null ? options : CookieOptions.of();
        final byte[] encoded = encoder.encode(value);
        return encryptor.encrypt(opts.newCookie(name, ""), encoded);
    }

    /**
     * Decrypts and decodes the cookie with the specified {@code name} sent with the request of the
     * specified {@link ServiceRequestContext}.
     *
     * @throws CookieNotFoundException if there is no such cookie or its value is empty
     * @throws InvalidCookieException if the cookie cannot be verified or decoded
     */
    public <T> T get(ServiceRequestContext ctx, String name, Class<T> type) {
        requireNonNull(ctx, "ctx");
        return get(ctx.request().headers(), name, type);
    }

    /**
     * Decrypts and decodes the cookie with the specified {@code name} from the specified
     * {@link RequestHeaders}.
     *
     * @throws CookieNotFoundException if there is no such cookie or its value is empty
     * @throws InvalidCookieException if the cookie cannot be verified or decoded
     */
    public <T> T get(RequestHeaders headers, String name, Class<T> type) {
        requireNonNull(type, "type");
        final Cookie cookie = findCookie(headers, name);
        return encoder.decode(encryptor.decrypt(cookie), type);
    }

    /**
     * Returns the cookie with the specified {@code name} whose value is replaced with its decrypted
     * payload.
     *
     * @throws CookieDecodeException if the payload is not valid UTF-8 text
     */
    public Cookie getCookie(RequestHeaders headers, String name) {
        final Cookie cookie = findCookie(headers, name);
        final byte[] payload = encryptor.decrypt(cookie);
        return cookie.toBuilder()
                     .value(CookieValueEncoder.ofString().decode(payload, String.class))
                     .build();
    }

    /**
     * Adds a cookie which makes the client discard the cookie with the specified {@code name}.
     * Every attribute of the {@code options} but {@link CookieOptions#maxAge()} and
     * {@link CookieOptions#expires()} is carried over, so that the client matches the cookie it stored,
     * including a {@code Partitioned} one.
     */
    public Cookie delete(ServiceRequestContext ctx, String name, @Nullable CookieOptions options) {
        requireNonNull(ctx, "ctx");
        requireNonNull(name, "name");
        final CookieOptions opts = (options != null ? options.toBuilder() : CookieOptions.builder())
                .maxAge(null)
                .expires(null)
                .build();
        final Cookie cookie = opts.newCookie(name, "")
                                  .toBuilder()
                                  .maxAge(-1)
                                  .build();
        ctx.addAdditionalResponseHeader(HttpHeaderNames.SET_COOKIE, opts.toSetCookieHeader(cookie));
        return cookie;
    }

    private static Cookie findCookie(RequestHeaders headers, String name) {
        requireNonNull(headers, "headers");
        requireNonNull(name, "name");
        for (Cookie cookie : headers.cookies()) {
            if (cookie.name().equals(name)) {
                if (cookie.value().isEmpty()) {
                    break;
                }
                return cookie;
            }
        }
        logger.trace("Cookie '{}' not found in the request: {}", name, headers.path());
        throw new CookieNotFoundException("cookie not found: " + name);
    }
}
