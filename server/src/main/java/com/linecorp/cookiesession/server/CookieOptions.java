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

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.common.Cookie;
import com.linecorp.armeria.common.CookieBuilder;

/**
 * The attributes of a cookie emitted by {@link SecureCookieManager}. It has no cryptographic role.
 */
public final class CookieOptions {

    private static final CookieOptions DEFAULT = new CookieOptionsBuilder().build();

    /**
     * Returns the {@link CookieOptions} with no attributes set.
     */
    public static CookieOptions of() {
        return DEFAULT;
    }

    /**
     * Returns a new {@link CookieOptionsBuilder}.
     */
    public static CookieOptionsBuilder builder() {
        return new CookieOptionsBuilder();
    }

    @Nullable
    private final String domain;
    @Nullable
    private final String path;
    private final boolean httpOnly;
    private final boolean secure;
    @Nullable
    private final Duration maxAge;
    @Nullable
    private final Instant expires;
    @Nullable
    private final String sameSite;
    private final boolean partitioned;

    CookieOptions(@Nullable String domain, @Nullable String path, boolean httpOnly, boolean secure,
                  @Nullable Duration maxAge, @Nullable Instant expires, @Nullable String sameSite,
                  boolean partitioned) {
        this.domain = domain;
        this.path = path;
        this.httpOnly = httpOnly;
        this.secure = secure;
        this.maxAge = maxAge;
        this.expires = expires;
        this.sameSite = sameSite;
        this.partitioned = partitioned;
    }

    /**
     * Returns the {@code Domain} attribute.
     */
    @Nullable
    public String domain() {
        return domain;
    }

    /**
     * Returns the {@code Path} attribute.
     */
    @Nullable
    public String path() {
        return path;
    }

    /**
     * Returns whether the {@code HttpOnly} attribute is set.
     */
    public boolean httpOnly() {
        return httpOnly;
    }

    /**
     * Returns whether the {@code Secure} attribute is set.
     */
    public boolean secure() {
        return secure;
    }

    /**
     * Returns the {@code Max-Age} attribute.
     */
    @Nullable
    public Duration maxAge() {
        return maxAge;
    }

    /**
     * Returns the absolute expiry time. It is ignored when {@link #maxAge()} is set.
     */
    @Nullable
    public Instant expires() {
        return expires;
    }

    /**
     * Returns the {@code SameSite} attribute.
     */
    @Nullable
    public String sameSite() {
        return sameSite;
    }

    /**
     * Returns whether the {@code Partitioned} attribute is set.
     */
    public boolean partitioned() {
        return partitioned;
    }

    /**
     * Returns a new {@link CookieOptionsBuilder} initialized with the attributes of this options.
     */
    public CookieOptionsBuilder toBuilder() {
        return new CookieOptionsBuilder().domain(domain)
                                         .path(path)
                                         .httpOnly(httpOnly)
                                         .secure(secure)
                                         .maxAge(maxAge)
                                         .expires(expires)
                                         .sameSite(sameSite)
                                         .partitioned(partitioned);
    }

    /**
     * Returns a new {@link Cookie} with the specified {@code name} and {@code value} and the attributes
     * of this options. {@link #partitioned()} is not part of the returned {@link Cookie}; use
     * {@link #toSetCookieHeader(Cookie)} to render it.
     */
    public Cookie newCookie(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        final CookieBuilder builder = Cookie.builder(name, value)
                                            .httpOnly(httpOnly)
                                            .secure(secure);
        if (!isNullOrEmpty(domain)) {
            builder.domain(domain);
        }
        if (!isNullOrEmpty(path)) {
            builder.path(path);
        }
        if (!isNullOrEmpty(sameSite)) {
            builder.sameSite(sameSite);
        }
        if (maxAge != null) {
            builder.maxAge(maxAge.getSeconds());
        } else if (expires != null) {
            // Armeria renders 'Expires' from 'Max-Age'.
            builder.maxAge(Duration.between(Instant.now(), expires).getSeconds());
        }
        return builder.build();
    }

    /**
     * Returns the {@code Set-Cookie} header value of the specified {@link Cookie}, with the
     * {@code Partitioned} attribute appended if {@link #partitioned()} is set.
     */
    public String toSetCookieHeader(Cookie cookie) {
        requireNonNull(cookie, "cookie");
        final String header = cookie.toSetCookieHeader();
        return partitioned ? header + "; Partitioned" : header;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CookieOptions)) {
            return false;
        }
        final CookieOptions that = (CookieOptions) o;
        return httpOnly == that.httpOnly &&
               secure == that.secure &&
               partitioned == that.partitioned &&
               Objects.equals(domain, that.domain) &&
               Objects.equals(path, that.path) &&
               Objects.equals(maxAge, that.maxAge) &&
               Objects.equals(expires, that.expires) &&
               Objects.equals(sameSite, that.sameSite);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, path, httpOnly, secure, maxAge, expires, sameSite, partitioned);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("domain", domain)
                          .add("path", path)
                          .add("httpOnly", httpOnly)
                          .add("secure", secure)
                          .add("maxAge", maxAge)
                          .add("expires", expires)
                          .add("sameSite", sameSite)
                          .add("partitioned", partitioned)
                          .toString();
    }
}
