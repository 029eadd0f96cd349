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

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.time.Instant;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableSet;

/**
 * Builds a new {@link CookieOptions}.
 */
public final class CookieOptionsBuilder {

    private static final ImmutableSet<String> SAME_SITE_VALUES = ImmutableSet.of("Strict", "Lax", "None");

    @Nullable
    private String domain;
    @Nullable
    private String path;
    private boolean httpOnly;
    private boolean secure;
    @Nullable
    private Duration maxAge;
    @Nullable
    private Instant expires;
    @Nullable
    private String sameSite;
    private boolean partitioned;

    CookieOptionsBuilder() {}

    /**
     * Sets the {@code Domain} attribute. {@code null} or an empty string makes the cookie host-only.
     */
    public CookieOptionsBuilder domain(@Nullable String domain) {
        this.domain = domain;
        return this;
    }

    /**
     * Sets the {@code Path} attribute.
     */
    public CookieOptionsBuilder path(@Nullable String path) {
        checkArgument(path == null || path.isEmpty() || path.charAt(0) == '/',
                      "path: %s (expected: an absolute path)", path);
        this.path = path;
        return this;
    }

    /**
     * Sets whether the cookie is hidden from scripts.
     */
    public CookieOptionsBuilder httpOnly(boolean httpOnly) {
        this.httpOnly = httpOnly;
        return this;
    }

    /**
     * Sets whether the cookie is sent only over secure connections.
     */
    public CookieOptionsBuilder secure(boolean secure) {
        this.secure = secure;
        return this;
    }

    /**
     * Sets the {@code Max-Age} attribute. {@code null} makes the cookie a session cookie unless
     * {@link #expires(Instant)} is set.
     */
    public CookieOptionsBuilder maxAge(@Nullable Duration maxAge) {
        this.maxAge = maxAge;
        return this;
    }

    /**
     * Sets the absolute expiry time of the cookie.
     */
    public CookieOptionsBuilder expires(@Nullable Instant expires) {
        this.expires = expires;
        return this;
    }

    /**
     * Sets the {@code SameSite} attribute, one of {@code "Strict"}, {@code "Lax"} and {@code "None"}.
     */
    public CookieOptionsBuilder sameSite(@Nullable String sameSite) {
        if (sameSite == null) {
            this.sameSite = null;
            return this;
        }
        final String normalized = SAME_SITE_VALUES.stream()
                                                  .filter(sameSite::equalsIgnoreCase)
                                                  .findFirst()
                                                  .orElse(null);
        checkArgument(normalized != null, "sameSite: %s (expected: one of %s)", sameSite, SAME_SITE_VALUES);
        this.sameSite = normalized;
        return this;
    }

    /**
     * Sets whether the cookie is stored in partitioned storage.
     */
    public CookieOptionsBuilder partitioned(boolean partitioned) {
        this.partitioned = partitioned;
        return this;
    }

    /**
     * Returns a newly-created {@link CookieOptions}.
     */
    public CookieOptions build() {
        return new CookieOptions(domain, path, httpOnly, secure, maxAge, expires, sameSite, partitioned);
    }
}
