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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

import com.linecorp.cookiesession.codec.CookieValueEncoder;
import com.linecorp.cookiesession.server.CookieEncryptor;
import com.linecorp.cookiesession.server.CookieOptions;
import com.linecorp.cookiesession.server.CookieSessionConfig;
import com.linecorp.cookiesession.server.SecureCookieManager;

/**
 * Builds a new {@link CookieSessionManager}.
 * Either {@link #secret(String)} or {@link #secureCookieManager(SecureCookieManager)} must be specified.
 */
public final class CookieSessionManagerBuilder<T extends Session> {

    private final Class<T> sessionType;

    @Nullable
    private String secret;
    private int iterations = CookieSessionConfig.DEFAULT_ITERATIONS;
    @Nullable
    private SecureCookieManager secureCookieManager;
    private CookieValueEncoder valueEncoder = CookieValueEncoder.ofJson();
    private String cookieName = CookieSessionConfig.DEFAULT_COOKIE_NAME;
    private CookieOptions cookieOptions = CookieOptions.builder()
                                                       .httpOnly(true)
                                                       .sameSite(CookieSessionConfig.DEFAULT_SAME_SITE)
                                                       .build();
    @Nullable
    private String trustedDomain;
    @Nullable
    private CookieOptionsPolicy cookieOptionsPolicy;
    @Nullable
    private SessionFactory<T> sessionFactory;

    CookieSessionManagerBuilder(Class<T> sessionType) {
        this.sessionType = requireNonNull(sessionType, "sessionType");
    }

    /**
     * Sets the master secret which the cookie keys are derived from.
     */
    public CookieSessionManagerBuilder<T> secret(String secret) {
        requireNonNull(secret, "secret");
        checkArgument(!secret.isEmpty(), "secret is empty.");
        this.secret = secret;
        return this;
    }

    /**
     * Sets the number of iterations of the key derivation.
     * {@value CookieSessionConfig#DEFAULT_ITERATIONS} is used by default.
     */
    public CookieSessionManagerBuilder<T> iterations(int iterations) {
        checkArgument(iterations > 0, "iterations: %s (expected: > 0)", iterations);
        this.iterations = iterations;
        return this;
    }

    /**
     * Sets the {@link SecureCookieManager} which reads and writes the session cookie. The
     * {@link #secret(String)}, {@link #iterations(int)} and {@link #valueEncoder(CookieValueEncoder)}
     * are ignored when this is specified.
     */
    public CookieSessionManagerBuilder<T> secureCookieManager(SecureCookieManager secureCookieManager) {
        this.secureCookieManager = requireNonNull(secureCookieManager, "secureCookieManager");
        return this;
    }

    /**
     * Sets the {@link CookieValueEncoder} of sessions. {@link CookieValueEncoder#ofJson()} is used by
     * default.
     */
    public CookieSessionManagerBuilder<T> valueEncoder(CookieValueEncoder valueEncoder) {
        this.valueEncoder = requireNonNull(valueEncoder, "valueEncoder");
        return this;
    }

    /**
     * Sets the name of the session cookie. {@value CookieSessionConfig#DEFAULT_COOKIE_NAME} is used by
     * default.
     */
    public CookieSessionManagerBuilder<T> cookieName(String cookieName) {
        requireNonNull(cookieName, "cookieName");
        checkArgument(!cookieName.isEmpty(), "cookieName is empty.");
        this.cookieName = cookieName;
        return this;
    }

    /**
     * Sets the base {@link CookieOptions} of the session cookie. The default is an {@code HttpOnly}
     * cookie with {@code SameSite=Strict}.
     */
    public CookieSessionManagerBuilder<T> cookieOptions(CookieOptions cookieOptions) {
        this.cookieOptions = requireNonNull(cookieOptions, "cookieOptions");
        return this;
    }

    /**
     * Sets the {@code Domain} of the session cookie for requests to a non-loopback host.
     */
    public CookieSessionManagerBuilder<T> trustedDomain(String trustedDomain) {
        this.trustedDomain = requireNonNull(trustedDomain, "trustedDomain");
        return this;
    }

    /**
     * Sets the {@link CookieOptionsPolicy} which decides the {@link CookieOptions} per request.
     * If not specified, {@link CookieOptionsPolicy#ofHost(String, CookieOptions)} is used with the
     * {@link #trustedDomain(String)} and the {@link #cookieOptions(CookieOptions)}.
     */
    public CookieSessionManagerBuilder<T> cookieOptionsPolicy(CookieOptionsPolicy cookieOptionsPolicy) {
        this.cookieOptionsPolicy = requireNonNull(cookieOptionsPolicy, "cookieOptionsPolicy");
        return this;
    }

    /**
     * Sets the {@link SessionFactory} used by {@link CookieSessionManager#currentOrCreate}.
     */
    public CookieSessionManagerBuilder<T> sessionFactory(SessionFactory<T> sessionFactory) {
        this.sessionFactory = requireNonNull(sessionFactory, "sessionFactory");
        return this;
    }

    /**
     * Applies the specified {@link CookieSessionConfig}.
     */
    public CookieSessionManagerBuilder<T> config(CookieSessionConfig config) {
        requireNonNull(config, "config");
        secret(config.secret());
        iterations(config.iterations());
        cookieName(config.cookieName());
        cookieOptions(config.toCookieOptions());
        final String trustedDomain = config.trustedDomain();
        if (trustedDomain != null) {
            trustedDomain(trustedDomain);
        }
        return this;
    }

    /**
     * Returns a newly-created {@link CookieSessionManager}.
     */
    public CookieSessionManager<T> build() {
        checkState(secret != null || secureCookieManager != null,
                   "secret() or secureCookieManager() must be specified.");
        final SecureCookieManager cookieManager;
        if (secureCookieManager != null) {
            cookieManager = secureCookieManager;
        } else {
            cookieManager = new SecureCookieManager(CookieEncryptor.of(secret, iterations), valueEncoder);
        }
        final CookieOptionsPolicy policy;
        if (cookieOptionsPolicy != null) {
            policy = cookieOptionsPolicy;
        } else {
            policy = CookieOptionsPolicy.ofHost(trustedDomain, cookieOptions);
        }
        return new CookieSessionManager<>(sessionType, cookieManager, cookieName, policy, sessionFactory);
    }
}
