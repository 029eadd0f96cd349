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

import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.server.CookieOptions;

/**
 * Decides the {@link CookieOptions} of the session cookie for a request.
 */
@FunctionalInterface
public interface CookieOptionsPolicy {

    /**
     * Returns a {@link CookieOptionsPolicy} which always returns the specified {@link CookieOptions}.
     */
    static CookieOptionsPolicy of(CookieOptions options) {
        requireNonNull(options, "options");
        return ctx -> options;
    }

    /**
     * Returns a {@link CookieOptionsPolicy} which decides {@code Domain}, {@code Path} and {@code Secure}
     * from the host the request was sent to. A loopback host gets an insecure host-only cookie and any
     * other host gets a secure cookie for the specified {@code trustedDomain}. The other attributes are
     * taken from the specified {@code baseOptions}. A {@code null} {@code trustedDomain} makes the cookie
     * host-only for every host.
     */
    static CookieOptionsPolicy ofHost(@Nullable String trustedDomain, CookieOptions baseOptions) {
        return new HostBasedCookieOptionsPolicy(trustedDomain, baseOptions);
    }

    /**
     * Returns the {@link CookieOptions} for the request of the specified {@link ServiceRequestContext}.
     */
    CookieOptions apply(ServiceRequestContext ctx);
}
