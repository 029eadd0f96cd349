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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;

import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.server.CookieOptions;

final class HostBasedCookieOptionsPolicy implements CookieOptionsPolicy {

    private static final Logger logger = LoggerFactory.getLogger(HostBasedCookieOptionsPolicy.class);

    @Nullable
    private final String trustedDomain;
    private final CookieOptions loopbackOptions;
    private final CookieOptions remoteOptions;

    HostBasedCookieOptionsPolicy(@Nullable String trustedDomain, CookieOptions baseOptions) {
        requireNonNull(baseOptions, "baseOptions");
        this.trustedDomain = Strings.emptyToNull(trustedDomain);
        loopbackOptions = baseOptions.toBuilder()
                                     .secure(false)
                                     .domain(null)
                                     .path("/")
                                     .build();
        remoteOptions = baseOptions.toBuilder()
                                   .secure(true)
                                   .domain(this.trustedDomain)
                                   .path("/")
                                   .build();
    }

    @Override
    public CookieOptions apply(ServiceRequestContext ctx) {
        requireNonNull(ctx, "ctx");
        return isLoopback(ctx.request().authority()) ? loopbackOptions : remoteOptions;
    }

    @VisibleForTesting
    static boolean isLoopback(@Nullable String authority) {
        if (Strings.isNullOrEmpty(authority)) {
            return false;
        }
        final String host;
        try {
            host = HostAndPort.fromString(authority).getHost();
        } catch (IllegalArgumentException e) {
            logger.debug("Failed to parse the authority: {}", authority, e);
            return false;
        }
        if ("localhost".equalsIgnoreCase(host)) {
            return true;
        }
        return InetAddresses.isInetAddress(host) && InetAddresses.forString(host).isLoopbackAddress();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("trustedDomain", trustedDomain)
                          .add("remoteOptions", remoteOptions)
                          .toString();
    }
}
