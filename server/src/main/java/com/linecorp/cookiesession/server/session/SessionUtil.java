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

import com.google.common.annotations.VisibleForTesting;

import com.linecorp.armeria.common.RequestContext;
import com.linecorp.armeria.server.ServiceRequestContext;

import io.netty.util.AttributeKey;

/**
 * A utility class to access the {@link Session} which {@link SessionCookieAuthorizer} attached to the
 * current request.
 */
public final class SessionUtil {

    @VisibleForTesting
    static final AttributeKey<Session> CURRENT_SESSION =
            AttributeKey.valueOf(SessionUtil.class, "CURRENT_SESSION");

    /**
     * Returns the {@link Session} of the specified {@link ServiceRequestContext}, or {@code null} if
     * the request was not authorized by {@link SessionCookieAuthorizer}.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public static <T extends Session> T currentSession(ServiceRequestContext ctx) {
        requireNonNull(ctx, "ctx");
        return (T) ctx.attr(CURRENT_SESSION);
    }

    /**
     * Returns the {@link Session} of the {@link ServiceRequestContext} of the current thread, or
     * {@code null} if the request was not authorized by {@link SessionCookieAuthorizer}.
     *
     * @throws IllegalStateException if there is no {@link ServiceRequestContext} in the current thread
     */
    @Nullable
    public static <T extends Session> T currentSession() {
        return currentSession(RequestContext.current());
    }

    static void setCurrentSession(ServiceRequestContext ctx, Session session) {
        requireNonNull(ctx, "ctx");
        requireNonNull(session, "session");
        ctx.setAttr(CURRENT_SESSION, session);
    }

    private SessionUtil() {}
}
