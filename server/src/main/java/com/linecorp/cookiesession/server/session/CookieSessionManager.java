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

import com.google.common.base.MoreObjects;

import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.SessionValidationException;
import com.linecorp.cookiesession.server.SecureCookieManager;

/**
 * A {@link SessionManager} which stores the whole {@link Session} in an encrypted and signed cookie.
 * Nothing is stored on the server side.
 */
public final class CookieSessionManager<T extends Session> implements SessionManager<T> {

    private static final Logger logger = LoggerFactory.getLogger(CookieSessionManager.class);

    /**
     * Returns a new {@link CookieSessionManagerBuilder} for sessions of the specified {@code sessionType}.
     */
    public static <T extends Session> CookieSessionManagerBuilder<T> builder(Class<T> sessionType) {
        return new CookieSessionManagerBuilder<>(sessionType);
    }

    private final Class<T> sessionType;
    private final SecureCookieManager cookieManager;
    private final String cookieName;
    private final CookieOptionsPolicy cookieOptionsPolicy;
    @Nullable
    private final SessionFactory<T> sessionFactory;

    CookieSessionManager(Class<T> sessionType, SecureCookieManager cookieManager, String cookieName,
                         CookieOptionsPolicy cookieOptionsPolicy, @Nullable SessionFactory<T> sessionFactory) {
        this.sessionType = requireNonNull(sessionType, "sessionType");
        this.cookieManager = requireNonNull(cookieManager, "cookieManager");
        this.cookieName = requireNonNull(cookieName, "cookieName");
        this.cookieOptionsPolicy = requireNonNull(cookieOptionsPolicy, "cookieOptionsPolicy");
        this.sessionFactory = sessionFactory;
    }

    /**
     * Returns the name of the session cookie.
     */
    public String cookieName() {
        return cookieName;
    }

    @Override
    public T current(ServiceRequestContext ctx) {
        requireNonNull(ctx, "ctx");
        final T session = cookieManager.get(ctx, cookieName, sessionType);
        try {
            session.validate(ctx);
        } catch (SessionValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SessionValidationException("failed to validate a session", e);
        }
        return session;
    }

    /**
     * Returns the validated {@link Session} of the request, or a new one created by the
     * {@link SessionFactory} if the request carries no session cookie. The new session is not sent
     * to the client until {@link #update(ServiceRequestContext, Session)} is called.
     *
     * @throws CookieNotFoundException if the request carries no session and no {@link SessionFactory}
     *                                 was specified
     */
    public T currentOrCreate(ServiceRequestContext ctx) {
        try {
            return current(ctx);
        } catch (CookieNotFoundException e) {
            if (sessionFactory == null) {
                throw e;
            }
            logger.trace("Creating a new session, ctx={}", ctx);
            return requireNonNull(sessionFactory.create(ctx), "sessionFactory.create() returned null");
        }
    }

    @Override
    public void update(ServiceRequestContext ctx, T session) {
        requireNonNull(ctx, "ctx");
        requireNonNull(session, "session");
        cookieManager.set(ctx, cookieName, cookieOptionsPolicy.apply(ctx), session);
    }

    @Override
    public void invalidate(ServiceRequestContext ctx) {
        requireNonNull(ctx, "ctx");
        cookieManager.delete(ctx, cookieName, cookieOptionsPolicy.apply(ctx));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("sessionType", sessionType.getName())
                          .add("cookieName", cookieName)
                          .add("cookieOptionsPolicy", cookieOptionsPolicy)
                          .toString();
    }
}
