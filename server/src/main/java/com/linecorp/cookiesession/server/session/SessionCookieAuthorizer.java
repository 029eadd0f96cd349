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

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.armeria.common.HttpRequest;
import com.linecorp.armeria.common.util.UnmodifiableFuture;
import com.linecorp.armeria.server.HttpService;
import com.linecorp.armeria.server.ServiceRequestContext;
import com.linecorp.armeria.server.auth.AuthService;
import com.linecorp.armeria.server.auth.Authorizer;

import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.InvalidCookieException;

/**
 * An {@link Authorizer} which accepts a request only if it carries a valid session cookie. The
 * {@link Session} of an accepted request is available via {@link SessionUtil#currentSession(
 * ServiceRequestContext)}.
 *
 * <p>A missing cookie and a cookie which cannot be verified, decoded or validated are rejected the same
 * way. The reason is only logged.
 */
public final class SessionCookieAuthorizer<T extends Session> implements Authorizer<HttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(SessionCookieAuthorizer.class);

    /**
     * Returns a decorator which rejects a request without a valid session of the specified
     * {@link SessionManager} with {@link SessionAuthFailureHandler}.
     */
    public static Function<? super HttpService, AuthService> newDecorator(
            SessionManager<? extends Session> sessionManager) {
        return AuthService.builder()
                          .add(new SessionCookieAuthorizer<>(sessionManager))
                          .onFailure(new SessionAuthFailureHandler())
                          .newDecorator();
    }

    private final SessionManager<T> sessionManager;

    public SessionCookieAuthorizer(SessionManager<T> sessionManager) {
        this.sessionManager = requireNonNull(sessionManager, "sessionManager");
    }

    @Override
    public CompletionStage<Boolean> authorize(ServiceRequestContext ctx, HttpRequest req) {
        final T session;
        try {
            session = sessionManager.current(ctx);
        } catch (CookieNotFoundException e) {
            logger.trace("Session cookie not found, ctx={}", ctx);
            return UnmodifiableFuture.completedFuture(false);
        } catch (InvalidCookieException e) {
            logger.debug("Rejected an invalid session cookie, ctx={}, reason={}", ctx, e.toString());
            return UnmodifiableFuture.completedFuture(false);
        }
        SessionUtil.setCurrentSession(ctx, session);
        return UnmodifiableFuture.completedFuture(true);
    }
}
