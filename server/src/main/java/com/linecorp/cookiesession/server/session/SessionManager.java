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

import com.linecorp.armeria.server.ServiceRequestContext;

import com.linecorp.cookiesession.common.CookieNotFoundException;
import com.linecorp.cookiesession.common.InvalidCookieException;

/**
 * Loads and stores the {@link Session} of a request.
 */
public interface SessionManager<T extends Session> {

    /**
     * Returns the validated {@link Session} of the request of the specified {@link ServiceRequestContext}.
     *
     * @throws CookieNotFoundException if the request carries no session
     * @throws InvalidCookieException if the session cannot be restored or is rejected by
     *                                {@link Session#validate(ServiceRequestContext)}
     */
    T current(ServiceRequestContext ctx);

    /**
     * Replaces the session of the client with the specified {@code session}.
     */
    void update(ServiceRequestContext ctx, T session);

    /**
     * Makes the client discard its session.
     */
    void invalidate(ServiceRequestContext ctx);
}
