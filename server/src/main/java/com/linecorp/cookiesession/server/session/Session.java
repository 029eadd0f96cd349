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

import com.linecorp.cookiesession.common.SessionValidationException;

/**
 * An application-defined session which is stored in a cookie. An implementation must be serializable
 * with the {@link com.linecorp.cookiesession.codec.CookieValueEncoder} of its
 * {@link CookieSessionManager}, which is Jackson by default.
 */
public interface Session {

    /**
     * Checks whether this session may be used for the request of the specified
     * {@link ServiceRequestContext}, for example by comparing a fingerprint of the client stored in the
     * session with the request.
     *
     * @throws SessionValidationException if this session must not be used
     */
    void validate(ServiceRequestContext ctx);
}
