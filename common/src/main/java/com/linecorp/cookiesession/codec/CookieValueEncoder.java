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
package com.linecorp.cookiesession.codec;

import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;

/**
 * Serializes an application value into the payload of a protected cookie and back.
 * {@code decode(encode(value), type)} must be equivalent to {@code value}.
 */
public interface CookieValueEncoder {

    /**
     * Returns the {@link CookieValueEncoder} which serializes values as JSON.
     */
    static CookieValueEncoder ofJson() {
        return JsonCookieValueEncoder.INSTANCE;
    }

    /**
     * Returns the {@link CookieValueEncoder} which stores {@link String} values as they are.
     */
    static CookieValueEncoder ofString() {
        return StringCookieValueEncoder.INSTANCE;
    }

    /**
     * Serializes the specified {@code value}.
     *
     * @throws CookieEncodeException if the {@code value} cannot be serialized
     */
    byte[] encode(Object value);

    /**
     * Deserializes the specified {@code data} into an instance of {@code type}.
     *
     * @throws CookieDecodeException if the {@code data} is empty, malformed or of a different type
     */
    <T> T decode(byte[] data, Class<T> type);
}
