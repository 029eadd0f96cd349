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

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;

import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;
import com.linecorp.cookiesession.internal.Jackson;

enum JsonCookieValueEncoder implements CookieValueEncoder {
    INSTANCE;

    @Override
    public byte[] encode(Object value) {
        requireNonNull(value, "value");
        try {
            return Jackson.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CookieEncodeException("failed to serialize " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        requireNonNull(data, "data");
        requireNonNull(type, "type");
        if (data.length == 0) {
            throw new CookieDecodeException("empty payload");
        }

        final T value;
        try {
            value = Jackson.readValue(data, type);
        } catch (JsonProcessingException e) {
            // The payload is never part of the message.
            throw new CookieDecodeException("failed to deserialize " + type.getName(), e);
        }
        if (value == null) {
            throw new CookieDecodeException("payload decodes to null: " + type.getName());
        }
        return value;
    }
}
