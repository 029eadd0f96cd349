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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;

enum StringCookieValueEncoder implements CookieValueEncoder {
    INSTANCE;

    @Override
    public byte[] encode(Object value) {
        requireNonNull(value, "value");
        if (!(value instanceof String)) {
            throw new CookieEncodeException("unsupported value type: " + value.getClass().getName() +
                                            " (expected: " + String.class.getName() + ')');
        }
        return ((String) value).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        requireNonNull(data, "data");
        requireNonNull(type, "type");
        if (!type.isAssignableFrom(String.class)) {
            throw new CookieDecodeException("unsupported type: " + type.getName() +
                                            " (expected: " + String.class.getName() + ')');
        }
        if (data.length == 0) {
            throw new CookieDecodeException("empty payload");
        }

        final CharsetDecoder charsetDecoder =
                StandardCharsets.UTF_8.newDecoder()
                                      .onMalformedInput(CodingErrorAction.REPORT)
                                      .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return type.cast(charsetDecoder.decode(ByteBuffer.wrap(data)).toString());
        } catch (CharacterCodingException e) {
            throw new CookieDecodeException("payload is not a valid UTF-8 string", e);
        }
    }
}
