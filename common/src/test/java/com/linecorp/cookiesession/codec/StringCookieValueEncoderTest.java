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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;

class StringCookieValueEncoderTest {

    private final CookieValueEncoder encoder = CookieValueEncoder.ofString();

    @Test
    void roundTrip() {
        final byte[] encoded = encoder.encode("héllo, 世界");
        assertThat(encoded).isEqualTo("héllo, 世界".getBytes(StandardCharsets.UTF_8));
        assertThat(encoder.decode(encoded, String.class)).isEqualTo("héllo, 世界");
        assertThat(encoder.decode(encoded, CharSequence.class)).hasToString("héllo, 世界");
    }

    @Test
    void onlyStringsAreEncoded() {
        assertThatThrownBy(() -> encoder.encode(42))
                .isInstanceOf(CookieEncodeException.class);
    }

    @Test
    void onlyStringsAreDecoded() {
        assertThatThrownBy(() -> encoder.decode(new byte[] { 'a' }, Integer.class))
                .isInstanceOf(CookieDecodeException.class);
    }

    @Test
    void emptyPayload() {
        assertThatThrownBy(() -> encoder.decode(new byte[0], String.class))
                .isInstanceOf(CookieDecodeException.class);
    }

    @Test
    void invalidUtf8() {
        assertThatThrownBy(() -> encoder.decode(new byte[] { (byte) 0xC3, (byte) 0x28 }, String.class))
                .isInstanceOf(CookieDecodeException.class);
    }
}
