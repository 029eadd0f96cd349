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
import java.util.Map;
import java.util.Objects;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import com.linecorp.cookiesession.common.CookieDecodeException;
import com.linecorp.cookiesession.common.CookieEncodeException;

class JsonCookieValueEncoderTest {

    private final CookieValueEncoder encoder = CookieValueEncoder.ofJson();

    @Test
    void encodeMap() {
        final byte[] encoded = encoder.encode(ImmutableMap.of("uid", 42));
        assertThat(new String(encoded, StandardCharsets.UTF_8)).isEqualTo("{\"uid\":42}");
    }

    @Test
    void decodeMap() {
        @SuppressWarnings("unchecked")
        final Map<String, Object> decoded =
                encoder.decode("{\"uid\":42}".getBytes(StandardCharsets.UTF_8), Map.class);
        assertThat(decoded).containsEntry("uid", 42);
    }

    @Test
    void roundTripBean() {
        final Profile profile = new Profile("alice", 3);
        assertThat(encoder.decode(encoder.encode(profile), Profile.class)).isEqualTo(profile);
    }

    @Test
    void emptyPayload() {
        assertThatThrownBy(() -> encoder.decode(new byte[0], Map.class))
                .isInstanceOf(CookieDecodeException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = { "{", "not json", "\"text\"", "[1, 2]" })
    void malformedOrMismatchedPayload(String payload) {
        assertThatThrownBy(() -> encoder.decode(payload.getBytes(StandardCharsets.UTF_8), Profile.class))
                .isInstanceOf(CookieDecodeException.class)
                .hasMessageNotContaining(payload);
    }

    @Test
    void nullPayload() {
        assertThatThrownBy(() -> encoder.decode("null".getBytes(StandardCharsets.UTF_8), Profile.class))
                .isInstanceOf(CookieDecodeException.class);
    }

    @Test
    void unserializableValue() {
        assertThatThrownBy(() -> encoder.encode(new Object()))
                .isInstanceOf(CookieEncodeException.class);
    }

    static final class Profile {

        private final String name;
        private final int visits;

        @JsonCreator
        Profile(@JsonProperty("name") String name, @JsonProperty("visits") int visits) {
            this.name = name;
            this.visits = visits;
        }

        @JsonProperty
        String name() {
            return name;
        }

        @JsonProperty
        int visits() {
            return visits;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Profile)) {
                return false;
            }
            final Profile that = (Profile) o;
            return visits == that.visits && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, visits);
        }
    }
}
