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
package com.linecorp.cookiesession.server;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.IOError;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.ServiceLoader;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Streams;

/**
 * The configuration of a {@link com.linecorp.cookiesession.server.session.CookieSessionManager},
 * usually loaded from a JSON file:
 * <pre>{@code
 * {
 *   "secret": "file:/etc/app/session-secret",
 *   "iterations": 65536,
 *   "cookieName": "session",
 *   "trustedDomain": "example.com",
 *   "maxAgeSeconds": 28800,
 *   "httpOnly": true,
 *   "sameSite": "Strict",
 *   "partitioned": false
 * }
 * }</pre>
 * The {@code secret} may be given with a prefix such as {@code file:} or {@code env:}. See
 * {@link ConfigValueConverter}.
 */
public final class CookieSessionConfig {

    private static final Logger logger = LoggerFactory.getLogger(CookieSessionConfig.class);

    public static final int DEFAULT_ITERATIONS = 65536;
    public static final String DEFAULT_COOKIE_NAME = "session";
    public static final String DEFAULT_SAME_SITE = "Strict";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Pattern PREFIX_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

    private static final Map<String, ConfigValueConverter> CONFIG_VALUE_CONVERTERS;

    static {
        final ArrayList<ConfigValueConverter> configValueConverters = new ArrayList<>();
        Streams.stream(ServiceLoader.load(ConfigValueConverter.class)).forEach(configValueConverters::add);
        configValueConverters.add(DefaultConfigValueConverter.INSTANCE);
        // The first converter registered for a prefix wins.
        final Map<String, ConfigValueConverter> converters = new LinkedHashMap<>();
        for (ConfigValueConverter converter : configValueConverters) {
            final boolean valid = converter.supportedPrefixes().stream()
                                           .allMatch(prefix -> PREFIX_PATTERN.matcher(prefix).matches());
            if (!valid) {
                logger.warn("{} isn't used because it has an invalid prefix: {} (expected: {})",
                            converter, converter.supportedPrefixes(), PREFIX_PATTERN.pattern());
                continue;
            }
            converter.supportedPrefixes().forEach(prefix -> converters.putIfAbsent(prefix, converter));
        }
        CONFIG_VALUE_CONVERTERS = ImmutableMap.copyOf(converters);

        if (logger.isDebugEnabled()) {
            final StringBuilder sb = new StringBuilder();
            sb.append('{');
            CONFIG_VALUE_CONVERTERS.entrySet().stream().sorted(Entry.comparingByKey()).forEach(
                    entry -> sb.append(entry.getKey())
                               .append('=')
                               .append(entry.getValue().getClass().getName()).append(", "));
            if (sb.length() > 1) {
                sb.setLength(sb.length() - 2);
            }
            sb.append('}');
            logger.debug("Available {}s: {}", ConfigValueConverter.class.getName(), sb);
        }
    }

    /**
     * Converts the specified {@code value} using {@link ConfigValueConverter} if the specified {@code value}
     * starts with a prefix followed by a colon {@code ':'}.
     */
    @Nullable
    public static String convertValue(@Nullable String value, String propertyName) {
        if (value == null) {
            return null;
        }

        final int index = value.indexOf(':');
        if (index <= 0) {
            // no prefix or starts with ':'.
            return value;
        }

        final String prefix = value.substring(0, index);
        if (!PREFIX_PATTERN.matcher(prefix).matches()) {
            // Not a prefix.
            return value;
        }

        final ConfigValueConverter converter = CONFIG_VALUE_CONVERTERS.get(prefix);
        if (converter != null) {
            return converter.convert(prefix, value.substring(index + 1));
        }
        logger.warn("No {} found for {}. prefix: {}",
                    ConfigValueConverter.class.getSimpleName(), propertyName, prefix);
        return value;
    }

    /**
     * Loads the configuration from the specified {@link File}.
     */
    public static CookieSessionConfig load(File configFile) throws JsonMappingException, JsonParseException {
        requireNonNull(configFile, "configFile");
        try {
            return objectMapper.readValue(configFile, CookieSessionConfig.class);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    /**
     * Loads the configuration from the specified JSON string.
     */
    @VisibleForTesting
    public static CookieSessionConfig load(String json) throws JsonMappingException, JsonParseException {
        requireNonNull(json, "json");
        try {
            return objectMapper.readValue(json, CookieSessionConfig.class);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    private final String secret;
    private final int iterations;
    private final String cookieName;
    @Nullable
    private final String trustedDomain;
    @Nullable
    private final Long maxAgeSeconds;
    private final boolean httpOnly;
    private final String sameSite;
    private final boolean partitioned;
    private final CookieOptions cookieOptions;

    /**
     * Creates a new instance.
     */
    @JsonCreator
    public CookieSessionConfig(@JsonProperty(value = "secret", required = true) String secret,
                               @JsonProperty("iterations") @Nullable Integer iterations,
                               @JsonProperty("cookieName") @Nullable String cookieName,
                               @JsonProperty("trustedDomain") @Nullable String trustedDomain,
                               @JsonProperty("maxAgeSeconds") @Nullable Long maxAgeSeconds,
                               @JsonProperty("httpOnly") @Nullable Boolean httpOnly,
                               @JsonProperty("sameSite") @Nullable String sameSite,
                               @JsonProperty("partitioned") @Nullable Boolean partitioned) {
        this.secret = requireNonNull(convertValue(requireNonNull(secret, "secret"), "secret"), "secret");
        checkArgument(!this.secret.isEmpty(), "secret is empty.");
        this.iterations = firstNonNull(iterations, DEFAULT_ITERATIONS);
        checkArgument(this.iterations > 0, "iterations: %s (expected: > 0)", this.iterations);
        this.cookieName = firstNonNull(cookieName, DEFAULT_COOKIE_NAME);
        checkArgument(!this.cookieName.isEmpty(), "cookieName is empty.");
        this.trustedDomain = trustedDomain;
        checkArgument(maxAgeSeconds == null || maxAgeSeconds >= 0,
                      "maxAgeSeconds: %s (expected: >= 0)", maxAgeSeconds);
        this.maxAgeSeconds = maxAgeSeconds;
        this.httpOnly = firstNonNull(httpOnly, true);
        // Validated when building the cookie options below.
        this.sameSite = firstNonNull(sameSite, DEFAULT_SAME_SITE);
        this.partitioned = firstNonNull(partitioned, false);
        cookieOptions = CookieOptions.builder()
                                     .httpOnly(this.httpOnly)
                                     .sameSite(this.sameSite)
                                     .partitioned(this.partitioned)
                                     .maxAge(maxAgeSeconds != null ? Duration.ofSeconds(maxAgeSeconds) : null)
                                     .build();
    }

    /**
     * Returns the master secret. It is not serialized.
     */
    public String secret() {
        return secret;
    }

    /**
     * Returns the number of iterations of the key derivation.
     */
    @JsonProperty
    public int iterations() {
        return iterations;
    }

    /**
     * Returns the name of the session cookie.
     */
    @JsonProperty
    public String cookieName() {
        return cookieName;
    }

    /**
     * Returns the {@code Domain} of the session cookie for non-loopback hosts.
     */
    @JsonProperty
    @Nullable
    public String trustedDomain() {
        return trustedDomain;
    }

    /**
     * Returns the {@code Max-Age} of the session cookie in seconds, or {@code null} for a cookie which
     * lasts until the browser is closed.
     */
    @JsonProperty
    @Nullable
    public Long maxAgeSeconds() {
        return maxAgeSeconds;
    }

    /**
     * Returns whether the session cookie is hidden from scripts.
     */
    @JsonProperty
    public boolean httpOnly() {
        return httpOnly;
    }

    /**
     * Returns the {@code SameSite} attribute of the session cookie.
     */
    @JsonProperty
    public String sameSite() {
        return sameSite;
    }

    /**
     * Returns whether the session cookie is partitioned.
     */
    @JsonProperty
    public boolean partitioned() {
        return partitioned;
    }

    /**
     * Returns the base {@link CookieOptions} described by this configuration. {@code Domain},
     * {@code Path} and {@code Secure} are decided per request.
     */
    public CookieOptions toCookieOptions() {
        return cookieOptions;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("iterations", iterations)
                          .add("cookieName", cookieName)
                          .add("trustedDomain", trustedDomain)
                          .add("maxAgeSeconds", maxAgeSeconds)
                          .add("httpOnly", httpOnly)
                          .add("sameSite", sameSite)
                          .add("partitioned", partitioned)
                          .toString();
    }
}
