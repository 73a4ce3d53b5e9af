// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.warden.auth;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable Warden configuration - a flat map of string properties with typed accessors.
 *
 * <p>How the properties are located and parsed (YAML, JSON, env) is up to the embedding
 * application; this class only interprets them.
 *
 * <p>Recognised properties:
 * <ul>
 *   <li><b>hash.algorithm</b> - Password hashing algorithm (BCRYPT/SHA256), default: BCRYPT</li>
 *   <li><b>hash.bcrypt.log_rounds</b> - BCrypt work factor, default: 10</li>
 *   <li><b>token.signer</b> - Token signing capability, default: jwt</li>
 *   <li><b>token.algorithm</b> - Signing algorithm (ES256/HS256), default: ES256</li>
 *   <li><b>token.key_path</b> - Signing key file, default: signing_keys.json</li>
 *   <li><b>token.ttl_seconds</b> - Token time to live, default: 86400 (1 day), at most 100 years</li>
 *   <li><b>token.issuer</b> - Issuer claim, default: warden</li>
 *   <li><b>token.audience</b> - Comma-separated audience, default: none</li>
 *   <li><b>brute_force.max_attempts</b> - Max failed attempts before lockout, default: 5</li>
 *   <li><b>brute_force.lockout_duration_seconds</b> - Lockout duration, default: 300 (5 min)</li>
 *   <li><b>password.min_length</b> - Minimum password length, default: 8</li>
 *   <li><b>password.require_uppercase</b> - Require uppercase letters, default: false</li>
 *   <li><b>password.require_lowercase</b> - Require lowercase letters, default: false</li>
 *   <li><b>password.require_digit</b> - Require digits, default: false</li>
 *   <li><b>password.require_special</b> - Require special characters, default: false</li>
 * </ul>
 */
public final class WardenConfig {

    private static final Logger LOG = LogManager.getLogger(WardenConfig.class);

    public static final String HASH_ALGORITHM = "hash.algorithm";
    public static final String BCRYPT_LOG_ROUNDS = "hash.bcrypt.log_rounds";
    public static final String TOKEN_SIGNER = "token.signer";
    public static final String TOKEN_ALGORITHM = "token.algorithm";
    public static final String TOKEN_KEY_PATH = "token.key_path";
    public static final String TOKEN_TTL_SECONDS = "token.ttl_seconds";
    public static final String TOKEN_ISSUER = "token.issuer";
    public static final String TOKEN_AUDIENCE = "token.audience";
    public static final String MAX_ATTEMPTS = "brute_force.max_attempts";
    public static final String LOCKOUT_DURATION = "brute_force.lockout_duration_seconds";
    public static final String PASSWORD_MIN_LENGTH = "password.min_length";
    public static final String PASSWORD_REQUIRE_UPPERCASE = "password.require_uppercase";
    public static final String PASSWORD_REQUIRE_LOWERCASE = "password.require_lowercase";
    public static final String PASSWORD_REQUIRE_DIGIT = "password.require_digit";
    public static final String PASSWORD_REQUIRE_SPECIAL = "password.require_special";

    public static final String DEFAULT_HASH_ALGORITHM = "BCRYPT";
    public static final String DEFAULT_TOKEN_SIGNER = "jwt";
    public static final String DEFAULT_TOKEN_ALGORITHM = "ES256";
    public static final String DEFAULT_TOKEN_KEY_PATH = "signing_keys.json";
    public static final long DEFAULT_TOKEN_TTL_SECONDS = 60L * 60 * 24;
    public static final String DEFAULT_TOKEN_ISSUER = "warden";

    /** Upper bound for {@code token.ttl_seconds} (100 years), keeping expirations within JWT date range. */
    public static final long MAX_TOKEN_TTL_SECONDS = 60L * 60 * 24 * 365 * 100;

    private static final String[] POSITIVE_INTEGER_KEYS = {
        BCRYPT_LOG_ROUNDS, TOKEN_TTL_SECONDS, MAX_ATTEMPTS, LOCKOUT_DURATION, PASSWORD_MIN_LENGTH
    };

    private static final WardenConfig EMPTY = builder().build();

    private final Map<String, String> properties;

    private WardenConfig(Builder builder) {
        this.properties = Collections.unmodifiableMap(new HashMap<>(builder.properties));
    }

    /**
     * Returns a configuration with no properties set; every accessor yields its default.
     *
     * @return empty configuration
     */
    public static WardenConfig defaults() {
        return EMPTY;
    }

    /**
     * Adapts an already loaded {@link Properties} object.
     *
     * @param source loaded properties
     * @return configuration holding every string property of {@code source}
     */
    public static WardenConfig fromProperties(Properties source) {
        Builder builder = builder();
        for (String key : source.stringPropertyNames()) {
            builder.property(key, source.getProperty(key));
        }
        return builder.build();
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public Optional<String> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public String getString(String key, String defaultValue) {
        String value = properties.get(key);
        return Strings.isNullOrEmpty(value) ? defaultValue : value.trim();
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Invalid integer value for '{}': {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.get(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Invalid long value for '{}': {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.get(key);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Splits a comma-separated property, dropping blanks.
     *
     * @param key property key
     * @return list of values, empty if unset
     */
    public List<String> getList(String key) {
        String value = properties.get(key);
        if (Strings.isNullOrEmpty(value)) {
            return Collections.emptyList();
        }
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value);
    }

    /**
     * Checks the numeric properties eagerly so that a bad deployment fails at startup instead
     * of silently running on defaults.
     *
     * @throws WardenException CONVERSION naming the first invalid property
     */
    public void validate() throws WardenException {
        for (String key : POSITIVE_INTEGER_KEYS) {
            String value = properties.get(key);
            if (value == null) {
                continue;
            }
            long parsed;
            try {
                parsed = Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw WardenException.conversion(key, "expected an integer but got '" + value + "'");
            }
            if (parsed <= 0) {
                throw WardenException.conversion(key, "must be positive, got " + parsed);
            }
            if (TOKEN_TTL_SECONDS.equals(key) && parsed > MAX_TOKEN_TTL_SECONDS) {
                throw WardenException.conversion(key, "must not exceed " + MAX_TOKEN_TTL_SECONDS + ", got " + parsed);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return properties.equals(((WardenConfig) o).properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return "WardenConfig{properties=" + properties.size() + " entries}";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with the properties of this configuration.
     *
     * @return builder with copied values
     */
    public Builder toBuilder() {
        return new Builder().properties(properties);
    }

    /**
     * Builder for {@link WardenConfig}.
     */
    public static final class Builder {
        private Map<String, String> properties = new HashMap<>();

        private Builder() {
        }

        public Builder properties(Map<String, String> properties) {
            this.properties = properties != null ? new HashMap<>(properties) : new HashMap<>();
            return this;
        }

        public Builder property(String key, String value) {
            this.properties.put(key, value);
            return this;
        }

        public WardenConfig build() {
            return new WardenConfig(this);
        }
    }
}
