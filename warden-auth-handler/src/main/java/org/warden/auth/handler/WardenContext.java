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


package org.warden.auth.handler;

import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;
import org.warden.auth.spi.Database;
import org.warden.auth.spi.PasswordHasher;
import org.warden.auth.spi.TokenSigner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;

/**
 * Process-scoped handle holding the database, the capabilities and the services built on
 * them. Create one at startup and close it on shutdown.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (WardenContext context = WardenContext.create(config, new MemoryDatabase())) {
 *     AuthenticatedPrincipal principal = context.authentication().register(user);
 *     UUID id = context.authentication().authorize(principal.getEncodedToken());
 * }
 * }</pre>
 */
public final class WardenContext implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WardenContext.class);

    private final WardenConfig config;
    private final Database database;
    private final TokenSigner signer;
    private final CredentialService credentials;
    private final TokenService tokens;
    private final LoginAttemptTracker attempts;
    private final AuthenticationService authentication;

    private WardenContext(Builder builder, PasswordHasher hasher, TokenSigner signer) {
        this.config = builder.config;
        this.database = builder.database;
        this.signer = signer;
        this.credentials = new CredentialService(hasher, PasswordPolicy.fromConfig(config));
        this.tokens = TokenService.fromConfig(signer, builder.clock, config);
        this.attempts = LoginAttemptTracker.fromConfig(builder.clock, config);
        this.authentication = new AuthenticationService(database.users(), credentials, tokens, attempts);
    }

    /**
     * Builds a context with discovered capabilities and the system clock.
     */
    public static WardenContext create(WardenConfig config, Database database) throws WardenException {
        return builder().config(config).database(database).build();
    }

    public WardenConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public CredentialService credentials() {
        return credentials;
    }

    public TokenService tokens() {
        return tokens;
    }

    public AuthenticationService authentication() {
        return authentication;
    }

    @Override
    public void close() {
        attempts.clear();
        signer.close();
        database.close();
        LOG.info("Closed warden context");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link WardenContext}.
     */
    public static final class Builder {
        private WardenConfig config = WardenConfig.defaults();
        private Database database;
        private Clock clock = Clock.systemUTC();
        private CapabilityManager capabilities;

        private Builder() {
        }

        public Builder config(WardenConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder database(Database database) {
            this.database = database;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder capabilities(CapabilityManager capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        /**
         * Validates the configuration and creates the capabilities.
         *
         * @throws WardenException CONVERSION naming the offending property, INTERNAL if the
         *         signing keys cannot be loaded or written
         */
        public WardenContext build() throws WardenException {
            Objects.requireNonNull(database, "database is required");
            config.validate();
            CapabilityManager manager = capabilities != null ? capabilities : new CapabilityManager();
            PasswordHasher hasher = manager.createHasher(config);
            TokenSigner signer = manager.createSigner(config);
            LOG.info("Created warden context: hasher={}, signer={} ({})",
                    hasher.algorithm(), config.getString(WardenConfig.TOKEN_SIGNER,
                            WardenConfig.DEFAULT_TOKEN_SIGNER), signer.algorithm());
            return new WardenContext(this, hasher, signer);
        }
    }
}
