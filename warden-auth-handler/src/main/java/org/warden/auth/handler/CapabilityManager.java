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
import org.warden.auth.spi.PasswordHasher;
import org.warden.auth.spi.PasswordHasherFactory;
import org.warden.auth.spi.TokenSigner;
import org.warden.auth.spi.TokenSignerFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of hashing and signing capabilities.
 *
 * <p>Factories found on the class path through {@link ServiceLoader} are registered at
 * construction; more can be added with {@link #registerHasherFactory} and
 * {@link #registerSignerFactory}, which override a factory of the same name. Names are
 * case-insensitive.
 */
public class CapabilityManager {

    private static final Logger LOG = LogManager.getLogger(CapabilityManager.class);

    /** Hasher factories by algorithm name (e.g., "BCRYPT", "SHA256") */
    private final Map<String, PasswordHasherFactory> hasherFactories = new ConcurrentHashMap<>();

    /** Signer factories by name (e.g., "jwt") */
    private final Map<String, TokenSignerFactory> signerFactories = new ConcurrentHashMap<>();

    public CapabilityManager() {
        this(true);
    }

    /**
     * @param discover whether to load factories through {@link ServiceLoader}
     */
    public CapabilityManager(boolean discover) {
        if (discover) {
            ServiceLoader.load(PasswordHasherFactory.class).forEach(this::registerHasherFactory);
            ServiceLoader.load(TokenSignerFactory.class).forEach(this::registerSignerFactory);
            LOG.info("Discovered password hashers {} and token signers {}",
                    getHasherNames(), getSignerNames());
        }
    }

    public void registerHasherFactory(PasswordHasherFactory factory) {
        Objects.requireNonNull(factory, "factory");
        hasherFactories.put(key(factory.name()), factory);
    }

    public void registerSignerFactory(TokenSignerFactory factory) {
        Objects.requireNonNull(factory, "factory");
        signerFactories.put(key(factory.name()), factory);
    }

    public Optional<PasswordHasherFactory> getHasherFactory(String name) {
        return Optional.ofNullable(hasherFactories.get(key(name)));
    }

    public Optional<TokenSignerFactory> getSignerFactory(String name) {
        return Optional.ofNullable(signerFactories.get(key(name)));
    }

    /**
     * Creates the hasher named by {@code hash.algorithm}.
     *
     * @throws WardenException CONVERSION on {@code hash.algorithm} if no factory has that name
     */
    public PasswordHasher createHasher(WardenConfig config) throws WardenException {
        String name = config.getString(WardenConfig.HASH_ALGORITHM, WardenConfig.DEFAULT_HASH_ALGORITHM);
        PasswordHasherFactory factory = hasherFactories.get(key(name));
        if (factory == null) {
            throw WardenException.conversion(WardenConfig.HASH_ALGORITHM,
                    "unknown hash algorithm '" + name + "', available: " + getHasherNames());
        }
        return factory.create(config);
    }

    /**
     * Creates the signer named by {@code token.signer}.
     *
     * @throws WardenException CONVERSION on {@code token.signer} if no factory has that name
     */
    public TokenSigner createSigner(WardenConfig config) throws WardenException {
        String name = config.getString(WardenConfig.TOKEN_SIGNER, WardenConfig.DEFAULT_TOKEN_SIGNER);
        TokenSignerFactory factory = signerFactories.get(key(name));
        if (factory == null) {
            throw WardenException.conversion(WardenConfig.TOKEN_SIGNER,
                    "unknown token signer '" + name + "', available: " + getSignerNames());
        }
        return factory.create(config);
    }

    public List<String> getHasherNames() {
        return sorted(hasherFactories);
    }

    public List<String> getSignerNames() {
        return sorted(signerFactories);
    }

    private static List<String> sorted(Map<String, ?> factories) {
        List<String> names = new ArrayList<>(factories.keySet());
        Collections.sort(names);
        return names;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
