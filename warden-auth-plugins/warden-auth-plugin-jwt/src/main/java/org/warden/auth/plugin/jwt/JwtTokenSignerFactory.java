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


package org.warden.auth.plugin.jwt;

import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;
import org.warden.auth.spi.TokenSigner;
import org.warden.auth.spi.TokenSignerFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Factory for {@link JwtTokenSigner} instances.
 *
 * <p>This factory is discovered via Java ServiceLoader mechanism.
 * Configuration file: META-INF/services/org.warden.auth.spi.TokenSignerFactory
 *
 * <p>Configuration properties:
 * <ul>
 *   <li><b>token.algorithm</b> - ES256 or HS256, default: ES256</li>
 *   <li><b>token.key_path</b> - Key file, created on first start, default: signing_keys.json</li>
 * </ul>
 */
public class JwtTokenSignerFactory implements TokenSignerFactory {

    private static final Logger LOG = LogManager.getLogger(JwtTokenSignerFactory.class);

    private static final String SIGNER_NAME = "jwt";

    @Override
    public String name() {
        return SIGNER_NAME;
    }

    @Override
    public TokenSigner create(WardenConfig config) throws WardenException {
        SigningKeys.Algorithm algorithm = SigningKeys.Algorithm.parse(
                config.getString(WardenConfig.TOKEN_ALGORITHM, WardenConfig.DEFAULT_TOKEN_ALGORITHM));
        String location = config.getString(WardenConfig.TOKEN_KEY_PATH, WardenConfig.DEFAULT_TOKEN_KEY_PATH);
        Path path;
        try {
            path = Paths.get(location);
        } catch (InvalidPathException e) {
            throw WardenException.conversion(WardenConfig.TOKEN_KEY_PATH, "invalid path '" + location + "'");
        }
        JwtTokenSigner signer = new JwtTokenSigner(new SigningKeyFile(path).loadOrCreate(algorithm));
        LOG.info("Initialized token signer: {}", signer);
        return signer;
    }
}
