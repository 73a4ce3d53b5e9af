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


package org.warden.auth.plugin.password;

import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;
import org.warden.auth.spi.PasswordHasher;
import org.warden.auth.spi.PasswordHasherFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base factory for {@link NativePasswordHasher}; one subclass per target algorithm.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li><b>hash.bcrypt.log_rounds</b> - BCrypt work factor (4-31), default: 10</li>
 * </ul>
 */
abstract class NativePasswordHasherFactory implements PasswordHasherFactory {

    private static final Logger LOG = LogManager.getLogger(NativePasswordHasherFactory.class);

    private final NativePasswordHasher.Algorithm algorithm;

    NativePasswordHasherFactory(NativePasswordHasher.Algorithm algorithm) {
        this.algorithm = algorithm;
    }

    @Override
    public String name() {
        return algorithm.name();
    }

    @Override
    public PasswordHasher create(WardenConfig config) throws WardenException {
        int logRounds = config.getInt(WardenConfig.BCRYPT_LOG_ROUNDS, NativePasswordHasher.DEFAULT_LOG_ROUNDS);
        if (logRounds < NativePasswordHasher.MIN_LOG_ROUNDS || logRounds > NativePasswordHasher.MAX_LOG_ROUNDS) {
            throw WardenException.conversion(WardenConfig.BCRYPT_LOG_ROUNDS,
                    "must be between " + NativePasswordHasher.MIN_LOG_ROUNDS + " and "
                            + NativePasswordHasher.MAX_LOG_ROUNDS + ", got " + logRounds);
        }
        NativePasswordHasher hasher = new NativePasswordHasher(algorithm, logRounds);
        LOG.info("Initialized password hasher: {}", hasher);
        return hasher;
    }
}
