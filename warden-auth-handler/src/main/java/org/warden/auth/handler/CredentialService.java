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

import org.warden.auth.WardenException;
import org.warden.auth.spi.PasswordHasher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Hashes and checks passwords through the configured {@link PasswordHasher}.
 *
 * <p>A stored hash that cannot be parsed is an INTERNAL failure; a well-formed hash that simply
 * does not match is UNAUTHORIZED.
 */
public class CredentialService {

    private static final Logger LOG = LogManager.getLogger(CredentialService.class);

    private final PasswordHasher hasher;
    private final PasswordPolicy policy;

    public CredentialService(PasswordHasher hasher, PasswordPolicy policy) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Checks the password against the policy and hashes it.
     *
     * @param plaintext new password
     * @return opaque hash
     * @throws WardenException CONVERSION if the policy rejects the password, INTERNAL if hashing fails
     */
    public String hashNew(String plaintext) throws WardenException {
        policy.check(plaintext);
        return hash(plaintext);
    }

    /**
     * Hashes without a policy check, for rehashing a password that was already accepted once.
     */
    public String hash(String plaintext) throws WardenException {
        return hasher.hash(plaintext);
    }

    public boolean verify(String plaintext, String storedHash) throws WardenException {
        if (plaintext == null || storedHash == null) {
            return false;
        }
        return hasher.verify(plaintext, storedHash);
    }

    /**
     * Like {@link #verify} but raises on a mismatch.
     *
     * @throws WardenException UNAUTHORIZED on mismatch, INTERNAL on a malformed hash
     */
    public void check(String plaintext, String storedHash) throws WardenException {
        if (!verify(plaintext, storedHash)) {
            throw WardenException.unauthorized("password mismatch");
        }
    }

    public boolean needsRehash(String storedHash) {
        boolean rehash = hasher.needsRehash(storedHash);
        if (rehash) {
            LOG.debug("Stored hash does not match current {} settings", hasher.algorithm());
        }
        return rehash;
    }

    public PasswordHasher getHasher() {
        return hasher;
    }

    public PasswordPolicy getPolicy() {
        return policy;
    }
}
