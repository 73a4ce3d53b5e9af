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


package org.warden.auth.spi;

import org.warden.auth.WardenException;

/**
 * Password hashing capability.
 *
 * <p>A hash is self-describing: it carries the algorithm and its parameters, so a hasher can
 * tell whether a stored hash was produced with weaker settings than its own.
 */
public interface PasswordHasher {

    /**
     * Algorithm name, e.g. {@code BCRYPT}.
     *
     * @return algorithm name
     */
    String algorithm();

    /**
     * Hashes a plaintext password with a fresh salt.
     *
     * @param plaintext password
     * @return opaque hash, never equal to the plaintext
     * @throws WardenException INTERNAL if the hashing library fails
     */
    String hash(String plaintext) throws WardenException;

    /**
     * Checks a plaintext password against a stored hash.
     *
     * @param plaintext password
     * @param storedHash hash produced by {@link #hash(String)}
     * @return false on a plain mismatch
     * @throws WardenException INTERNAL if the stored hash is malformed
     */
    boolean verify(String plaintext, String storedHash) throws WardenException;

    /**
     * Whether a stored hash should be replaced by a fresh one from this hasher.
     *
     * @param storedHash current hash
     * @return true if rehashing is needed
     */
    default boolean needsRehash(String storedHash) {
        return false;
    }
}
