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

import org.warden.auth.WardenException;
import org.warden.auth.spi.PasswordHasher;

import org.mindrot.jbcrypt.BCrypt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;

/**
 * Password hasher supporting BCrypt and legacy SHA-256 hashes.
 *
 * <p>New hashes are produced with the target algorithm. Verification detects the algorithm
 * from the stored hash, so hashes written under an earlier configuration keep working and can
 * be upgraded on the next successful login (see {@link #needsRehash(String)}).
 *
 * <p>Supported formats:
 * <ul>
 *   <li>BCrypt (default, recommended) - {@code $2a$<rounds>$<salt+hash>}</li>
 *   <li>SHA-256 - {@code {SHA256}<base64>}, unsalted, kept for backward compatibility</li>
 * </ul>
 */
public class NativePasswordHasher implements PasswordHasher {

    private static final String BCRYPT_PREFIX = "$2";
    private static final String SHA256_PREFIX = "{SHA256}";

    public static final int DEFAULT_LOG_ROUNDS = 10;
    public static final int MIN_LOG_ROUNDS = 4;
    public static final int MAX_LOG_ROUNDS = 31;

    /**
     * Hash algorithm enumeration.
     */
    public enum Algorithm {
        BCRYPT,
        SHA256
    }

    private final Algorithm target;
    private final int logRounds;

    public NativePasswordHasher(Algorithm target, int logRounds) {
        this.target = Objects.requireNonNull(target, "target algorithm is required");
        if (logRounds < MIN_LOG_ROUNDS || logRounds > MAX_LOG_ROUNDS) {
            throw new IllegalArgumentException("log rounds must be between " + MIN_LOG_ROUNDS
                    + " and " + MAX_LOG_ROUNDS + ", got " + logRounds);
        }
        this.logRounds = logRounds;
    }

    @Override
    public String algorithm() {
        return target.name();
    }

    public int getLogRounds() {
        return logRounds;
    }

    @Override
    public String hash(String plaintext) throws WardenException {
        Objects.requireNonNull(plaintext, "plaintext is required");
        switch (target) {
            case BCRYPT:
                try {
                    return BCrypt.hashpw(plaintext, BCrypt.gensalt(logRounds));
                } catch (IllegalArgumentException e) {
                    throw WardenException.internal("bcrypt hashing failed", e);
                }
            case SHA256:
                return SHA256_PREFIX + sha256(plaintext);
            default:
                throw WardenException.internal("unknown algorithm " + target, null);
        }
    }

    @Override
    public boolean verify(String plaintext, String storedHash) throws WardenException {
        Objects.requireNonNull(plaintext, "plaintext is required");
        if (storedHash == null) {
            throw WardenException.internal("no stored password hash", null);
        }
        switch (detectAlgorithm(storedHash)) {
            case BCRYPT:
                try {
                    return BCrypt.checkpw(plaintext, storedHash);
                } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                    throw WardenException.internal("malformed bcrypt hash", e);
                }
            case SHA256:
                byte[] expected = storedHash.substring(SHA256_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
                byte[] actual = sha256(plaintext).getBytes(StandardCharsets.UTF_8);
                return MessageDigest.isEqual(expected, actual);
            default:
                throw WardenException.internal("unsupported password hash format", null);
        }
    }

    /**
     * A stored hash needs rehashing when it was produced by another algorithm, with fewer
     * BCrypt rounds than configured, or is not recognised at all.
     */
    @Override
    public boolean needsRehash(String storedHash) {
        if (storedHash == null) {
            return true;
        }
        Algorithm current;
        try {
            current = detectAlgorithm(storedHash);
        } catch (WardenException e) {
            return true;
        }
        if (current != target) {
            return true;
        }
        if (current == Algorithm.BCRYPT) {
            // BCrypt format: $2a$<rounds>$<salt+hash>
            String[] parts = storedHash.split("\\$");
            if (parts.length < 3) {
                return true;
            }
            try {
                return Integer.parseInt(parts[2]) < logRounds;
            } catch (NumberFormatException e) {
                return true;
            }
        }
        return false;
    }

    /**
     * Detects the hashing algorithm from a stored hash.
     *
     * @param storedHash stored hash
     * @return detected algorithm
     * @throws WardenException INTERNAL if the format is not recognised
     */
    public static Algorithm detectAlgorithm(String storedHash) throws WardenException {
        if (storedHash.startsWith(BCRYPT_PREFIX)) {
            return Algorithm.BCRYPT;
        } else if (storedHash.startsWith(SHA256_PREFIX)) {
            return Algorithm.SHA256;
        }
        throw WardenException.internal("unknown password hash format", null);
    }

    private static String sha256(String input) throws WardenException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw WardenException.internal("SHA-256 algorithm not available", e);
        }
    }

    @Override
    public String toString() {
        return "NativePasswordHasher{" + target + (target == Algorithm.BCRYPT ? ", rounds=" + logRounds : "") + "}";
    }
}
