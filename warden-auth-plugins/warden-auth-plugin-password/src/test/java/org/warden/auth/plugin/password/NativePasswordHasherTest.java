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

import org.warden.auth.ErrorCode;
import org.warden.auth.WardenException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link NativePasswordHasher}.
 */
@DisplayName("NativePasswordHasher Unit Tests")
class NativePasswordHasherTest {

    // Low work factor keeps the tests fast.
    private final NativePasswordHasher bcrypt = new NativePasswordHasher(NativePasswordHasher.Algorithm.BCRYPT, 4);
    private final NativePasswordHasher sha256 = new NativePasswordHasher(NativePasswordHasher.Algorithm.SHA256, 4);

    // ==================== Hash Generation Tests ====================

    @Test
    @DisplayName("UT-PWD-H-001: BCrypt hash differs from the plaintext and is salted")
    void testHash_Bcrypt() throws Exception {
        // Given
        String plainPassword = "secret123";

        // When
        String first = bcrypt.hash(plainPassword);
        String second = bcrypt.hash(plainPassword);

        // Then
        Assertions.assertTrue(first.startsWith("$2a$04$"), "BCrypt hash should carry its rounds");
        Assertions.assertNotEquals(plainPassword, first);
        Assertions.assertNotEquals(first, second, "Each hash uses a fresh salt");
    }

    @Test
    @DisplayName("UT-PWD-H-002: SHA-256 hash carries its prefix")
    void testHash_Sha256() throws Exception {
        // When
        String hashedPassword = sha256.hash("TestPassword");

        // Then
        Assertions.assertTrue(hashedPassword.startsWith("{SHA256}"));
        Assertions.assertEquals(hashedPassword, sha256.hash("TestPassword"));
    }

    // ==================== Verification Tests ====================

    @Test
    @DisplayName("UT-PWD-H-003: Verify accepts the right password and rejects a wrong one")
    void testVerify() throws Exception {
        // Given
        String bcryptHash = bcrypt.hash("secret123");
        String shaHash = sha256.hash("secret123");

        // Then
        Assertions.assertTrue(bcrypt.verify("secret123", bcryptHash));
        Assertions.assertFalse(bcrypt.verify("wrong-password", bcryptHash));
        Assertions.assertTrue(bcrypt.verify("secret123", shaHash), "Legacy hashes still verify");
        Assertions.assertFalse(sha256.verify("wrong-password", shaHash));
        Assertions.assertTrue(sha256.verify("secret123", bcryptHash));
    }

    @Test
    @DisplayName("UT-PWD-H-004: Malformed stored hash is an internal failure, not a mismatch")
    void testVerify_MalformedHash() {
        // When & Then
        WardenException truncated = Assertions.assertThrows(WardenException.class,
                () -> bcrypt.verify("secret123", "$2a$10$short"));
        WardenException unknown = Assertions.assertThrows(WardenException.class,
                () -> bcrypt.verify("secret123", "secret123"));

        Assertions.assertEquals(ErrorCode.INTERNAL, truncated.getCode());
        Assertions.assertEquals(ErrorCode.INTERNAL, unknown.getCode());
        Assertions.assertEquals("internal server error", unknown.getPublicMessage());
    }

    // ==================== Rehash Tests ====================

    @Test
    @DisplayName("UT-PWD-H-005: Weaker or foreign hashes need rehashing")
    void testNeedsRehash() throws Exception {
        // Given
        NativePasswordHasher stronger = new NativePasswordHasher(NativePasswordHasher.Algorithm.BCRYPT, 5);
        String weakHash = bcrypt.hash("secret123");

        // Then
        Assertions.assertFalse(bcrypt.needsRehash(weakHash));
        Assertions.assertTrue(stronger.needsRehash(weakHash));
        Assertions.assertTrue(bcrypt.needsRehash(sha256.hash("secret123")));
        Assertions.assertTrue(bcrypt.needsRehash("garbage"));
        Assertions.assertFalse(sha256.needsRehash(sha256.hash("secret123")));
    }

    @Test
    @DisplayName("UT-PWD-H-006: Detect algorithm from the stored hash")
    void testDetectAlgorithm() throws Exception {
        Assertions.assertEquals(NativePasswordHasher.Algorithm.BCRYPT,
                NativePasswordHasher.detectAlgorithm("$2a$10$abcdefghijklmnopqrstuv"));
        Assertions.assertEquals(NativePasswordHasher.Algorithm.SHA256,
                NativePasswordHasher.detectAlgorithm("{SHA256}abc="));
        Assertions.assertThrows(WardenException.class, () -> NativePasswordHasher.detectAlgorithm("{MD5}abc"));
    }

    @Test
    @DisplayName("UT-PWD-H-007: Work factor outside 4-31 is rejected")
    void testInvalidLogRounds() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new NativePasswordHasher(NativePasswordHasher.Algorithm.BCRYPT, 3));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new NativePasswordHasher(NativePasswordHasher.Algorithm.BCRYPT, 32));
    }
}
