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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.UUID;

/**
 * Unit tests for {@link Token} and {@link Audience}.
 */
@DisplayName("Token Unit Tests")
class TokenTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00.750Z");

    @Test
    @DisplayName("UT-API-TK-001: Timestamps are truncated to seconds")
    void testSecondPrecision() {
        // When
        Token token = Token.builder()
                .issuer("warden")
                .subject(UUID.randomUUID())
                .issuedAt(NOW)
                .expiration(NOW.plusSeconds(60))
                .build();

        // Then
        Assertions.assertEquals(Instant.parse("2024-03-01T10:00:00Z"), token.getIssuedAt());
        Assertions.assertEquals(Instant.parse("2024-03-01T10:01:00Z"), token.getExpiration().get());
        Assertions.assertNotNull(token.getId());
        Assertions.assertTrue(token.getAudience().isEmpty());
    }

    @Test
    @DisplayName("UT-API-TK-002: Expiration and not-before bound the active window")
    void testActiveWindow() {
        // Given
        Token token = Token.builder()
                .issuer("warden")
                .subject(UUID.randomUUID())
                .issuedAt(NOW)
                .notBefore(NOW.plusSeconds(10))
                .expiration(NOW.plusSeconds(20))
                .build();

        // Then
        Assertions.assertFalse(token.isActive(NOW));
        Assertions.assertTrue(token.isActive(NOW.plusSeconds(15)));
        Assertions.assertTrue(token.isExpired(NOW.plusSeconds(20)));
        Assertions.assertFalse(token.isActive(NOW.plusSeconds(20)));
    }

    @Test
    @DisplayName("UT-API-TK-003: Custom claims may not shadow registered claims")
    void testRegisteredClaimShadowing() throws Exception {
        Token.checkCustomClaims(Collections.singletonMap("scope", "read"));
        WardenException e = Assertions.assertThrows(WardenException.class,
                () -> Token.checkCustomClaims(Collections.singletonMap("sub", "someone-else")));
        Assertions.assertEquals(ErrorCode.CONVERSION, e.getCode());
        Assertions.assertEquals("sub", e.getField().orElse(null));
    }

    @Test
    @DisplayName("UT-API-TK-004: Audience shape follows the number of recipients")
    void testAudienceKinds() {
        Assertions.assertEquals(Audience.Kind.NONE, Audience.of(Collections.emptyList()).getKind());
        Assertions.assertEquals(Audience.Kind.ONE, Audience.of(Collections.singletonList("web")).getKind());
        Audience many = Audience.of(Arrays.asList("web", "cli"));
        Assertions.assertEquals(Audience.Kind.MANY, many.getKind());
        Assertions.assertTrue(many.contains("cli"));
        Assertions.assertEquals(Audience.one("web"), Audience.of(Collections.singletonList("web")));
    }
}
