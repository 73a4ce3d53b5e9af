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

/**
 * Unit tests for {@link AuthenticationResult}.
 */
@DisplayName("AuthenticationResult Unit Tests")
class AuthenticationResultTest {

    @Test
    @DisplayName("UT-API-AR-001: Create successful result with principal")
    void testCreateSuccess() throws Exception {
        // Given
        User user = User.builder()
                .username("alice")
                .contact(Contact.email(EmailAddress.parse("alice@example.com")))
                .password("$2a$10$hash")
                .build();
        Token token = Token.builder().issuer("warden").subject(user.getId()).issuedAt(Instant.now()).build();

        // When
        AuthenticationResult result = AuthenticationResult.success(new AuthenticatedPrincipal(user, token, "a.b.c"));

        // Then
        Assertions.assertEquals(AuthenticationResult.Status.SUCCESS, result.getStatus());
        Assertions.assertTrue(result.isSuccess());
        Assertions.assertFalse(result.isFailure());
        Assertions.assertFalse(result.getPrincipal().getUser().getPassword().isPresent());
        Assertions.assertFalse(result.getPublicMessage().isPresent());
        Assertions.assertNull(result.getException());
        Assertions.assertTrue(result.toString().contains("SUCCESS"));
    }

    @Test
    @DisplayName("UT-API-AR-002: Unknown login and wrong password look the same to the caller")
    void testUniformFailureMessage() {
        // Given
        AuthenticationResult notFound = AuthenticationResult.failure(WardenException.notFound("user"));
        AuthenticationResult mismatch = AuthenticationResult.failure(WardenException.unauthorized("wrong password"));

        // Then
        Assertions.assertEquals(ErrorCode.NOT_FOUND, notFound.getException().getCode());
        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, mismatch.getException().getCode());
        Assertions.assertEquals(notFound.getPublicMessage(), mismatch.getPublicMessage());
        Assertions.assertEquals("invalid credentials", mismatch.getPublicMessage().get());
        Assertions.assertNull(notFound.getPrincipal());
    }

    @Test
    @DisplayName("UT-API-AR-003: Null arguments are rejected")
    void testNullArguments() {
        Assertions.assertThrows(NullPointerException.class,
                () -> AuthenticationResult.success(null));
        Assertions.assertThrows(NullPointerException.class,
                () -> AuthenticationResult.failure(null));
    }
}
