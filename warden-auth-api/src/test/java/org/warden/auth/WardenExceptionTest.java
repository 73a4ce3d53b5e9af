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

/**
 * Unit tests for {@link WardenException}.
 */
@DisplayName("WardenException Unit Tests")
class WardenExceptionTest {

    @Test
    @DisplayName("UT-API-WE-001: Not found and conflict name the item")
    void testNotFoundAndConflict() {
        // When
        WardenException notFound = WardenException.notFound("member");
        WardenException conflict = WardenException.conflict("user");

        // Then
        Assertions.assertEquals(ErrorCode.NOT_FOUND, notFound.getCode());
        Assertions.assertEquals("member not found", notFound.getMessage());
        Assertions.assertEquals("member", notFound.getItem().orElse(null));
        Assertions.assertEquals(404, notFound.getStatus());
        Assertions.assertTrue(notFound.isExpected());

        Assertions.assertEquals(ErrorCode.CONFLICT, conflict.getCode());
        Assertions.assertEquals("user already exists", conflict.getMessage());
        Assertions.assertEquals(409, conflict.getStatus());
    }

    @Test
    @DisplayName("UT-API-WE-002: Conversion error carries field and formats message")
    void testConversion() {
        // When
        WardenException withMessage = WardenException.conversion("owner", "expected a boolean");
        WardenException withoutMessage = WardenException.conversion("roles", null);
        WardenException withoutField = WardenException.conversion(null, null);

        // Then
        Assertions.assertEquals("expected a boolean for field `owner`", withMessage.getMessage());
        Assertions.assertEquals("owner", withMessage.getField().orElse(null));
        Assertions.assertEquals(400, withMessage.getStatus());
        Assertions.assertEquals("invalid data format for field `roles`", withoutMessage.getMessage());
        Assertions.assertEquals("invalid data format", withoutField.getMessage());
        Assertions.assertFalse(withoutField.getField().isPresent());
    }

    @Test
    @DisplayName("UT-API-WE-003: Internal failures never leak their message")
    void testPublicMessageHidesInternalDetails() {
        // Given
        WardenException internal = WardenException.internal("bcrypt salt version mismatch",
                new IllegalArgumentException("Invalid salt version"));
        WardenException poisoned = WardenException.lockPoisoned("members", null);
        WardenException serverConversion = WardenException.conversion("exp", "bad timestamp", 500);

        // Then
        Assertions.assertEquals("internal server error", internal.getPublicMessage());
        Assertions.assertEquals("internal server error", poisoned.getPublicMessage());
        Assertions.assertEquals("internal server error", serverConversion.getPublicMessage());
        Assertions.assertFalse(internal.isExpected());
        Assertions.assertFalse(serverConversion.isExpected());
        Assertions.assertNotNull(internal.getCause());
    }

    @Test
    @DisplayName("UT-API-WE-004: Expected failures expose a fixed public message")
    void testPublicMessageForExpectedFailures() {
        Assertions.assertEquals("invalid credentials",
                WardenException.unauthorized("password mismatch for alice").getPublicMessage());
        Assertions.assertEquals("invalid token",
                WardenException.invalidToken("signature mismatch", null).getPublicMessage());
        Assertions.assertEquals("expired token", WardenException.expiredToken().getPublicMessage());
        Assertions.assertEquals("unsupported operation",
                WardenException.unsupported("cannot delete member fields").getPublicMessage());
        Assertions.assertEquals("member not found", WardenException.notFound("member").getPublicMessage());
    }

    @Test
    @DisplayName("UT-API-WE-005: toString contains the code and message")
    void testToString() {
        // Given
        WardenException exception = WardenException.inconsistentData("members", "dangling tenant");

        // When
        String text = exception.toString();

        // Then
        Assertions.assertTrue(text.contains("WardenException"));
        Assertions.assertTrue(text.contains("INCONSISTENT_DATA"));
        Assertions.assertTrue(text.contains("dangling tenant"));
        Assertions.assertInstanceOf(Exception.class, exception);
    }
}
