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

import org.warden.auth.AuthenticatedPrincipal;
import org.warden.auth.AuthenticationResult;
import org.warden.auth.Contact;
import org.warden.auth.EmailAddress;
import org.warden.auth.ErrorCode;
import org.warden.auth.User;
import org.warden.auth.WardenConfig;
import org.warden.auth.WardenException;
import org.warden.auth.store.memory.MemoryDatabase;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

@DisplayName("WardenContext Unit Tests")
class WardenContextTest {

    @TempDir
    Path tempDir;

    private WardenConfig config() {
        return WardenConfig.builder()
                .property(WardenConfig.BCRYPT_LOG_ROUNDS, "4")
                .property(WardenConfig.TOKEN_KEY_PATH, tempDir.resolve("signing_keys.json").toString())
                .property(WardenConfig.TOKEN_TTL_SECONDS, "60")
                .property(WardenConfig.TOKEN_AUDIENCE, "web, cli")
                .build();
    }

    @Test
    @DisplayName("UT-HDL-WC-001: Context wires register, authenticate and authorize end to end")
    void testEndToEnd() throws Exception {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        MemoryDatabase database = new MemoryDatabase();
        User user = User.builder()
                .username("bob")
                .contact(Contact.email(EmailAddress.parse("bob@example.com")))
                .password("secret123")
                .build();

        try (WardenContext context = WardenContext.builder()
                .config(config())
                .database(database)
                .clock(clock)
                .build()) {
            // When
            AuthenticatedPrincipal registered = context.authentication().register(user);
            AuthenticationResult login = context.authentication().authenticate("bob@example.com", "secret123");

            // Then
            Assertions.assertTrue(Files.exists(tempDir.resolve("signing_keys.json")));
            Assertions.assertTrue(login.isSuccess());
            Assertions.assertEquals(2, registered.getToken().getAudience().getValues().size());
            Assertions.assertEquals(user.getId(),
                    context.authentication().authorize(login.getPrincipal().getEncodedToken()));
            clock.advance(Duration.ofSeconds(60));
            Assertions.assertEquals(ErrorCode.EXPIRED_TOKEN, Assertions.assertThrows(WardenException.class,
                    () -> context.authentication().authorize(registered.getEncodedToken())).getCode());
        }
        Assertions.assertEquals(0, database.users().size());
    }

    @Test
    @DisplayName("UT-HDL-WC-002: Tokens survive a restart with the same key file")
    void testRestartKeepsKeys() throws Exception {
        String encoded;
        User user = User.builder()
                .username("carol")
                .contact(Contact.email(EmailAddress.parse("carol@example.com")))
                .password("secret123")
                .build();
        try (WardenContext first = WardenContext.create(config(), new MemoryDatabase())) {
            encoded = first.authentication().register(user).getEncodedToken();
        }

        try (WardenContext second = WardenContext.create(config(), new MemoryDatabase())) {
            Assertions.assertEquals(user.getId(), second.tokens().authorize(encoded));
        }
    }

    @Test
    @DisplayName("UT-HDL-WC-003: Invalid configuration fails at startup")
    void testInvalidConfig() {
        WardenConfig bad = config().toBuilder().property(WardenConfig.TOKEN_TTL_SECONDS, "-1").build();

        WardenException e = Assertions.assertThrows(WardenException.class,
                () -> WardenContext.create(bad, new MemoryDatabase()));

        Assertions.assertEquals(ErrorCode.CONVERSION, e.getCode());
        Assertions.assertEquals(WardenConfig.TOKEN_TTL_SECONDS, e.getField().orElse(null));
    }
}
