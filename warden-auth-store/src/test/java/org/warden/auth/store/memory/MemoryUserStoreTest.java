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


package org.warden.auth.store.memory;

import org.warden.auth.Contact;
import org.warden.auth.EmailAddress;
import org.warden.auth.ErrorCode;
import org.warden.auth.Phone;
import org.warden.auth.User;
import org.warden.auth.UserPatch;
import org.warden.auth.WardenException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MemoryUserStore}.
 */
@DisplayName("MemoryUserStore Unit Tests")
class MemoryUserStoreTest {

    private MemoryUserStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryUserStore();
    }

    private static User user(String username, String email, String phone) throws WardenException {
        return User.builder()
                .username(username)
                .contact(Contact.of(email != null ? EmailAddress.parse(email) : null,
                        phone != null ? Phone.parse(phone) : null))
                .password("{SHA256}hash")
                .build();
    }

    @Test
    @DisplayName("UT-STORE-U-001: findByLogin matches email, phone and username")
    void testFindByLogin() throws Exception {
        // Given
        User alice = user("Alice", "Alice@Example.com", "+15550100");
        store.create(alice);

        // Then
        Assertions.assertEquals(alice.getId(), store.findByLogin("alice@example.com").get().getId());
        Assertions.assertEquals(alice.getId(), store.findByLogin("+15550100").get().getId());
        Assertions.assertEquals(alice.getId(), store.findByLogin(" ALICE ").get().getId());
        Assertions.assertFalse(store.findByLogin("bob@example.com").isPresent());
        Assertions.assertTrue(store.findByLogin("alice").get().getPassword().isPresent());
    }

    @Test
    @DisplayName("UT-STORE-U-002: Duplicate email, phone or username conflicts")
    void testUniqueAttributes() throws Exception {
        // Given
        store.create(user("alice", "alice@example.com", "+15550100"));

        // When
        WardenException email = Assertions.assertThrows(WardenException.class,
                () -> store.create(user("alice2", "ALICE@example.com", null)));
        WardenException phone = Assertions.assertThrows(WardenException.class,
                () -> store.create(user("alice3", null, "+15550100")));
        WardenException username = Assertions.assertThrows(WardenException.class,
                () -> store.create(user("Alice", "other@example.com", null)));

        // Then
        Assertions.assertEquals(ErrorCode.CONFLICT, email.getCode());
        Assertions.assertEquals("email already exists", email.getMessage());
        Assertions.assertEquals("phone", phone.getItem().orElse(null));
        Assertions.assertEquals("username", username.getItem().orElse(null));
        Assertions.assertEquals(1, store.size());
    }

    @Test
    @DisplayName("UT-STORE-U-003: Patch re-indexes a changed email")
    void testPatchReindexes() throws Exception {
        // Given
        User alice = user("alice", "alice@example.com", null);
        store.create(alice);

        // When
        store.patch(alice.getId(), UserPatch.builder().email(EmailAddress.parse("alice@new.example.com")).build());

        // Then
        Assertions.assertFalse(store.findByLogin("alice@example.com").isPresent());
        Assertions.assertTrue(store.findByLogin("alice@new.example.com").isPresent());
        store.create(user("bob", "alice@example.com", null));
    }

    @Test
    @DisplayName("UT-STORE-U-004: Patch onto another user's email conflicts without changes")
    void testPatchConflict() throws Exception {
        // Given
        User alice = user("alice", "alice@example.com", null);
        User bob = user("bob", "bob@example.com", null);
        store.create(alice);
        store.create(bob);

        // When
        WardenException e = Assertions.assertThrows(WardenException.class, () -> store.patch(bob.getId(),
                UserPatch.builder().email(EmailAddress.parse("alice@example.com")).build()));

        // Then
        Assertions.assertEquals(ErrorCode.CONFLICT, e.getCode());
        Assertions.assertEquals(bob.getId(), store.findByLogin("bob@example.com").get().getId());
        Assertions.assertEquals(alice.getId(), store.findByLogin("alice@example.com").get().getId());
    }

    @Test
    @DisplayName("UT-STORE-U-005: Delete frees the unique attributes")
    void testDelete() throws Exception {
        // Given
        User alice = user("alice", "alice@example.com", "+15550100");
        store.create(alice);

        // When
        store.delete(alice.getId());

        // Then
        Assertions.assertFalse(store.findByLogin("alice").isPresent());
        Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(WardenException.class,
                () -> store.read(alice.getId())).getCode());
        store.create(user("alice", "alice@example.com", "+15550100"));
    }

    @Test
    @DisplayName("UT-STORE-U-006: A login value cannot be shared across email, phone and username")
    void testCrossAttributeConflicts() throws Exception {
        // Given
        User alice = user("alice", "alice@example.com", "+15550100");
        store.create(alice);

        // When
        WardenException usernameIsEmail = Assertions.assertThrows(WardenException.class,
                () -> store.create(user("Alice@Example.com", "bob@example.com", null)));
        WardenException usernameIsPhone = Assertions.assertThrows(WardenException.class,
                () -> store.create(user("+15550100", "carol@example.com", null)));
        WardenException phoneIsUsername = Assertions.assertThrows(WardenException.class,
                () -> store.create(user("dave", null, "alice")));

        // Then
        Assertions.assertEquals("username", usernameIsEmail.getItem().orElse(null));
        Assertions.assertEquals("username", usernameIsPhone.getItem().orElse(null));
        Assertions.assertEquals("phone", phoneIsUsername.getItem().orElse(null));
        Assertions.assertEquals(1, store.size());
        Assertions.assertEquals(alice.getId(), store.findByLogin("alice").get().getId());
    }
}
