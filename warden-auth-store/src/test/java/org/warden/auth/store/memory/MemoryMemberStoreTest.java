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

import org.warden.auth.ErrorCode;
import org.warden.auth.Member;
import org.warden.auth.MemberKey;
import org.warden.auth.MemberPatch;
import org.warden.auth.WardenException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Unit tests for {@link MemoryMemberStore}.
 */
@DisplayName("MemoryMemberStore Unit Tests")
class MemoryMemberStoreTest {

    private static final UUID T1 = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID T2 = UUID.fromString("00000000-0000-0000-0000-0000000000a2");
    private static final UUID P1 = UUID.fromString("00000000-0000-0000-0000-0000000000b1");
    private static final UUID P2 = UUID.fromString("00000000-0000-0000-0000-0000000000b2");
    private static final UUID R1 = UUID.fromString("00000000-0000-0000-0000-0000000000c1");
    private static final UUID R2 = UUID.fromString("00000000-0000-0000-0000-0000000000c2");

    private MemoryMemberStore store;

    @BeforeEach
    void setUp() {
        store = new MemoryMemberStore();
    }

    private static Member member(UUID tenant, UUID principal, String title, boolean owner, UUID... roles) {
        return Member.builder()
                .tenantId(tenant)
                .principalId(principal)
                .title(title)
                .owner(owner)
                .roles(Arrays.asList(roles))
                .build();
    }

    @Test
    @DisplayName("UT-STORE-M-001: Create, get, patch title, delete")
    void testMembershipLifecycle() throws Exception {
        // Given
        Member owner = member(T1, P1, "Owner", true, R1);
        MemberKey key = MemberKey.of(T1, P1);

        // When
        MemberKey created = store.create(owner);

        // Then
        Assertions.assertEquals(key, created);
        Assertions.assertEquals(owner, store.read(key));

        // When
        store.patch(key, MemberPatch.builder().title("Lead").build());

        // Then
        Member patched = store.read(key);
        Assertions.assertEquals("Lead", patched.getTitle());
        Assertions.assertTrue(patched.isOwner());
        Assertions.assertEquals(Collections.singleton(R1), patched.getRoles());

        // When
        store.delete(key);

        // Then
        WardenException e = Assertions.assertThrows(WardenException.class, () -> store.read(key));
        Assertions.assertEquals(ErrorCode.NOT_FOUND, e.getCode());
        Assertions.assertEquals("member not found", e.getMessage());
        Assertions.assertTrue(store.principalsOf(T1).isEmpty());
        Assertions.assertTrue(store.tenantsOf(P1).isEmpty());
        store.checkConsistency();
    }

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("UT-STORE-M-002: Duplicate key conflicts and leaves the existing record")
        void testDuplicateCreate() throws Exception {
            // Given
            Member original = member(T1, P1, "Owner", true, R1);
            store.create(original);

            // When
            WardenException e = Assertions.assertThrows(WardenException.class,
                    () -> store.create(member(T1, P1, "Intruder", false)));

            // Then
            Assertions.assertEquals(ErrorCode.CONFLICT, e.getCode());
            Assertions.assertEquals(original, store.read(MemberKey.of(T1, P1)));
            Assertions.assertEquals(Collections.singletonList(P1), store.principalsOf(T1));
            Assertions.assertEquals(1, store.size());
        }

        @Test
        @DisplayName("UT-STORE-M-003: Both indexes reflect every membership")
        void testIndexesAfterCreate() throws Exception {
            // When
            store.create(member(T1, P1, "a", false));
            store.create(member(T1, P2, "b", false));
            store.create(member(T2, P1, "c", false));

            // Then
            Assertions.assertEquals(Arrays.asList(P1, P2), store.principalsOf(T1));
            Assertions.assertEquals(Collections.singletonList(P1), store.principalsOf(T2));
            Assertions.assertEquals(Arrays.asList(T1, T2), store.tenantsOf(P1));
            Assertions.assertEquals(Collections.singletonList(T1), store.tenantsOf(P2));
            Assertions.assertEquals(2, store.findByTenant(T1).size());
            Assertions.assertEquals(2, store.findByPrincipal(P1).size());
            store.checkConsistency();
        }
    }

    @Nested
    @DisplayName("Patch and update")
    class MutationTests {

        @Test
        @DisplayName("UT-STORE-M-004: Patching owner leaves title and roles unchanged")
        void testPatchOwnerOnly() throws Exception {
            // Given
            store.create(member(T1, P1, "Owner", true, R1, R2));

            // When
            Member patched = store.patch(MemberKey.of(T1, P1), MemberPatch.builder().owner(false).build());

            // Then
            Assertions.assertFalse(patched.isOwner());
            Assertions.assertEquals("Owner", patched.getTitle());
            Assertions.assertEquals(Arrays.asList(R1, R2), new java.util.ArrayList<>(patched.getRoles()));
            Assertions.assertEquals(Collections.singletonList(P1), store.principalsOf(T1));
            store.checkConsistency();
        }

        @Test
        @DisplayName("UT-STORE-M-005: Patch, update and delete of an absent key are NOT_FOUND")
        void testAbsentKey() {
            MemberKey missing = MemberKey.of(T1, P1);
            Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(WardenException.class,
                    () -> store.patch(missing, MemberPatch.builder().title("x").build())).getCode());
            Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(WardenException.class,
                    () -> store.update(member(T1, P1, "x", false))).getCode());
            Assertions.assertEquals(ErrorCode.NOT_FOUND, Assertions.assertThrows(WardenException.class,
                    () -> store.delete(missing)).getCode());
        }

        @Test
        @DisplayName("UT-STORE-M-006: Update under a new key moves the membership and its index entries")
        void testUpdateMoves() throws Exception {
            // Given
            store.create(member(T1, P1, "Owner", true, R1));

            // When
            MemberKey moved = store.update(MemberKey.of(T1, P1), member(T2, P1, "Owner", true, R1));

            // Then
            Assertions.assertEquals(MemberKey.of(T2, P1), moved);
            Assertions.assertFalse(store.find(MemberKey.of(T1, P1)).isPresent());
            Assertions.assertTrue(store.principalsOf(T1).isEmpty());
            Assertions.assertEquals(Collections.singletonList(P1), store.principalsOf(T2));
            Assertions.assertEquals(Collections.singletonList(T2), store.tenantsOf(P1));
            store.checkConsistency();
        }

        @Test
        @DisplayName("UT-STORE-M-007: Moving onto an occupied key conflicts without changes")
        void testMoveConflict() throws Exception {
            // Given
            store.create(member(T1, P1, "a", false));
            store.create(member(T2, P1, "b", false));

            // When
            WardenException e = Assertions.assertThrows(WardenException.class,
                    () -> store.update(MemberKey.of(T1, P1), member(T2, P1, "a", false)));

            // Then
            Assertions.assertEquals(ErrorCode.CONFLICT, e.getCode());
            Assertions.assertEquals("a", store.read(MemberKey.of(T1, P1)).getTitle());
            Assertions.assertEquals("b", store.read(MemberKey.of(T2, P1)).getTitle());
            store.checkConsistency();
        }

        @Test
        @DisplayName("UT-STORE-M-008: Field deletion is always unsupported")
        void testDeleteFieldsUnsupported() throws Exception {
            // Given
            store.create(member(T1, P1, "Owner", true, R1));
            List<List<String>> requests = Arrays.asList(
                    Collections.<String>emptyList(),
                    Collections.singletonList("title"),
                    Arrays.asList("owner", "roles", "unknown"));

            // When & Then
            for (List<String> fields : requests) {
                WardenException e = Assertions.assertThrows(WardenException.class,
                        () -> store.deleteFields(MemberKey.of(T1, P1), fields));
                Assertions.assertEquals(ErrorCode.UNSUPPORTED_OPERATION, e.getCode());
            }
            WardenException absent = Assertions.assertThrows(WardenException.class,
                    () -> store.deleteFields(MemberKey.of(T2, P2), Collections.singletonList("title")));
            Assertions.assertEquals(ErrorCode.UNSUPPORTED_OPERATION, absent.getCode());
            Assertions.assertEquals("Owner", store.read(MemberKey.of(T1, P1)).getTitle());
        }
    }
}
