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
import org.warden.auth.WardenException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the locking and failure model of {@link MemoryTable}.
 */
@DisplayName("MemoryTable Unit Tests")
class MemoryTableTest {

    private WordTable table;

    @BeforeEach
    void setUp() {
        table = new WordTable();
    }

    @Test
    @DisplayName("UT-STORE-T-001: Interrupted lock wait fails the operation only")
    void testInterruptedLockWait() throws Exception {
        // Given
        table.create("alpha");
        Thread.currentThread().interrupt();

        // When
        WardenException e = Assertions.assertThrows(WardenException.class, () -> table.read("alpha"));

        // Then
        Assertions.assertTrue(Thread.interrupted(), "interrupt flag must be restored");
        Assertions.assertEquals(ErrorCode.LOCK_POISONED, e.getCode());
        Assertions.assertFalse(table.isPoisoned());
        Assertions.assertEquals("alpha", table.read("alpha"));
    }

    @Test
    @DisplayName("UT-STORE-T-002: Runtime failure inside a write poisons the table")
    void testRuntimeFailurePoisons() throws Exception {
        // Given
        table.create("alpha");
        table.failIndexing = true;

        // When
        WardenException e = Assertions.assertThrows(WardenException.class, () -> table.create("beta"));

        // Then
        Assertions.assertEquals(ErrorCode.LOCK_POISONED, e.getCode());
        Assertions.assertEquals("internal server error", e.getPublicMessage());
        Assertions.assertTrue(table.isPoisoned());
        table.failIndexing = false;
        WardenException later = Assertions.assertThrows(WardenException.class, () -> table.read("alpha"));
        Assertions.assertEquals(ErrorCode.LOCK_POISONED, later.getCode());
    }

    @Test
    @DisplayName("UT-STORE-T-003: Checked failures do not poison the table")
    void testCheckedFailureDoesNotPoison() throws Exception {
        // Given
        table.create("alpha");

        // When
        Assertions.assertThrows(WardenException.class, () -> table.create("alpha"));
        Assertions.assertThrows(WardenException.class, () -> table.patch("alpha", ""));

        // Then
        Assertions.assertFalse(table.isPoisoned());
        Assertions.assertEquals("alpha", table.read("alpha"));
        Assertions.assertEquals(1, table.size());
    }

    /**
     * Table of words keyed by themselves, patched by appending a suffix.
     */
    private static class WordTable extends MemoryTable<String, String, String> {
        private volatile boolean failIndexing;

        WordTable() {
            super("word");
        }

        @Override
        protected String keyOf(String item) {
            return item;
        }

        @Override
        protected String applyPatch(String current, String patch) throws WardenException {
            if (patch.isEmpty()) {
                throw WardenException.conversion("suffix", "suffix is required");
            }
            return current + patch;
        }

        @Override
        protected void indexAdd(String item) {
            if (failIndexing) {
                throw new IllegalStateException("index corrupted");
            }
        }
    }
}
