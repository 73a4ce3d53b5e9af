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

import org.warden.auth.ErrorCode;
import org.warden.auth.WardenException;

import java.util.Optional;

/**
 * Generic keyed storage contract.
 *
 * <p>Implementations must be safe for concurrent use. Every failure is reported as a
 * {@link WardenException} whose item name is {@link #name()}:
 * <ul>
 *   <li>{@code create} of an existing key - CONFLICT, the existing record is left untouched</li>
 *   <li>{@code read}, {@code patch}, {@code update}, {@code delete} of an absent key - NOT_FOUND</li>
 *   <li>concurrency-control failure - LOCK_POISONED</li>
 * </ul>
 *
 * @param <K> primary key type
 * @param <V> record type
 * @param <P> typed patch descriptor
 */
public interface Table<K, V, P> {

    /**
     * Table name, used as the item name in error messages.
     *
     * @return table name
     */
    String name();

    /**
     * Inserts a new record.
     *
     * @param item record to insert
     * @return key of the inserted record
     * @throws WardenException CONFLICT if the key (or another unique attribute) is taken
     */
    K create(V item) throws WardenException;

    V read(K key) throws WardenException;

    /**
     * Reads a record, mapping NOT_FOUND to an empty result.
     *
     * @param key primary key
     * @return record, or empty if absent
     * @throws WardenException for failures other than NOT_FOUND
     */
    default Optional<V> find(K key) throws WardenException {
        try {
            return Optional.of(read(key));
        } catch (WardenException e) {
            if (e.getCode() == ErrorCode.NOT_FOUND) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Applies the fields present in {@code patch} and leaves all others untouched.
     *
     * @param key primary key
     * @param patch partial update
     * @return the patched record
     * @throws WardenException NOT_FOUND if absent, CONVERSION if a field value is rejected
     */
    V patch(K key, P patch) throws WardenException;

    /**
     * Replaces the record stored under the item's own key.
     *
     * @param item replacement record
     * @return key of the replaced record
     * @throws WardenException NOT_FOUND if no record has that key
     */
    K update(V item) throws WardenException;

    void delete(K key) throws WardenException;

    int size() throws WardenException;
}
