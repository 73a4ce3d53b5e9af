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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Secondary index from a key to an insertion-ordered list of distinct values.
 *
 * <p>Not thread-safe: callers hold the owning table's lock.
 */
final class ListIndex<K, V> {

    private final Map<K, List<V>> entries = new HashMap<>();

    /**
     * Appends {@code value} under {@code key}, removing an earlier occurrence first so each
     * value appears at most once.
     */
    void add(K key, V value) {
        List<V> values = entries.computeIfAbsent(key, k -> new ArrayList<>());
        values.remove(value);
        values.add(value);
    }

    void remove(K key, V value) {
        List<V> values = entries.get(key);
        if (values == null) {
            return;
        }
        values.remove(value);
        if (values.isEmpty()) {
            entries.remove(key);
        }
    }

    List<V> get(K key) {
        List<V> values = entries.get(key);
        return values == null ? Collections.emptyList() : new ArrayList<>(values);
    }

    boolean contains(K key, V value) {
        List<V> values = entries.get(key);
        return values != null && values.contains(value);
    }

    Set<Map.Entry<K, List<V>>> entrySet() {
        return entries.entrySet();
    }

    void clear() {
        entries.clear();
    }
}
