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

import org.warden.auth.WardenException;
import org.warden.auth.spi.Table;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link Table} backed by a hash map.
 *
 * <p>One {@link ReentrantReadWriteLock} guards the primary map together with every secondary
 * index a subclass maintains through {@link #indexAdd} / {@link #indexRemove}, so a reader never
 * observes the primary table and an index out of step. All validation (key conflicts, patch
 * conversion, unique attributes) runs before the first mutation, so a failed operation leaves
 * no partial change behind.
 *
 * <p>Failure model:
 * <ul>
 *   <li>Interrupted while waiting for the lock - the operation fails with LOCK_POISONED and the
 *       thread's interrupt flag is restored; the table stays usable.</li>
 *   <li>A runtime exception escaping a write section may have left the structures half
 *       updated. The table is poisoned: that operation and every later one fail with
 *       LOCK_POISONED.</li>
 * </ul>
 *
 * @param <K> primary key type
 * @param <V> record type
 * @param <P> patch descriptor type
 */
public abstract class MemoryTable<K, V, P> implements Table<K, V, P> {

    private static final Logger LOG = LogManager.getLogger(MemoryTable.class);

    private final String name;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // guarded by lock
    private final Map<K, V> rows = new HashMap<>();
    private volatile RuntimeException poisonCause;

    protected MemoryTable(String name) {
        this.name = Objects.requireNonNull(name, "name is required");
    }

    /**
     * Body of a locked section.
     */
    @FunctionalInterface
    protected interface Section<T> {
        T run() throws WardenException;
    }

    protected abstract K keyOf(V item);

    protected abstract V applyPatch(V current, P patch) throws WardenException;

    /**
     * Rejects {@code item} if one of its unique attributes is held by another record. Called
     * under the write lock before any mutation.
     *
     * @param item record about to be stored
     * @param replaced record it replaces, or null on create
     * @throws WardenException CONFLICT naming the attribute
     */
    protected void checkUnique(V item, V replaced) throws WardenException {
    }

    protected void indexAdd(V item) {
    }

    protected void indexRemove(V item) {
    }

    protected void indexClear() {
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public K create(V item) throws WardenException {
        Objects.requireNonNull(item, "item is required");
        return inWriteLock(() -> {
            K key = keyOf(item);
            if (rows.containsKey(key)) {
                throw WardenException.conflict(name);
            }
            checkUnique(item, null);
            rows.put(key, item);
            indexAdd(item);
            LOG.debug("Created {} {}", name, key);
            return key;
        });
    }

    @Override
    public V read(K key) throws WardenException {
        Objects.requireNonNull(key, "key is required");
        return inReadLock(() -> row(key));
    }

    @Override
    public V patch(K key, P patch) throws WardenException {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(patch, "patch is required");
        return inWriteLock(() -> {
            V current = row(key);
            V updated = applyPatch(current, patch);
            if (!key.equals(keyOf(updated))) {
                throw WardenException.internal("patch changed the key of " + name + " " + key, null);
            }
            checkUnique(updated, current);
            indexRemove(current);
            rows.put(key, updated);
            indexAdd(updated);
            LOG.debug("Patched {} {}", name, key);
            return updated;
        });
    }

    @Override
    public K update(V item) throws WardenException {
        Objects.requireNonNull(item, "item is required");
        return replace(keyOf(item), item);
    }

    /**
     * Replaces the record under {@code key} with {@code item}, moving it when the item's own
     * key differs.
     *
     * @param key current key
     * @param item replacement
     * @return key the record is stored under afterwards
     * @throws WardenException NOT_FOUND if {@code key} is absent, CONFLICT if the target key
     *         or a unique attribute is taken by another record
     */
    protected K replace(K key, V item) throws WardenException {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(item, "item is required");
        return inWriteLock(() -> {
            V current = row(key);
            K newKey = keyOf(item);
            boolean move = !key.equals(newKey);
            if (move && rows.containsKey(newKey)) {
                throw WardenException.conflict(name);
            }
            checkUnique(item, current);
            indexRemove(current);
            if (move) {
                rows.remove(key);
            }
            rows.put(newKey, item);
            indexAdd(item);
            if (move) {
                LOG.debug("Moved {} {} to {}", name, key, newKey);
            } else {
                LOG.debug("Updated {} {}", name, key);
            }
            return newKey;
        });
    }

    @Override
    public void delete(K key) throws WardenException {
        Objects.requireNonNull(key, "key is required");
        inWriteLock(() -> {
            V removed = rows.remove(key);
            if (removed == null) {
                throw WardenException.notFound(name);
            }
            indexRemove(removed);
            LOG.debug("Deleted {} {}", name, key);
            return null;
        });
    }

    @Override
    public int size() throws WardenException {
        return inReadLock(rows::size);
    }

    /**
     * Removes every record and index entry.
     *
     * @throws WardenException LOCK_POISONED if the lock cannot be taken
     */
    public void clear() throws WardenException {
        inWriteLock(() -> {
            rows.clear();
            indexClear();
            return null;
        });
    }

    public boolean isPoisoned() {
        return poisonCause != null;
    }

    /**
     * Looks up a row. Only valid inside a locked section.
     */
    protected final V row(K key) throws WardenException {
        V value = rows.get(key);
        if (value == null) {
            throw WardenException.notFound(name);
        }
        return value;
    }

    protected final V rowOrNull(K key) {
        return rows.get(key);
    }

    /**
     * Copies the rows. Only valid inside a locked section.
     */
    protected final List<V> rows() {
        return new ArrayList<>(rows.values());
    }

    protected final <T> T inReadLock(Section<T> section) throws WardenException {
        Lock readLock = lock.readLock();
        acquire(readLock);
        try {
            checkPoisoned();
            return section.run();
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure reading {}", name, e);
            throw WardenException.internal("failed to read " + name, e);
        } finally {
            readLock.unlock();
        }
    }

    protected final <T> T inWriteLock(Section<T> section) throws WardenException {
        Lock writeLock = lock.writeLock();
        acquire(writeLock);
        try {
            checkPoisoned();
            return section.run();
        } catch (RuntimeException e) {
            poisonCause = e;
            LOG.error("Table {} poisoned by a failure inside a write section", name, e);
            throw WardenException.lockPoisoned(name, e);
        } finally {
            writeLock.unlock();
        }
    }

    private void acquire(Lock target) throws WardenException {
        try {
            target.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the {} lock", name);
            throw WardenException.lockPoisoned(name, e);
        }
    }

    private void checkPoisoned() throws WardenException {
        RuntimeException cause = poisonCause;
        if (cause != null) {
            throw WardenException.lockPoisoned(name, cause);
        }
    }
}
