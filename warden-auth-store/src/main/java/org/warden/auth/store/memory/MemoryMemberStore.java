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

import org.warden.auth.Member;
import org.warden.auth.MemberKey;
import org.warden.auth.MemberPatch;
import org.warden.auth.WardenException;
import org.warden.auth.spi.MemberStore;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory {@link MemberStore}.
 *
 * <p>Maintains {@code tenant -> principals} and {@code principal -> tenants} under the table
 * lock. Every mutation removes the old record's index entries before installing the new ones,
 * including patches that leave the key unchanged.
 */
public class MemoryMemberStore extends MemoryTable<MemberKey, Member, MemberPatch> implements MemberStore {

    private static final Logger LOG = LogManager.getLogger(MemoryMemberStore.class);

    // guarded by the table lock
    private final ListIndex<UUID, UUID> principalsByTenant = new ListIndex<>();
    private final ListIndex<UUID, UUID> tenantsByPrincipal = new ListIndex<>();

    public MemoryMemberStore() {
        super(TABLE_NAME);
    }

    @Override
    public MemberKey update(MemberKey key, Member member) throws WardenException {
        return replace(key, member);
    }

    @Override
    public List<Member> findByTenant(UUID tenantId) throws WardenException {
        Objects.requireNonNull(tenantId, "tenantId is required");
        return inReadLock(() -> {
            List<Member> members = new ArrayList<>();
            for (UUID principalId : principalsByTenant.get(tenantId)) {
                members.add(indexed(new MemberKey(tenantId, principalId)));
            }
            return members;
        });
    }

    @Override
    public List<Member> findByPrincipal(UUID principalId) throws WardenException {
        Objects.requireNonNull(principalId, "principalId is required");
        return inReadLock(() -> {
            List<Member> members = new ArrayList<>();
            for (UUID tenantId : tenantsByPrincipal.get(principalId)) {
                members.add(indexed(new MemberKey(tenantId, principalId)));
            }
            return members;
        });
    }

    @Override
    public List<UUID> principalsOf(UUID tenantId) throws WardenException {
        Objects.requireNonNull(tenantId, "tenantId is required");
        return inReadLock(() -> principalsByTenant.get(tenantId));
    }

    @Override
    public List<UUID> tenantsOf(UUID principalId) throws WardenException {
        Objects.requireNonNull(principalId, "principalId is required");
        return inReadLock(() -> tenantsByPrincipal.get(principalId));
    }

    @Override
    public void deleteFields(MemberKey key, Collection<String> fields) throws WardenException {
        throw WardenException.unsupported("cannot delete fields of a " + name());
    }

    @Override
    public void checkConsistency() throws WardenException {
        inReadLock(() -> {
            Set<MemberKey> keys = new HashSet<>();
            for (Member member : rows()) {
                MemberKey key = member.getKey();
                keys.add(key);
                if (!principalsByTenant.contains(key.getTenantId(), key.getPrincipalId())) {
                    throw WardenException.inconsistentData(name(),
                            "tenant index lacks principal of " + key);
                }
                if (!tenantsByPrincipal.contains(key.getPrincipalId(), key.getTenantId())) {
                    throw WardenException.inconsistentData(name(),
                            "principal index lacks tenant of " + key);
                }
            }
            for (Map.Entry<UUID, List<UUID>> entry : principalsByTenant.entrySet()) {
                checkEntries(keys, entry.getKey(), entry.getValue(), true);
            }
            for (Map.Entry<UUID, List<UUID>> entry : tenantsByPrincipal.entrySet()) {
                checkEntries(keys, entry.getKey(), entry.getValue(), false);
            }
            return null;
        });
    }

    @Override
    protected MemberKey keyOf(Member item) {
        return item.getKey();
    }

    @Override
    protected Member applyPatch(Member current, MemberPatch patch) {
        return patch.applyTo(current);
    }

    @Override
    protected void indexAdd(Member item) {
        principalsByTenant.add(item.getTenantId(), item.getPrincipalId());
        tenantsByPrincipal.add(item.getPrincipalId(), item.getTenantId());
    }

    @Override
    protected void indexRemove(Member item) {
        principalsByTenant.remove(item.getTenantId(), item.getPrincipalId());
        tenantsByPrincipal.remove(item.getPrincipalId(), item.getTenantId());
    }

    @Override
    protected void indexClear() {
        principalsByTenant.clear();
        tenantsByPrincipal.clear();
    }

    private Member indexed(MemberKey key) throws WardenException {
        Member member = rowOrNull(key);
        if (member == null) {
            LOG.error("Index of {} references missing membership {}", name(), key);
            throw WardenException.inconsistentData(name(), "index references missing membership " + key);
        }
        return member;
    }

    private void checkEntries(Set<MemberKey> keys, UUID indexKey, List<UUID> values, boolean byTenant)
            throws WardenException {
        Set<UUID> seen = new HashSet<>();
        for (UUID value : values) {
            if (!seen.add(value)) {
                throw WardenException.inconsistentData(name(), "duplicate index entry " + value + " under " + indexKey);
            }
            MemberKey key = byTenant ? new MemberKey(indexKey, value) : new MemberKey(value, indexKey);
            if (!keys.contains(key)) {
                throw WardenException.inconsistentData(name(), "index entry without membership " + key);
            }
        }
    }
}
